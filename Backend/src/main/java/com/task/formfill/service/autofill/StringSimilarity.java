package com.task.formfill.service.autofill;

/**
 * Normalized edit-distance similarity, {@code 1 - levenshtein(a, b) / max(|a|, |b|)}.
 */
public final class StringSimilarity {

    private StringSimilarity() {
    }

    public static double similarity(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        if (s1.isEmpty()) return s2.isEmpty() ? 1.0 : 0.0;
        if (s2.isEmpty()) return 0.0;

        int maxLen = Math.max(s1.length(), s2.length());
        return (maxLen - (double) levenshtein(s1, s2)) / maxLen;
    }

    public static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) prev[j] = j;

        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
