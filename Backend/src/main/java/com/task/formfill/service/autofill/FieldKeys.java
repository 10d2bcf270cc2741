package com.task.formfill.service.autofill;

import java.util.Locale;

public final class FieldKeys {

    private FieldKeys() {
    }

    /**
     * Lowercases, replaces every non-alphanumeric character with {@code _}, collapses runs of
     * underscores and trims them from both ends. {@code "Patient's  Name:"} becomes {@code patient_s_name}.
     */
    public static String normalize(String key) {
        if (key == null) return "";
        return key.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]", "_")
                .replaceAll("_+", "_")
                .replaceAll("^_+|_+$", "");
    }
}
