package com.task.formfill.service;

import com.task.formfill.model.Candidate;
import com.task.formfill.model.ClassificationResult;
import com.task.formfill.model.ClassifiedField;
import com.task.formfill.model.FieldType;
import com.task.formfill.service.autofill.FieldKeys;
import com.task.formfill.service.autofill.MatchingTables;
import com.task.formfill.service.classify.ClassificationEntry;
import com.task.formfill.service.classify.ClassificationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts grouped candidates into typed fields. The heavy lifting is done by the configured
 * {@link ClassificationProvider}; this class batches the requests and then applies a
 * deterministic local pass (confidence capping, pattern overrides, profile hints, canned
 * suggestions, key de-duplication and reading order).
 */
@Service
public class FieldClassifier {

    private static final Logger log = LoggerFactory.getLogger(FieldClassifier.class);

    private static final Pattern PUNCTUATION_ONLY = Pattern.compile("^[^\\p{L}\\p{N}]*$");
    private static final Pattern PHONE = Pattern.compile("\\(?\\d{3}\\)?[-.\\s]?\\d{3}[-.\\s]?\\d{4}");
    private static final Pattern DATE = Pattern.compile("\\d{1,2}[/-]\\d{1,2}[/-]\\d{2,4}");
    private static final Pattern NUMBER = Pattern.compile("^\\d+(\\.\\d+)?$");

    private static final double DEFAULT_SERVICE_CONFIDENCE = 0.5;

    private final ClassificationProvider provider;
    private final List<String> profileVocabulary;
    private final int batchSize;
    private final double minConfidence;

    public FieldClassifier(
            ClassificationProvider provider,
            MatchingTables tables,
            @Value("${formfill.classification.batch-size:50}") int batchSize,
            @Value("${formfill.classification.min-confidence:0.30}") double minConfidence
    ) {
        this.provider = provider;
        this.profileVocabulary = tables.profileVocabulary();
        this.batchSize = Math.max(1, Math.min(50, batchSize));
        this.minConfidence = minConfidence;
    }

    public ClassificationResult classify(List<Candidate> candidates) {
        long t0 = System.currentTimeMillis();

        List<Candidate> usable = preprocess(candidates);
        if (usable.isEmpty()) {
            return ClassificationResult.success(List.of(), List.of(), System.currentTimeMillis() - t0);
        }

        Map<String, Candidate> byId = new LinkedHashMap<>();
        for (Candidate c : usable) byId.put(c.id(), c);

        List<String> warnings = new ArrayList<>();
        List<ClassifiedField> fields = new ArrayList<>();
        try {
            for (int from = 0; from < usable.size(); from += batchSize) {
                List<Candidate> batch = usable.subList(from, Math.min(from + batchSize, usable.size()));
                List<ClassificationEntry> entries = provider.classify(batch);
                if (entries == null) continue;

                for (ClassificationEntry entry : entries) {
                    Candidate source = entry.candidateId() == null ? null : byId.get(entry.candidateId());
                    if (source == null) {
                        log.warn("Classification entry references unknown candidate id {}, dropping it", entry.candidateId());
                        warnings.add("Dropped classification entry with unknown id: " + entry.candidateId());
                        continue;
                    }
                    fields.add(enhance(source, entry));
                }
            }
        } catch (Exception ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Field classification via {} failed: {}", provider.name(), ex.getMessage());
            return ClassificationResult.failure("Classification failed: " + ex.getMessage(),
                    System.currentTimeMillis() - t0);
        }

        List<ClassifiedField> result = order(dedupe(fields));
        log.info("Classified {} of {} candidates into {} fields", usable.size(), candidates.size(), result.size());
        return ClassificationResult.success(result, warnings, System.currentTimeMillis() - t0);
    }

    List<Candidate> preprocess(List<Candidate> candidates) {
        List<Candidate> out = new ArrayList<>();
        if (candidates == null) return out;
        for (Candidate c : candidates) {
            if (c == null || c.rawText() == null) continue;
            String text = c.rawText().trim();
            if (text.isEmpty() || c.confidence() < minConfidence) continue;
            if (PUNCTUATION_ONLY.matcher(text).matches()) continue;
            out.add(c);
        }
        return out;
    }

    ClassifiedField enhance(Candidate candidate, ClassificationEntry entry) {
        String raw = candidate.rawText();
        String key = resolveKey(candidate, entry);
        String label = entry.label() == null || entry.label().isBlank() ? raw.trim() : entry.label().trim();

        double serviceConfidence = entry.confidence() == null ? DEFAULT_SERVICE_CONFIDENCE : entry.confidence();
        double confidence = Math.max(0, Math.min(candidate.confidence(), Math.min(1.0, serviceConfidence)));

        FieldType type = FieldType.fromValue(entry.type());
        boolean required = Boolean.TRUE.equals(entry.required());

        FieldType overridden = patternType(raw);
        if (overridden != null) type = overridden;
        if (raw.toLowerCase(Locale.ROOT).contains("sign")) {
            type = FieldType.SIGNATURE;
            required = true;
        }

        List<String> suggestions = entry.suggestions() == null ? List.of()
                : entry.suggestions().stream().filter(Objects::nonNull).toList();
        if (suggestions.isEmpty()) {
            suggestions = cannedSuggestions(type, key);
        }

        return new ClassifiedField(candidate.id(), key, label, type, required, confidence,
                candidate.bbox(), raw, suggestions, isProfileField(key));
    }

    private static String resolveKey(Candidate candidate, ClassificationEntry entry) {
        String key = FieldKeys.normalize(entry.key());
        if (key.isEmpty()) key = FieldKeys.normalize(candidate.rawText());
        if (key.isEmpty()) key = "field_" + FieldKeys.normalize(candidate.id());
        return key;
    }

    static FieldType patternType(String raw) {
        if (raw == null) return null;
        String text = raw.trim();
        if (text.contains("@")) return FieldType.EMAIL;
        if (PHONE.matcher(text).find()) return FieldType.PHONE;
        if (DATE.matcher(text).find()) return FieldType.DATE;
        if (NUMBER.matcher(text).matches()) return FieldType.NUMBER;
        return null;
    }

    boolean isProfileField(String key) {
        if (key == null || key.isEmpty()) return false;
        for (String term : profileVocabulary) {
            if (key.contains(term) || term.contains(key)) return true;
        }
        return false;
    }

    static List<String> cannedSuggestions(FieldType type, String key) {
        switch (type) {
            case DATE:
                return List.of("MM/DD/YYYY", "Today", "Date of Birth");
            case PHONE:
                return List.of("(555) 123-4567", "Primary Phone", "Emergency Contact");
            case EMAIL:
                return List.of("user@example.com", "Primary Email", "Work Email");
            case SIGNATURE:
                return List.of("Digital Signature", "Print Name", "Date Signed");
            case ADDRESS:
                return List.of("Street Address", "City, State ZIP", "Mailing Address");
            default:
                if (key != null && key.contains("name")) {
                    return List.of("Full Name", "First Name", "Last Name");
                }
                return List.of();
        }
    }

    private static List<ClassifiedField> dedupe(List<ClassifiedField> fields) {
        Set<String> seen = new HashSet<>();
        List<ClassifiedField> out = new ArrayList<>();
        for (ClassifiedField f : fields) {
            if (seen.add(f.key())) out.add(f);
        }
        return out;
    }

    private static List<ClassifiedField> order(List<ClassifiedField> fields) {
        List<ClassifiedField> sorted = new ArrayList<>(fields);
        sorted.sort(Comparator
                .comparingInt((ClassifiedField f) -> f.bbox() == null ? Integer.MAX_VALUE : f.bbox().page())
                .thenComparingDouble(f -> f.bbox() == null ? Double.MAX_VALUE : f.bbox().y()));
        return sorted;
    }
}
