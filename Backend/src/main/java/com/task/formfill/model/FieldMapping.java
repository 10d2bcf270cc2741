package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resolved value (or lack of one) and provenance for one classified field.
 */
public record FieldMapping(
        @JsonProperty("field_id")
        String fieldId,

        @JsonProperty("value")
        Object value,

        @JsonProperty("source")
        MappingSource source,

        @JsonProperty("source_id")
        String sourceId,

        @JsonProperty("confidence")
        double confidence
) {

    public static FieldMapping unresolved(String fieldId) {
        return new FieldMapping(fieldId, null, MappingSource.MANUAL, null, 0.0);
    }

    public static FieldMapping manual(String fieldId, Object value) {
        return new FieldMapping(fieldId, value, MappingSource.MANUAL, null, 1.0);
    }

    public boolean hasValue() {
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Boolean b) return b;
        return true;
    }
}
