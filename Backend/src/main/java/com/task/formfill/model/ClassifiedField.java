package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A candidate enriched with a semantic key, label, type and suggestion metadata.
 */
public record ClassifiedField(
        @JsonProperty("id")
        String id,

        @JsonProperty("key")
        String key,

        @JsonProperty("label")
        String label,

        @JsonProperty("type")
        FieldType type,

        @JsonProperty("required")
        boolean required,

        @JsonProperty("confidence")
        double confidence,

        @JsonProperty("bbox")
        BoundingBox bbox,

        @JsonProperty("raw_text")
        String rawText,

        @JsonProperty("suggestions")
        List<String> suggestions,

        @JsonProperty("save_to_profile")
        boolean saveToProfile
) {

    public ClassifiedField {
        type = type == null ? FieldType.TEXT : type;
        label = label == null ? "" : label;
        rawText = rawText == null ? "" : rawText;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
