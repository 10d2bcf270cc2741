package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ClassificationResult(
        @JsonProperty("success")
        boolean success,

        @JsonProperty("fields")
        List<ClassifiedField> fields,

        @JsonProperty("warnings")
        List<String> warnings,

        @JsonProperty("processing_time_ms")
        long processingTimeMs,

        @JsonProperty("error")
        String error
) {

    public ClassificationResult {
        fields = fields == null ? List.of() : List.copyOf(fields);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ClassificationResult success(List<ClassifiedField> fields, List<String> warnings, long processingTimeMs) {
        return new ClassificationResult(true, fields, warnings, processingTimeMs, null);
    }

    public static ClassificationResult failure(String error, long processingTimeMs) {
        return new ClassificationResult(false, List.of(), List.of(), processingTimeMs, error);
    }
}
