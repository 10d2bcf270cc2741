package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ExtractionResult(
        @JsonProperty("success")
        boolean success,

        @JsonProperty("candidates")
        List<Candidate> candidates,

        @JsonProperty("total_pages")
        int totalPages,

        @JsonProperty("provider")
        String provider,

        @JsonProperty("processing_time_ms")
        long processingTimeMs,

        @JsonProperty("error")
        String error,

        @JsonProperty("error_kind")
        String errorKind
) {

    public ExtractionResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static ExtractionResult success(List<Candidate> candidates, int totalPages, String provider, long processingTimeMs) {
        return new ExtractionResult(true, candidates, totalPages, provider, processingTimeMs, null, null);
    }

    public static ExtractionResult failure(String error, String errorKind, long processingTimeMs) {
        return new ExtractionResult(false, List.of(), 0, null, processingTimeMs, error, errorKind);
    }

    public ExtractionResult withCandidates(List<Candidate> replaced) {
        return new ExtractionResult(success, replaced, totalPages, provider, processingTimeMs, error, errorKind);
    }
}
