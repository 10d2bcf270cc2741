package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PipelineResult(
        @JsonProperty("candidates")
        List<Candidate> candidates,

        @JsonProperty("fields")
        List<ClassifiedField> fields,

        @JsonProperty("autofill")
        AutoFillResult autofill,

        @JsonProperty("warnings")
        List<String> warnings,

        @JsonProperty("processing_time_ms")
        long processingTimeMs
) {}
