package com.task.formfill.service.classify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationEntry(
        @JsonProperty("id")
        String candidateId,

        @JsonProperty("key")
        String key,

        @JsonProperty("label")
        String label,

        @JsonProperty("type")
        String type,

        @JsonProperty("required")
        Boolean required,

        @JsonProperty("confidence")
        Double confidence,

        @JsonProperty("suggestions")
        List<String> suggestions
) {}
