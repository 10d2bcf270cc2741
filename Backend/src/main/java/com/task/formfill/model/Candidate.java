package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single positioned text or form-field detection, before semantic classification.
 */
public record Candidate(
        @JsonProperty("id")
        String id,

        @JsonProperty("raw_text")
        String rawText,

        @JsonProperty("confidence")
        double confidence,

        @JsonProperty("bbox")
        BoundingBox bbox,

        @JsonProperty("nearby_text")
        List<String> nearbyText
) {

    public Candidate {
        nearbyText = nearbyText == null ? List.of() : List.copyOf(nearbyText);
    }

    public Candidate withNearbyText(List<String> nearby) {
        return new Candidate(id, rawText, confidence, bbox, nearby);
    }
}
