package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AutoFillResult(
        @JsonProperty("mappings")
        List<FieldMapping> mappings,

        @JsonProperty("auto_filled_count")
        int autoFilledCount,

        @JsonProperty("total_fields")
        int totalFields
) {

    public AutoFillResult {
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
    }

    public static AutoFillResult of(List<FieldMapping> mappings) {
        int filled = (int) mappings.stream().filter(FieldMapping::hasValue).count();
        return new AutoFillResult(mappings, filled, mappings.size());
    }
}
