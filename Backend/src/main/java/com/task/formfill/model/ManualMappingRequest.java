package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A value typed by the user for one field, optionally to be kept on their profile.
 */
public record ManualMappingRequest(
        @JsonProperty("user_id")
        String userId,

        @JsonProperty("field")
        ClassifiedField field,

        @JsonProperty("value")
        Object value,

        @JsonProperty("save_to_profile")
        boolean saveToProfile
) {}
