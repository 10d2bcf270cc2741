package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record AutoFillRequest(
        @JsonProperty("user_id")
        String userId,

        @JsonProperty("household_member_id")
        String householdMemberId,

        @JsonProperty("fields")
        List<ClassifiedField> fields
) {}
