package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of everything the user has previously supplied, fetched once per resolution pass.
 */
public record UserContext(
        @JsonProperty("profile")
        Profile profile,

        @JsonProperty("household_members")
        List<HouseholdMember> householdMembers,

        @JsonProperty("saved_dates")
        List<SavedDate> savedDates
) {

    public UserContext {
        householdMembers = householdMembers == null ? List.of() : List.copyOf(householdMembers);
        savedDates = savedDates == null ? List.of() : List.copyOf(savedDates);
    }

    public static UserContext empty() {
        return new UserContext(null, List.of(), List.of());
    }

    public record Profile(
            @JsonProperty("id")
            String id,

            @JsonProperty("full_name")
            String fullName,

            @JsonProperty("email")
            String email,

            @JsonProperty("phone")
            String phone,

            @JsonProperty("date_of_birth")
            String dateOfBirth,

            // street / city / state / zip
            @JsonProperty("address")
            Map<String, String> address,

            @JsonProperty("custom_fields")
            Map<String, Object> customFields
    ) {
        public Profile {
            address = address == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(address));
            customFields = customFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
        }
    }

    public record HouseholdMember(
            @JsonProperty("id")
            String id,

            @JsonProperty("name")
            String name,

            @JsonProperty("date_of_birth")
            String dateOfBirth,

            @JsonProperty("relationship")
            String relationship,

            @JsonProperty("custom_fields")
            Map<String, Object> customFields
    ) {
        public HouseholdMember {
            customFields = customFields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(customFields));
        }
    }

    public record SavedDate(
            @JsonProperty("id")
            String id,

            @JsonProperty("label")
            String label,

            @JsonProperty("value")
            String value
    ) {}
}
