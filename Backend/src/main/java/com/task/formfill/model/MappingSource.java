package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MappingSource {
    PROFILE,
    HOUSEHOLD_MEMBER,
    SAVED_DATE,
    MANUAL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MappingSource fromValue(String value) {
        return value == null ? MANUAL : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
