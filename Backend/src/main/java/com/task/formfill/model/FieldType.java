package com.task.formfill.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FieldType {
    TEXT,
    CHECKBOX,
    RADIO,
    SELECT,
    DATE,
    SIGNATURE,
    NUMBER,
    EMAIL,
    PHONE,
    ADDRESS;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Unknown or missing values fall back to {@link #TEXT}. */
    @JsonCreator
    public static FieldType fromValue(String value) {
        if (value == null) return TEXT;
        for (FieldType t : values()) {
            if (t.value().equalsIgnoreCase(value.trim())) return t;
        }
        return TEXT;
    }
}
