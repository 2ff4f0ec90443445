package com.geevly.student;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Sex {
    MALE("male"),
    FEMALE("female"),
    UNSPECIFIED("unspecified");

    private final String value;

    Sex(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Sex fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNSPECIFIED;
        }
        String normalized = raw.trim();
        if (normalized.equalsIgnoreCase("m")) {
            return MALE;
        }
        if (normalized.equalsIgnoreCase("f")) {
            return FEMALE;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(normalized))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown sex: " + raw));
    }
}
