package com.geevly.student;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NutritionalStatus {
    NORMAL("normal"),
    WASTED("wasted"),
    SEVERELY_WASTED("severely_wasted");

    private final String value;

    NutritionalStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
