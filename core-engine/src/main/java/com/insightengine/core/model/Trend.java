package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Trend {

    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String wireName;

    Trend(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
