package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PatternType {

    TREND("trend");

    private final String wireName;

    PatternType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
