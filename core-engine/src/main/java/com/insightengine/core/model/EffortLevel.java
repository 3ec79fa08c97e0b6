package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EffortLevel {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    EffortLevel(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EffortLevel fromWireName(String name) {
        for (EffortLevel level : values()) {
            if (level.wireName.equalsIgnoreCase(name)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown effort level: '" + name + "'. Supported: low, medium, high");
    }
}
