package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {

    IMMEDIATE("immediate"),
    SHORT_TERM("short_term"),
    LONG_TERM("long_term");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ActionType fromWireName(String name) {
        for (ActionType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown action type: '" + name
                + "'. Supported: immediate, short_term, long_term");
    }
}
