package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Urgency of a recommendation, ordered from least to most urgent.
 *
 * @since 1.0.0
 */
public enum Priority {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Priority fromWireName(String name) {
        for (Priority priority : values()) {
            if (priority.wireName.equalsIgnoreCase(name)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: '" + name + "'");
    }

    /**
     * @param severity severity of the anomaly or degradation behind a recommendation
     * @return priority of the same rank
     */
    public static Priority fromSeverity(Severity severity) {
        return switch (severity) {
            case CRITICAL -> CRITICAL;
            case HIGH -> HIGH;
            case MEDIUM -> MEDIUM;
            case LOW -> LOW;
        };
    }
}
