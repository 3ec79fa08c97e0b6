package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Qualitative magnitude bucket, ordered from least to most severe.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Severity fromWireName(String name) {
        for (Severity severity : values()) {
            if (severity.wireName.equalsIgnoreCase(name)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown severity: '" + name + "'");
    }

    /**
     * Bucket a magnitude against three ascending cut points.
     *
     * @param magnitude         value to classify
     * @param mediumThreshold   lowest value classified as medium
     * @param highThreshold     lowest value classified as high
     * @param criticalThreshold lowest value classified as critical
     * @return severity bucket
     */
    public static Severity classify(double magnitude, double mediumThreshold, double highThreshold,
                                    double criticalThreshold) {
        if (magnitude >= criticalThreshold)
            return CRITICAL;
        if (magnitude >= highThreshold)
            return HIGH;
        if (magnitude >= mediumThreshold)
            return MEDIUM;
        return LOW;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
