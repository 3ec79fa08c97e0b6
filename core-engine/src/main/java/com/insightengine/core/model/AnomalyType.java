package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which outlier test produced an anomaly.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    STATISTICAL_OUTLIER("statistical_outlier"),
    IQR_OUTLIER("iqr_outlier"),
    SUDDEN_DROP("sudden_drop"),
    SUDDEN_SPIKE("sudden_spike"),
    SUSTAINED_DEGRADATION("sustained_degradation");

    private final String wireName;

    AnomalyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * @return the wire name with underscores replaced by spaces
     */
    public String label() {
        return wireName.replace('_', ' ');
    }
}
