package com.insightengine.core.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of a stored anomaly.
 *
 * <p>
 * {@code pending} moves to any other state, {@code acknowledged} to
 * {@code resolved} or {@code dismissed}. The last two are final.
 * </p>
 */
public enum AcknowledgementStatus {

    PENDING("pending"),
    ACKNOWLEDGED("acknowledged"),
    RESOLVED("resolved"),
    DISMISSED("dismissed");

    private final String wireName;

    AcknowledgementStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AcknowledgementStatus fromWireName(String name) {
        for (AcknowledgementStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(name)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown acknowledgement status: '" + name + "'");
    }

    public boolean canTransitionTo(AcknowledgementStatus next) {
        return switch (this) {
            case PENDING -> next != PENDING;
            case ACKNOWLEDGED -> next == RESOLVED || next == DISMISSED;
            case RESOLVED, DISMISSED -> false;
        };
    }

    public boolean isFinal() {
        return this == RESOLVED || this == DISMISSED;
    }
}
