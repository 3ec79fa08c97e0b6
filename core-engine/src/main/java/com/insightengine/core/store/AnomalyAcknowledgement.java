package com.insightengine.core.store;

import java.time.Instant;
import java.util.Objects;

/**
 * Review state attached to a stored anomaly by id. The anomaly itself is
 * never modified; a status change replaces this record.
 *
 * @since 1.0.0
 */
public final class AnomalyAcknowledgement {

    private final String anomalyId;
    private final AcknowledgementStatus status;
    private final String actor;
    private final String note;
    private final Instant updatedAt;

    public AnomalyAcknowledgement(String anomalyId, AcknowledgementStatus status, String actor, String note,
                                  Instant updatedAt) {
        this.anomalyId = Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.actor = actor;
        this.note = note;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt must not be null");
    }

    public static AnomalyAcknowledgement pending(String anomalyId, Instant at) {
        return new AnomalyAcknowledgement(anomalyId, AcknowledgementStatus.PENDING, null, null, at);
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public AcknowledgementStatus getStatus() {
        return status;
    }

    public String getActor() {
        return actor;
    }

    public String getNote() {
        return note;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyAcknowledgement that))
            return false;
        return anomalyId.equals(that.anomalyId)
                && status == that.status
                && Objects.equals(actor, that.actor)
                && Objects.equals(note, that.note)
                && updatedAt.equals(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(anomalyId, status, actor, note, updatedAt);
    }

    @Override
    public String toString() {
        return "AnomalyAcknowledgement{anomalyId='" + anomalyId + "', status=" + status.wireName()
                + ", actor='" + actor + "', updatedAt=" + updatedAt + '}';
    }
}
