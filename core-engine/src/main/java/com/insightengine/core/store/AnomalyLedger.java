package com.insightengine.core.store;

import com.insightengine.core.model.Anomaly;

import java.util.List;
import java.util.Optional;

/**
 * Stores anomalies by id with a separate, mutable review record per id.
 */
public interface AnomalyLedger {

    /**
     * Store an anomaly. A new id starts {@link AcknowledgementStatus#PENDING};
     * recording a known id again keeps its review state.
     *
     * @param anomaly anomaly to store
     * @return current review record of the anomaly
     */
    AnomalyAcknowledgement record(Anomaly anomaly);

    Optional<Anomaly> find(String anomalyId);

    Optional<AnomalyAcknowledgement> acknowledgement(String anomalyId);

    /**
     * @param anomalyId id of a recorded anomaly
     * @param status    new status
     * @param actor     who made the change
     * @param note      free-text note, may be {@code null}
     * @return the replacing review record
     * @throws IllegalArgumentException if the id is unknown
     * @throws IllegalStateException    if the transition is not allowed
     */
    AnomalyAcknowledgement updateStatus(String anomalyId, AcknowledgementStatus status, String actor, String note);

    /**
     * @param status status to filter on
     * @return anomalies currently in that status, in recording order
     */
    List<Anomaly> findByStatus(AcknowledgementStatus status);
}
