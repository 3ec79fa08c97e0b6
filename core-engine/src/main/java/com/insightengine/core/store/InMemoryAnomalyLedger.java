package com.insightengine.core.store;

import com.insightengine.core.model.Anomaly;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory {@link AnomalyLedger}.
 *
 * @since 1.0.0
 */
public class InMemoryAnomalyLedger implements AnomalyLedger {

    private final Map<String, Anomaly> anomalies = new ConcurrentHashMap<>();
    private final Map<String, AnomalyAcknowledgement> acknowledgements = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryAnomalyLedger() {
        this(Clock.systemUTC());
    }

    public InMemoryAnomalyLedger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public AnomalyAcknowledgement record(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        String id = anomaly.getId();
        // review record first, so an id visible in the order always has one
        AnomalyAcknowledgement acknowledgement =
                acknowledgements.computeIfAbsent(id, key -> AnomalyAcknowledgement.pending(key, clock.instant()));
        if (anomalies.putIfAbsent(id, anomaly) == null) {
            order.add(id);
        }
        return acknowledgement;
    }

    @Override
    public Optional<Anomaly> find(String anomalyId) {
        return Optional.ofNullable(anomalies.get(anomalyId));
    }

    @Override
    public Optional<AnomalyAcknowledgement> acknowledgement(String anomalyId) {
        return Optional.ofNullable(acknowledgements.get(anomalyId));
    }

    @Override
    public AnomalyAcknowledgement updateStatus(String anomalyId, AcknowledgementStatus status, String actor,
                                               String note) {
        Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!anomalies.containsKey(anomalyId)) {
            throw new IllegalArgumentException("Unknown anomaly id: " + anomalyId);
        }
        return acknowledgements.compute(anomalyId, (id, current) -> {
            if (!current.getStatus().canTransitionTo(status)) {
                throw new IllegalStateException(String.format("Anomaly %s cannot move from %s to %s",
                        id, current.getStatus().wireName(), status.wireName()));
            }
            return new AnomalyAcknowledgement(id, status, actor, note, clock.instant());
        });
    }

    @Override
    public List<Anomaly> findByStatus(AcknowledgementStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        return order.stream()
                .filter(id -> acknowledgements.get(id).getStatus() == status)
                .map(anomalies::get)
                .toList();
    }
}
