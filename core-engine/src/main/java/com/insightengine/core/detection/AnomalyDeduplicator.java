package com.insightengine.core.detection;

import com.insightengine.core.model.Anomaly;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses anomalies that several tests raised for the same point.
 *
 * @since 1.0.0
 */
public final class AnomalyDeduplicator {

    private AnomalyDeduplicator() {
        // utility class
    }

    /**
     * Keep the most severe anomaly per {@code (metricName, detectedAt)}. Equal
     * severities keep the earlier entry of the input.
     *
     * @param anomalies anomalies, possibly from several tests and metrics
     * @return one anomaly per point, newest first
     */
    public static List<Anomaly> mergeByTimestamp(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Map<String, Anomaly> byPoint = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            String key = anomaly.getMetricName() + '|' + anomaly.getDetectedAt();
            byPoint.merge(key, anomaly,
                    (kept, candidate) -> candidate.getSeverity().compareTo(kept.getSeverity()) > 0 ? candidate : kept);
        }
        List<Anomaly> merged = new ArrayList<>(byPoint.values());
        merged.sort(Comparator.comparing(Anomaly::getDetectedAt, Comparator.<Instant>reverseOrder()));
        return List.copyOf(merged);
    }
}
