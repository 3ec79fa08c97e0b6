package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a full detect, analyse and recommend pass over one metric.
 *
 * <p>
 * {@code analysis} is empty when no unfavourable anomaly was found on the
 * latest point; {@code recommendations} is then empty too.
 * </p>
 *
 * @since 1.0.0
 */
public final class Investigation {

    private final String metricName;
    private final List<Anomaly> anomalies;
    @JsonProperty("analysis")
    private final RootCauseAnalysis analysis;
    private final List<Recommendation> recommendations;

    public Investigation(String metricName, List<Anomaly> anomalies, RootCauseAnalysis analysis,
                         List<Recommendation> recommendations) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.anomalies = List.copyOf(anomalies);
        this.analysis = analysis;
        this.recommendations = List.copyOf(recommendations);
    }

    public String getMetricName() {
        return metricName;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    @JsonIgnore
    public Optional<RootCauseAnalysis> getAnalysis() {
        return Optional.ofNullable(analysis);
    }

    public List<Recommendation> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "Investigation{metricName='" + metricName + "', anomalies=" + anomalies.size()
                + ", analysed=" + (analysis != null) + ", recommendations=" + recommendations.size() + '}';
    }
}
