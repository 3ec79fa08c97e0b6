package com.insightengine.core.model;

import com.insightengine.core.stats.Statistics;

import java.util.List;
import java.util.Objects;

/**
 * Anomalies found on one series, with the series statistics and short
 * human-readable insights.
 *
 * @since 1.0.0
 */
public final class AnomalyReport {

    private final String metricName;
    private final int pointsAnalyzed;
    private final Statistics statistics;
    private final List<Anomaly> anomalies;
    private final List<String> insights;

    public AnomalyReport(String metricName, int pointsAnalyzed, Statistics statistics,
                         List<Anomaly> anomalies, List<String> insights) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.pointsAnalyzed = pointsAnalyzed;
        this.statistics = statistics;
        this.anomalies = List.copyOf(anomalies);
        this.insights = List.copyOf(insights);
    }

    public String getMetricName() {
        return metricName;
    }

    public int getPointsAnalyzed() {
        return pointsAnalyzed;
    }

    /**
     * @return statistics over the whole series, or {@code null} for an empty series
     */
    public Statistics getStatistics() {
        return statistics;
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public List<String> getInsights() {
        return insights;
    }

    @Override
    public String toString() {
        return "AnomalyReport{metricName='" + metricName + "', pointsAnalyzed=" + pointsAnalyzed
                + ", anomalies=" + anomalies.size() + '}';
    }
}
