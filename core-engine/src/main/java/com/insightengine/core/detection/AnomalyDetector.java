package com.insightengine.core.detection;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyReport;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Statistics;
import com.insightengine.core.stats.Stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs every {@link AnomalyCheck} against a series and concatenates the results.
 *
 * <p>
 * Checks run in the order of {@link AnomalyCheckFactory#createAll}. Two checks
 * may flag the same point; both records are returned, and callers that want
 * one record per point use {@link AnomalyDeduplicator}.
 * </p>
 *
 * <p>
 * A series of fewer than {@value #MIN_POINTS} points has no baseline and
 * yields an empty list.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyDetector {

    /** Smallest series that has a baseline to compare against. */
    public static final int MIN_POINTS = 2;

    /** Coefficient of variation above which a series is called highly variable. */
    static final double HIGH_VARIABILITY_CV = 0.5;

    private final EngineConfig config;
    private final List<AnomalyCheck> checks;
    private final InsightLogger logger;

    public AnomalyDetector(EngineConfig config) {
        this(config, Slf4jInsightLogger.forClass(AnomalyDetector.class));
    }

    public AnomalyDetector(EngineConfig config, InsightLogger logger) {
        this(config, AnomalyCheckFactory.createAll(config, logger), logger);
    }

    /**
     * @param config configuration used to resolve metric directions
     * @param checks checks to run, in order
     * @param logger structured logger
     */
    public AnomalyDetector(EngineConfig config, List<AnomalyCheck> checks, InsightLogger logger) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null").copy();
        this.checks = List.copyOf(checks);
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * Judge the latest point (and the latest windows) of a series.
     *
     * @param series the series; must not be {@code null}
     * @return anomalies in check order, empty when nothing is anomalous or the
     *         series is too short
     */
    public List<Anomaly> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        if (series.size() < MIN_POINTS) {
            logger.info("anomaly_detection_skipped", LogFields.of(
                    "metric", series.getMetricName(), "points", series.size(), "required", MIN_POINTS));
            return List.of();
        }

        MetricDirection direction = config.directionFor(series.getMetricName());
        List<Anomaly> anomalies = new ArrayList<>();
        for (AnomalyCheck check : checks) {
            anomalies.addAll(check.evaluate(series, direction));
        }

        logger.info("anomaly_detection_completed", LogFields.of(
                "metric", series.getMetricName(),
                "points", series.size(),
                "anomalies", anomalies.size()));
        return List.copyOf(anomalies);
    }

    /**
     * Detect anomalies and summarise them.
     *
     * @param series the series; must not be {@code null}
     * @return report with statistics of the whole series and insights
     */
    public AnomalyReport analyze(MetricSeries series) {
        List<Anomaly> anomalies = detect(series);
        Statistics statistics = series.isEmpty() ? null : Stats.summarize(series.values());
        return new AnomalyReport(series.getMetricName(), series.size(), statistics, anomalies,
                insights(anomalies, statistics));
    }

    // ---------------------------------------------------------------
    // Insights
    // ---------------------------------------------------------------

    private static List<String> insights(List<Anomaly> anomalies, Statistics statistics) {
        List<String> insights = new ArrayList<>();
        if (anomalies.isEmpty()) {
            insights.add("No anomalies detected: quality metrics are stable and consistent");
            return insights;
        }

        long critical = anomalies.stream().filter(a -> a.getSeverity() == Severity.CRITICAL).count();
        long high = anomalies.stream().filter(a -> a.getSeverity() == Severity.HIGH).count();
        if (critical > 0) {
            insights.add(String.format(Locale.ROOT,
                    "CRITICAL: %d critical anomal%s detected, immediate attention required",
                    critical, critical == 1 ? "y" : "ies"));
        }
        if (high > 0) {
            insights.add(String.format(Locale.ROOT,
                    "%d high-severity anomal%s detected, investigation recommended",
                    high, high == 1 ? "y" : "ies"));
        }

        Map<AnomalyType, Integer> byType = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            byType.merge(anomaly.getAnomalyType(), 1, Integer::sum);
        }
        AnomalyType dominant = null;
        int dominantCount = 0;
        for (Map.Entry<AnomalyType, Integer> entry : byType.entrySet()) {
            if (entry.getValue() > dominantCount) {
                dominant = entry.getKey();
                dominantCount = entry.getValue();
            }
        }
        insights.add(String.format(Locale.ROOT, "Most common anomaly type: %s (%d occurrence%s)",
                dominant.label(), dominantCount, dominantCount == 1 ? "" : "s"));

        if (statistics != null && Math.abs(statistics.getMean()) > Stats.EPSILON) {
            double cv = statistics.getStdDev() / Math.abs(statistics.getMean());
            if (cv > HIGH_VARIABILITY_CV) {
                insights.add(String.format(Locale.ROOT,
                        "High variability detected (coefficient of variation %.2f): quality is inconsistent", cv));
            }
        }
        return insights;
    }
}
