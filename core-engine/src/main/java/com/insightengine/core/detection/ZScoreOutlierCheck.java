package com.insightengine.core.detection;

import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricPoint;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Statistics;
import com.insightengine.core.stats.Stats;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Statistical outlier test based on the z-score of the latest point.
 *
 * <p>
 * The baseline is every point except the latest. The latest point is flagged
 * when it lies more than {@code threshold} standard deviations from the
 * baseline mean. A baseline with zero dispersion reports nothing.
 * </p>
 *
 * <h3>Severity</h3>
 * <ul>
 * <li>below 2.5&sigma; &rarr; low</li>
 * <li>2.5&sigma; to 3.0&sigma; &rarr; medium</li>
 * <li>3.0&sigma; to 4.0&sigma; &rarr; high</li>
 * <li>4.0&sigma; and above &rarr; critical</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ZScoreOutlierCheck implements AnomalyCheck {

    private final double threshold;
    private final InsightLogger logger;

    /**
     * @param threshold number of standard deviations; must be positive
     * @param logger    structured logger
     */
    public ZScoreOutlierCheck(double threshold, InsightLogger logger) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("z-score threshold must be > 0, got: " + threshold);
        }
        this.threshold = threshold;
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public List<Anomaly> evaluate(MetricSeries series, MetricDirection direction) {
        double[] values = series.values();
        double[] baseline = Arrays.copyOf(values, values.length - 1);
        Statistics stats = Stats.summarize(baseline);

        if (stats.hasZeroVariance()) {
            logger.info("anomaly_check_skipped", LogFields.of(
                    "check", getName(), "metric", series.getMetricName(), "reason", "zero_dispersion"));
            return List.of();
        }

        MetricPoint latest = series.latest();
        double value = latest.getValue();
        double mean = stats.getMean();
        double z = Math.abs(value - mean) / stats.getStdDev();
        if (z <= threshold) {
            return List.of();
        }

        double sign = value >= mean ? 1.0 : -1.0;
        boolean zeroBaseline = mean == 0.0;
        Severity severity = Severity.classify(z, 2.5, 3.0, 4.0);

        return List.of(Anomaly.builder()
                .id(AnomalyIds.of(series.getMetricName(), AnomalyType.STATISTICAL_OUTLIER, latest.getTimestamp()))
                .metricName(series.getMetricName())
                .anomalyType(AnomalyType.STATISTICAL_OUTLIER)
                .severity(severity)
                .confidence(Scoring.confidence(z, threshold, zeroBaseline))
                .detectedValue(value)
                .expectedValue(mean)
                .thresholdValue(mean + sign * threshold * stats.getStdDev())
                .deviationPercentage(Stats.percentChange(mean, value))
                .detectedAt(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "%s value %.2f is %.1f standard deviations from the mean %.2f",
                        series.getMetricName(), value, z, mean))
                .build());
    }

    @Override
    public String getName() {
        return "z_score";
    }
}
