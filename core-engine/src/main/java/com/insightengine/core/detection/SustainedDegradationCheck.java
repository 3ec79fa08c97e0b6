package com.insightengine.core.detection;

import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricPoint;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Stats;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Sustained shift of the trailing {@code N}-point average against the
 * {@code N} points before it, in the metric's unfavourable direction only.
 *
 * <p>
 * Needs {@code 2·N} points. The anomaly reports the recent average as the
 * detected value and the previous average as the expected value.
 * </p>
 *
 * @since 1.0.0
 */
public class SustainedDegradationCheck implements AnomalyCheck {

    private final int windowSize;
    private final double thresholdPct;
    private final InsightLogger logger;

    public SustainedDegradationCheck(int windowSize, double thresholdPct, InsightLogger logger) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("Sustained window must be >= 1, got: " + windowSize);
        }
        if (thresholdPct <= 0) {
            throw new IllegalArgumentException("Sustained threshold must be > 0, got: " + thresholdPct);
        }
        this.windowSize = windowSize;
        this.thresholdPct = thresholdPct;
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public List<Anomaly> evaluate(MetricSeries series, MetricDirection direction) {
        int n = series.size();
        if (n < 2 * windowSize) {
            logger.info("anomaly_check_skipped", LogFields.of(
                    "check", getName(), "metric", series.getMetricName(),
                    "reason", "insufficient_history", "required", 2 * windowSize, "actual", n));
            return List.of();
        }

        double[] values = series.values();
        double recent = Stats.mean(values, n - windowSize, n);
        double previous = Stats.mean(values, n - 2 * windowSize, n - windowSize);
        if (recent == previous || !direction.isUnfavorable(recent - previous)) {
            return List.of();
        }

        boolean zeroBaseline = previous == 0.0;
        double changePct = zeroBaseline
                ? Stats.DEVIATION_SENTINEL
                : Math.abs(recent - previous) / Math.abs(previous) * 100.0;
        if (changePct <= thresholdPct) {
            return List.of();
        }

        MetricPoint latest = series.latest();
        Severity severity = zeroBaseline ? Severity.CRITICAL : Scoring.fromThresholdRatio(changePct / thresholdPct);
        double band = Math.abs(previous) * thresholdPct / 100.0;
        double threshold = direction == MetricDirection.HIGHER_IS_BETTER ? previous - band : previous + band;

        return List.of(Anomaly.builder()
                .id(AnomalyIds.of(series.getMetricName(), AnomalyType.SUSTAINED_DEGRADATION, latest.getTimestamp()))
                .metricName(series.getMetricName())
                .anomalyType(AnomalyType.SUSTAINED_DEGRADATION)
                .severity(severity)
                .confidence(Scoring.confidence(changePct, thresholdPct, zeroBaseline))
                .detectedValue(recent)
                .expectedValue(previous)
                .thresholdValue(threshold)
                .deviationPercentage(Stats.percentChange(previous, recent))
                .detectedAt(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "%s averaged %.2f over the last %d points against %.2f over the %d before",
                        series.getMetricName(), recent, windowSize, previous, windowSize))
                .build());
    }

    @Override
    public String getName() {
        return "sustained_degradation";
    }
}
