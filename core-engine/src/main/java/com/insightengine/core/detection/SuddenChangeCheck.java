package com.insightengine.core.detection;

import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricPoint;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Stats;

import java.util.List;
import java.util.Locale;

/**
 * Sudden drop or spike of the latest point against the mean of the points
 * just before it.
 *
 * <p>
 * The trailing window holds up to {@code windowSize} points preceding the
 * latest one. The change is flagged in either direction; its sign decides
 * between {@link AnomalyType#SUDDEN_DROP} and {@link AnomalyType#SUDDEN_SPIKE}.
 * A zero window mean makes any non-zero value a critical change with capped
 * confidence.
 * </p>
 *
 * @since 1.0.0
 */
public class SuddenChangeCheck implements AnomalyCheck {

    private final double thresholdPct;
    private final int windowSize;

    public SuddenChangeCheck(double thresholdPct, int windowSize) {
        if (thresholdPct <= 0) {
            throw new IllegalArgumentException("Sudden change threshold must be > 0, got: " + thresholdPct);
        }
        if (windowSize < 1) {
            throw new IllegalArgumentException("Sudden change window must be >= 1, got: " + windowSize);
        }
        this.thresholdPct = thresholdPct;
        this.windowSize = windowSize;
    }

    @Override
    public List<Anomaly> evaluate(MetricSeries series, MetricDirection direction) {
        double[] values = series.values();
        int last = values.length - 1;
        double expected = Stats.mean(values, Math.max(0, last - windowSize), last);

        MetricPoint latest = series.latest();
        double value = latest.getValue();
        if (value == expected) {
            return List.of();
        }

        boolean zeroBaseline = expected == 0.0;
        double changePct = zeroBaseline
                ? Stats.DEVIATION_SENTINEL
                : Math.abs(value - expected) / Math.abs(expected) * 100.0;
        if (changePct <= thresholdPct) {
            return List.of();
        }

        boolean drop = value < expected;
        AnomalyType type = drop ? AnomalyType.SUDDEN_DROP : AnomalyType.SUDDEN_SPIKE;
        Severity severity = zeroBaseline ? Severity.CRITICAL : Scoring.fromThresholdRatio(changePct / thresholdPct);
        double band = Math.abs(expected) * thresholdPct / 100.0;

        return List.of(Anomaly.builder()
                .id(AnomalyIds.of(series.getMetricName(), type, latest.getTimestamp()))
                .metricName(series.getMetricName())
                .anomalyType(type)
                .severity(severity)
                .confidence(Scoring.confidence(changePct, thresholdPct, zeroBaseline))
                .detectedValue(value)
                .expectedValue(expected)
                .thresholdValue(drop ? expected - band : expected + band)
                .deviationPercentage(Stats.percentChange(expected, value))
                .detectedAt(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "%s %s to %.2f from a trailing average of %.2f",
                        series.getMetricName(), drop ? "dropped" : "spiked", value, expected))
                .build());
    }

    @Override
    public String getName() {
        return "sudden_change";
    }
}
