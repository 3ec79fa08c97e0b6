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
 * Interquartile-range outlier test of the latest point.
 *
 * <p>
 * Fences are {@code Q1 - k·IQR} and {@code Q3 + k·IQR} of every point except
 * the latest. Severity grows with the distance beyond the fence, in IQR units:
 * 0.5 medium, 1.5 high, 3 critical.
 * </p>
 *
 * @since 1.0.0
 */
public class IqrOutlierCheck implements AnomalyCheck {

    private final double multiplier;
    private final InsightLogger logger;

    public IqrOutlierCheck(double multiplier, InsightLogger logger) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("IQR multiplier must be > 0, got: " + multiplier);
        }
        this.multiplier = multiplier;
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    @Override
    public List<Anomaly> evaluate(MetricSeries series, MetricDirection direction) {
        double[] values = series.values();
        Statistics stats = Stats.summarize(Arrays.copyOf(values, values.length - 1));
        double iqr = stats.iqr();

        if (iqr < Stats.EPSILON) {
            logger.info("anomaly_check_skipped", LogFields.of(
                    "check", getName(), "metric", series.getMetricName(), "reason", "zero_dispersion"));
            return List.of();
        }

        MetricPoint latest = series.latest();
        double value = latest.getValue();
        double lowerFence = stats.getQ1() - multiplier * iqr;
        double upperFence = stats.getQ3() + multiplier * iqr;

        double fence;
        double distance;
        if (value < lowerFence) {
            fence = lowerFence;
            distance = (lowerFence - value) / iqr;
        } else if (value > upperFence) {
            fence = upperFence;
            distance = (value - upperFence) / iqr;
        } else {
            return List.of();
        }

        double mean = stats.getMean();
        return List.of(Anomaly.builder()
                .id(AnomalyIds.of(series.getMetricName(), AnomalyType.IQR_OUTLIER, latest.getTimestamp()))
                .metricName(series.getMetricName())
                .anomalyType(AnomalyType.IQR_OUTLIER)
                .severity(Severity.classify(distance, 0.5, 1.5, 3.0))
                .confidence(Scoring.confidence(multiplier + distance, multiplier, mean == 0.0))
                .detectedValue(value)
                .expectedValue(mean)
                .thresholdValue(fence)
                .deviationPercentage(Stats.percentChange(mean, value))
                .detectedAt(latest.getTimestamp())
                .description(String.format(Locale.ROOT,
                        "%s value %.2f is outside the IQR fences [%.2f, %.2f]",
                        series.getMetricName(), value, lowerFence, upperFence))
                .build());
    }

    @Override
    public String getName() {
        return "iqr";
    }
}
