package com.insightengine.core.detection;

import com.insightengine.core.error.InvalidInputException;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.Correlation;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.stats.Stats;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pairwise Pearson correlation across metrics, keeping only strong
 * associations.
 *
 * @since 1.0.0
 */
public class CorrelationFinder {

    /** Coefficients at or below this magnitude are dropped. */
    public static final double SIGNIFICANCE_CUTOFF = 0.6;

    private final InsightLogger logger;

    public CorrelationFinder() {
        this(Slf4jInsightLogger.forClass(CorrelationFinder.class));
    }

    public CorrelationFinder(InsightLogger logger) {
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @param series index-aligned series of several metrics
     * @return correlations with {@code |r| > 0.6}, in pair order; pairs of
     *         different length or with a constant series are skipped
     */
    public List<Correlation> findCorrelations(List<MetricSeries> series) {
        Objects.requireNonNull(series, "series must not be null");
        List<Correlation> correlations = new ArrayList<>();
        for (int i = 0; i < series.size(); i++) {
            for (int j = i + 1; j < series.size(); j++) {
                MetricSeries a = series.get(i);
                MetricSeries b = series.get(j);
                double r;
                try {
                    r = Stats.correlation(a.values(), b.values());
                } catch (InvalidInputException e) {
                    logger.info("correlation_skipped", LogFields.of(
                            "metricA", a.getMetricName(), "metricB", b.getMetricName(), "reason", e.getMessage()));
                    continue;
                }
                if (Math.abs(r) > SIGNIFICANCE_CUTOFF) {
                    correlations.add(new Correlation(a.getMetricName(), b.getMetricName(), r));
                }
            }
        }
        return List.copyOf(correlations);
    }
}
