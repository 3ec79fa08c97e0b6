package com.insightengine.core.detection;

import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;

import java.util.List;

/**
 * Contract for one outlier test run by the {@link AnomalyDetector}.
 *
 * <p>
 * Implementations are <strong>stateless</strong>: every call judges the series
 * it is given and nothing else, so one instance may be shared across threads.
 * A test that cannot build a baseline (too few points, zero dispersion)
 * returns an empty list.
 * </p>
 */
public interface AnomalyCheck {

    /**
     * Evaluate a series.
     *
     * @param series    the series to judge; holds at least two points
     * @param direction which way the metric improves
     * @return anomalies found, never {@code null}
     */
    List<Anomaly> evaluate(MetricSeries series, MetricDirection direction);

    /**
     * @return short name used in log events
     */
    String getName();
}
