package com.insightengine.core.store;

import com.insightengine.core.model.MetricSeries;

import java.time.Instant;

/**
 * Source of metric history.
 *
 * <p>
 * Implementations return points in ascending timestamp order; the engine does
 * not sort them.
 * </p>
 */
public interface MetricStore {

    /**
     * @param metricName metric to fetch
     * @param from       inclusive start
     * @param to         inclusive end
     * @return the points in range; an empty series when there are none
     */
    MetricSeries fetch(String metricName, Instant from, Instant to);
}
