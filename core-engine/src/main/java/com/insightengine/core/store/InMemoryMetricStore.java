package com.insightengine.core.store;

import com.insightengine.core.model.MetricPoint;
import com.insightengine.core.model.MetricSeries;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link MetricStore}. Points are kept sorted by
 * timestamp whatever the order they arrive in.
 *
 * @since 1.0.0
 */
public class InMemoryMetricStore implements MetricStore {

    private final Map<String, MetricSeries> series = new ConcurrentHashMap<>();

    /**
     * Add every point of a series to the stored history of its metric.
     *
     * @param incoming points to add
     */
    public void put(MetricSeries incoming) {
        Objects.requireNonNull(incoming, "series must not be null");
        series.merge(incoming.getMetricName(), sorted(incoming), InMemoryMetricStore::concat);
    }

    public void append(String metricName, Instant timestamp, double value) {
        put(new MetricSeries(metricName, List.of(new MetricPoint(timestamp, value))));
    }

    @Override
    public MetricSeries fetch(String metricName, Instant from, Instant to) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        MetricSeries stored = series.get(metricName);
        if (stored == null) {
            return new MetricSeries(metricName, List.of());
        }
        return stored.between(from, to);
    }

    private static MetricSeries concat(MetricSeries existing, MetricSeries added) {
        List<MetricPoint> points = new ArrayList<>(existing.getPoints());
        points.addAll(added.getPoints());
        return sorted(new MetricSeries(existing.getMetricName(), points));
    }

    private static MetricSeries sorted(MetricSeries unsorted) {
        List<MetricPoint> points = new ArrayList<>(unsorted.getPoints());
        // stable, so duplicate timestamps keep arrival order
        points.sort(Comparator.comparing(MetricPoint::getTimestamp));
        return new MetricSeries(unsorted.getMetricName(), points);
    }
}
