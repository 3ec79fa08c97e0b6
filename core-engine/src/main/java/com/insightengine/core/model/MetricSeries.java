package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.error.InvalidInputException;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered observations of one named metric.
 *
 * <p>
 * Points are expected in ascending timestamp order; the series does not sort
 * them. Duplicate timestamps are kept as given.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String metricName;
    private final List<MetricPoint> points;

    /**
     * @param metricName metric name; must not be {@code null}
     * @param points     observations; must not be {@code null} or contain
     *                   {@code null}
     * @throws InvalidInputException if a value is NaN or infinite
     */
    @JsonCreator
    public MetricSeries(@JsonProperty("metricName") String metricName,
                        @JsonProperty("points") List<MetricPoint> points) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.points = List.copyOf(Objects.requireNonNull(points, "points must not be null"));
        for (MetricPoint point : this.points) {
            if (!Double.isFinite(point.getValue())) {
                throw new InvalidInputException(
                        "Series '" + metricName + "' contains a non-finite value at " + point.getTimestamp());
            }
        }
    }

    /**
     * Build a series of evenly spaced points.
     *
     * @param metricName metric name
     * @param start      timestamp of the first value
     * @param step       spacing between consecutive values
     * @param values     observed values
     * @return new series
     */
    public static MetricSeries evenlySpaced(String metricName, Instant start, Duration step, double... values) {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(step, "step must not be null");
        List<MetricPoint> points = new ArrayList<>(values.length);
        for (int i = 0; i < values.length; i++) {
            points.add(new MetricPoint(start.plus(step.multipliedBy(i)), values[i]));
        }
        return new MetricSeries(metricName, points);
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable list of points
     */
    public List<MetricPoint> getPoints() {
        return points;
    }

    public int size() {
        return points.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * @return a fresh copy of the values, in point order
     */
    public double[] values() {
        double[] values = new double[points.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = points.get(i).getValue();
        }
        return values;
    }

    /**
     * @return the most recent point
     * @throws InsufficientDataException if the series is empty
     */
    public MetricPoint latest() {
        if (points.isEmpty()) {
            throw new InsufficientDataException("Latest point of '" + metricName + "'", 1, 0);
        }
        return points.get(points.size() - 1);
    }

    /**
     * @param count number of leading points to keep
     * @return series made of the first {@code count} points
     */
    public MetricSeries head(int count) {
        return new MetricSeries(metricName, points.subList(0, Math.min(count, points.size())));
    }

    /**
     * @param from inclusive lower bound
     * @param to   inclusive upper bound
     * @return series of the points with {@code from <= timestamp <= to}
     */
    public MetricSeries between(Instant from, Instant to) {
        List<MetricPoint> kept = new ArrayList<>();
        for (MetricPoint point : points) {
            Instant t = point.getTimestamp();
            if (!t.isBefore(from) && !t.isAfter(to)) {
                kept.add(point);
            }
        }
        return new MetricSeries(metricName, kept);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return metricName.equals(that.metricName) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, points);
    }

    @Override
    public String toString() {
        return "MetricSeries{metricName='" + metricName + "', size=" + points.size() + '}';
    }
}
