package com.insightengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Multi-day projection of a metric with trend classification.
 *
 * <p>
 * {@code slope} is in metric units per day. {@code accuracyEstimate} is
 * {@code 1 - MAE / |historicalMean|} clamped to {@code [0, 1]}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ForecastResult {

    private final String metricName;
    private final List<ForecastPoint> points;
    private final Trend trend;
    private final double historicalMean;
    private final double forecastMean;
    private final double slope;
    private final double accuracyEstimate;

    public ForecastResult(String metricName, List<ForecastPoint> points, Trend trend, double historicalMean,
                          double forecastMean, double slope, double accuracyEstimate) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.points = List.copyOf(points);
        this.trend = Objects.requireNonNull(trend, "trend must not be null");
        this.historicalMean = historicalMean;
        this.forecastMean = forecastMean;
        this.slope = slope;
        this.accuracyEstimate = accuracyEstimate;
    }

    public String getMetricName() {
        return metricName;
    }

    public List<ForecastPoint> getPoints() {
        return points;
    }

    public Trend getTrend() {
        return trend;
    }

    public double getHistoricalMean() {
        return historicalMean;
    }

    public double getForecastMean() {
        return forecastMean;
    }

    public double getSlope() {
        return slope;
    }

    public double getAccuracyEstimate() {
        return accuracyEstimate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastResult that))
            return false;
        return Double.compare(historicalMean, that.historicalMean) == 0
                && Double.compare(forecastMean, that.forecastMean) == 0
                && Double.compare(slope, that.slope) == 0
                && Double.compare(accuracyEstimate, that.accuracyEstimate) == 0
                && metricName.equals(that.metricName)
                && points.equals(that.points)
                && trend == that.trend;
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, points, trend, historicalMean, forecastMean, slope, accuracyEstimate);
    }

    @Override
    public String toString() {
        return "ForecastResult{" +
                "metricName='" + metricName + '\'' +
                ", trend=" + trend.wireName() +
                ", slope=" + slope +
                ", historicalMean=" + historicalMean +
                ", forecastMean=" + forecastMean +
                ", accuracyEstimate=" + accuracyEstimate +
                ", points=" + points.size() +
                '}';
    }
}
