package com.insightengine.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One projected value with its prediction interval.
 *
 * @since 1.0.0
 */
public final class ForecastPoint {

    private final Instant timestamp;
    private final double predictedValue;
    private final double lowerBound;
    private final double upperBound;

    public ForecastPoint(Instant timestamp, double predictedValue, double lowerBound, double upperBound) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.predictedValue = predictedValue;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getPredictedValue() {
        return predictedValue;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    /**
     * @return {@code upperBound - lowerBound}
     */
    public double intervalWidth() {
        return upperBound - lowerBound;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ForecastPoint that))
            return false;
        return Double.compare(predictedValue, that.predictedValue) == 0
                && Double.compare(lowerBound, that.lowerBound) == 0
                && Double.compare(upperBound, that.upperBound) == 0
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, predictedValue, lowerBound, upperBound);
    }

    @Override
    public String toString() {
        return "ForecastPoint{" + timestamp + ": " + predictedValue + " [" + lowerBound + ", " + upperBound + "]}";
    }
}
