package com.insightengine.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A past degradation of the same metric, supplied by the incident history.
 *
 * @since 1.0.0
 */
public final class SimilarIncident {

    private final Instant date;
    private final String metricName;
    private final double percentageDrop;
    private final String cause;
    private final String resolution;

    public SimilarIncident(Instant date, String metricName, double percentageDrop, String cause, String resolution) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.percentageDrop = percentageDrop;
        this.cause = cause;
        this.resolution = resolution;
    }

    public Instant getDate() {
        return date;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getPercentageDrop() {
        return percentageDrop;
    }

    public String getCause() {
        return cause;
    }

    public String getResolution() {
        return resolution;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SimilarIncident that))
            return false;
        return Double.compare(percentageDrop, that.percentageDrop) == 0
                && date.equals(that.date)
                && metricName.equals(that.metricName)
                && Objects.equals(cause, that.cause)
                && Objects.equals(resolution, that.resolution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, metricName, percentageDrop, cause, resolution);
    }

    @Override
    public String toString() {
        return "SimilarIncident{date=" + date + ", metricName='" + metricName + "', percentageDrop="
                + percentageDrop + ", cause='" + cause + "'}";
    }
}
