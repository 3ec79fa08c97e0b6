package com.insightengine.core.rca;

import java.util.Objects;

/**
 * What makes a past incident "similar": same metric, a percentage drop within
 * {@code dropTolerance} points, at most {@code limit} results, most recent
 * first.
 *
 * @since 1.0.0
 */
public final class IncidentQuery {

    private final String metricName;
    private final double percentageDrop;
    private final double dropTolerance;
    private final int limit;

    public IncidentQuery(String metricName, double percentageDrop, double dropTolerance, int limit) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        if (dropTolerance < 0) {
            throw new IllegalArgumentException("dropTolerance must be >= 0, got: " + dropTolerance);
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got: " + limit);
        }
        this.percentageDrop = percentageDrop;
        this.dropTolerance = dropTolerance;
        this.limit = limit;
    }

    public String getMetricName() {
        return metricName;
    }

    public double getPercentageDrop() {
        return percentageDrop;
    }

    public double getDropTolerance() {
        return dropTolerance;
    }

    public int getLimit() {
        return limit;
    }

    /**
     * @param metricName     metric of a past incident
     * @param percentageDrop drop of a past incident
     * @return {@code true} if the incident satisfies this query's filter
     */
    public boolean matches(String metricName, double percentageDrop) {
        return this.metricName.equals(metricName)
                && Math.abs(this.percentageDrop - percentageDrop) <= dropTolerance;
    }

    @Override
    public String toString() {
        return "IncidentQuery{metricName='" + metricName + "', percentageDrop=" + percentageDrop
                + ", dropTolerance=" + dropTolerance + ", limit=" + limit + '}';
    }
}
