package com.insightengine.core.model;

import java.util.Objects;

/**
 * A significant linear association between two metrics.
 *
 * @since 1.0.0
 */
public final class Correlation {

    private final String metricA;
    private final String metricB;
    private final double coefficient;

    public Correlation(String metricA, String metricB, double coefficient) {
        this.metricA = Objects.requireNonNull(metricA, "metricA must not be null");
        this.metricB = Objects.requireNonNull(metricB, "metricB must not be null");
        if (coefficient < -1.0 || coefficient > 1.0) {
            throw new IllegalArgumentException("coefficient must be in [-1, 1], got: " + coefficient);
        }
        this.coefficient = coefficient;
    }

    public String getMetricA() {
        return metricA;
    }

    public String getMetricB() {
        return metricB;
    }

    public double getCoefficient() {
        return coefficient;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Correlation that))
            return false;
        return Double.compare(coefficient, that.coefficient) == 0
                && metricA.equals(that.metricA)
                && metricB.equals(that.metricB);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricA, metricB, coefficient);
    }

    @Override
    public String toString() {
        return "Correlation{" + metricA + " ~ " + metricB + " = " + coefficient + '}';
    }
}
