package com.insightengine.core.model;

import java.util.Objects;

/**
 * A correlated sibling metric with the time by which its shift preceded the
 * degradation.
 *
 * @since 1.0.0
 */
public final class ContributingFactor {

    private final String factor;
    private final double correlation;
    private final Double timeLagHours;

    public ContributingFactor(String factor, double correlation, Double timeLagHours) {
        this.factor = Objects.requireNonNull(factor, "factor must not be null");
        this.correlation = correlation;
        this.timeLagHours = timeLagHours;
    }

    public String getFactor() {
        return factor;
    }

    public double getCorrelation() {
        return correlation;
    }

    /**
     * @return hours between the factor's shift and the degradation (positive
     *         when the factor moved first), or {@code null} if no shift was found
     */
    public Double getTimeLagHours() {
        return timeLagHours;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ContributingFactor that))
            return false;
        return Double.compare(correlation, that.correlation) == 0
                && factor.equals(that.factor)
                && Objects.equals(timeLagHours, that.timeLagHours);
    }

    @Override
    public int hashCode() {
        return Objects.hash(factor, correlation, timeLagHours);
    }

    @Override
    public String toString() {
        return "ContributingFactor{factor='" + factor + "', correlation=" + correlation
                + ", timeLagHours=" + timeLagHours + '}';
    }
}
