package com.insightengine.core.stats;

import java.util.Objects;

/**
 * Ordinary least-squares fit {@code y = intercept + slope * x}.
 *
 * @since 1.0.0
 */
public final class RegressionLine {

    private final double slope;
    private final double intercept;

    public RegressionLine(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    public double getSlope() {
        return slope;
    }

    public double getIntercept() {
        return intercept;
    }

    public double predict(double x) {
        return intercept + slope * x;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RegressionLine that))
            return false;
        return Double.compare(slope, that.slope) == 0 && Double.compare(intercept, that.intercept) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(slope, intercept);
    }

    @Override
    public String toString() {
        return "RegressionLine{slope=" + slope + ", intercept=" + intercept + '}';
    }
}
