package com.insightengine.core.stats;

import java.util.Objects;

/**
 * Immutable summary of a series of values.
 *
 * <p>
 * {@code stdDev} is the population standard deviation. Quartiles use linear
 * interpolation between ranks.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private final double mean;
    private final double stdDev;
    private final double median;
    private final double q1;
    private final double q3;

    public Statistics(double mean, double stdDev, double median, double q1, double q3) {
        this.mean = mean;
        this.stdDev = stdDev;
        this.median = median;
        this.q1 = q1;
        this.q3 = q3;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getMedian() {
        return median;
    }

    public double getQ1() {
        return q1;
    }

    public double getQ3() {
        return q3;
    }

    /**
     * @return interquartile range {@code q3 - q1}
     */
    public double iqr() {
        return q3 - q1;
    }

    /**
     * @return {@code true} when the standard deviation is indistinguishable from zero
     */
    public boolean hasZeroVariance() {
        return stdDev < Stats.EPSILON;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Statistics that))
            return false;
        return Double.compare(mean, that.mean) == 0
                && Double.compare(stdDev, that.stdDev) == 0
                && Double.compare(median, that.median) == 0
                && Double.compare(q1, that.q1) == 0
                && Double.compare(q3, that.q3) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mean, stdDev, median, q1, q3);
    }

    @Override
    public String toString() {
        return "Statistics{" +
                "mean=" + mean +
                ", stdDev=" + stdDev +
                ", median=" + median +
                ", q1=" + q1 +
                ", q3=" + q3 +
                '}';
    }
}
