package com.insightengine.core.stats;

import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.error.InvalidInputException;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Objects;

/**
 * Closed-form statistics used by every analysis component.
 *
 * <p>
 * All methods are pure and thread-safe. Input arrays are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class Stats {

    /** Dispersion below this value is treated as zero. */
    public static final double EPSILON = 1e-10;

    /**
     * Magnitude reported as a percentage change when the baseline is zero and
     * the ratio is undefined.
     */
    public static final double DEVIATION_SENTINEL = 1_000_000.0;

    private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

    private Stats() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Summary statistics
    // ---------------------------------------------------------------

    /**
     * Summarize a non-empty sequence of values.
     *
     * @param values the values; must not be {@code null} or empty
     * @return mean, population standard deviation, median and quartiles
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static Statistics summarize(double[] values) {
        requireNonEmpty(values, "Statistics summary");
        double mean = mean(values);
        double stdDev = stdDev(values, mean);
        Percentile percentile = new Percentile().withEstimationType(Percentile.EstimationType.R_7);
        percentile.setData(values);
        return new Statistics(
                mean,
                stdDev,
                percentile.evaluate(50.0),
                percentile.evaluate(25.0),
                percentile.evaluate(75.0));
    }

    /**
     * @param values the values; must not be empty
     * @return arithmetic mean
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static double mean(double[] values) {
        requireNonEmpty(values, "Mean");
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by N).
     *
     * @param values the values; must not be empty
     * @return standard deviation
     * @throws InsufficientDataException if {@code values} is empty
     */
    public static double stdDev(double[] values) {
        return stdDev(values, mean(values));
    }

    private static double stdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    // ---------------------------------------------------------------
    // Correlation / regression
    // ---------------------------------------------------------------

    /**
     * Pearson correlation coefficient of two index-aligned series.
     *
     * @param seriesA first series
     * @param seriesB second series, same length as {@code seriesA}
     * @return coefficient in {@code [-1, 1]}
     * @throws InvalidInputException if the lengths differ, the series are
     *                               empty, or either series has zero variance
     */
    public static double correlation(double[] seriesA, double[] seriesB) {
        Objects.requireNonNull(seriesA, "seriesA must not be null");
        Objects.requireNonNull(seriesB, "seriesB must not be null");
        if (seriesA.length != seriesB.length) {
            throw new InvalidInputException(String.format(
                    "Correlation requires equal-length series, got %d and %d", seriesA.length, seriesB.length));
        }
        if (seriesA.length == 0) {
            throw new InvalidInputException("Correlation requires non-empty series");
        }

        double meanA = mean(seriesA);
        double meanB = mean(seriesB);
        double numerator = 0;
        double sumSqA = 0;
        double sumSqB = 0;
        for (int i = 0; i < seriesA.length; i++) {
            double diffA = seriesA[i] - meanA;
            double diffB = seriesB[i] - meanB;
            numerator += diffA * diffB;
            sumSqA += diffA * diffA;
            sumSqB += diffB * diffB;
        }

        if (Math.sqrt(sumSqA / seriesA.length) < EPSILON || Math.sqrt(sumSqB / seriesB.length) < EPSILON) {
            throw new InvalidInputException("Correlation is undefined for a series with zero variance");
        }
        double r = numerator / Math.sqrt(sumSqA * sumSqB);
        // rounding can push |r| a hair past 1
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Ordinary least-squares fit over the point index ({@code x = 0, 1, 2, ...}).
     *
     * @param values the y values
     * @return fitted line
     * @throws InvalidInputException if fewer than two values are given
     */
    public static RegressionLine linearRegression(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        double[] x = new double[values.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        return linearRegression(x, values);
    }

    /**
     * Ordinary least-squares fit of {@code y} against {@code x}.
     *
     * @param x numeric x-axis (index or elapsed time)
     * @param y observed values, same length as {@code x}
     * @return fitted line
     * @throws InvalidInputException if the lengths differ, fewer than two
     *                               points are given, or all x are equal
     */
    public static RegressionLine linearRegression(double[] x, double[] y) {
        Objects.requireNonNull(x, "x must not be null");
        Objects.requireNonNull(y, "y must not be null");
        if (x.length != y.length) {
            throw new InvalidInputException(String.format(
                    "Regression requires equal-length axes, got %d and %d", x.length, y.length));
        }
        if (x.length < 2) {
            throw new InvalidInputException("Regression requires at least 2 points, got " + x.length);
        }

        double xMean = mean(x);
        double yMean = mean(y);
        double covariance = 0;
        double variance = 0;
        for (int i = 0; i < x.length; i++) {
            double dX = x[i] - xMean;
            covariance += dX * (y[i] - yMean);
            variance += dX * dX;
        }
        if (variance < EPSILON) {
            throw new InvalidInputException("Regression is undefined when all x values are equal");
        }

        double slope = covariance / variance;
        return new RegressionLine(slope, yMean - slope * xMean);
    }

    /**
     * @param actual    observed values
     * @param predicted fitted values, same length as {@code actual}
     * @return mean of absolute residuals
     * @throws InvalidInputException if the lengths differ or the arrays are empty
     */
    public static double meanAbsoluteError(double[] actual, double[] predicted) {
        Objects.requireNonNull(actual, "actual must not be null");
        Objects.requireNonNull(predicted, "predicted must not be null");
        if (actual.length != predicted.length) {
            throw new InvalidInputException(String.format(
                    "MAE requires equal-length series, got %d and %d", actual.length, predicted.length));
        }
        if (actual.length == 0) {
            throw new InvalidInputException("MAE requires non-empty series");
        }
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    // ---------------------------------------------------------------
    // Helpers shared by the detectors and the forecaster
    // ---------------------------------------------------------------

    /**
     * Two-sided standard-normal quantile for a confidence level, e.g.
     * {@code 0.95 -> 1.96}.
     *
     * @param confidenceLevel level in {@code (0, 1)}
     * @return z-value
     * @throws InvalidInputException if the level is outside {@code (0, 1)}
     */
    public static double zValue(double confidenceLevel) {
        if (!(confidenceLevel > 0.0 && confidenceLevel < 1.0)) {
            throw new InvalidInputException("Confidence level must be in (0, 1), got " + confidenceLevel);
        }
        return STANDARD_NORMAL.inverseCumulativeProbability(1.0 - (1.0 - confidenceLevel) / 2.0);
    }

    /**
     * Percentage change from {@code from} to {@code to}.
     *
     * <p>
     * When {@code from} is zero the ratio is undefined; the result is then the
     * sign of {@code to} times {@link #DEVIATION_SENTINEL}.
     * </p>
     *
     * @param from baseline
     * @param to   observed value
     * @return {@code (to - from) / from * 100}, or the sentinel
     */
    public static double percentChange(double from, double to) {
        if (from == 0.0) {
            return Math.signum(to) * DEVIATION_SENTINEL;
        }
        return (to - from) / from * 100.0;
    }

    /**
     * @param value the value to clamp
     * @return {@code value} restricted to {@code [0, 1]}
     */
    public static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * @param values source array
     * @param from   inclusive start
     * @param to     exclusive end
     * @return mean of {@code values[from, to)}
     */
    public static double mean(double[] values, int from, int to) {
        if (from >= to) {
            throw new InsufficientDataException("Mean of range", 1, 0);
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static void requireNonEmpty(double[] values, String operation) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.length == 0) {
            throw new InsufficientDataException(operation, 1, 0);
        }
    }
}
