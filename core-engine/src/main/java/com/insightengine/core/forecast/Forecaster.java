package com.insightengine.core.forecast;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.ForecastPoint;
import com.insightengine.core.model.ForecastResult;
import com.insightengine.core.model.MetricPoint;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Trend;
import com.insightengine.core.stats.RegressionLine;
import com.insightengine.core.stats.Stats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Linear-trend forecaster with prediction intervals.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>x is the elapsed time since the first point, in fractional days.</li>
 * <li>A trailing moving average of width {@code min(smoothingWindow, n - 2)}
 * smooths the series. Only full windows are kept and each averaged value is
 * placed at the mean x of its window, so a straight line stays straight.</li>
 * <li>An ordinary least-squares line is fitted to the smoothed points.</li>
 * <li>The residual standard error comes from the raw points:
 * {@code sqrt(SSE / (n - 2))}.</li>
 * <li>Day {@code k} is projected at {@code x_last + k} with the margin
 * {@code z · se · sqrt(1 + 1/m + (x - x̄)² / Σ(x - x̄)²)} over the {@code m}
 * fitted points, so the interval widens with the horizon.</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class Forecaster {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final EngineConfig config;
    private final InsightLogger logger;

    public Forecaster(EngineConfig config) {
        this(config, Slf4jInsightLogger.forClass(Forecaster.class));
    }

    public Forecaster(EngineConfig config, InsightLogger logger) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null").copy();
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * Forecast {@code forecastDays} days with the configured confidence level.
     *
     * @param series history, timestamp-ascending
     * @return forecast
     * @throws InsufficientDataException if the series is shorter than
     *                                   {@code minForecastPoints}
     */
    public ForecastResult forecast(MetricSeries series) {
        return forecast(series, config.getForecastDays(), config.getForecastConfidenceLevel());
    }

    /**
     * @param series          history, timestamp-ascending
     * @param days            number of future days; at least 1
     * @param confidenceLevel interval confidence in {@code (0, 1)}
     * @return forecast with one point per future day
     * @throws InsufficientDataException if the series is shorter than
     *                                   {@code minForecastPoints}
     * @throws com.insightengine.core.error.InvalidInputException if all
     *         timestamps are equal or the confidence level is out of range
     */
    public ForecastResult forecast(MetricSeries series, int days, double confidenceLevel) {
        Objects.requireNonNull(series, "series must not be null");
        if (days < 1) {
            throw new IllegalArgumentException("days must be >= 1, got: " + days);
        }
        int n = series.size();
        int required = Math.max(EngineConfig.FORECAST_POINT_FLOOR, config.getMinForecastPoints());
        if (n < required) {
            throw new InsufficientDataException("Forecast of '" + series.getMetricName() + "'", required, n);
        }
        double z = Stats.zValue(confidenceLevel);

        List<MetricPoint> points = series.getPoints();
        Instant origin = points.get(0).getTimestamp();
        double[] x = new double[n];
        double[] y = series.values();
        for (int i = 0; i < n; i++) {
            x[i] = elapsedDays(origin, points.get(i).getTimestamp());
        }

        int window = Math.min(config.getSmoothingWindow(), n - 2);
        double[] fitX = smooth(x, window);
        double[] fitY = smooth(y, window);
        RegressionLine line = Stats.linearRegression(fitX, fitY);

        double[] fitted = new double[n];
        double sse = 0;
        for (int i = 0; i < n; i++) {
            fitted[i] = line.predict(x[i]);
            double residual = y[i] - fitted[i];
            sse += residual * residual;
        }
        double standardError = Math.sqrt(sse / (n - 2));
        double historicalMean = Stats.mean(y);
        double accuracy = accuracy(Stats.meanAbsoluteError(y, fitted), historicalMean);

        double fitMeanX = Stats.mean(fitX);
        double sxx = 0;
        for (double v : fitX) {
            sxx += (v - fitMeanX) * (v - fitMeanX);
        }

        Instant lastTimestamp = points.get(n - 1).getTimestamp();
        double lastX = x[n - 1];
        List<ForecastPoint> forecast = new ArrayList<>(days);
        double predictedSum = 0;
        for (int k = 1; k <= days; k++) {
            double xk = lastX + k;
            double predicted = line.predict(xk);
            double spread = Math.sqrt(1.0 + 1.0 / fitX.length + (xk - fitMeanX) * (xk - fitMeanX) / sxx);
            double margin = z * standardError * spread;
            forecast.add(new ForecastPoint(lastTimestamp.plus(Duration.ofDays(k)),
                    predicted, predicted - margin, predicted + margin));
            predictedSum += predicted;
        }

        Trend trend = classify(line.getSlope(), historicalMean);
        ForecastResult result = new ForecastResult(series.getMetricName(), forecast, trend, historicalMean,
                predictedSum / days, line.getSlope(), accuracy);

        logger.info("forecast_completed", LogFields.of(
                "metric", series.getMetricName(),
                "points", n,
                "days", days,
                "trend", trend.wireName(),
                "slope", line.getSlope(),
                "accuracy", accuracy));
        return result;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Trend classify(double slope, double historicalMean) {
        double epsilon = config.getTrendEpsilonFraction() * Math.abs(historicalMean);
        if (slope > epsilon) {
            return Trend.INCREASING;
        }
        if (slope < -epsilon) {
            return Trend.DECREASING;
        }
        return Trend.STABLE;
    }

    static double accuracy(double mae, double historicalMean) {
        double normalized;
        if (Math.abs(historicalMean) > Stats.EPSILON) {
            normalized = mae / Math.abs(historicalMean);
        } else {
            normalized = mae < Stats.EPSILON ? 0.0 : 1.0;
        }
        return Stats.clampUnit(1.0 - normalized);
    }

    /**
     * Trailing moving average over full windows only.
     *
     * @param values source values
     * @param window window width; 1 returns a copy
     * @return {@code values.length - window + 1} averages
     */
    static double[] smooth(double[] values, int window) {
        if (window <= 1) {
            return values.clone();
        }
        double[] smoothed = new double[values.length - window + 1];
        for (int i = 0; i < smoothed.length; i++) {
            smoothed[i] = Stats.mean(values, i, i + window);
        }
        return smoothed;
    }

    private static double elapsedDays(Instant origin, Instant timestamp) {
        return Duration.between(origin, timestamp).toMillis() / MILLIS_PER_DAY;
    }
}
