package com.insightengine.core.forecast;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.logging.RecordingInsightLogger;
import com.insightengine.core.model.ForecastPoint;
import com.insightengine.core.model.ForecastResult;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Trend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Forecaster}.
 */
class ForecasterTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final double[] NOISY = {10, 12, 11, 13, 12, 14, 13, 15, 14, 16};

    private RecordingInsightLogger logger;
    private Forecaster forecaster;

    @BeforeEach
    void setUp() {
        logger = new RecordingInsightLogger();
        forecaster = new Forecaster(EngineConfig.defaults(), logger);
    }

    @Test
    @DisplayName("Should continue a straight line with full accuracy")
    void shouldContinueStraightLine() {
        ForecastResult result = forecaster.forecast(daily("quality_score", linear(50, 2, 10)));

        assertThat(result.getTrend()).isEqualTo(Trend.INCREASING);
        assertThat(result.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(result.getAccuracyEstimate()).isCloseTo(1.0, within(1e-9));
        assertThat(result.getPoints()).hasSize(7);
        for (int k = 1; k <= 7; k++) {
            ForecastPoint point = result.getPoints().get(k - 1);
            assertThat(point.getPredictedValue()).isCloseTo(50 + 2 * (9 + k), within(1e-6));
            assertThat(point.getTimestamp()).isEqualTo(T0.plus(Duration.ofDays(9 + k)));
        }
        assertThat(logger.first("forecast_completed").getFields()).containsEntry("trend", "increasing");
    }

    @Test
    @DisplayName("Should widen the interval with the horizon")
    void intervalShouldWidenWithHorizon() {
        List<ForecastPoint> points = forecaster.forecast(daily("quality_score", NOISY)).getPoints();

        for (int i = 1; i < points.size(); i++) {
            assertThat(points.get(i).intervalWidth()).isGreaterThan(points.get(i - 1).intervalWidth());
        }
        for (ForecastPoint point : points) {
            assertThat(point.getLowerBound()).isLessThan(point.getPredictedValue());
            assertThat(point.getUpperBound()).isGreaterThan(point.getPredictedValue());
        }
    }

    @Test
    @DisplayName("A lower confidence level should give a narrower interval")
    void lowerConfidenceShouldNarrowInterval() {
        MetricSeries series = daily("quality_score", NOISY);

        ForecastPoint wide = forecaster.forecast(series, 3, 0.95).getPoints().get(0);
        ForecastPoint narrow = forecaster.forecast(series, 3, 0.80).getPoints().get(0);

        assertThat(narrow.intervalWidth()).isLessThan(wide.intervalWidth());
        assertThat(narrow.getPredictedValue()).isCloseTo(wide.getPredictedValue(), within(1e-9));
    }

    @Test
    @DisplayName("Should classify flat and falling series")
    void shouldClassifyTrend() {
        assertThat(forecaster.forecast(daily("quality_score", 5, 5, 5, 5, 5, 5, 5, 5)).getTrend())
                .isEqualTo(Trend.STABLE);
        assertThat(forecaster.forecast(daily("quality_score", linear(100, -3, 10))).getTrend())
                .isEqualTo(Trend.DECREASING);
    }

    @Test
    @DisplayName("Should measure the slope per elapsed day for hourly data")
    void shouldUseElapsedDays() {
        MetricSeries hourly = MetricSeries.evenlySpaced("requests", T0, Duration.ofHours(1), linear(0, 1, 10));

        ForecastResult result = forecaster.forecast(hourly, 1, 0.95);

        assertThat(result.getSlope()).isCloseTo(24.0, within(1e-6));
        assertThat(result.getPoints().get(0).getPredictedValue()).isCloseTo(33.0, within(1e-6));
    }

    @Test
    @DisplayName("Should refuse fewer than seven points")
    void shouldRefuseShortSeries() {
        assertThatThrownBy(() -> forecaster.forecast(daily("quality_score", 1, 2, 3, 4, 5, 6)))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(7);
                    assertThat(e.getActual()).isEqualTo(6);
                });
    }

    @Test
    @DisplayName("Should honour a larger configured minimum")
    void shouldHonourConfiguredMinimum() {
        EngineConfig config = EngineConfig.defaults();
        config.setMinForecastPoints(10);
        Forecaster strict = new Forecaster(config, logger);

        assertThatThrownBy(() -> strict.forecast(daily("quality_score", linear(1, 1, 8))))
                .isInstanceOfSatisfying(InsufficientDataException.class,
                        e -> assertThat(e.getRequired()).isEqualTo(10));
    }

    @Test
    @DisplayName("Should keep the options it was built with")
    void shouldKeepOptionsFromConstruction() {
        EngineConfig config = EngineConfig.defaults();
        Forecaster built = new Forecaster(config, logger);
        config.setForecastDays(0);
        config.setMinForecastPoints(100);

        assertThat(built.forecast(daily("quality_score", linear(50, 2, 10))).getPoints()).hasSize(7);
    }

    @Test
    @DisplayName("Smoothing should average full trailing windows")
    void smoothingShouldAverageFullWindows() {
        assertThat(Forecaster.smooth(new double[] {1, 2, 3, 4, 5}, 3)).containsExactly(2, 3, 4);
        assertThat(Forecaster.smooth(new double[] {1, 2}, 1)).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Accuracy should be one minus the relative error, clamped")
    void accuracyShouldBeClamped() {
        assertThat(Forecaster.accuracy(5, 50)).isCloseTo(0.9, within(1e-12));
        assertThat(Forecaster.accuracy(80, 50)).isZero();
        assertThat(Forecaster.accuracy(0, 0)).isEqualTo(1.0);
        assertThat(Forecaster.accuracy(1, 0)).isZero();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static double[] linear(double start, double step, int count) {
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = start + step * i;
        }
        return values;
    }

    private static MetricSeries daily(String metric, double... values) {
        return MetricSeries.evenlySpaced(metric, T0, Duration.ofDays(1), values);
    }
}
