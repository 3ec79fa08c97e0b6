package com.insightengine.core.forecast;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.RiskScore;
import com.insightengine.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link RiskAssessor}.
 */
class RiskAssessorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private final EngineConfig config = EngineConfig.defaults();
    private final Forecaster forecaster = new Forecaster(config, InsightLogger.noop());
    private final RiskAssessor assessor = new RiskAssessor(config, InsightLogger.noop());

    @Test
    @DisplayName("A steadily falling quality score should be critical")
    void fallingQualityShouldBeCritical() {
        MetricSeries series = declining();

        RiskScore risk = assessor.assess(series, forecaster.forecast(series), MetricDirection.HIGHER_IS_BETTER);

        // trend 30 + forecast 25 + volatility 25
        assertThat(risk.getScore()).isEqualTo(80);
        assertThat(risk.getLevel()).isEqualTo(Severity.CRITICAL);
        assertThat(risk.getProbability()).isCloseTo(0.8, within(1e-12));
        assertThat(risk.getRecommendations()).hasSize(3);
    }

    @Test
    @DisplayName("The same fall should only count as volatility for a lower-is-better metric")
    void fallShouldBeFavourableForLowerIsBetter() {
        MetricSeries series = declining();

        RiskScore risk = assessor.assess(series, forecaster.forecast(series), MetricDirection.LOWER_IS_BETTER);

        assertThat(risk.getScore()).isEqualTo(25);
        assertThat(risk.getLevel()).isEqualTo(Severity.MEDIUM);
        assertThat(risk.getRecommendations()).singleElement()
                .satisfies(recommendation -> assertThat(recommendation).contains("volatile"));
    }

    @Test
    @DisplayName("A flat series should carry no risk")
    void flatSeriesShouldCarryNoRisk() {
        MetricSeries series = MetricSeries.evenlySpaced("quality_score", T0, Duration.ofDays(1),
                50, 50, 50, 50, 50, 50, 50, 50, 50, 50, 50, 50, 50, 50);

        RiskScore risk = assessor.assess(series, forecaster.forecast(series), MetricDirection.HIGHER_IS_BETTER);

        assertThat(risk.getScore()).isZero();
        assertThat(risk.getLevel()).isEqualTo(Severity.LOW);
        assertThat(risk.getRecommendations()).isEmpty();
    }

    @Test
    @DisplayName("An erratic series should be penalised for low forecast accuracy")
    void erraticSeriesShouldLoseAccuracyPoints() {
        MetricSeries series = MetricSeries.evenlySpaced("quality_score", T0, Duration.ofDays(1),
                1, 100, 1, 100, 1, 100, 1, 100, 1, 100, 1, 100, 1, 100);

        RiskScore risk = assessor.assess(series, forecaster.forecast(series), MetricDirection.HIGHER_IS_BETTER);

        assertThat(risk.getScore()).isGreaterThanOrEqualTo(45);
        assertThat(risk.getRecommendations())
                .contains("Low forecast confidence for quality_score: collect more data");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries declining() {
        double[] values = new double[14];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 - 5 * i;
        }
        return MetricSeries.evenlySpaced("quality_score", T0, Duration.ofDays(1), values);
    }
}
