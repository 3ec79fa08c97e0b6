package com.insightengine.core;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.error.InvalidInputException;
import com.insightengine.core.logging.RecordingInsightLogger;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.CauseCategory;
import com.insightengine.core.model.Investigation;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.PrimaryCause;
import com.insightengine.core.model.Priority;
import com.insightengine.core.model.Recommendation;
import com.insightengine.core.model.RiskScore;
import com.insightengine.core.model.RootCauseAnalysis;
import com.insightengine.core.model.Severity;
import com.insightengine.core.store.InMemoryMetricStore;
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
 * End-to-end tests for {@link InsightEngine}.
 */
class InsightEngineTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final Instant T6 = T0.plus(Duration.ofHours(6));

    private InMemoryMetricStore store;
    private RecordingInsightLogger logger;
    private InsightEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetricStore();
        logger = new RecordingInsightLogger();
        engine = InsightEngine.builder()
                .config(EngineConfig.defaults())
                .metricStore(store)
                .logger(logger)
                .build();
    }

    @Test
    @DisplayName("Should trace a success-rate collapse to the error count and recommend a fix")
    void shouldInvestigateEndToEnd() {
        store.put(hourly("success_rate", 10, 10, 10, 10, 10, 10, 2));
        store.put(hourly("error_count", 1, 1, 1, 1, 1, 1, 9));

        Investigation investigation = engine.investigate("success_rate", List.of("error_count"), T0, T6);

        assertThat(investigation.getAnomalies()).singleElement()
                .satisfies(a -> assertThat(a.getAnomalyType()).isEqualTo(AnomalyType.SUDDEN_DROP));
        assertThat(investigation.getAnalysis()).isPresent();
        RootCauseAnalysis analysis = investigation.getAnalysis().get();
        assertThat(analysis.getDegradation().getStartTime()).isEqualTo(T6);
        assertThat(analysis.getDegradation().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(analysis.getDegradation().getPercentageDrop()).isCloseTo(80.0, within(1e-9));
        PrimaryCause cause = analysis.getPrimaryCauses().get(0);
        assertThat(cause.getFactor()).isEqualTo("error_count");
        assertThat(cause.getContributionPercentage()).isCloseTo(100.0, within(1e-9));

        assertThat(investigation.getRecommendations()).singleElement().satisfies(r -> {
            assertThat(r.getCategory()).isEqualTo(CauseCategory.HIGH_ERROR_RATE);
            assertThat(r.getPriority()).isEqualTo(Priority.CRITICAL);
            assertThat(r.getTitle()).isEqualTo("Investigate and fix error_count errors");
        });
        assertThat(logger.first("investigation_completed").getFields())
                .containsEntry("analysed", true)
                .containsEntry("recommendations", 1);
    }

    @Test
    @DisplayName("Should give the same answer for the same data")
    void investigationShouldBeRepeatable() {
        store.put(hourly("success_rate", 10, 10, 10, 10, 10, 10, 2));
        store.put(hourly("error_count", 1, 1, 1, 1, 1, 1, 9));

        Investigation first = engine.investigate("success_rate", List.of("error_count"), T0, T6);
        Investigation second = engine.investigate("success_rate", List.of("error_count"), T0, T6);

        assertThat(second.getRecommendations()).extracting(Recommendation::getId)
                .isEqualTo(first.getRecommendations().stream().map(Recommendation::getId).toList());
        assertThat(second.getAnalysis()).isEqualTo(first.getAnalysis());
    }

    @Test
    @DisplayName("A favourable change should not start an analysis")
    void favourableChangeShouldNotTriggerAnalysis() {
        store.put(hourly("error_count", 9, 9, 9, 9, 9, 9, 1));

        Investigation investigation = engine.investigate("error_count", List.of(), T0, T6);

        assertThat(investigation.getAnomalies()).isNotEmpty();
        assertThat(investigation.getAnalysis()).isEmpty();
        assertThat(investigation.getRecommendations()).isEmpty();
    }

    @Test
    @DisplayName("A stable metric should yield an empty investigation")
    void stableMetricShouldYieldNothing() {
        store.put(hourly("success_rate", 10, 10, 10, 10, 10, 10, 10));

        Investigation investigation = engine.investigate("success_rate", List.of("error_count"), T0, T6);

        assertThat(investigation.getAnomalies()).isEmpty();
        assertThat(investigation.getAnalysis()).isEmpty();
    }

    @Test
    @DisplayName("Should log and rethrow when a sibling is misaligned")
    void shouldLogAndRethrowAnalysisFailure() {
        store.put(hourly("success_rate", 10, 10, 10, 10, 10, 10, 2));
        store.put(MetricSeries.evenlySpaced("error_count", T0.plus(Duration.ofHours(4)), Duration.ofHours(1), 1, 1, 9));

        assertThatThrownBy(() -> engine.investigate("success_rate", List.of("error_count"), T0, T6))
                .isInstanceOf(InvalidInputException.class);
        RecordingInsightLogger.Entry failure = logger.first("investigation_failed");
        assertThat(failure.getLevel()).isEqualTo(RecordingInsightLogger.Level.ERROR);
        assertThat(failure.getCause()).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Investigate should need a metric store")
    void investigateShouldNeedStore() {
        InsightEngine storeless = InsightEngine.builder().config(EngineConfig.defaults()).logger(logger).build();

        assertThatThrownBy(() -> storeless.investigate("success_rate", List.of(), T0, T6))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MetricStore");
    }

    @Test
    @DisplayName("Should score risk with the metric's own direction")
    void shouldAssessRisk() {
        double[] values = new double[14];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 - 5 * i;
        }

        RiskScore quality = engine.assessRisk(
                MetricSeries.evenlySpaced("quality_score", T0, Duration.ofDays(1), values));
        RiskScore errors = engine.assessRisk(
                MetricSeries.evenlySpaced("error_count", T0, Duration.ofDays(1), values));

        assertThat(quality.getLevel()).isEqualTo(Severity.CRITICAL);
        assertThat(errors.getScore()).isLessThan(quality.getScore());
    }

    @Test
    @DisplayName("Should load the bundled configuration when none is given")
    void shouldLoadBundledConfig() {
        InsightEngine defaults = InsightEngine.builder().logger(logger).build();

        assertThat(defaults.getConfig().getRecommendationTemplates()).hasSize(4);
        assertThat(defaults.getConfig().getZScoreThreshold()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should refuse an invalid configuration")
    void shouldRefuseInvalidConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setForecastDays(0);

        assertThatThrownBy(() -> InsightEngine.builder().config(config).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("forecastDays");
    }

    @Test
    @DisplayName("Changing a configuration after build should not affect the engine")
    void configChangesAfterBuildShouldNotReachEngine() {
        EngineConfig config = EngineConfig.defaults();
        InsightEngine isolated = InsightEngine.builder().config(config).logger(logger).build();
        MetricSeries collapse = hourly("success_rate", 10, 10, 10, 10, 10, 10, 2);
        double[] values = new double[14];
        for (int i = 0; i < values.length; i++) {
            values[i] = 50 + i;
        }
        MetricSeries daily = MetricSeries.evenlySpaced("quality_score", T0, Duration.ofDays(1), values);
        int anomaliesBefore = isolated.detect(collapse).size();

        config.setSuddenChangeThresholdPct(500);
        config.setZScoreThreshold(100);
        config.setForecastDays(0);
        isolated.getConfig().setForecastDays(0);
        isolated.getConfig().setIqrMultiplier(100);
        isolated.getConfig().getMetricDirections().put("success_rate", "lower_is_better");

        assertThat(anomaliesBefore).isPositive();
        assertThat(isolated.detect(collapse)).hasSize(anomaliesBefore);
        assertThat(isolated.forecast(daily).getPoints()).hasSize(7);
        assertThat(isolated.getConfig().getForecastDays()).isEqualTo(7);
        assertThat(isolated.getConfig().getMetricDirections()).doesNotContainKey("success_rate");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries hourly(String metric, double... values) {
        return MetricSeries.evenlySpaced(metric, T0, Duration.ofHours(1), values);
    }
}
