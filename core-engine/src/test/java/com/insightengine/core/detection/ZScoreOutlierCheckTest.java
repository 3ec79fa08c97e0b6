package com.insightengine.core.detection;

import com.insightengine.core.logging.RecordingInsightLogger;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Stats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ZScoreOutlierCheck}.
 */
class ZScoreOutlierCheckTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");
    private static final double[] BASELINE = {10, 12, 9, 11, 10, 13, 8, 10, 11, 9, 12};

    private RecordingInsightLogger logger;
    private ZScoreOutlierCheck check;

    @BeforeEach
    void setUp() {
        logger = new RecordingInsightLogger();
        check = new ZScoreOutlierCheck(2.0, logger);
    }

    @Test
    @DisplayName("Should NOT fire on a constant series")
    void shouldNotFireOnConstantSeries() {
        List<Anomaly> anomalies = check.evaluate(series(5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 5),
                MetricDirection.HIGHER_IS_BETTER);

        assertThat(anomalies).isEmpty();
    }

    @Test
    @DisplayName("Should skip and log when the baseline has no dispersion")
    void shouldSkipZeroDispersionBaseline() {
        List<Anomaly> anomalies = check.evaluate(series(5, 5, 5, 5, 5, 5, 5, 5, 5, 5, 9),
                MetricDirection.HIGHER_IS_BETTER);

        assertThat(anomalies).isEmpty();
        assertThat(logger.first("anomaly_check_skipped").getFields())
                .containsEntry("check", "z_score")
                .containsEntry("reason", "zero_dispersion");
    }

    @Test
    @DisplayName("Should flag a point five standard deviations out as critical")
    void shouldFlagFarOutlierAsCritical() {
        double mean = Stats.mean(BASELINE);
        double sd = Stats.stdDev(BASELINE);

        List<Anomaly> anomalies = check.evaluate(withLatest(mean + 5 * sd), MetricDirection.HIGHER_IS_BETTER);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.STATISTICAL_OUTLIER);
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(anomaly.getExpectedValue()).isCloseTo(mean, within(1e-9));
        assertThat(anomaly.getThresholdValue()).isCloseTo(mean + 2 * sd, within(1e-9));
        assertThat(anomaly.getConfidence()).isCloseTo(0.8, within(1e-9));
        assertThat(anomaly.getDeviationPercentage()).isCloseTo(5 * sd / mean * 100, within(1e-9));
        assertThat(anomaly.getDetectedAt()).isEqualTo(T0.plus(Duration.ofHours(BASELINE.length)));
    }

    @Test
    @DisplayName("Should flag a mild outlier as low severity and put the threshold below for drops")
    void shouldGradeMildOutliers() {
        double mean = Stats.mean(BASELINE);
        double sd = Stats.stdDev(BASELINE);

        Anomaly high = check.evaluate(withLatest(mean + 2.2 * sd), MetricDirection.HIGHER_IS_BETTER).get(0);
        Anomaly low = check.evaluate(withLatest(mean - 2.2 * sd), MetricDirection.HIGHER_IS_BETTER).get(0);

        assertThat(high.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(high.getConfidence()).isCloseTo(1 - 1 / 2.2, within(1e-9));
        assertThat(low.getThresholdValue()).isCloseTo(mean - 2 * sd, within(1e-9));
        assertThat(low.getDeviationPercentage()).isNegative();
    }

    @Test
    @DisplayName("Should NOT fire within the threshold")
    void shouldNotFireWithinThreshold() {
        double mean = Stats.mean(BASELINE);
        double sd = Stats.stdDev(BASELINE);

        assertThat(check.evaluate(withLatest(mean + sd), MetricDirection.HIGHER_IS_BETTER)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive threshold")
    void shouldRejectNonPositiveThreshold() {
        assertThatThrownBy(() -> new ZScoreOutlierCheck(0, logger))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries withLatest(double latest) {
        double[] values = Arrays.copyOf(BASELINE, BASELINE.length + 1);
        values[BASELINE.length] = latest;
        return series(values);
    }

    private static MetricSeries series(double... values) {
        return MetricSeries.evenlySpaced("quality_score", T0, Duration.ofHours(1), values);
    }
}
