package com.insightengine.core.detection;

import com.insightengine.core.logging.RecordingInsightLogger;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyType;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link IqrOutlierCheck}.
 */
class IqrOutlierCheckTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    private RecordingInsightLogger logger;
    private IqrOutlierCheck check;

    @BeforeEach
    void setUp() {
        logger = new RecordingInsightLogger();
        check = new IqrOutlierCheck(1.5, logger);
    }

    @Test
    @DisplayName("Should flag a value above the upper fence")
    void shouldFlagValueAboveUpperFence() {
        // baseline 1..9: q1 = 3, q3 = 7, IQR = 4, fences [-3, 13]
        List<Anomaly> anomalies = check.evaluate(series(1, 2, 3, 4, 5, 6, 7, 8, 9, 20),
                MetricDirection.HIGHER_IS_BETTER);

        assertThat(anomalies).hasSize(1);
        Anomaly anomaly = anomalies.get(0);
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.IQR_OUTLIER);
        assertThat(anomaly.getThresholdValue()).isCloseTo(13.0, within(1e-9));
        assertThat(anomaly.getExpectedValue()).isCloseTo(5.0, within(1e-9));
        assertThat(anomaly.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(anomaly.getConfidence()).isCloseTo(1 - 0.5 * 1.5 / 3.25, within(1e-9));
    }

    @Test
    @DisplayName("Should grade severity by distance beyond the fence in IQR units")
    void shouldGradeByDistance() {
        Anomaly barelyOut = check.evaluate(series(1, 2, 3, 4, 5, 6, 7, 8, 9, 14),
                MetricDirection.HIGHER_IS_BETTER).get(0);
        Anomaly farOut = check.evaluate(series(1, 2, 3, 4, 5, 6, 7, 8, 9, 30),
                MetricDirection.HIGHER_IS_BETTER).get(0);
        Anomaly below = check.evaluate(series(1, 2, 3, 4, 5, 6, 7, 8, 9, -5),
                MetricDirection.HIGHER_IS_BETTER).get(0);

        assertThat(barelyOut.getSeverity()).isEqualTo(Severity.LOW);
        assertThat(farOut.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(below.getThresholdValue()).isCloseTo(-3.0, within(1e-9));
        assertThat(below.getSeverity()).isEqualTo(Severity.MEDIUM);
    }

    @Test
    @DisplayName("Should NOT fire inside the fences")
    void shouldNotFireInsideFences() {
        assertThat(check.evaluate(series(1, 2, 3, 4, 5, 6, 7, 8, 9, 10), MetricDirection.HIGHER_IS_BETTER))
                .isEmpty();
    }

    @Test
    @DisplayName("Should skip a baseline with zero IQR")
    void shouldSkipZeroIqr() {
        assertThat(check.evaluate(series(4, 4, 4, 4, 4, 4, 4, 4, 100), MetricDirection.HIGHER_IS_BETTER))
                .isEmpty();
        assertThat(logger.events()).containsExactly("anomaly_check_skipped");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries series(double... values) {
        return MetricSeries.evenlySpaced("quality_score", T0, Duration.ofHours(1), values);
    }
}
