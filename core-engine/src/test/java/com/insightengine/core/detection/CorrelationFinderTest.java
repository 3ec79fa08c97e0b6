package com.insightengine.core.detection;

import com.insightengine.core.logging.RecordingInsightLogger;
import com.insightengine.core.model.Correlation;
import com.insightengine.core.model.MetricSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CorrelationFinder}.
 */
class CorrelationFinderTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("Should keep only strongly correlated pairs")
    void shouldKeepStrongPairs() {
        CorrelationFinder finder = new CorrelationFinder(new RecordingInsightLogger());

        List<Correlation> correlations = finder.findCorrelations(List.of(
                series("requests", 1, 2, 3, 4, 5),
                series("tokens", 2, 4, 6, 8, 10),
                series("quality_score", 3, 1, 4, 1, 5)));

        assertThat(correlations).hasSize(1);
        Correlation correlation = correlations.get(0);
        assertThat(correlation.getMetricA()).isEqualTo("requests");
        assertThat(correlation.getMetricB()).isEqualTo("tokens");
        assertThat(correlation.getCoefficient()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    @DisplayName("Should keep strong negative correlations")
    void shouldKeepNegativeCorrelation() {
        CorrelationFinder finder = new CorrelationFinder(new RecordingInsightLogger());

        List<Correlation> correlations = finder.findCorrelations(List.of(
                series("error_count", 1, 2, 3, 4, 5),
                series("success_rate", 5, 4, 3, 2, 1)));

        assertThat(correlations).singleElement()
                .satisfies(c -> assertThat(c.getCoefficient()).isCloseTo(-1.0, within(1e-12)));
    }

    @Test
    @DisplayName("Should skip constant and misaligned series")
    void shouldSkipUndefinedPairs() {
        RecordingInsightLogger logger = new RecordingInsightLogger();
        CorrelationFinder finder = new CorrelationFinder(logger);

        List<Correlation> correlations = finder.findCorrelations(List.of(
                series("requests", 1, 2, 3, 4, 5),
                series("replicas", 3, 3, 3, 3, 3),
                series("tokens", 2, 4, 6)));

        assertThat(correlations).isEmpty();
        assertThat(logger.events()).containsOnly("correlation_skipped").hasSize(3);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static MetricSeries series(String metric, double... values) {
        return MetricSeries.evenlySpaced(metric, T0, Duration.ofHours(1), values);
    }
}
