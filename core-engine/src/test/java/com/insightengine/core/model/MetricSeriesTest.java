package com.insightengine.core.model;

import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.error.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricSeries}.
 */
class MetricSeriesTest {

    private static final Instant T0 = Instant.parse("2024-03-01T00:00:00Z");

    @Test
    @DisplayName("Should build evenly spaced points from the start timestamp")
    void shouldBuildEvenlySpacedSeries() {
        MetricSeries series = MetricSeries.evenlySpaced("success_rate", T0, Duration.ofHours(1), 10, 11, 12);

        assertThat(series.size()).isEqualTo(3);
        assertThat(series.getPoints()).extracting(MetricPoint::getTimestamp)
                .containsExactly(T0, T0.plusSeconds(3600), T0.plusSeconds(7200));
        assertThat(series.values()).containsExactly(10, 11, 12);
        assertThat(series.latest()).isEqualTo(MetricPoint.of(T0.plusSeconds(7200), 12));
    }

    @Test
    @DisplayName("Should return a fresh values array on every call")
    void valuesShouldBeACopy() {
        MetricSeries series = MetricSeries.evenlySpaced("success_rate", T0, Duration.ofHours(1), 1, 2);

        series.values()[0] = 99;

        assertThat(series.values()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("Should filter by an inclusive time range")
    void shouldFilterInclusiveRange() {
        MetricSeries series = MetricSeries.evenlySpaced("success_rate", T0, Duration.ofHours(1), 1, 2, 3, 4, 5);

        MetricSeries window = series.between(T0.plusSeconds(3600), T0.plusSeconds(3 * 3600));

        assertThat(window.values()).containsExactly(2, 3, 4);
        assertThat(window.getMetricName()).isEqualTo("success_rate");
    }

    @Test
    @DisplayName("Should keep the leading points only")
    void shouldTakeHead() {
        MetricSeries series = MetricSeries.evenlySpaced("success_rate", T0, Duration.ofHours(1), 1, 2, 3);

        assertThat(series.head(2).values()).containsExactly(1, 2);
        assertThat(series.head(10).values()).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Should reject non-finite values")
    void shouldRejectNonFiniteValues() {
        assertThatThrownBy(() -> new MetricSeries("latency_ms", List.of(MetricPoint.of(T0, Double.NaN))))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("latency_ms");
    }

    @Test
    @DisplayName("Latest point of an empty series should be insufficient data")
    void latestOfEmptySeriesShouldFail() {
        MetricSeries empty = new MetricSeries("success_rate", List.of());

        assertThat(empty.isEmpty()).isTrue();
        assertThatThrownBy(empty::latest).isInstanceOf(InsufficientDataException.class);
    }

    @Test
    @DisplayName("Should infer direction from the metric name")
    void shouldInferDirection() {
        assertThat(MetricDirection.inferFrom("error_count")).isEqualTo(MetricDirection.LOWER_IS_BETTER);
        assertThat(MetricDirection.inferFrom("p95_latency_ms")).isEqualTo(MetricDirection.LOWER_IS_BETTER);
        assertThat(MetricDirection.inferFrom("Token_Cost")).isEqualTo(MetricDirection.LOWER_IS_BETTER);
        assertThat(MetricDirection.inferFrom("success_rate")).isEqualTo(MetricDirection.HIGHER_IS_BETTER);
        assertThat(MetricDirection.inferFrom("quality_score")).isEqualTo(MetricDirection.HIGHER_IS_BETTER);
    }

    @Test
    @DisplayName("Should tell unfavourable changes apart by direction")
    void shouldJudgeFavourability() {
        assertThat(MetricDirection.HIGHER_IS_BETTER.isUnfavorable(-5)).isTrue();
        assertThat(MetricDirection.HIGHER_IS_BETTER.isUnfavorable(5)).isFalse();
        assertThat(MetricDirection.LOWER_IS_BETTER.isUnfavorable(5)).isTrue();
        assertThat(MetricDirection.LOWER_IS_BETTER.isUnfavorable(0)).isFalse();
    }

    @Test
    @DisplayName("Should classify severity against ascending cut points")
    void shouldClassifySeverity() {
        assertThat(Severity.classify(1.0, 1.5, 2, 3)).isEqualTo(Severity.LOW);
        assertThat(Severity.classify(1.5, 1.5, 2, 3)).isEqualTo(Severity.MEDIUM);
        assertThat(Severity.classify(2.5, 1.5, 2, 3)).isEqualTo(Severity.HIGH);
        assertThat(Severity.classify(3.0, 1.5, 2, 3)).isEqualTo(Severity.CRITICAL);
        assertThat(Severity.CRITICAL.isAtLeast(Severity.HIGH)).isTrue();
        assertThat(Severity.LOW.isAtLeast(Severity.MEDIUM)).isFalse();
        assertThat(Priority.fromSeverity(Severity.HIGH)).isEqualTo(Priority.HIGH);
    }

    @Test
    @DisplayName("Should match cause categories by keyword, ignoring case")
    void shouldMatchCauseCategories() {
        assertThat(CauseCategory.HIGH_ERROR_RATE.matches("API_Error_Rate")).isTrue();
        assertThat(CauseCategory.HIGH_LATENCY.matches("p95_latency_ms")).isTrue();
        assertThat(CauseCategory.QUALITY_DEGRADATION.matches("success_rate")).isTrue();
        assertThat(CauseCategory.HIGH_COST.matches("token_spend")).isTrue();
        assertThat(CauseCategory.HIGH_COST.matches("cpu_usage")).isFalse();
        assertThat(CauseCategory.HIGH_ERROR_RATE.matches(null)).isFalse();
    }
}
