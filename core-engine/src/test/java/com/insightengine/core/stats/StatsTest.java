package com.insightengine.core.stats;

import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.error.InvalidInputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Stats}.
 */
class StatsTest {

    private static final double TOLERANCE = 1e-9;

    // ------------------------------------------------------------------
    // Summary statistics
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should summarize 1..5 with population standard deviation")
    void shouldSummarizeSmallSample() {
        Statistics stats = Stats.summarize(new double[] {1, 2, 3, 4, 5});

        assertThat(stats.getMean()).isCloseTo(3.0, within(TOLERANCE));
        assertThat(stats.getStdDev()).isCloseTo(Math.sqrt(2.0), within(TOLERANCE));
        assertThat(stats.getMedian()).isCloseTo(3.0, within(TOLERANCE));
        assertThat(stats.getQ1()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(stats.getQ3()).isCloseTo(4.0, within(TOLERANCE));
        assertThat(stats.iqr()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(stats.hasZeroVariance()).isFalse();
    }

    @Test
    @DisplayName("Should interpolate quartiles linearly between ranks")
    void shouldInterpolateQuartiles() {
        Statistics stats = Stats.summarize(new double[] {4, 1, 3, 2});

        assertThat(stats.getMedian()).isCloseTo(2.5, within(TOLERANCE));
        assertThat(stats.getQ1()).isCloseTo(1.75, within(TOLERANCE));
        assertThat(stats.getQ3()).isCloseTo(3.25, within(TOLERANCE));
    }

    @Test
    @DisplayName("Should report zero variance for a constant series")
    void shouldReportZeroVariance() {
        Statistics stats = Stats.summarize(new double[] {7, 7, 7, 7});

        assertThat(stats.getStdDev()).isZero();
        assertThat(stats.hasZeroVariance()).isTrue();
        assertThat(stats.iqr()).isZero();
    }

    @Test
    @DisplayName("Should fail on an empty series")
    void shouldFailOnEmptySeries() {
        assertThatThrownBy(() -> Stats.summarize(new double[0]))
                .isInstanceOfSatisfying(InsufficientDataException.class, e -> {
                    assertThat(e.getRequired()).isEqualTo(1);
                    assertThat(e.getActual()).isZero();
                });
        assertThatThrownBy(() -> Stats.mean(new double[0]))
                .isInstanceOf(InsufficientDataException.class);
    }

    // ------------------------------------------------------------------
    // Correlation / regression
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Correlation of a series with itself and its negation should be +1 and -1")
    void correlationShouldBeBounded() {
        double[] values = {3, 1, 4, 1, 5, 9, 2, 6};
        double[] negated = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            negated[i] = -values[i];
        }

        assertThat(Stats.correlation(values, values)).isCloseTo(1.0, within(1e-12));
        assertThat(Stats.correlation(values, negated)).isCloseTo(-1.0, within(1e-12));
    }

    @Test
    @DisplayName("Correlation should be symmetric and within [-1, 1]")
    void correlationShouldBeSymmetric() {
        double[] a = {1, 2, 3, 4, 5, 6, 7, 8};
        double[] b = {3, 1, 4, 1, 5, 9, 2, 6};

        double ab = Stats.correlation(a, b);

        assertThat(ab).isCloseTo(Stats.correlation(b, a), within(1e-12));
        assertThat(ab).isBetween(-1.0, 1.0);
        assertThat(ab).isCloseTo(22.5 / Math.sqrt(42 * 52.875), within(1e-9));
    }

    @Test
    @DisplayName("Correlation should reject zero variance and mismatched lengths")
    void correlationShouldRejectInvalidInput() {
        assertThatThrownBy(() -> Stats.correlation(new double[] {1, 1, 1}, new double[] {1, 2, 3}))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("zero variance");
        assertThatThrownBy(() -> Stats.correlation(new double[] {1, 2, 3}, new double[] {1, 2}))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("equal-length");
    }

    @Test
    @DisplayName("Should fit an exact line over the point index")
    void shouldFitLineOverIndex() {
        RegressionLine line = Stats.linearRegression(new double[] {1, 3, 5, 7});

        assertThat(line.getSlope()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(line.getIntercept()).isCloseTo(1.0, within(TOLERANCE));
        assertThat(line.predict(10)).isCloseTo(21.0, within(TOLERANCE));
    }

    @Test
    @DisplayName("Should fit against an explicit x-axis")
    void shouldFitAgainstExplicitAxis() {
        RegressionLine line = Stats.linearRegression(new double[] {0.0, 0.5, 2.0}, new double[] {1.0, 2.0, 5.0});

        assertThat(line.getSlope()).isCloseTo(2.0, within(TOLERANCE));
        assertThat(line.getIntercept()).isCloseTo(1.0, within(TOLERANCE));
    }

    @Test
    @DisplayName("Regression should need two points and distinct x values")
    void regressionShouldRejectDegenerateInput() {
        assertThatThrownBy(() -> Stats.linearRegression(new double[] {4}))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> Stats.linearRegression(new double[] {1, 1}, new double[] {2, 3}))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should compute mean absolute error")
    void shouldComputeMae() {
        assertThat(Stats.meanAbsoluteError(new double[] {1, 2, 3}, new double[] {2, 2, 5}))
                .isCloseTo(1.0, within(TOLERANCE));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    @Test
    @DisplayName("Should return the two-sided normal quantile")
    void shouldReturnZValue() {
        assertThat(Stats.zValue(0.95)).isCloseTo(1.959964, within(1e-6));
        assertThat(Stats.zValue(0.80)).isCloseTo(1.281552, within(1e-6));
        assertThatThrownBy(() -> Stats.zValue(1.0)).isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Should compute percentage change and use the sentinel for a zero baseline")
    void shouldComputePercentChange() {
        assertThat(Stats.percentChange(10, 2)).isCloseTo(-80.0, within(TOLERANCE));
        assertThat(Stats.percentChange(10, 13)).isCloseTo(30.0, within(TOLERANCE));
        assertThat(Stats.percentChange(0, 5)).isEqualTo(Stats.DEVIATION_SENTINEL);
        assertThat(Stats.percentChange(0, -5)).isEqualTo(-Stats.DEVIATION_SENTINEL);
        assertThat(Stats.percentChange(0, 0)).isZero();
    }

    @Test
    @DisplayName("Should clamp to the unit interval")
    void shouldClampUnit() {
        assertThat(Stats.clampUnit(-0.2)).isZero();
        assertThat(Stats.clampUnit(0.4)).isEqualTo(0.4);
        assertThat(Stats.clampUnit(1.3)).isEqualTo(1.0);
    }
}
