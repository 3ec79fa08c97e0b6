package com.insightengine.core.detection;

import com.insightengine.core.model.Severity;
import com.insightengine.core.stats.Stats;

/**
 * Confidence and severity arithmetic shared by the outlier tests.
 */
final class Scoring {

    /** Confidence ceiling when the baseline is zero and the deviation is a sentinel. */
    static final double ZERO_BASELINE_CONFIDENCE_CAP = 0.5;

    private Scoring() {
        // utility class
    }

    /**
     * Maps a magnitude at or above its threshold to {@code [0.5, 1)}.
     *
     * @param magnitude    observed magnitude, same unit as {@code threshold}
     * @param threshold    the test's firing threshold
     * @param zeroBaseline whether the expected value was zero
     * @return confidence in {@code [0, 1]}
     */
    static double confidence(double magnitude, double threshold, boolean zeroBaseline) {
        double confidence = magnitude <= 0 ? 0.0 : Stats.clampUnit(1.0 - 0.5 * threshold / magnitude);
        return zeroBaseline ? Math.min(confidence, ZERO_BASELINE_CONFIDENCE_CAP) : confidence;
    }

    /**
     * Severity of a relative change measured in multiples of its threshold.
     *
     * @param ratio relative change divided by the firing threshold
     * @return severity bucket
     */
    static Severity fromThresholdRatio(double ratio) {
        return Severity.classify(ratio, 1.5, 2.0, 3.0);
    }
}
