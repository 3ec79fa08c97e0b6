package com.insightengine.core.detection;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;

import java.util.List;
import java.util.Objects;

/**
 * Creates the outlier checks the {@link AnomalyDetector} runs, in their fixed
 * evaluation order.
 *
 * <p>
 * This is the single point of extension when adding a new test.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCheckFactory {

    private AnomalyCheckFactory() {
        // utility class
    }

    /**
     * @param config validated engine configuration; must not be {@code null}
     * @param logger logger handed to the checks that report skips
     * @return unmodifiable list: z-score, IQR, sudden change, sustained
     *         degradation
     */
    public static List<AnomalyCheck> createAll(EngineConfig config, InsightLogger logger) {
        Objects.requireNonNull(config, "EngineConfig must not be null");
        Objects.requireNonNull(logger, "logger must not be null");
        List<AnomalyCheck> checks = List.of(
                new ZScoreOutlierCheck(config.getZScoreThreshold(), logger),
                new IqrOutlierCheck(config.getIqrMultiplier(), logger),
                new SuddenChangeCheck(config.getSuddenChangeThresholdPct(), config.getSuddenChangeWindowSize()),
                new SustainedDegradationCheck(config.getSustainedWindowSize(),
                        config.getSustainedChangeThresholdPct(), logger));
        logger.info("anomaly_checks_created", LogFields.of("count", checks.size()));
        return checks;
    }
}
