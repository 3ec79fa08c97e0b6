package com.insightengine.core.forecast;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.ForecastResult;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.RiskScore;
import com.insightengine.core.model.Severity;
import com.insightengine.core.model.Trend;
import com.insightengine.core.stats.Stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Scores how likely a metric is to keep degrading, from its history and its
 * forecast.
 *
 * <table>
 * <caption>Risk factors</caption>
 * <tr><th>Factor</th><th>Points</th></tr>
 * <tr><td>trend moving in the unfavourable direction</td><td>30</td></tr>
 * <tr><td>forecast mean worse than the historical mean beyond the sustained-change threshold</td><td>25</td></tr>
 * <tr><td>coefficient of variation above 0.25 over the last 14 points</td><td>25</td></tr>
 * <tr><td>forecast accuracy below 0.6</td><td>20</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public class RiskAssessor {

    static final int RECENT_POINTS = 14;
    static final double VOLATILITY_CV = 0.25;
    static final double LOW_ACCURACY = 0.6;

    private final EngineConfig config;
    private final InsightLogger logger;

    public RiskAssessor(EngineConfig config) {
        this(config, Slf4jInsightLogger.forClass(RiskAssessor.class));
    }

    public RiskAssessor(EngineConfig config, InsightLogger logger) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null").copy();
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @param series    the history the forecast was built from
     * @param forecast  forecast of {@code series}
     * @param direction which way the metric improves
     * @return score in {@code [0, 100]} with level and suggested actions
     */
    public RiskScore assess(MetricSeries series, ForecastResult forecast, MetricDirection direction) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(forecast, "forecast must not be null");
        Objects.requireNonNull(direction, "direction must not be null");

        int score = 0;
        List<String> recommendations = new ArrayList<>();
        String metric = series.getMetricName();

        boolean worseningTrend = direction == MetricDirection.HIGHER_IS_BETTER
                ? forecast.getTrend() == Trend.DECREASING
                : forecast.getTrend() == Trend.INCREASING;
        if (worseningTrend) {
            score += 30;
            recommendations.add(metric + " is trending the wrong way: investigate recent changes");
        }

        double historical = forecast.getHistoricalMean();
        double projected = forecast.getForecastMean();
        if (Math.abs(historical) > Stats.EPSILON && direction.isUnfavorable(projected - historical)
                && Math.abs(projected - historical) / Math.abs(historical) * 100.0
                > config.getSustainedChangeThresholdPct()) {
            score += 25;
            recommendations.add("Forecast for " + metric + " is worse than its historical level: plan corrective work");
        }

        double[] values = series.values();
        int from = Math.max(0, values.length - RECENT_POINTS);
        double[] recent = Arrays.copyOfRange(values, from, values.length);
        if (recent.length > 0) {
            double mean = Stats.mean(recent);
            if (Math.abs(mean) > Stats.EPSILON && Stats.stdDev(recent) / Math.abs(mean) > VOLATILITY_CV) {
                score += 25;
                recommendations.add(metric + " is volatile: review error handling and fallbacks");
            }
        }

        if (forecast.getAccuracyEstimate() < LOW_ACCURACY) {
            score += 20;
            recommendations.add("Low forecast confidence for " + metric + ": collect more data");
        }

        Severity level = Severity.classify(score, 25, 50, 75);
        logger.info("risk_assessed", LogFields.of("metric", metric, "score", score, "level", level.wireName()));
        return new RiskScore(score, level, score / 100.0, recommendations);
    }
}
