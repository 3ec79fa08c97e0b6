package com.insightengine.core.config;

import com.insightengine.core.model.MetricDirection;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tuning options shared by every analysis component.
 *
 * <p>
 * Every option has a default, so a YAML file only lists what it overrides:
 * </p>
 *
 * <pre>
 * zScoreThreshold: 2.5
 * lookbackHours: 12
 * metricDirections:
 *   queue_depth: lower_is_better
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading or after changing values by hand.
 * Components take a {@link #copy()} when they are built, so changing an
 * instance afterwards does not reach them.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Forecasts are never fitted on fewer points than this. */
    public static final int FORECAST_POINT_FLOOR = 7;

    // --- Anomaly detection ---
    private double zScoreThreshold = 2.0;
    private double iqrMultiplier = 1.5;
    private double suddenChangeThresholdPct = 20.0;
    private int suddenChangeWindowSize = 7;
    private int sustainedWindowSize = 7;
    private double sustainedChangeThresholdPct = 10.0;

    // --- Forecasting ---
    private double forecastConfidenceLevel = 0.95;
    private int smoothingWindow = 3;
    private int forecastDays = 7;
    private int minForecastPoints = FORECAST_POINT_FLOOR;
    private double trendEpsilonFraction = 0.01;

    // --- Root-cause analysis ---
    private double correlationSignificanceCutoff = 0.6;
    private double lookbackHours = 24.0;
    private double leadingIndicatorBonus = 0.1;
    private int maxSiblings = 50;
    private double similarIncidentDropTolerance = 10.0;
    private int similarIncidentLimit = 5;

    /** Metric name to {@code higher_is_better} / {@code lower_is_better}. */
    private Map<String, String> metricDirections = new LinkedHashMap<>();

    private List<RecommendationTemplate> recommendationTemplates = new ArrayList<>();

    /**
     * @return a configuration with every default and the built-in
     *         recommendation catalog
     */
    public static EngineConfig defaults() {
        EngineConfig config = new EngineConfig();
        config.setRecommendationTemplates(builtInTemplates());
        return config;
    }

    /**
     * @return the recommendation templates used when a configuration lists none
     */
    public static List<RecommendationTemplate> builtInTemplates() {
        List<RecommendationTemplate> templates = new ArrayList<>();
        templates.add(new RecommendationTemplate(
                "high_error_rate",
                "Investigate and fix {factor} errors",
                "High error rate detected for {factor} (now {current_value}, {delta} against baseline). "
                        + "This is affecting {metric}.",
                "immediate",
                List.of("Check error logs for {factor}",
                        "Identify root cause",
                        "Implement fix",
                        "Deploy and monitor"),
                40.0, 0.7, "low", "2-4 hours"));
        templates.add(new RecommendationTemplate(
                "high_latency",
                "Optimize response time of {factor}",
                "Response times of {factor} have increased significantly ({delta}, now {current_value}).",
                "short_term",
                List.of("Profile slow requests",
                        "Optimize database queries",
                        "Add caching for common requests",
                        "Consider switching to faster model"),
                30.0, 0.6, "medium", "1-2 days"));
        templates.add(new RecommendationTemplate(
                "quality_degradation",
                "Improve prompt quality and model performance for {metric}",
                "Quality metrics have declined: {factor} moved {delta} to {current_value}.",
                "short_term",
                List.of("Review recent prompt changes",
                        "A/B test prompt variations",
                        "Consider few-shot examples",
                        "Evaluate alternative models"),
                25.0, 0.6, "medium", "2-3 days"));
        templates.add(new RecommendationTemplate(
                "high_cost",
                "Reduce {factor} spend",
                "Cost indicator {factor} changed {delta} to {current_value}.",
                "long_term",
                List.of("Break down {factor} by model and endpoint",
                        "Cache repeated prompts",
                        "Route simple requests to a cheaper model",
                        "Set budget alerts"),
                20.0, 0.5, "high", "1-2 weeks"));
        return templates;
    }

    /**
     * @return an independent copy; later changes to either side are not seen
     *         by the other
     */
    public EngineConfig copy() {
        EngineConfig copy = new EngineConfig();
        copy.zScoreThreshold = zScoreThreshold;
        copy.iqrMultiplier = iqrMultiplier;
        copy.suddenChangeThresholdPct = suddenChangeThresholdPct;
        copy.suddenChangeWindowSize = suddenChangeWindowSize;
        copy.sustainedWindowSize = sustainedWindowSize;
        copy.sustainedChangeThresholdPct = sustainedChangeThresholdPct;
        copy.forecastConfidenceLevel = forecastConfidenceLevel;
        copy.smoothingWindow = smoothingWindow;
        copy.forecastDays = forecastDays;
        copy.minForecastPoints = minForecastPoints;
        copy.trendEpsilonFraction = trendEpsilonFraction;
        copy.correlationSignificanceCutoff = correlationSignificanceCutoff;
        copy.lookbackHours = lookbackHours;
        copy.leadingIndicatorBonus = leadingIndicatorBonus;
        copy.maxSiblings = maxSiblings;
        copy.similarIncidentDropTolerance = similarIncidentDropTolerance;
        copy.similarIncidentLimit = similarIncidentLimit;
        copy.metricDirections = new LinkedHashMap<>(metricDirections);
        List<RecommendationTemplate> templates = new ArrayList<>(recommendationTemplates.size());
        for (RecommendationTemplate template : recommendationTemplates) {
            templates.add(template != null ? template.copy() : null);
        }
        copy.recommendationTemplates = templates;
        return copy;
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every option and template.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is
     * illegal.
     * </p>
     *
     * @throws IllegalStateException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (zScoreThreshold <= 0) {
            errors.add("'zScoreThreshold' must be > 0");
        }
        if (iqrMultiplier <= 0) {
            errors.add("'iqrMultiplier' must be > 0");
        }
        if (suddenChangeThresholdPct <= 0) {
            errors.add("'suddenChangeThresholdPct' must be > 0");
        }
        if (suddenChangeWindowSize < 1) {
            errors.add("'suddenChangeWindowSize' must be >= 1");
        }
        if (sustainedWindowSize < 1) {
            errors.add("'sustainedWindowSize' must be >= 1");
        }
        if (sustainedChangeThresholdPct <= 0) {
            errors.add("'sustainedChangeThresholdPct' must be > 0");
        }
        if (!(forecastConfidenceLevel > 0 && forecastConfidenceLevel < 1)) {
            errors.add("'forecastConfidenceLevel' must be in (0, 1)");
        }
        if (smoothingWindow < 1) {
            errors.add("'smoothingWindow' must be >= 1");
        }
        if (forecastDays < 1) {
            errors.add("'forecastDays' must be >= 1");
        }
        if (minForecastPoints < FORECAST_POINT_FLOOR) {
            errors.add("'minForecastPoints' must be >= " + FORECAST_POINT_FLOOR);
        }
        if (trendEpsilonFraction < 0) {
            errors.add("'trendEpsilonFraction' must be >= 0");
        }
        if (correlationSignificanceCutoff < 0 || correlationSignificanceCutoff > 1) {
            errors.add("'correlationSignificanceCutoff' must be in [0, 1]");
        }
        if (lookbackHours <= 0) {
            errors.add("'lookbackHours' must be > 0");
        }
        if (leadingIndicatorBonus < 0 || leadingIndicatorBonus > 1) {
            errors.add("'leadingIndicatorBonus' must be in [0, 1]");
        }
        if (maxSiblings < 1) {
            errors.add("'maxSiblings' must be >= 1");
        }
        if (similarIncidentDropTolerance < 0) {
            errors.add("'similarIncidentDropTolerance' must be >= 0");
        }
        if (similarIncidentLimit < 1) {
            errors.add("'similarIncidentLimit' must be >= 1");
        }

        for (Map.Entry<String, String> entry : metricDirections.entrySet()) {
            try {
                MetricDirection.fromWireName(entry.getValue());
            } catch (IllegalArgumentException e) {
                errors.add("metricDirections['" + entry.getKey() + "']: " + e.getMessage());
            }
        }

        Set<String> categories = new HashSet<>();
        for (int i = 0; i < recommendationTemplates.size(); i++) {
            RecommendationTemplate template = recommendationTemplates.get(i);
            if (template == null) {
                errors.add("Template at index " + i + " is null");
                continue;
            }
            try {
                template.validate();
                if (!categories.add(template.getCategory())) {
                    errors.add("Duplicate template for category '" + template.getCategory() + "'");
                }
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Engine configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * Resolve the direction of a metric: an explicit {@code metricDirections}
     * entry wins, otherwise it is inferred from the name.
     *
     * @param metricName metric name
     * @return direction in which the metric improves
     */
    public MetricDirection directionFor(String metricName) {
        String explicit = metricDirections.get(metricName);
        if (explicit != null) {
            return MetricDirection.fromWireName(explicit);
        }
        return MetricDirection.inferFrom(metricName);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getZScoreThreshold() {
        return zScoreThreshold;
    }

    public void setZScoreThreshold(double zScoreThreshold) {
        this.zScoreThreshold = zScoreThreshold;
    }

    public double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public double getSuddenChangeThresholdPct() {
        return suddenChangeThresholdPct;
    }

    public void setSuddenChangeThresholdPct(double suddenChangeThresholdPct) {
        this.suddenChangeThresholdPct = suddenChangeThresholdPct;
    }

    public int getSuddenChangeWindowSize() {
        return suddenChangeWindowSize;
    }

    public void setSuddenChangeWindowSize(int suddenChangeWindowSize) {
        this.suddenChangeWindowSize = suddenChangeWindowSize;
    }

    public int getSustainedWindowSize() {
        return sustainedWindowSize;
    }

    public void setSustainedWindowSize(int sustainedWindowSize) {
        this.sustainedWindowSize = sustainedWindowSize;
    }

    public double getSustainedChangeThresholdPct() {
        return sustainedChangeThresholdPct;
    }

    public void setSustainedChangeThresholdPct(double sustainedChangeThresholdPct) {
        this.sustainedChangeThresholdPct = sustainedChangeThresholdPct;
    }

    public double getForecastConfidenceLevel() {
        return forecastConfidenceLevel;
    }

    public void setForecastConfidenceLevel(double forecastConfidenceLevel) {
        this.forecastConfidenceLevel = forecastConfidenceLevel;
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public int getForecastDays() {
        return forecastDays;
    }

    public void setForecastDays(int forecastDays) {
        this.forecastDays = forecastDays;
    }

    public int getMinForecastPoints() {
        return minForecastPoints;
    }

    public void setMinForecastPoints(int minForecastPoints) {
        this.minForecastPoints = minForecastPoints;
    }

    public double getTrendEpsilonFraction() {
        return trendEpsilonFraction;
    }

    public void setTrendEpsilonFraction(double trendEpsilonFraction) {
        this.trendEpsilonFraction = trendEpsilonFraction;
    }

    public double getCorrelationSignificanceCutoff() {
        return correlationSignificanceCutoff;
    }

    public void setCorrelationSignificanceCutoff(double correlationSignificanceCutoff) {
        this.correlationSignificanceCutoff = correlationSignificanceCutoff;
    }

    public double getLookbackHours() {
        return lookbackHours;
    }

    public void setLookbackHours(double lookbackHours) {
        this.lookbackHours = lookbackHours;
    }

    public double getLeadingIndicatorBonus() {
        return leadingIndicatorBonus;
    }

    public void setLeadingIndicatorBonus(double leadingIndicatorBonus) {
        this.leadingIndicatorBonus = leadingIndicatorBonus;
    }

    public int getMaxSiblings() {
        return maxSiblings;
    }

    public void setMaxSiblings(int maxSiblings) {
        this.maxSiblings = maxSiblings;
    }

    public double getSimilarIncidentDropTolerance() {
        return similarIncidentDropTolerance;
    }

    public void setSimilarIncidentDropTolerance(double similarIncidentDropTolerance) {
        this.similarIncidentDropTolerance = similarIncidentDropTolerance;
    }

    public int getSimilarIncidentLimit() {
        return similarIncidentLimit;
    }

    public void setSimilarIncidentLimit(int similarIncidentLimit) {
        this.similarIncidentLimit = similarIncidentLimit;
    }

    public Map<String, String> getMetricDirections() {
        return metricDirections;
    }

    public void setMetricDirections(Map<String, String> metricDirections) {
        this.metricDirections = metricDirections != null ? new LinkedHashMap<>(metricDirections) : new LinkedHashMap<>();
    }

    public List<RecommendationTemplate> getRecommendationTemplates() {
        return recommendationTemplates;
    }

    public void setRecommendationTemplates(List<RecommendationTemplate> recommendationTemplates) {
        this.recommendationTemplates = recommendationTemplates != null
                ? new ArrayList<>(recommendationTemplates)
                : new ArrayList<>();
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "zScoreThreshold=" + zScoreThreshold +
                ", iqrMultiplier=" + iqrMultiplier +
                ", suddenChangeThresholdPct=" + suddenChangeThresholdPct +
                ", sustainedWindowSize=" + sustainedWindowSize +
                ", sustainedChangeThresholdPct=" + sustainedChangeThresholdPct +
                ", forecastConfidenceLevel=" + forecastConfidenceLevel +
                ", smoothingWindow=" + smoothingWindow +
                ", correlationSignificanceCutoff=" + correlationSignificanceCutoff +
                ", lookbackHours=" + lookbackHours +
                ", templates=" + recommendationTemplates.size() +
                '}';
    }
}
