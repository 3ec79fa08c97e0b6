package com.insightengine.core.recommendation;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.config.RecommendationTemplate;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.ActionType;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.CauseCategory;
import com.insightengine.core.model.EffortEstimate;
import com.insightengine.core.model.EffortLevel;
import com.insightengine.core.model.ImpactEstimate;
import com.insightengine.core.model.PrimaryCause;
import com.insightengine.core.model.Priority;
import com.insightengine.core.model.Recommendation;
import com.insightengine.core.model.RootCauseAnalysis;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Turns ranked causes, or raw anomalies, into recommendations from the
 * {@link RecommendationCatalog}.
 *
 * <p>
 * Each cause yields one recommendation per category its name matches.
 * Priority follows the severity behind the recommendation; impact and effort
 * are copied from the template. Output is ordered by priority, most urgent
 * first, then by input order. Identical input gives identical output,
 * ids included.
 * </p>
 *
 * @since 1.0.0
 */
public class RecommendationEngine {

    private static final Comparator<Recommendation> BY_PRIORITY =
            Comparator.comparing(Recommendation::getPriority).reversed();

    private final RecommendationCatalog catalog;
    private final InsightLogger logger;

    public RecommendationEngine(EngineConfig config) {
        this(RecommendationCatalog.fromConfig(config), Slf4jInsightLogger.forClass(RecommendationEngine.class));
    }

    public RecommendationEngine(RecommendationCatalog catalog, InsightLogger logger) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @param analysis root-cause analysis
     * @return recommendations for its primary causes, empty if none match
     */
    public List<Recommendation> recommend(RootCauseAnalysis analysis) {
        Objects.requireNonNull(analysis, "analysis must not be null");
        Priority priority = Priority.fromSeverity(analysis.getDegradation().getSeverity());

        List<Recommendation> recommendations = new ArrayList<>();
        for (PrimaryCause cause : analysis.getPrimaryCauses()) {
            for (CauseCategory category : catalog.match(cause.getFactor())) {
                RecommendationTemplate template = catalog.templateFor(category).orElseThrow();
                Map<String, String> values = placeholders(cause.getFactor(), analysis.getMetricName(),
                        cause.getCurrentValue(), cause.getChangePercentage());
                String id = stableId(analysis.getMetricName(), cause.getFactor(), category.wireName(),
                        analysis.getDegradation().getStartTime().toString());
                recommendations.add(build(id, template, category, priority, analysis.getMetricName(),
                        values, cause.getConfidence()));
            }
        }
        return finish(recommendations, LogFields.of("metric", analysis.getMetricName()));
    }

    /**
     * Recommend from anomalies alone, matching on each anomaly's metric name.
     * Several anomalies of one metric give one recommendation per category,
     * from the most severe of them.
     *
     * @param anomalies detected anomalies
     * @return recommendations, empty if no metric name matches
     */
    public List<Recommendation> recommendForAnomalies(List<Anomaly> anomalies) {
        Objects.requireNonNull(anomalies, "anomalies must not be null");
        Map<String, Anomaly> mostSevere = new LinkedHashMap<>();
        for (Anomaly anomaly : anomalies) {
            mostSevere.merge(anomaly.getMetricName(), anomaly,
                    (kept, candidate) -> candidate.getSeverity().compareTo(kept.getSeverity()) > 0 ? candidate : kept);
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (Anomaly anomaly : mostSevere.values()) {
            String metric = anomaly.getMetricName();
            for (CauseCategory category : catalog.match(metric)) {
                RecommendationTemplate template = catalog.templateFor(category).orElseThrow();
                Map<String, String> values = placeholders(metric, metric,
                        anomaly.getDetectedValue(), anomaly.getDeviationPercentage());
                recommendations.add(build(stableId(anomaly.getId(), category.wireName()), template, category,
                        Priority.fromSeverity(anomaly.getSeverity()), metric, values, anomaly.getConfidence()));
            }
        }
        return finish(recommendations, LogFields.of("metrics", mostSevere.size()));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<Recommendation> finish(List<Recommendation> recommendations, Map<String, Object> context) {
        // List.sort is stable, so equal priorities keep input order
        recommendations.sort(BY_PRIORITY);
        Map<String, Object> fields = new LinkedHashMap<>(context);
        fields.put("count", recommendations.size());
        logger.info("recommendations_generated", fields);
        return List.copyOf(recommendations);
    }

    private static Recommendation build(String id, RecommendationTemplate template, CauseCategory category,
                                        Priority priority, String metricName, Map<String, String> values,
                                        double confidence) {
        List<String> steps = new ArrayList<>();
        for (String step : template.getSteps()) {
            steps.add(fill(step, values));
        }
        return Recommendation.builder()
                .id(id)
                .title(fill(template.getTitle(), values))
                .description(fill(template.getDescription(), values))
                .category(category)
                .priority(priority)
                .actionType(ActionType.fromWireName(template.getActionType()))
                .estimatedImpact(new ImpactEstimate(metricName, template.getImprovementPercentage(),
                        template.getImpactConfidence()))
                .estimatedEffort(new EffortEstimate(EffortLevel.fromWireName(template.getEffortLevel()),
                        template.getEffortDuration()))
                .implementationSteps(steps)
                .dependencies(List.of())
                .confidence(Math.max(0.0, Math.min(1.0, confidence)))
                .build();
    }

    private static Map<String, String> placeholders(String factor, String metric, double currentValue,
                                                    double delta) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("{factor}", factor);
        values.put("{metric}", metric);
        values.put("{current_value}", String.format(Locale.ROOT, "%.2f", currentValue));
        values.put("{delta}", String.format(Locale.ROOT, "%+.1f%%", delta));
        return values;
    }

    static String fill(String text, Map<String, String> values) {
        if (text == null) {
            return null;
        }
        String filled = text;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            filled = filled.replace(entry.getKey(), entry.getValue());
        }
        return filled;
    }

    private static String stableId(String... parts) {
        return UUID.nameUUIDFromBytes(String.join("|", parts).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
