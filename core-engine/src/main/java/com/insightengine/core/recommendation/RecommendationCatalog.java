package com.insightengine.core.recommendation;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.config.RecommendationTemplate;
import com.insightengine.core.model.CauseCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup table from {@link CauseCategory} to its remediation template.
 *
 * <p>
 * A category without a template never produces a recommendation.
 * </p>
 *
 * @since 1.0.0
 */
public final class RecommendationCatalog {

    private final Map<CauseCategory, RecommendationTemplate> templates;

    private RecommendationCatalog(Map<CauseCategory, RecommendationTemplate> templates) {
        this.templates = Collections.unmodifiableMap(templates);
    }

    /**
     * @return catalog of {@link EngineConfig#builtInTemplates()}
     */
    public static RecommendationCatalog builtIn() {
        return fromTemplates(EngineConfig.builtInTemplates());
    }

    /**
     * @param templates templates, at most one per category
     * @return catalog keyed by category
     * @throws IllegalStateException if a template is invalid or a category
     *                               appears twice
     */
    public static RecommendationCatalog fromTemplates(List<RecommendationTemplate> templates) {
        Objects.requireNonNull(templates, "templates must not be null");
        Map<CauseCategory, RecommendationTemplate> byCategory = new EnumMap<>(CauseCategory.class);
        for (RecommendationTemplate template : templates) {
            template.validate();
            CauseCategory category = CauseCategory.fromWireName(template.getCategory());
            if (byCategory.putIfAbsent(category, template) != null) {
                throw new IllegalStateException("Duplicate template for category '" + category.wireName() + "'");
            }
        }
        return new RecommendationCatalog(byCategory);
    }

    /**
     * @param config engine configuration
     * @return catalog of the configured templates, or the built-in catalog
     *         when none are configured
     */
    public static RecommendationCatalog fromConfig(EngineConfig config) {
        List<RecommendationTemplate> configured = config.getRecommendationTemplates();
        return configured.isEmpty() ? builtIn() : fromTemplates(configured);
    }

    public Optional<RecommendationTemplate> templateFor(CauseCategory category) {
        return Optional.ofNullable(templates.get(category));
    }

    /**
     * @param factor metric or factor name
     * @return categories whose keywords match the name and that have a
     *         template, in declaration order
     */
    public List<CauseCategory> match(String factor) {
        List<CauseCategory> matched = new ArrayList<>();
        for (CauseCategory category : templates.keySet()) {
            if (category.matches(factor)) {
                matched.add(category);
            }
        }
        return matched;
    }

    public int size() {
        return templates.size();
    }
}
