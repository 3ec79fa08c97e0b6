package com.insightengine.core.config;

import com.insightengine.core.model.ActionType;
import com.insightengine.core.model.CauseCategory;
import com.insightengine.core.model.EffortLevel;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One remediation template of the recommendation catalog, as loaded from
 * configuration.
 *
 * <p>
 * Title, description and steps may contain the placeholders
 * {@code {factor}}, {@code {metric}}, {@code {current_value}} and
 * {@code {delta}}. Impact and effort figures are used as written.
 * </p>
 *
 * <pre>
 * recommendationTemplates:
 *   - category: high_latency
 *     title: "Optimize response time for {factor}"
 *     actionType: short_term
 *     improvementPercentage: 30
 *     effortLevel: medium
 *     effortDuration: "1-2 days"
 *     steps: ["Profile slow requests", "Add caching"]
 * </pre>
 *
 * @since 1.0.0
 */
public class RecommendationTemplate implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Cause category wire name, e.g. {@code high_error_rate}. */
    private String category;

    private String title;
    private String description;

    /** {@code immediate}, {@code short_term} or {@code long_term}. */
    private String actionType;

    private List<String> steps = new ArrayList<>();

    /** Expected improvement of the affected metric, in percent. */
    private double improvementPercentage;

    /** Confidence in {@link #improvementPercentage}, in {@code [0, 1]}. */
    private double impactConfidence = 0.7;

    /** {@code low}, {@code medium} or {@code high}. */
    private String effortLevel;

    private String effortDuration;

    public RecommendationTemplate() {
    }

    public RecommendationTemplate(String category, String title, String description, String actionType,
                                  List<String> steps, double improvementPercentage, double impactConfidence,
                                  String effortLevel, String effortDuration) {
        setCategory(category);
        this.title = title;
        this.description = description;
        setActionType(actionType);
        setSteps(steps);
        this.improvementPercentage = improvementPercentage;
        this.impactConfidence = impactConfidence;
        setEffortLevel(effortLevel);
        this.effortDuration = effortDuration;
    }

    RecommendationTemplate copy() {
        return new RecommendationTemplate(category, title, description, actionType, steps,
                improvementPercentage, impactConfidence, effortLevel, effortDuration);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * @throws IllegalStateException if a required field is missing or an enum
     *                               value is unknown
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (category == null || category.isBlank()) {
            errors.add("Template 'category' is required");
        } else {
            try {
                CauseCategory.fromWireName(category);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (title == null || title.isBlank()) {
            errors.add("Template '" + category + "' requires 'title'");
        }
        if (actionType == null) {
            errors.add("Template '" + category + "' requires 'actionType'");
        } else {
            try {
                ActionType.fromWireName(actionType);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (effortLevel == null) {
            errors.add("Template '" + category + "' requires 'effortLevel'");
        } else {
            try {
                EffortLevel.fromWireName(effortLevel);
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }
        if (steps == null || steps.isEmpty()) {
            errors.add("Template '" + category + "' requires at least one step");
        }
        if (improvementPercentage < 0 || improvementPercentage > 100) {
            errors.add("Template '" + category + "' requires 'improvementPercentage' in [0, 100]");
        }
        if (impactConfidence < 0 || impactConfidence > 1) {
            errors.add("Template '" + category + "' requires 'impactConfidence' in [0, 1]");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid RecommendationTemplate: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category != null ? category.toLowerCase(Locale.ROOT) : null;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getActionType() {
        return actionType;
    }

    public void setActionType(String actionType) {
        this.actionType = actionType != null ? actionType.toLowerCase(Locale.ROOT) : null;
    }

    public List<String> getSteps() {
        return steps;
    }

    public void setSteps(List<String> steps) {
        this.steps = steps != null ? new ArrayList<>(steps) : new ArrayList<>();
    }

    public double getImprovementPercentage() {
        return improvementPercentage;
    }

    public void setImprovementPercentage(double improvementPercentage) {
        this.improvementPercentage = improvementPercentage;
    }

    public double getImpactConfidence() {
        return impactConfidence;
    }

    public void setImpactConfidence(double impactConfidence) {
        this.impactConfidence = impactConfidence;
    }

    public String getEffortLevel() {
        return effortLevel;
    }

    public void setEffortLevel(String effortLevel) {
        this.effortLevel = effortLevel != null ? effortLevel.toLowerCase(Locale.ROOT) : null;
    }

    public String getEffortDuration() {
        return effortDuration;
    }

    public void setEffortDuration(String effortDuration) {
        this.effortDuration = effortDuration;
    }

    @Override
    public String toString() {
        return "RecommendationTemplate{" +
                "category='" + category + '\'' +
                ", title='" + title + '\'' +
                ", actionType='" + actionType + '\'' +
                ", effortLevel='" + effortLevel + '\'' +
                '}';
    }
}
