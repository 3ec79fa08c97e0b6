package com.insightengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A remediation produced from a catalog template.
 *
 * <p>
 * {@code estimatedImpact} and {@code estimatedEffort} come from the template
 * unchanged. Only the title and description carry values of the analysed
 * metric.
 * </p>
 *
 * @since 1.0.0
 */
public final class Recommendation {

    private final String id;
    private final String title;
    private final String description;
    private final CauseCategory category;
    private final Priority priority;
    private final ActionType actionType;
    private final ImpactEstimate estimatedImpact;
    private final EffortEstimate estimatedEffort;
    private final List<String> implementationSteps;
    private final List<String> dependencies;
    private final double confidence;

    private Recommendation(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.title = Objects.requireNonNull(builder.title, "title must not be null");
        this.description = builder.description;
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        this.priority = Objects.requireNonNull(builder.priority, "priority must not be null");
        this.actionType = Objects.requireNonNull(builder.actionType, "actionType must not be null");
        this.estimatedImpact = Objects.requireNonNull(builder.estimatedImpact, "estimatedImpact must not be null");
        this.estimatedEffort = Objects.requireNonNull(builder.estimatedEffort, "estimatedEffort must not be null");
        this.implementationSteps = List.copyOf(builder.implementationSteps);
        this.dependencies = List.copyOf(builder.dependencies);
        this.confidence = builder.confidence;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String title;
        private String description;
        private CauseCategory category;
        private Priority priority;
        private ActionType actionType;
        private ImpactEstimate estimatedImpact;
        private EffortEstimate estimatedEffort;
        private List<String> implementationSteps = List.of();
        private List<String> dependencies = List.of();
        private double confidence;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(CauseCategory category) {
            this.category = category;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder actionType(ActionType actionType) {
            this.actionType = actionType;
            return this;
        }

        public Builder estimatedImpact(ImpactEstimate estimatedImpact) {
            this.estimatedImpact = estimatedImpact;
            return this;
        }

        public Builder estimatedEffort(EffortEstimate estimatedEffort) {
            this.estimatedEffort = estimatedEffort;
            return this;
        }

        public Builder implementationSteps(List<String> implementationSteps) {
            this.implementationSteps = implementationSteps;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Recommendation build() {
            return new Recommendation(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public CauseCategory getCategory() {
        return category;
    }

    public Priority getPriority() {
        return priority;
    }

    public ActionType getActionType() {
        return actionType;
    }

    public ImpactEstimate getEstimatedImpact() {
        return estimatedImpact;
    }

    public EffortEstimate getEstimatedEffort() {
        return estimatedEffort;
    }

    public List<String> getImplementationSteps() {
        return implementationSteps;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Recommendation that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && id.equals(that.id)
                && title.equals(that.title)
                && Objects.equals(description, that.description)
                && category == that.category
                && priority == that.priority
                && actionType == that.actionType
                && estimatedImpact.equals(that.estimatedImpact)
                && estimatedEffort.equals(that.estimatedEffort)
                && implementationSteps.equals(that.implementationSteps)
                && dependencies.equals(that.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, priority, actionType);
    }

    @Override
    public String toString() {
        return "Recommendation{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", priority=" + priority.wireName() +
                ", actionType=" + actionType.wireName() +
                '}';
    }
}
