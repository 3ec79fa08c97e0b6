package com.insightengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A sibling metric ranked as a likely cause of a degradation.
 *
 * <p>
 * {@code contributionPercentage} is the cause's share of the summed squared
 * correlations of all retained candidates. {@code currentValue} and
 * {@code changePercentage} describe the candidate's own latest movement.
 * </p>
 *
 * @since 1.0.0
 */
public final class PrimaryCause {

    private final String factor;
    private final double confidence;
    private final double contributionPercentage;
    private final double correlation;
    private final double currentValue;
    private final double changePercentage;
    private final List<String> evidence;

    private PrimaryCause(Builder builder) {
        this.factor = Objects.requireNonNull(builder.factor, "factor must not be null");
        this.confidence = builder.confidence;
        this.contributionPercentage = builder.contributionPercentage;
        this.correlation = builder.correlation;
        this.currentValue = builder.currentValue;
        this.changePercentage = builder.changePercentage;
        this.evidence = List.copyOf(builder.evidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String factor;
        private double confidence;
        private double contributionPercentage;
        private double correlation;
        private double currentValue;
        private double changePercentage;
        private List<String> evidence = List.of();

        public Builder factor(String factor) {
            this.factor = factor;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder contributionPercentage(double contributionPercentage) {
            this.contributionPercentage = contributionPercentage;
            return this;
        }

        public Builder correlation(double correlation) {
            this.correlation = correlation;
            return this;
        }

        public Builder currentValue(double currentValue) {
            this.currentValue = currentValue;
            return this;
        }

        public Builder changePercentage(double changePercentage) {
            this.changePercentage = changePercentage;
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence = evidence;
            return this;
        }

        public PrimaryCause build() {
            return new PrimaryCause(this);
        }
    }

    public String getFactor() {
        return factor;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getContributionPercentage() {
        return contributionPercentage;
    }

    public double getCorrelation() {
        return correlation;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getChangePercentage() {
        return changePercentage;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof PrimaryCause that))
            return false;
        return Double.compare(confidence, that.confidence) == 0
                && Double.compare(contributionPercentage, that.contributionPercentage) == 0
                && Double.compare(correlation, that.correlation) == 0
                && Double.compare(currentValue, that.currentValue) == 0
                && Double.compare(changePercentage, that.changePercentage) == 0
                && factor.equals(that.factor)
                && evidence.equals(that.evidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(factor, confidence, contributionPercentage, correlation);
    }

    @Override
    public String toString() {
        return "PrimaryCause{" +
                "factor='" + factor + '\'' +
                ", confidence=" + confidence +
                ", contributionPercentage=" + contributionPercentage +
                ", correlation=" + correlation +
                '}';
    }
}
