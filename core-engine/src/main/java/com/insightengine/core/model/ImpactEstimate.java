package com.insightengine.core.model;

import java.util.Objects;

/**
 * Expected effect of applying a recommendation.
 *
 * @since 1.0.0
 */
public final class ImpactEstimate {

    private final String metric;
    private final double improvementPercentage;
    private final double confidence;

    public ImpactEstimate(String metric, double improvementPercentage, double confidence) {
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.improvementPercentage = improvementPercentage;
        this.confidence = confidence;
    }

    public String getMetric() {
        return metric;
    }

    public double getImprovementPercentage() {
        return improvementPercentage;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ImpactEstimate that))
            return false;
        return Double.compare(improvementPercentage, that.improvementPercentage) == 0
                && Double.compare(confidence, that.confidence) == 0
                && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metric, improvementPercentage, confidence);
    }

    @Override
    public String toString() {
        return "ImpactEstimate{metric='" + metric + "', improvementPercentage=" + improvementPercentage
                + ", confidence=" + confidence + '}';
    }
}
