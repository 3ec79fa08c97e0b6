package com.insightengine.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An anomalous observation found by one outlier test.
 *
 * <p>
 * Instances are immutable. Acknowledgement and resolution state is kept by the
 * persistence side against {@link #getId()}, never on the anomaly itself.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code id}, {@code metricName}, {@code anomalyType},
 * {@code severity} and {@code detectedAt} are required; omitting any of them
 * throws {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public final class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String metricName;
    private final AnomalyType anomalyType;
    private final Severity severity;
    private final double confidence;
    private final double detectedValue;
    private final double expectedValue;
    private final double thresholdValue;
    private final double deviationPercentage;
    private final Instant detectedAt;
    private final String description;

    private Anomaly(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.metricName = Objects.requireNonNull(builder.metricName, "metricName must not be null");
        this.anomalyType = Objects.requireNonNull(builder.anomalyType, "anomalyType must not be null");
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.confidence = builder.confidence;
        this.detectedValue = builder.detectedValue;
        this.expectedValue = builder.expectedValue;
        this.thresholdValue = builder.thresholdValue;
        this.deviationPercentage = builder.deviationPercentage;
        this.detectedAt = Objects.requireNonNull(builder.detectedAt, "detectedAt must not be null");
        this.description = builder.description;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly} instances.
     */
    public static class Builder {
        private String id;
        private String metricName;
        private AnomalyType anomalyType;
        private Severity severity;
        private double confidence;
        private double detectedValue;
        private double expectedValue;
        private double thresholdValue;
        private double deviationPercentage;
        private Instant detectedAt;
        private String description;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder anomalyType(AnomalyType anomalyType) {
            this.anomalyType = anomalyType;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder detectedValue(double detectedValue) {
            this.detectedValue = detectedValue;
            return this;
        }

        public Builder expectedValue(double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder thresholdValue(double thresholdValue) {
            this.thresholdValue = thresholdValue;
            return this;
        }

        public Builder deviationPercentage(double deviationPercentage) {
            this.deviationPercentage = deviationPercentage;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        /**
         * @return a new {@link Anomaly}
         * @throws NullPointerException     if a required field is missing
         * @throws IllegalArgumentException if confidence is outside [0, 1]
         */
        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    public String getId() {
        return id;
    }

    public String getMetricName() {
        return metricName;
    }

    public AnomalyType getAnomalyType() {
        return anomalyType;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getDetectedValue() {
        return detectedValue;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public double getThresholdValue() {
        return thresholdValue;
    }

    public double getDeviationPercentage() {
        return deviationPercentage;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly anomaly))
            return false;
        return Double.compare(confidence, anomaly.confidence) == 0
                && Double.compare(detectedValue, anomaly.detectedValue) == 0
                && Double.compare(expectedValue, anomaly.expectedValue) == 0
                && Double.compare(thresholdValue, anomaly.thresholdValue) == 0
                && Double.compare(deviationPercentage, anomaly.deviationPercentage) == 0
                && id.equals(anomaly.id)
                && metricName.equals(anomaly.metricName)
                && anomalyType == anomaly.anomalyType
                && severity == anomaly.severity
                && detectedAt.equals(anomaly.detectedAt)
                && Objects.equals(description, anomaly.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, metricName, anomalyType, severity, detectedAt);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", metricName='" + metricName + '\'' +
                ", anomalyType=" + anomalyType.wireName() +
                ", severity=" + severity.wireName() +
                ", confidence=" + confidence +
                ", detectedValue=" + detectedValue +
                ", expectedValue=" + expectedValue +
                ", deviationPercentage=" + deviationPercentage +
                ", detectedAt=" + detectedAt +
                '}';
    }
}
