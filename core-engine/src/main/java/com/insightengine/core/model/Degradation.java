package com.insightengine.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * The degradation a root-cause analysis explains.
 *
 * @since 1.0.0
 */
public final class Degradation {

    private final Instant startTime;
    private final Severity severity;
    private final double percentageDrop;

    public Degradation(Instant startTime, Severity severity, double percentageDrop) {
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.percentageDrop = percentageDrop;
    }

    /**
     * @param anomaly detected anomaly on the target metric
     * @return degradation starting at the anomaly, sized by its deviation
     */
    public static Degradation fromAnomaly(Anomaly anomaly) {
        Objects.requireNonNull(anomaly, "anomaly must not be null");
        return new Degradation(anomaly.getDetectedAt(), anomaly.getSeverity(),
                Math.abs(anomaly.getDeviationPercentage()));
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Severity getSeverity() {
        return severity;
    }

    public double getPercentageDrop() {
        return percentageDrop;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Degradation that))
            return false;
        return Double.compare(percentageDrop, that.percentageDrop) == 0
                && startTime.equals(that.startTime)
                && severity == that.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startTime, severity, percentageDrop);
    }

    @Override
    public String toString() {
        return "Degradation{startTime=" + startTime + ", severity=" + severity.wireName()
                + ", percentageDrop=" + percentageDrop + '}';
    }
}
