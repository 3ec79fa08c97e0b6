package com.insightengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ranked causes, timeline and related incidents for one degradation.
 *
 * <p>
 * {@code primaryCauses} is ordered by descending contribution, ties broken by
 * descending confidence. It may be empty when no sibling metric correlates
 * strongly enough.
 * </p>
 *
 * @since 1.0.0
 */
public final class RootCauseAnalysis {

    private final String metricName;
    private final Degradation degradation;
    private final List<PrimaryCause> primaryCauses;
    private final List<ContributingFactor> contributingFactors;
    private final List<TimelineEvent> timeline;
    private final List<SimilarIncident> similarIncidents;

    public RootCauseAnalysis(String metricName, Degradation degradation, List<PrimaryCause> primaryCauses,
                             List<ContributingFactor> contributingFactors, List<TimelineEvent> timeline,
                             List<SimilarIncident> similarIncidents) {
        this.metricName = Objects.requireNonNull(metricName, "metricName must not be null");
        this.degradation = Objects.requireNonNull(degradation, "degradation must not be null");
        this.primaryCauses = List.copyOf(primaryCauses);
        this.contributingFactors = List.copyOf(contributingFactors);
        this.timeline = List.copyOf(timeline);
        this.similarIncidents = List.copyOf(similarIncidents);
    }

    public String getMetricName() {
        return metricName;
    }

    public Degradation getDegradation() {
        return degradation;
    }

    public List<PrimaryCause> getPrimaryCauses() {
        return primaryCauses;
    }

    public List<ContributingFactor> getContributingFactors() {
        return contributingFactors;
    }

    public List<TimelineEvent> getTimeline() {
        return timeline;
    }

    public List<SimilarIncident> getSimilarIncidents() {
        return similarIncidents;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RootCauseAnalysis that))
            return false;
        return metricName.equals(that.metricName)
                && degradation.equals(that.degradation)
                && primaryCauses.equals(that.primaryCauses)
                && contributingFactors.equals(that.contributingFactors)
                && timeline.equals(that.timeline)
                && similarIncidents.equals(that.similarIncidents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metricName, degradation, primaryCauses, timeline);
    }

    @Override
    public String toString() {
        return "RootCauseAnalysis{" +
                "metricName='" + metricName + '\'' +
                ", degradation=" + degradation +
                ", primaryCauses=" + primaryCauses +
                ", timeline=" + timeline.size() + " event(s)" +
                ", similarIncidents=" + similarIncidents.size() +
                '}';
    }
}
