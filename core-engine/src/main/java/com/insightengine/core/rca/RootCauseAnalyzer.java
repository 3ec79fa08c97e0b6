package com.insightengine.core.rca;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.detection.AnomalyDetector;
import com.insightengine.core.error.InsufficientDataException;
import com.insightengine.core.error.InvalidInputException;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.ContributingFactor;
import com.insightengine.core.model.Degradation;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.PrimaryCause;
import com.insightengine.core.model.RootCauseAnalysis;
import com.insightengine.core.model.SimilarIncident;
import com.insightengine.core.model.TimelineEvent;
import com.insightengine.core.stats.Stats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Ranks sibling metrics as likely causes of a degradation on a target metric.
 *
 * <h3>Algorithm</h3>
 * <ol>
 * <li>Keep the points with {@code start - lookback <= t <= start} of the target
 * and of every sibling. The target needs at least two of them.</li>
 * <li>Correlate each sibling with the target. Siblings must be index-aligned
 * with the target; a different length is an {@link InvalidInputException}. A
 * constant sibling has no computable correlation and is skipped.</li>
 * <li>Siblings with {@code |r| >= correlationSignificanceCutoff} become
 * candidates. Contribution is {@code r² / Σr² · 100}; confidence is
 * {@code |r|}, plus {@code leadingIndicatorBonus} when the sibling shifted
 * strictly before the degradation, capped at 1.</li>
 * <li>A sibling's shift point is the latest timestamp of the shortest prefix of
 * its window on which the {@link AnomalyDetector} finds an anomaly.</li>
 * </ol>
 *
 * <p>
 * No candidate is a valid outcome: {@code primaryCauses} is then empty.
 * </p>
 *
 * @since 1.0.0
 */
public class RootCauseAnalyzer {

    private static final double MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    /** Descending contribution, then descending confidence. */
    static final Comparator<PrimaryCause> CAUSE_ORDER =
            Comparator.comparingDouble(PrimaryCause::getContributionPercentage).reversed()
                    .thenComparing(Comparator.comparingDouble(PrimaryCause::getConfidence).reversed());

    private final EngineConfig config;
    private final AnomalyDetector shiftDetector;
    private final IncidentHistoryStore incidentStore;
    private final InsightLogger logger;

    public RootCauseAnalyzer(EngineConfig config) {
        this(config, null, Slf4jInsightLogger.forClass(RootCauseAnalyzer.class));
    }

    /**
     * @param config        engine configuration
     * @param incidentStore past incidents, or {@code null} for none
     * @param logger        structured logger
     */
    public RootCauseAnalyzer(EngineConfig config, IncidentHistoryStore incidentStore, InsightLogger logger) {
        // shift scanning runs the detector once per prefix; its events would drown the analysis log
        this(config, new AnomalyDetector(config, InsightLogger.noop()), incidentStore, logger);
    }

    public RootCauseAnalyzer(EngineConfig config, AnomalyDetector shiftDetector,
                             IncidentHistoryStore incidentStore, InsightLogger logger) {
        this.config = Objects.requireNonNull(config, "EngineConfig must not be null").copy();
        this.shiftDetector = Objects.requireNonNull(shiftDetector, "shiftDetector must not be null");
        this.incidentStore = incidentStore;
        this.logger = Objects.requireNonNull(logger, "logger must not be null");
    }

    /**
     * @param target      the degraded metric
     * @param degradation when and how badly it degraded
     * @param siblings    candidate cause metrics, index-aligned with the target
     * @return analysis with ranked causes, timeline and similar incidents
     * @throws InsufficientDataException if the target has fewer than two points
     *                                   in the window
     * @throws InvalidInputException     if a sibling is not aligned with the
     *                                   target
     */
    public RootCauseAnalysis analyze(MetricSeries target, Degradation degradation, List<MetricSeries> siblings) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(degradation, "degradation must not be null");
        Objects.requireNonNull(siblings, "siblings must not be null");

        if (siblings.size() > config.getMaxSiblings()) {
            logger.warn("sibling_cap_exceeded", LogFields.of(
                    "metric", target.getMetricName(), "siblings", siblings.size(), "cap", config.getMaxSiblings()));
        }

        Instant start = degradation.getStartTime();
        Instant windowStart = start.minusMillis(Math.round(config.getLookbackHours() * MILLIS_PER_HOUR));
        MetricSeries targetWindow = target.between(windowStart, start);
        if (targetWindow.size() < 2) {
            throw new InsufficientDataException(
                    "Root-cause analysis of '" + target.getMetricName() + "'", 2, targetWindow.size());
        }
        double[] targetValues = targetWindow.values();

        List<Candidate> candidates = new ArrayList<>();
        int skipped = 0;
        for (MetricSeries sibling : siblings) {
            MetricSeries window = sibling.between(windowStart, start);
            if (window.size() != targetValues.length) {
                throw new InvalidInputException(String.format(Locale.ROOT,
                        "Sibling '%s' has %d point(s) in the analysis window, target '%s' has %d",
                        sibling.getMetricName(), window.size(), target.getMetricName(), targetValues.length));
            }
            double r;
            try {
                r = Stats.correlation(targetValues, window.values());
            } catch (InvalidInputException e) {
                skipped++;
                logger.warn("candidate_skipped", LogFields.of(
                        "metric", target.getMetricName(), "candidate", sibling.getMetricName(),
                        "reason", e.getMessage()));
                continue;
            }
            if (Math.abs(r) >= config.getCorrelationSignificanceCutoff()) {
                candidates.add(new Candidate(window, r, findShift(window)));
            }
        }

        double totalSquared = 0;
        for (Candidate candidate : candidates) {
            totalSquared += candidate.correlation * candidate.correlation;
        }

        for (Candidate candidate : candidates) {
            candidate.cause = toCause(candidate, start, totalSquared);
        }
        candidates.sort(Comparator.comparing((Candidate candidate) -> candidate.cause, CAUSE_ORDER));

        List<PrimaryCause> causes = new ArrayList<>();
        List<ContributingFactor> factors = new ArrayList<>();
        for (Candidate candidate : candidates) {
            causes.add(candidate.cause);
            Double lag = candidate.shift == null
                    ? null
                    : Duration.between(candidate.shift, start).toMillis() / MILLIS_PER_HOUR;
            factors.add(new ContributingFactor(candidate.cause.getFactor(), candidate.correlation, lag));
        }

        RootCauseAnalysis analysis = new RootCauseAnalysis(
                target.getMetricName(),
                degradation,
                causes,
                factors,
                timeline(target.getMetricName(), degradation, windowStart, candidates),
                similarIncidents(target.getMetricName(), degradation));

        logger.info("root_cause_analysis_completed", LogFields.of(
                "metric", target.getMetricName(),
                "siblings", siblings.size(),
                "candidates", causes.size(),
                "skipped", skipped,
                "similarIncidents", analysis.getSimilarIncidents().size()));
        return analysis;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Instant findShift(MetricSeries window) {
        for (int k = AnomalyDetector.MIN_POINTS; k <= window.size(); k++) {
            List<Anomaly> found = shiftDetector.detect(window.head(k));
            if (!found.isEmpty()) {
                return found.get(0).getDetectedAt();
            }
        }
        return null;
    }

    private PrimaryCause toCause(Candidate candidate, Instant start, double totalSquared) {
        double r = candidate.correlation;
        boolean leading = candidate.shift != null && candidate.shift.isBefore(start);
        double confidence = Math.min(1.0, Math.abs(r) + (leading ? config.getLeadingIndicatorBonus() : 0.0));
        double contribution = totalSquared > 0 ? r * r / totalSquared * 100.0 : 0.0;

        double[] values = candidate.window.values();
        double current = values[values.length - 1];
        double change = Stats.percentChange(Stats.mean(values, 0, values.length - 1), current);

        List<String> evidence = new ArrayList<>();
        evidence.add(String.format(Locale.ROOT, "Correlation %.2f with the degraded metric (%s %s)",
                r, Math.abs(r) >= 0.8 ? "strong" : "moderate", r >= 0 ? "positive" : "negative"));
        if (candidate.shift == null) {
            evidence.add("No distinct shift detected in the analysis window");
        } else if (leading) {
            evidence.add(String.format(Locale.ROOT, "Shifted %.1f hour(s) before the degradation",
                    Duration.between(candidate.shift, start).toMillis() / MILLIS_PER_HOUR));
        } else {
            evidence.add("Shifted at the same time as the degradation");
        }
        evidence.add(String.format(Locale.ROOT, "Latest value %.2f (%+.1f%% against the window average)",
                current, change));

        return PrimaryCause.builder()
                .factor(candidate.window.getMetricName())
                .confidence(confidence)
                .contributionPercentage(contribution)
                .correlation(r)
                .currentValue(current)
                .changePercentage(change)
                .evidence(evidence)
                .build();
    }

    private static List<TimelineEvent> timeline(String metricName, Degradation degradation, Instant windowStart,
                                                List<Candidate> candidates) {
        Map<String, TimelineEvent> events = new LinkedHashMap<>();
        add(events, new TimelineEvent(windowStart, "Analysis window start", "Baseline metrics established"));
        for (Candidate candidate : candidates) {
            if (candidate.shift != null) {
                boolean leading = candidate.shift.isBefore(degradation.getStartTime());
                add(events, new TimelineEvent(candidate.shift,
                        "Shift detected in " + candidate.window.getMetricName(),
                        leading ? "Leading indicator" : "Coincident with degradation"));
            }
        }
        add(events, new TimelineEvent(degradation.getStartTime(),
                "Degradation detected in " + metricName,
                String.format(Locale.ROOT, "%s severity, %.1f%% change",
                        degradation.getSeverity().wireName(), degradation.getPercentageDrop())));

        List<TimelineEvent> ordered = new ArrayList<>(events.values());
        ordered.sort(Comparator.comparing(TimelineEvent::getTimestamp));
        return ordered;
    }

    private static void add(Map<String, TimelineEvent> events, TimelineEvent event) {
        events.putIfAbsent(event.getTimestamp() + "|" + event.getEvent(), event);
    }

    private List<SimilarIncident> similarIncidents(String metricName, Degradation degradation) {
        if (incidentStore == null) {
            return List.of();
        }
        return incidentStore.findSimilar(new IncidentQuery(metricName, degradation.getPercentageDrop(),
                config.getSimilarIncidentDropTolerance(), config.getSimilarIncidentLimit()));
    }

    private static final class Candidate {
        private final MetricSeries window;
        private final double correlation;
        private final Instant shift;
        private PrimaryCause cause;

        private Candidate(MetricSeries window, double correlation, Instant shift) {
            this.window = window;
            this.correlation = correlation;
            this.shift = shift;
        }
    }
}
