package com.insightengine.core;

import com.insightengine.core.config.EngineConfig;
import com.insightengine.core.config.InsightConfigLoader;
import com.insightengine.core.detection.AnomalyDetector;
import com.insightengine.core.error.InsightException;
import com.insightengine.core.forecast.Forecaster;
import com.insightengine.core.forecast.RiskAssessor;
import com.insightengine.core.logging.InsightLogger;
import com.insightengine.core.logging.LogFields;
import com.insightengine.core.logging.Slf4jInsightLogger;
import com.insightengine.core.model.Anomaly;
import com.insightengine.core.model.AnomalyReport;
import com.insightengine.core.model.Degradation;
import com.insightengine.core.model.ForecastResult;
import com.insightengine.core.model.Investigation;
import com.insightengine.core.model.MetricDirection;
import com.insightengine.core.model.MetricSeries;
import com.insightengine.core.model.Recommendation;
import com.insightengine.core.model.RiskScore;
import com.insightengine.core.model.RootCauseAnalysis;
import com.insightengine.core.rca.IncidentHistoryStore;
import com.insightengine.core.rca.RootCauseAnalyzer;
import com.insightengine.core.recommendation.RecommendationCatalog;
import com.insightengine.core.recommendation.RecommendationEngine;
import com.insightengine.core.store.MetricStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point wiring every analysis component from one
 * {@link EngineConfig}.
 *
 * <p>
 * The engine keeps no state between calls and works on its own copy of the
 * configuration. Every method may be called concurrently; {@link #investigate} reads from the {@link MetricStore} on
 * every call and never reads back its own output.
 * </p>
 *
 * <h3>Usage</h3>
 *
 * <pre>
 * InsightEngine engine = InsightEngine.builder()
 *         .config(InsightConfigLoader.load())
 *         .metricStore(store)
 *         .build();
 * Investigation result = engine.investigate("success_rate", List.of("error_count"), from, to);
 * </pre>
 *
 * @since 1.0.0
 */
public final class InsightEngine {

    private final EngineConfig config;
    private final MetricStore metricStore;
    private final AnomalyDetector detector;
    private final Forecaster forecaster;
    private final RiskAssessor riskAssessor;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final RecommendationEngine recommendationEngine;
    private final InsightLogger logger;

    private InsightEngine(Builder builder) {
        this.config = builder.config != null ? builder.config.copy() : InsightConfigLoader.load();
        this.config.validate();
        this.metricStore = builder.metricStore;
        this.logger = loggerFor(builder.logger, InsightEngine.class);
        this.detector = new AnomalyDetector(config, loggerFor(builder.logger, AnomalyDetector.class));
        this.forecaster = new Forecaster(config, loggerFor(builder.logger, Forecaster.class));
        this.riskAssessor = new RiskAssessor(config, loggerFor(builder.logger, RiskAssessor.class));
        this.rootCauseAnalyzer = new RootCauseAnalyzer(config, builder.incidentStore,
                loggerFor(builder.logger, RootCauseAnalyzer.class));
        this.recommendationEngine = new RecommendationEngine(RecommendationCatalog.fromConfig(config),
                loggerFor(builder.logger, RecommendationEngine.class));
    }

    private static InsightLogger loggerFor(InsightLogger shared, Class<?> owner) {
        return shared != null ? shared : Slf4jInsightLogger.forClass(owner);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link InsightEngine}. Without a config,
     * {@link InsightConfigLoader#load()} is used.
     */
    public static class Builder {
        private EngineConfig config;
        private MetricStore metricStore;
        private IncidentHistoryStore incidentStore;
        private InsightLogger logger;

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        public Builder metricStore(MetricStore metricStore) {
            this.metricStore = metricStore;
            return this;
        }

        public Builder incidentStore(IncidentHistoryStore incidentStore) {
            this.incidentStore = incidentStore;
            return this;
        }

        /**
         * @param logger logger shared by every component; by default each
         *               component logs under its own class name
         */
        public Builder logger(InsightLogger logger) {
            this.logger = logger;
            return this;
        }

        public InsightEngine build() {
            return new InsightEngine(this);
        }
    }

    // ---------------------------------------------------------------
    // Single-component operations
    // ---------------------------------------------------------------

    public List<Anomaly> detect(MetricSeries series) {
        return detector.detect(series);
    }

    public AnomalyReport analyzeAnomalies(MetricSeries series) {
        return detector.analyze(series);
    }

    public ForecastResult forecast(MetricSeries series) {
        return forecaster.forecast(series);
    }

    /**
     * Forecast the series and score the risk of further degradation.
     *
     * @param series history of at least {@code minForecastPoints} points
     * @return risk score
     */
    public RiskScore assessRisk(MetricSeries series) {
        ForecastResult forecast = forecaster.forecast(series);
        return riskAssessor.assess(series, forecast, config.directionFor(series.getMetricName()));
    }

    public RootCauseAnalysis analyzeRootCause(MetricSeries target, Degradation degradation,
                                              List<MetricSeries> siblings) {
        return rootCauseAnalyzer.analyze(target, degradation, siblings);
    }

    public List<Recommendation> recommend(RootCauseAnalysis analysis) {
        return recommendationEngine.recommend(analysis);
    }

    public List<Recommendation> recommend(List<Anomaly> anomalies) {
        return recommendationEngine.recommendForAnomalies(anomalies);
    }

    // ---------------------------------------------------------------
    // End-to-end
    // ---------------------------------------------------------------

    /**
     * Fetch a metric and its siblings, detect anomalies on the latest point,
     * and explain the most severe unfavourable one.
     *
     * <p>
     * An anomaly is unfavourable when its deviation goes the wrong way for the
     * metric's direction. Without one there is nothing to remediate: no
     * root-cause analysis runs and no recommendation is made.
     * </p>
     *
     * @param metricName metric to investigate
     * @param siblings   names of candidate cause metrics
     * @param from       inclusive start of the fetched range
     * @param to         inclusive end of the fetched range
     * @return anomalies, optional analysis and recommendations
     * @throws IllegalStateException if the engine has no {@link MetricStore}
     */
    public Investigation investigate(String metricName, List<String> siblings, Instant from, Instant to) {
        Objects.requireNonNull(metricName, "metricName must not be null");
        Objects.requireNonNull(siblings, "siblings must not be null");
        if (metricStore == null) {
            throw new IllegalStateException("investigate requires a MetricStore");
        }

        MetricSeries target = metricStore.fetch(metricName, from, to);
        List<Anomaly> anomalies = detector.detect(target);
        MetricDirection direction = config.directionFor(metricName);

        Optional<Anomaly> trigger = anomalies.stream()
                .filter(a -> direction.isUnfavorable(a.getDetectedValue() - a.getExpectedValue()))
                .max(Comparator.comparing(Anomaly::getSeverity)
                        .thenComparingDouble(Anomaly::getConfidence));

        if (trigger.isEmpty()) {
            logger.info("investigation_completed", LogFields.of(
                    "metric", metricName, "anomalies", anomalies.size(), "analysed", false));
            return new Investigation(metricName, anomalies, null, List.of());
        }

        List<MetricSeries> siblingSeries = new ArrayList<>(siblings.size());
        for (String sibling : siblings) {
            siblingSeries.add(metricStore.fetch(sibling, from, to));
        }
        RootCauseAnalysis analysis;
        try {
            analysis = rootCauseAnalyzer.analyze(target, Degradation.fromAnomaly(trigger.get()), siblingSeries);
        } catch (InsightException e) {
            logger.error("investigation_failed", LogFields.of(
                    "metric", metricName, "siblings", siblings.size()), e);
            throw e;
        }
        List<Recommendation> recommendations = recommendationEngine.recommend(analysis);

        logger.info("investigation_completed", LogFields.of(
                "metric", metricName,
                "anomalies", anomalies.size(),
                "analysed", true,
                "causes", analysis.getPrimaryCauses().size(),
                "recommendations", recommendations.size()));
        return new Investigation(metricName, anomalies, analysis, recommendations);
    }

    /**
     * @return a copy of the configuration the engine was built with; changing
     *         it does not affect the engine
     */
    public EngineConfig getConfig() {
        return config.copy();
    }
}
