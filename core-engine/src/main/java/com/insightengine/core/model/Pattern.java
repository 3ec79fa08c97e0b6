package com.insightengine.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A recurring shape found in a series, such as a sustained upward trend.
 *
 * @since 1.0.0
 */
public final class Pattern {

    private final String id;
    private final PatternType patternType;
    private final String description;
    private final double confidence;
    private final Instant detectedAt;
    private final Map<String, Object> metadata;

    public Pattern(String id, PatternType patternType, String description, double confidence,
                   Instant detectedAt, Map<String, Object> metadata) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.patternType = Objects.requireNonNull(patternType, "patternType must not be null");
        this.description = description;
        this.confidence = confidence;
        this.detectedAt = Objects.requireNonNull(detectedAt, "detectedAt must not be null");
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getId() {
        return id;
    }

    public PatternType getPatternType() {
        return patternType;
    }

    public String getDescription() {
        return description;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getDetectedAt() {
        return detectedAt;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public String toString() {
        return "Pattern{" + patternType.wireName() + ": " + description + '}';
    }
}
