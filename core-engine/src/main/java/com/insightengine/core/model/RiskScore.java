package com.insightengine.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Likelihood that a metric keeps getting worse over the forecast horizon.
 *
 * @since 1.0.0
 */
public final class RiskScore {

    private final int score;
    private final Severity level;
    private final double probability;
    private final List<String> recommendations;

    public RiskScore(int score, Severity level, double probability, List<String> recommendations) {
        this.score = score;
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.probability = probability;
        this.recommendations = List.copyOf(recommendations);
    }

    /**
     * @return score in {@code [0, 100]}
     */
    public int getScore() {
        return score;
    }

    public Severity getLevel() {
        return level;
    }

    public double getProbability() {
        return probability;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "RiskScore{score=" + score + ", level=" + level.wireName() + ", recommendations=" + recommendations + '}';
    }
}
