package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Which way a metric moves when things get better.
 *
 * @since 1.0.0
 */
public enum MetricDirection {

    HIGHER_IS_BETTER("higher_is_better"),
    LOWER_IS_BETTER("lower_is_better");

    /** Name fragments of metrics where an increase is bad. */
    private static final List<String> LOWER_IS_BETTER_HINTS =
            List.of("error", "fail", "latency", "duration", "cost", "queue", "ttft");

    private final String wireName;

    MetricDirection(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static MetricDirection fromWireName(String name) {
        for (MetricDirection direction : values()) {
            if (direction.wireName.equalsIgnoreCase(name) || direction.name().equalsIgnoreCase(name)) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Unknown metric direction: '" + name
                + "'. Supported: higher_is_better, lower_is_better");
    }

    /**
     * Guess the direction from a metric name.
     *
     * @param metricName metric name
     * @return {@link #LOWER_IS_BETTER} for error, latency and cost style
     *         names, {@link #HIGHER_IS_BETTER} otherwise
     */
    public static MetricDirection inferFrom(String metricName) {
        String name = metricName.toLowerCase(Locale.ROOT);
        if (name.endsWith("_ms")) {
            return LOWER_IS_BETTER;
        }
        for (String hint : LOWER_IS_BETTER_HINTS) {
            if (name.contains(hint)) {
                return LOWER_IS_BETTER;
            }
        }
        return HIGHER_IS_BETTER;
    }

    /**
     * @param change signed change (absolute or relative)
     * @return {@code true} if a change of this sign is bad for the metric
     */
    public boolean isUnfavorable(double change) {
        return this == HIGHER_IS_BETTER ? change < 0 : change > 0;
    }
}
