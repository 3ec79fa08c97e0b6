package com.insightengine.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Category of a probable cause, matched from a metric or factor name by fixed
 * keywords.
 *
 * <p>
 * A name matches when its lower-cased form contains any of the category's
 * keywords. A name may match several categories.
 * </p>
 *
 * @since 1.0.0
 */
public enum CauseCategory {

    HIGH_ERROR_RATE("high_error_rate", List.of("error", "fail", "exception")),
    HIGH_LATENCY("high_latency", List.of("latency", "duration", "response_time", "ttft", "_ms")),
    QUALITY_DEGRADATION("quality_degradation", List.of("quality", "score", "rating", "accuracy", "success")),
    HIGH_COST("high_cost", List.of("cost", "spend", "token"));

    private final String wireName;
    private final List<String> keywords;

    CauseCategory(String wireName, List<String> keywords) {
        this.wireName = wireName;
        this.keywords = keywords;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public List<String> keywords() {
        return keywords;
    }

    @JsonCreator
    public static CauseCategory fromWireName(String name) {
        for (CauseCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(name) || category.name().equalsIgnoreCase(name)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown cause category: '" + name + "'");
    }

    /**
     * @param factor metric or factor name
     * @return {@code true} if the name contains one of this category's keywords
     */
    public boolean matches(String factor) {
        if (factor == null) {
            return false;
        }
        String name = factor.toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (name.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
