package com.insightengine.core.logging;

import java.util.Map;

/**
 * Structured logging capability injected into every computation component.
 *
 * <p>
 * Components report named events with ordered key/value fields instead of
 * formatting free text, so the computation core stays free of global logging
 * state and tests can observe events without capturing output.
 * </p>
 *
 * @since 1.0.0
 */
public interface InsightLogger {

    void info(String event, Map<String, ?> fields);

    void warn(String event, Map<String, ?> fields);

    void error(String event, Map<String, ?> fields, Throwable cause);

    /**
     * Return a logger that discards every event.
     *
     * @return no-op logger
     */
    static InsightLogger noop() {
        return NoopInsightLogger.INSTANCE;
    }
}
