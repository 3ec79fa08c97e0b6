package com.insightengine.core.error;

/**
 * Base type for the typed failures the engine reports to its immediate caller.
 *
 * <p>
 * A failure is distinct from an empty result: "no anomalies" or "no correlated
 * candidates" is always an empty list, never an exception.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class InsightException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected InsightException(String message) {
        super(message);
    }

    protected InsightException(String message, Throwable cause) {
        super(message, cause);
    }
}
