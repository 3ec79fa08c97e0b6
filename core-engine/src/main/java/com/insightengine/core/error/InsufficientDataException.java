package com.insightengine.core.error;

/**
 * Thrown when a computation receives fewer points than its stated minimum.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends InsightException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    public InsufficientDataException(String operation, int required, int actual) {
        super(String.format("%s requires at least %d data point(s), got %d", operation, required, actual));
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
