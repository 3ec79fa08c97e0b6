package com.insightengine.core.error;

/**
 * Thrown for input the engine cannot compute on: misaligned series, a series
 * with zero variance where variance is a divisor, non-finite values.
 *
 * @since 1.0.0
 */
public class InvalidInputException extends InsightException {

    private static final long serialVersionUID = 1L;

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
