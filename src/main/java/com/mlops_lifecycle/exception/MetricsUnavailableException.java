package com.mlops_lifecycle.exception;

/**
 * The evaluation record needed by the promotion gate could not be read.
 */
public class MetricsUnavailableException extends RuntimeException {

    public MetricsUnavailableException(String message) {
        super(message);
    }

    public MetricsUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
