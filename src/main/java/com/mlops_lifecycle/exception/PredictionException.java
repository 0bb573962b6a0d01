package com.mlops_lifecycle.exception;

/**
 * The loaded model failed while scoring a request.
 */
public class PredictionException extends RuntimeException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
