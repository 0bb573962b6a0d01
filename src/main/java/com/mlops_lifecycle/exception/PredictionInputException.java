package com.mlops_lifecycle.exception;

/**
 * Client supplied features that do not fit the loaded model.
 */
public class PredictionInputException extends RuntimeException {

    public PredictionInputException(String message) {
        super(message);
    }

    public PredictionInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
