package com.mlops_lifecycle.exception;

/**
 * A model artifact could not be read or is not a usable classifier.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
