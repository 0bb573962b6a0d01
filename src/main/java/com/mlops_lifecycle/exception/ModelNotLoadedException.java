package com.mlops_lifecycle.exception;

public class ModelNotLoadedException extends RuntimeException {

    public ModelNotLoadedException() {
        super("Model not loaded");
    }

    public ModelNotLoadedException(String message) {
        super(message);
    }
}
