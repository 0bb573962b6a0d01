package com.mlops_lifecycle.exception;

/**
 * Missing or malformed pipeline configuration. Always fatal.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
