package com.mlops_lifecycle.exception;

/**
 * Any failure talking to the remote model registry or its artifact store: connectivity,
 * timeout, non-2xx status, malformed body, missing entry. Callers degrade instead of failing.
 */
public class RegistryUnavailableException extends RuntimeException {

    public RegistryUnavailableException(String message) {
        super(message);
    }

    public RegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
