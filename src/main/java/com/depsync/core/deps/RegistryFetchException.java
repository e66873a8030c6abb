package com.depsync.core.deps;

/**
 * Thrown when a registry answers a version lookup with a non-success status.
 */
public class RegistryFetchException extends RuntimeException {

    private final int statusCode;

    public RegistryFetchException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RegistryFetchException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the registry, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
