package com.depsync.core.scanner;

/**
 * Thrown when a manifest's content is not a JSON(C) object.
 */
public class ManifestParseException extends RuntimeException {
    public ManifestParseException(String message) {
        super(message);
    }

    public ManifestParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
