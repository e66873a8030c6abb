package com.depsync.core.imports;

/**
 * Thrown when an imports sync has no {@code deno.jsonc} to work on.
 */
public class ImportsSyncException extends RuntimeException {
    public ImportsSyncException(String message) {
        super(message);
    }

    public ImportsSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
