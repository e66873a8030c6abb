package com.depsync.core.scanner;

/**
 * Thrown when a resolution that must yield a single project matches several.
 */
public class MultipleProjectsException extends RuntimeException {

    private final String ref;
    private final int count;

    public MultipleProjectsException(String ref, int count) {
        super("Reference '%s' matched %d projects; expected exactly one".formatted(ref, count));
        this.ref = ref;
        this.count = count;
    }

    public String getRef() {
        return ref;
    }

    public int getCount() {
        return count;
    }
}
