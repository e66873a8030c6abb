package com.depsync.core.model;

/**
 * Package registries a specifier can point at.
 */
public enum Registry {
    JSR("jsr"),
    NPM("npm");

    private final String prefix;

    Registry(String prefix) {
        this.prefix = prefix;
    }

    /** Specifier prefix without the trailing colon, e.g. {@code jsr}. */
    public String prefix() {
        return prefix;
    }

    public static Registry fromPrefix(String prefix) {
        for (Registry registry : values()) {
            if (registry.prefix.equalsIgnoreCase(prefix)) {
                return registry;
            }
        }
        throw new IllegalArgumentException("Unknown registry: " + prefix);
    }
}
