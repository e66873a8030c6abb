package com.depsync.core.model;

import java.time.Duration;

/**
 * Per-call options for registry lookups.
 *
 * @param timeout       request timeout, or {@code null} for the client default
 * @param includeYanked keep yanked or deprecated versions
 */
public record ResolveOptions(
    Duration timeout,
    boolean includeYanked
) {

    public static ResolveOptions defaults() {
        return new ResolveOptions(null, false);
    }
}
