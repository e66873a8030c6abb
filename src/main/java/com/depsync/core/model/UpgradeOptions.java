package com.depsync.core.model;

/**
 * Options for rewriting every reference of a package to one version.
 *
 * @param version target version
 * @param dryRun  compute results without writing
 * @param filter  narrows the references that are rewritten
 */
public record UpgradeOptions(
    String version,
    boolean dryRun,
    ReferenceFilter filter
) {

    public UpgradeOptions {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Target version is required");
        }
        filter = filter == null ? ReferenceFilter.all() : filter;
    }

    public static UpgradeOptions to(String version) {
        return new UpgradeOptions(version, false, ReferenceFilter.all());
    }

    public UpgradeOptions asDryRun() {
        return new UpgradeOptions(version, true, filter);
    }
}
