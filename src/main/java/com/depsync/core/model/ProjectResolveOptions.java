package com.depsync.core.model;

/**
 * Controls project resolution.
 *
 * @param includeNameless return manifests that declare no {@code name}
 * @param singleOnly      fail when more than one project matches
 * @param useFirst        stop at the first match; wins over {@code singleOnly}
 */
public record ProjectResolveOptions(
    boolean includeNameless,
    boolean singleOnly,
    boolean useFirst
) {

    public static ProjectResolveOptions defaults() {
        return new ProjectResolveOptions(true, false, false);
    }

    public static ProjectResolveOptions namedOnly() {
        return new ProjectResolveOptions(false, false, false);
    }

    public ProjectResolveOptions withSingleOnly() {
        return new ProjectResolveOptions(includeNameless, true, useFirst);
    }

    public ProjectResolveOptions withUseFirst() {
        return new ProjectResolveOptions(includeNameless, singleOnly, true);
    }
}
