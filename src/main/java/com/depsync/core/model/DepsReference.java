package com.depsync.core.model;

/**
 * A registry-qualified specifier such as {@code jsr:@scope/name@1.2.3/subpath}.
 *
 * @param registry      registry the specifier points at
 * @param scope         package scope including the {@code @}, or {@code null} when unscoped
 * @param name          package name without scope
 * @param fullName      scope and name, e.g. {@code @scope/name}
 * @param version       version token
 * @param subpath       trailing subpath including the leading slash, or {@code null}
 * @param fullSpecifier the specifier text without surrounding quotes
 * @param line          1-indexed line, or 0 when parsed outside of a file
 * @param column        1-indexed column, or 0 when parsed outside of a file
 */
public record DepsReference(
    Registry registry,
    String scope,
    String name,
    String fullName,
    String version,
    String subpath,
    String fullSpecifier,
    int line,
    int column
) {

    /**
     * Rebuilds the specifier text from its parts.
     */
    public String toSpecifier() {
        return registry.prefix() + ":" + fullName + "@" + version + (subpath == null ? "" : subpath);
    }
}
