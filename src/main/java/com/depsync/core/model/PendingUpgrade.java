package com.depsync.core.model;

/**
 * An upgrade computed from registry data but not yet written.
 */
public record PendingUpgrade(
    String packageName,
    Registry registry,
    String currentVersion,
    String newVersion,
    ReferenceSource source,
    String file,
    int line,
    String projectName
) {}
