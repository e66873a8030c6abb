package com.depsync.core.model;

/**
 * Outcome of rewriting (or previewing the rewrite of) a single reference.
 */
public record UpgradeResult(
    String file,
    int line,
    String oldVersion,
    String newVersion,
    ReferenceSource source,
    String projectName,
    boolean success,
    String error
) {

    public static UpgradeResult succeeded(PackageReference ref, String newVersion) {
        return new UpgradeResult(ref.file(), ref.line(), ref.currentVersion(), newVersion,
                ref.source(), ref.projectName(), true, null);
    }

    public static UpgradeResult failed(PackageReference ref, String newVersion, String error) {
        return new UpgradeResult(ref.file(), ref.line(), ref.currentVersion(), newVersion,
                ref.source(), ref.projectName(), false, error);
    }
}
