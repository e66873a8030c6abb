package com.depsync.core.model;

/**
 * Options for planning upgrades against registry data.
 *
 * @param mode           dependency selection mode
 * @param channel        prerelease channel to target, or {@code null} for production
 * @param packagePattern package name or wildcard pattern, or {@code null} for all
 * @param dryRun         plan without writing
 */
public record DepsUpgradeOptions(
    UpgradeMode mode,
    String channel,
    String packagePattern,
    boolean dryRun
) {

    public DepsUpgradeOptions {
        mode = mode == null ? UpgradeMode.ALL : mode;
    }

    public static DepsUpgradeOptions defaults() {
        return new DepsUpgradeOptions(UpgradeMode.ALL, null, null, false);
    }
}
