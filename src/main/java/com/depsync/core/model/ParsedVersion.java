package com.depsync.core.model;

import com.vdurmont.semver4j.Semver;

/**
 * A version string split into its base and channel.
 *
 * @param original the version as given
 * @param base     {@code major.minor.patch}
 * @param channel  prerelease channel (e.g. {@code integration}), or {@code null} for production
 * @param semver   structured value used for ordering
 */
public record ParsedVersion(
    String original,
    String base,
    String channel,
    Semver semver
) {

    public boolean isProduction() {
        return channel == null;
    }
}
