package com.depsync.core.model;

import java.time.Instant;

/**
 * A version published to a registry.
 *
 * @param version     version string
 * @param channel     prerelease channel, or {@code null} for production
 * @param publishedAt publish time when the registry reports one
 * @param yanked      whether the version is yanked (JSR) or deprecated (npm)
 */
public record AvailableVersion(
    String version,
    String channel,
    Instant publishedAt,
    boolean yanked
) {}
