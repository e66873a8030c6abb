package com.depsync.core.model;

/**
 * Records a workspace entry that was skipped during discovery.
 *
 * @param path   workspace-relative path of the skipped entry
 * @param reason short description of why it was skipped
 * @param cause  underlying exception, may be {@code null}
 */
public record DiscoveryDiagnostic(
    String path,
    String reason,
    Throwable cause
) {}
