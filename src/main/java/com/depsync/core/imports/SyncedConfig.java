package com.depsync.core.imports;

/**
 * Outcome of syncing one {@code deno.jsonc}.
 *
 * @param configPath workspace-relative manifest path
 * @param status     what happened to the file
 * @param message    reason when the file was skipped or failed, otherwise {@code null}
 */
public record SyncedConfig(String configPath, Status status, String message) {

    public enum Status { UPDATED, SKIPPED, FAILED }

    static SyncedConfig updated(String configPath) {
        return new SyncedConfig(configPath, Status.UPDATED, null);
    }

    static SyncedConfig skipped(String configPath, String message) {
        return new SyncedConfig(configPath, Status.SKIPPED, message);
    }

    static SyncedConfig failed(String configPath, String message) {
        return new SyncedConfig(configPath, Status.FAILED, message);
    }
}
