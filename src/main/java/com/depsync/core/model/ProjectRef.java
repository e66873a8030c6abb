package com.depsync.core.model;

import java.util.Map;

/**
 * A project discovered in the workspace, backed by a {@code deno.json} or {@code deno.jsonc} manifest.
 *
 * @param name       package name from the manifest, or {@code null} when the manifest has none
 * @param dir        workspace-relative directory of the manifest ({@code "."} for the root)
 * @param configPath workspace-relative path of the manifest
 * @param hasDev     whether the manifest defines a {@code dev} task
 * @param tasks      string-valued tasks declared by the manifest
 */
public record ProjectRef(
    String name,
    String dir,
    String configPath,
    boolean hasDev,
    Map<String, String> tasks
) {
    public ProjectRef {
        tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
    }

    public boolean isNamed() {
        return name != null && !name.isEmpty();
    }
}
