package com.depsync.core.imports;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A workspace package that publishes exports and can therefore stand in for its registry version.
 *
 * @param name       package name from the manifest
 * @param configPath workspace-relative path of its {@code deno.jsonc}
 * @param dir        workspace-relative directory of the manifest
 * @param exports    export key ({@code "."}, {@code "./api"}) to file path relative to {@code dir}
 * @param kind       runtime or library
 */
public record LocalPackage(
    String name,
    String configPath,
    String dir,
    Map<String, String> exports,
    PackageKind kind
) {
    public LocalPackage {
        exports = exports == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(exports));
    }

    /**
     * Import-map key under which an export is consumed: {@code "."} is the package itself,
     * {@code "./api"} becomes {@code name/api}.
     */
    public String importKey(String exportKey) {
        if (".".equals(exportKey)) return name;
        if (exportKey.startsWith("./")) return name + "/" + exportKey.substring(2);
        return name + "/" + exportKey;
    }
}
