package com.depsync.core.imports;

/**
 * How a workspace package is consumed.
 */
public enum PackageKind {
    /** Deployable package: has {@code main.ts}, {@code dev.ts} and {@code DOCKERFILE}, or a {@code .cli.json}. */
    RUNTIME,
    LIBRARY
}
