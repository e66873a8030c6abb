package com.depsync.core.fs;

/**
 * An entry produced by a workspace walk.
 *
 * @param path   workspace-relative, forward-slash path
 * @param isFile {@code true} for regular files, {@code false} for directories
 */
public record WalkEntry(String path, boolean isFile) {}
