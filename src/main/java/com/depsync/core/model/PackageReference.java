package com.depsync.core.model;

/**
 * One occurrence of a package specifier inside a workspace file.
 *
 * @param file           workspace-relative path of the file
 * @param line           1-indexed line of the occurrence
 * @param currentVersion version token of the specifier, never including a subpath
 * @param source         category of the file
 * @param projectName    name of the project owning the file
 */
public record PackageReference(
    String file,
    int line,
    String currentVersion,
    ReferenceSource source,
    String projectName
) {}
