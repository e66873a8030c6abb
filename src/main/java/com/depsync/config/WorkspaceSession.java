package com.depsync.config;

import com.depsync.core.deps.DependencyUpgradePlanner;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.imports.ImportsSyncService;
import com.depsync.core.references.PackageReferenceService;
import com.depsync.core.scanner.ProjectResolver;

/**
 * The engine components bound to one workspace root.
 */
public record WorkspaceSession(
    WorkspaceFileSystem fileSystem,
    ProjectResolver projects,
    PackageReferenceService references,
    DependencyUpgradePlanner planner,
    ImportsSyncService imports
) {}
