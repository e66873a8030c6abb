package com.depsync.config;

import com.depsync.core.deps.DependencyUpgradePlanner;
import com.depsync.core.deps.DepsFileParser;
import com.depsync.core.deps.VersionComparator;
import com.depsync.core.deps.VersionResolver;
import com.depsync.core.fs.LocalWorkspaceFileSystem;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.imports.ImportsSyncService;
import com.depsync.core.model.DiscoveryDiagnostic;
import com.depsync.core.model.ResolveOptions;
import com.depsync.core.references.PackageReferenceService;
import com.depsync.core.scanner.ManifestReader;
import com.depsync.core.scanner.ProjectResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Builds a {@link WorkspaceSession} for a workspace root chosen at run time.
 * The registry resolver and its cache are shared by every session.
 */
@Service
public class WorkspaceSessionFactory {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceSessionFactory.class);

    private final DepsyncProperties properties;
    private final ManifestReader manifestReader;
    private final DepsFileParser depsFileParser;
    private final VersionResolver versionResolver;
    private final VersionComparator versionComparator;

    public WorkspaceSessionFactory(DepsyncProperties properties, ManifestReader manifestReader,
                                   DepsFileParser depsFileParser, VersionResolver versionResolver,
                                   VersionComparator versionComparator) {
        this.properties = properties;
        this.manifestReader = manifestReader;
        this.depsFileParser = depsFileParser;
        this.versionResolver = versionResolver;
        this.versionComparator = versionComparator;
    }

    /** Opens the configured workspace root. */
    public WorkspaceSession open() {
        return open((Path) null);
    }

    /**
     * @param root workspace root, or {@code null} for {@code depsync.workspace.root}
     */
    public WorkspaceSession open(Path root) {
        Path effective = (root != null ? root : Path.of(properties.getWorkspaceRoot())).toAbsolutePath().normalize();
        log.debug("Opening workspace {}", effective);
        return open(new LocalWorkspaceFileSystem(effective));
    }

    public WorkspaceSession open(WorkspaceFileSystem fileSystem) {
        var resolver = new ProjectResolver(fileSystem, manifestReader, WorkspaceSessionFactory::logDiagnostic);
        var references = new PackageReferenceService(resolver);
        var planner = new DependencyUpgradePlanner(resolver, manifestReader, depsFileParser,
                versionResolver, versionComparator, resolveOptions());
        var imports = new ImportsSyncService(resolver, manifestReader);
        return new WorkspaceSession(fileSystem, resolver, references, planner, imports);
    }

    public VersionResolver versionResolver() {
        return versionResolver;
    }

    /** Registry lookup options derived from configuration. */
    public ResolveOptions resolveOptions() {
        return new ResolveOptions(properties.getRequestTimeout(), false);
    }

    private static void logDiagnostic(DiscoveryDiagnostic diagnostic) {
        log.warn("Skipped {}: {}", diagnostic.path(), diagnostic.reason());
    }
}
