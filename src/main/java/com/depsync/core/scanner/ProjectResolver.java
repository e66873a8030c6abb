package com.depsync.core.scanner;

import com.depsync.core.fs.WalkEntry;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.fs.WorkspacePaths;
import com.depsync.core.model.DiscoveryDiagnostic;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.model.ProjectResolveOptions;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Resolves a caller-supplied project reference into the workspace projects it denotes.
 * <p>
 * A single reference token is tried, in order, as:
 * <ol>
 *   <li>a path to a {@code deno.json(c)} manifest,</li>
 *   <li>a directory holding a manifest, or a directory whose subtree holds manifests,</li>
 *   <li>a package name matched exactly against every discovered project.</li>
 * </ol>
 * A reference may list several tokens separated by commas; results are merged and
 * deduplicated by {@code configPath} in first-seen order.
 * <p>
 * Unreadable or malformed manifests are treated as absent. Each one is reported to the
 * optional diagnostics consumer so skipped entries remain traceable.
 */
public class ProjectResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);

    /** Directories never descended into while looking for manifests. */
    public static final List<String> SKIP_DIRS = List.of("node_modules", ".git", ".deno", "cov");

    private static final List<Pattern> MANIFEST_MATCH = List.of(ManifestReader.MANIFEST_FILE);
    private static final List<Pattern> SKIP_PATTERNS = WorkspacePaths.directoryComponents(SKIP_DIRS);

    private final WorkspaceFileSystem fileSystem;
    private final ManifestReader manifestReader;
    private final Consumer<DiscoveryDiagnostic> diagnostics;

    public ProjectResolver(WorkspaceFileSystem fileSystem) {
        this(fileSystem, new ManifestReader(), null);
    }

    public ProjectResolver(WorkspaceFileSystem fileSystem, ManifestReader manifestReader,
                           Consumer<DiscoveryDiagnostic> diagnostics) {
        this.fileSystem = fileSystem;
        this.manifestReader = manifestReader;
        this.diagnostics = diagnostics;
    }

    public WorkspaceFileSystem fileSystem() {
        return fileSystem;
    }

    /** Discovers every project in the workspace. */
    public List<ProjectRef> resolve() {
        return resolve(null, ProjectResolveOptions.defaults());
    }

    public List<ProjectRef> resolve(String ref) {
        return resolve(ref, ProjectResolveOptions.defaults());
    }

    /**
     * Resolves {@code ref} into projects.
     *
     * @param ref     manifest path, directory, package name, or a comma-separated list of them;
     *                {@code null} or blank discovers all projects
     * @param options resolution options
     * @return matching projects, possibly empty
     * @throws MultipleProjectsException if {@code singleOnly} is set, {@code useFirst} is not,
     *                                   and more than one project matched
     */
    public List<ProjectRef> resolve(String ref, ProjectResolveOptions options) {
        var opts = options == null ? ProjectResolveOptions.defaults() : options;
        int limit = opts.useFirst() ? 1 : Integer.MAX_VALUE;

        List<ProjectRef> results;
        if (ref == null || ref.isBlank()) {
            results = walkManifests(entry -> true, opts.includeNameless(), limit);
        } else {
            var byConfigPath = new LinkedHashMap<String, ProjectRef>();
            for (String token : ref.split(",")) {
                String trimmed = token.trim();
                if (trimmed.isEmpty()) continue;

                for (ProjectRef project : resolveToken(trimmed, opts, limit)) {
                    byConfigPath.putIfAbsent(project.configPath(), project);
                }
                if (opts.useFirst() && !byConfigPath.isEmpty()) break;
            }
            results = List.copyOf(byConfigPath.values());
        }

        if (opts.useFirst()) {
            return results.isEmpty() ? List.of() : List.of(results.get(0));
        }
        if (opts.singleOnly() && results.size() > 1) {
            throw new MultipleProjectsException(ref, results.size());
        }
        log.debug("Resolved '{}' to {} project(s)", ref, results.size());
        return results;
    }

    private List<ProjectRef> resolveToken(String token, ProjectResolveOptions opts, int limit) {
        String normalized = WorkspacePaths.normalize(token);
        if (normalized.isEmpty() || WorkspacePaths.ROOT_DIR.equals(normalized)) {
            return walkManifests(entry -> true, opts.includeNameless(), limit);
        }

        if (ManifestReader.isManifestPath(normalized)) {
            Optional<ProjectRef> project = loadProject(normalized);
            if (project.isPresent()) {
                return keepIfAllowed(project.get(), opts.includeNameless());
            }
        }

        for (String manifestName : List.of("deno.jsonc", "deno.json")) {
            Optional<ProjectRef> project = loadProject(WorkspacePaths.join(normalized, manifestName));
            if (project.isPresent()) {
                return keepIfAllowed(project.get(), opts.includeNameless());
            }
        }

        if (isDirectory(normalized)) {
            String prefix = stripTrailingSlash(normalized) + "/";
            return walkManifests(entry -> entry.path().startsWith(prefix), opts.includeNameless(), limit);
        }

        return walkManifests(entry -> true, project -> token.equals(project.name()), limit);
    }

    private List<ProjectRef> walkManifests(Predicate<WalkEntry> accept, boolean includeNameless, int limit) {
        return walkManifests(accept, project -> includeNameless || project.isNamed(), limit);
    }

    private List<ProjectRef> walkManifests(Predicate<WalkEntry> accept, Predicate<ProjectRef> keep, int limit) {
        try (var entries = fileSystem.walk(MANIFEST_MATCH, SKIP_PATTERNS)) {
            return entries
                    .filter(WalkEntry::isFile)
                    .filter(accept)
                    .map(entry -> loadProject(entry.path()))
                    .flatMap(Optional::stream)
                    .filter(keep)
                    .limit(limit)
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            report(new DiscoveryDiagnostic("", "Workspace walk failed: " + e.getMessage(), e));
            return List.of();
        }
    }

    private boolean isDirectory(String dir) {
        try {
            return fileSystem.isDirectory(stripTrailingSlash(dir));
        } catch (IOException | UncheckedIOException e) {
            report(new DiscoveryDiagnostic(dir, "Directory check failed: " + e.getMessage(), e));
            return false;
        }
    }

    /**
     * Loads the project described by the manifest at {@code configPath}.
     * Returns empty when the file is absent, unreadable, or malformed.
     */
    Optional<ProjectRef> loadProject(String configPath) {
        String normalized = WorkspacePaths.normalize(configPath);
        try {
            var file = fileSystem.getFileInfo(normalized);
            if (file.isEmpty()) {
                return Optional.empty();
            }
            JsonNode manifest = manifestReader.parse(file.get().readText());

            JsonNode rawTasks = manifest.get("tasks");
            boolean hasDev = rawTasks != null && rawTasks.isObject() && rawTasks.has("dev");

            return Optional.of(new ProjectRef(
                    manifestReader.name(manifest),
                    WorkspacePaths.dirname(normalized),
                    normalized,
                    hasDev,
                    manifestReader.tasks(manifest)));
        } catch (ManifestParseException e) {
            report(new DiscoveryDiagnostic(normalized, e.getMessage(), e));
        } catch (IOException | UncheckedIOException e) {
            report(new DiscoveryDiagnostic(normalized, "Unreadable manifest: " + e.getMessage(), e));
        }
        return Optional.empty();
    }

    private void report(DiscoveryDiagnostic diagnostic) {
        log.debug("Skipping {}: {}", diagnostic.path(), diagnostic.reason());
        if (diagnostics != null) {
            diagnostics.accept(diagnostic);
        }
    }

    private static List<ProjectRef> keepIfAllowed(ProjectRef project, boolean includeNameless) {
        return !project.isNamed() && !includeNameless ? List.of() : List.of(project);
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
