package com.depsync.core.deps;

import com.depsync.core.fs.WalkEntry;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.fs.WorkspacePaths;
import com.depsync.core.logging.MdcContext;
import com.depsync.core.model.DepsReference;
import com.depsync.core.model.DepsUpgradeOptions;
import com.depsync.core.model.PendingUpgrade;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.model.ReferenceSource;
import com.depsync.core.model.Registry;
import com.depsync.core.model.ResolveOptions;
import com.depsync.core.model.UpgradeMode;
import com.depsync.core.model.UpgradeResult;
import com.depsync.core.scanner.ManifestParseException;
import com.depsync.core.scanner.ManifestReader;
import com.depsync.core.scanner.ProjectResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Plans and applies per-project upgrades to the newest published versions.
 * <p>
 * Dependencies come from each project's manifest {@code imports} and from the
 * {@code *.deps.ts} files under its directory. Every package is looked up once per
 * declaring file and only offered when the registry has a strictly newer version on the
 * requested channel.
 */
public class DependencyUpgradePlanner {

    private static final Logger log = LoggerFactory.getLogger(DependencyUpgradePlanner.class);

    private static final List<Pattern> DEPS_FILES = List.of(Pattern.compile("\\.deps\\.ts$"));
    private static final List<Pattern> SKIP_PATTERNS =
            WorkspacePaths.directoryComponents(List.of(".git", "node_modules", ".deno", "cov", ".coverage"));

    private final ProjectResolver resolver;
    private final WorkspaceFileSystem fileSystem;
    private final ManifestReader manifestReader;
    private final DepsFileParser parser;
    private final VersionResolver versionResolver;
    private final VersionComparator comparator;
    private final ResolveOptions resolveOptions;

    public DependencyUpgradePlanner(ProjectResolver resolver, ManifestReader manifestReader,
                                    DepsFileParser parser, VersionResolver versionResolver,
                                    VersionComparator comparator) {
        this(resolver, manifestReader, parser, versionResolver, comparator, ResolveOptions.defaults());
    }

    public DependencyUpgradePlanner(ProjectResolver resolver, ManifestReader manifestReader,
                                    DepsFileParser parser, VersionResolver versionResolver,
                                    VersionComparator comparator, ResolveOptions resolveOptions) {
        this.resolver = resolver;
        this.fileSystem = resolver.fileSystem();
        this.manifestReader = manifestReader;
        this.parser = parser;
        this.versionResolver = versionResolver;
        this.comparator = comparator;
        this.resolveOptions = resolveOptions;
    }

    /**
     * Computes the upgrades available for the projects {@code projectRef} resolves to.
     *
     * @param projectRef project reference; {@code null} or blank plans every named project
     */
    public List<PendingUpgrade> plan(String projectRef, DepsUpgradeOptions options) {
        var opts = options == null ? DepsUpgradeOptions.defaults() : options;
        Set<String> localPackages = opts.mode() == UpgradeMode.LOCAL_ONLY
                ? resolver.resolve().stream().filter(ProjectRef::isNamed).map(ProjectRef::name)
                        .collect(Collectors.toSet())
                : Set.of();

        var pending = new ArrayList<PendingUpgrade>();
        for (ProjectRef project : resolver.resolve(projectRef)) {
            MdcContext.setProject(project.isNamed() ? project.name() : project.dir());
            try {
                for (Map.Entry<String, List<DepsReference>> declared : declaredDependencies(project).entrySet()) {
                    List<DepsReference> candidates = select(declared.getValue(), opts, localPackages);
                    for (DepsReference ref : candidates) {
                        newerVersion(ref, opts.channel()).ifPresent(latest -> pending.add(new PendingUpgrade(
                                ref.fullName(), ref.registry(), ref.version(), latest,
                                ReferenceSource.fromPath(declared.getKey()), declared.getKey(), ref.line(),
                                project.name())));
                    }
                }
            } finally {
                MdcContext.clear();
            }
        }
        log.info("Planned {} upgrade(s) for '{}'", pending.size(), projectRef == null ? "" : projectRef);
        return pending;
    }

    /**
     * Writes planned upgrades, one read-modify-write per file. A failure on one file marks
     * that file's upgrades as failed and leaves the other files untouched.
     */
    public List<UpgradeResult> apply(List<PendingUpgrade> pending, boolean dryRun) {
        var byFile = new LinkedHashMap<String, List<PendingUpgrade>>();
        for (PendingUpgrade upgrade : pending) {
            byFile.computeIfAbsent(upgrade.file(), k -> new ArrayList<>()).add(upgrade);
        }

        var results = new ArrayList<UpgradeResult>();
        for (Map.Entry<String, List<PendingUpgrade>> entry : byFile.entrySet()) {
            String error = dryRun ? null : write(entry.getKey(), entry.getValue());
            for (PendingUpgrade upgrade : entry.getValue()) {
                results.add(new UpgradeResult(upgrade.file(), upgrade.line(), upgrade.currentVersion(),
                        upgrade.newVersion(), upgrade.source(), upgrade.projectName(), error == null, error));
            }
        }
        return results;
    }

    /** Returns the failure message, or {@code null} when the file was written. */
    private String write(String file, List<PendingUpgrade> upgrades) {
        var updates = new LinkedHashMap<String, String>();
        for (PendingUpgrade upgrade : upgrades) {
            updates.put(upgrade.packageName(), upgrade.newVersion());
        }
        try {
            var info = fileSystem.getFileInfo(file);
            if (info.isEmpty()) {
                return "File not found: " + file;
            }
            String content = info.get().readText();
            String updated = parser.update(content, updates);
            if (!updated.equals(content)) {
                fileSystem.writeFile(file, updated);
            }
            return null;
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to write upgrades to {}: {}", file, e.getMessage());
            return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        }
    }

    /** Unique dependencies per declaring file, manifest first. */
    private Map<String, List<DepsReference>> declaredDependencies(ProjectRef project) {
        var declared = new LinkedHashMap<String, List<DepsReference>>();
        manifestImports(project).ifPresent(refs -> declared.put(project.configPath(), refs));

        String prefix = WorkspacePaths.ROOT_DIR.equals(project.dir()) ? "" : project.dir() + "/";
        try (var entries = fileSystem.walk(DEPS_FILES, SKIP_PATTERNS)) {
            for (WalkEntry entry : entries.filter(WalkEntry::isFile)
                    .filter(e -> e.path().startsWith(prefix)).toList()) {
                readText(entry.path()).ifPresent(content -> declared.put(entry.path(),
                        List.copyOf(parser.getUniquePackages(parser.parse(content)).values())));
            }
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not list dependency files under {}: {}", project.dir(), e.getMessage());
        }
        return declared;
    }

    private Optional<List<DepsReference>> manifestImports(ProjectRef project) {
        return readText(project.configPath()).map(content -> {
            try {
                var imports = manifestReader.imports(manifestReader.parse(content));
                var refs = new ArrayList<DepsReference>();
                for (String value : imports.values()) {
                    DepsReference ref = parser.parseOne(value);
                    if (ref != null) {
                        refs.add(withLine(ref, lineOf(content, ref.fullSpecifier())));
                    }
                }
                return List.copyOf(parser.getUniquePackages(refs).values());
            } catch (ManifestParseException e) {
                log.warn("Skipping imports of {}: {}", project.configPath(), e.getMessage());
                return List.of();
            }
        });
    }

    private List<DepsReference> select(List<DepsReference> refs, DepsUpgradeOptions opts, Set<String> localPackages) {
        List<DepsReference> selected = switch (opts.mode()) {
            case JSR -> parser.filterByRegistry(refs, Registry.JSR);
            case NPM -> parser.filterByRegistry(refs, Registry.NPM);
            case LOCAL_ONLY -> refs.stream().filter(ref -> localPackages.contains(ref.fullName())).toList();
            case ALL -> refs;
        };
        if (opts.packagePattern() != null && !opts.packagePattern().isBlank()) {
            selected = parser.filterByPattern(selected, opts.packagePattern());
        }
        return selected;
    }

    private Optional<String> newerVersion(DepsReference ref, String channel) {
        try {
            return versionResolver.getLatest(ref.registry(), ref.fullName(), channel, resolveOptions)
                    .filter(latest -> comparator.isNewer(ref.version(), latest));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while looking up {}", ref.fullName());
            return Optional.empty();
        } catch (IOException | RegistryFetchException e) {
            log.warn("Skipping {}: {}", ref.fullName(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readText(String path) {
        try {
            return fileSystem.getFileInfo(path).map(file -> {
                try {
                    return file.readText();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.debug("Skipping unreadable file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static DepsReference withLine(DepsReference ref, int line) {
        return new DepsReference(ref.registry(), ref.scope(), ref.name(), ref.fullName(), ref.version(),
                ref.subpath(), ref.fullSpecifier(), line, 0);
    }

    private static int lineOf(String content, String text) {
        int index = content.indexOf(text);
        if (index < 0) return 0;
        int line = 1;
        for (int i = 0; i < index; i++) {
            if (content.charAt(i) == '\n') line++;
        }
        return line;
    }
}
