package com.depsync.core.imports;

import com.depsync.core.fs.WalkEntry;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.fs.WorkspacePaths;
import com.depsync.core.logging.MdcContext;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.scanner.ManifestParseException;
import com.depsync.core.scanner.ManifestReader;
import com.depsync.core.scanner.ProjectResolver;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Switches {@code deno.jsonc} import maps between registry specifiers and local workspace paths.
 * <p>
 * {@link ImportsSyncMode#LOCAL} rewrites every import of a workspace package to the relative path
 * of its exported source files and keeps the replaced block in a commented marker section.
 * Libraries additionally map the {@code jsr:} specifiers used by their {@code .deps.ts} files;
 * runtimes inherit the {@code jsr:} overrides declared by every library.
 * {@link ImportsSyncMode#REMOTE} puts the preserved block back and drops the marker section.
 * <p>
 * A local sync of an already-local file first restores the preserved block, so the registry
 * imports recorded by the first sync are never overwritten.
 */
public class ImportsSyncService {

    private static final Logger log = LoggerFactory.getLogger(ImportsSyncService.class);

    private static final List<Pattern> PACKAGE_CONFIGS = List.of(Pattern.compile("(^|/)deno\\.jsonc$"));
    private static final List<Pattern> DEPS_FILES = List.of(Pattern.compile("\\.deps\\.ts$"));
    private static final List<Pattern> SKIP_PATTERNS = WorkspacePaths.directoryComponents(ProjectResolver.SKIP_DIRS);

    private static final Pattern QUOTED_JSR = Pattern.compile("[\"'](jsr:[^\"']+)[\"']");
    private static final Pattern JSR_SPECIFIER =
            Pattern.compile("^jsr:(@[^/@]+/[^/@]+|[^/@]+)(?:@[^/]+)?(?:/(.*))?$");

    /** Any one complete set marks a runtime package. */
    private static final List<List<String>> RUNTIME_MARKERS = List.of(
            List.of("main.ts", "dev.ts", "DOCKERFILE"),
            List.of(".cli.json"));

    private final ProjectResolver resolver;
    private final ManifestReader manifestReader;
    private final WorkspaceFileSystem fileSystem;

    public ImportsSyncService(ProjectResolver resolver, ManifestReader manifestReader) {
        this.resolver = resolver;
        this.manifestReader = manifestReader;
        this.fileSystem = resolver.fileSystem();
    }

    /**
     * Syncs every {@code deno.jsonc} that {@code target} denotes.
     *
     * @param target project reference (name, manifest path, directory or comma list)
     *               or the name of a local package
     * @throws ImportsSyncException if no {@code deno.jsonc} target resolves
     */
    public ImportsSyncResult sync(String target, ImportsSyncMode mode) {
        List<LocalPackage> packages = discoverLocalPackages();
        long runtimes = packages.stream().filter(p -> p.kind() == PackageKind.RUNTIME).count();
        log.info("Discovered {} local package(s) (runtimes: {}, libraries: {})",
                packages.size(), runtimes, packages.size() - runtimes);

        List<String> targets = resolveTargets(target, packages);
        if (targets.isEmpty()) {
            throw new ImportsSyncException("No usable deno.jsonc targets resolved for: " + target);
        }
        log.info("Syncing {} deno.jsonc target(s) to {} mode", targets.size(), mode.name().toLowerCase());

        var outcomes = new ArrayList<SyncedConfig>();
        for (String configPath : targets) {
            MdcContext.setProject(configPath);
            try {
                SyncedConfig outcome = mode == ImportsSyncMode.LOCAL
                        ? applyLocal(configPath, packages)
                        : applyRemote(configPath);
                if (outcome.status() == SyncedConfig.Status.FAILED) {
                    log.warn("Failed to sync {}: {}", configPath, outcome.message());
                } else if (outcome.status() == SyncedConfig.Status.SKIPPED) {
                    log.info("Skipped {}: {}", configPath, outcome.message());
                }
                outcomes.add(outcome);
            } finally {
                MdcContext.clear();
            }
        }
        return new ImportsSyncResult(packages, outcomes);
    }

    /** Every {@code deno.jsonc} that declares both a {@code name} and {@code exports}. */
    public List<LocalPackage> discoverLocalPackages() {
        var packages = new ArrayList<LocalPackage>();
        try (var entries = fileSystem.walk(PACKAGE_CONFIGS, SKIP_PATTERNS)) {
            entries.filter(WalkEntry::isFile)
                    .forEach(entry -> readPackage(entry.path()).ifPresent(packages::add));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Package discovery failed: {}", e.getMessage());
        }
        return packages;
    }

    private Optional<LocalPackage> readPackage(String configPath) {
        JsonNode manifest;
        try {
            Optional<String> text = readText(configPath);
            if (text.isEmpty()) return Optional.empty();
            manifest = manifestReader.parse(text.get());
        } catch (IOException | ManifestParseException e) {
            log.debug("Skipping {}: {}", configPath, e.getMessage());
            return Optional.empty();
        }

        String name = manifestReader.name(manifest);
        Map<String, String> exports = exports(manifest.get("exports"));
        if (name == null || exports == null) {
            return Optional.empty();
        }
        String dir = WorkspacePaths.dirname(configPath);
        PackageKind kind = isRuntime(dir) ? PackageKind.RUNTIME : PackageKind.LIBRARY;
        return Optional.of(new LocalPackage(name, configPath, dir, exports, kind));
    }

    /** String exports count as the {@code "."} export; non-string entries of an export map are dropped. */
    private static Map<String, String> exports(JsonNode node) {
        if (node == null) return null;
        if (node.isTextual()) return Map.of(".", node.asText());
        if (!node.isObject()) return null;
        var exports = new LinkedHashMap<String, String>();
        node.fields().forEachRemaining(field -> {
            if (field.getValue().isTextual()) {
                exports.put(field.getKey(), field.getValue().asText());
            }
        });
        return exports;
    }

    private boolean isRuntime(String dir) {
        for (List<String> markers : RUNTIME_MARKERS) {
            if (markers.stream().allMatch(file -> exists(WorkspacePaths.join(dir, file)))) {
                return true;
            }
        }
        return false;
    }

    private boolean exists(String path) {
        try {
            return fileSystem.getFileInfo(path).isPresent();
        } catch (IOException e) {
            return false;
        }
    }

    private List<String> resolveTargets(String target, List<LocalPackage> packages) {
        List<ProjectRef> projects = resolver.resolve(target);
        if (!projects.isEmpty()) {
            return projects.stream()
                    .map(ProjectRef::configPath)
                    .filter(path -> path.endsWith(".jsonc"))
                    .toList();
        }
        return packages.stream()
                .filter(p -> p.name().equals(target))
                .map(LocalPackage::configPath)
                .findFirst()
                .map(List::of)
                .orElseGet(() -> {
                    log.warn("Target '{}' is neither a path nor a known local package name", target);
                    return List.of();
                });
    }

    // ── Local mode ──────────────────────────────────────────────────

    private SyncedConfig applyLocal(String configPath, List<LocalPackage> packages) {
        var loaded = load(configPath);
        if (loaded.outcome() != null) {
            return loaded.outcome();
        }
        ImportMapText doc = loaded.doc();
        ImportMapText.Range range = loaded.range();
        JsonNode manifest = loaded.manifest();

        if (doc.hasPreservedBlock()) {
            restore(doc);
            try {
                manifest = manifestReader.parse(doc.text());
            } catch (ManifestParseException e) {
                return SyncedConfig.failed(configPath, "Preserved imports are not valid JSONC: " + e.getMessage());
            }
            Optional<ImportMapText.Range> restored = doc.importsBlock();
            if (restored.isEmpty()) {
                return SyncedConfig.skipped(configPath, "Unable to locate imports block after restoring originals");
            }
            range = restored.get();
        }

        Map<String, String> imports = manifestReader.imports(manifest);
        Map<String, String> localImports = localImports(configPath, imports, packages);

        String indent = doc.indentOf(range.start());
        boolean trailingComma = doc.endsWithComma(range.end());
        List<String> original = doc.lines(range);
        List<String> rendered = ImportMapText.render(indent, localImports, trailingComma);
        doc.replace(range, rendered);
        doc.insertPreservedBlock(original, range.start() + rendered.size());
        return write(configPath, doc);
    }

    private Map<String, String> localImports(String configPath, Map<String, String> imports,
                                             List<LocalPackage> packages) {
        var byName = new LinkedHashMap<String, LocalPackage>();
        packages.forEach(p -> byName.put(p.name(), p));
        String configDir = WorkspacePaths.dirname(configPath);
        LocalPackage current = packages.stream()
                .filter(p -> p.configPath().equals(configPath))
                .findFirst()
                .orElse(null);

        var result = new LinkedHashMap<String, String>();
        imports.forEach((key, value) -> {
            if (!byName.containsKey(key)) {
                result.put(key, value);
            }
        });

        for (LocalPackage pkg : packages) {
            String declared = imports.get(pkg.name());
            if (declared == null || !declared.startsWith("jsr:")) continue;
            pkg.exports().forEach((exportKey, exportPath) ->
                    result.put(pkg.importKey(exportKey), importPath(configDir, locate(pkg.dir(), exportPath))));
        }

        if (current != null && current.kind() == PackageKind.LIBRARY) {
            result.putAll(libraryOverrides(current, byName));
        }
        if (current != null && current.kind() == PackageKind.RUNTIME) {
            runtimeOverrides(packages).forEach((specifier, file) ->
                    result.put(specifier, importPath(configDir, file)));
        }
        return result;
    }

    /** {@code jsr:} specifiers in the library's {@code .deps.ts} files that a workspace package can serve. */
    private Map<String, String> libraryOverrides(LocalPackage library, Map<String, LocalPackage> byName) {
        var overrides = new LinkedHashMap<String, String>();
        try (var entries = fileSystem.walk(DEPS_FILES, SKIP_PATTERNS)) {
            entries.filter(WalkEntry::isFile)
                    .filter(entry -> WorkspacePaths.isWithin(entry.path(), library.dir()))
                    .forEach(entry -> collectOverrides(entry.path(), library.dir(), byName, overrides));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to collect library overrides for {}: {}", library.configPath(), e.getMessage());
        }
        return overrides;
    }

    private void collectOverrides(String depsFile, String fromDir, Map<String, LocalPackage> byName,
                                  Map<String, String> overrides) {
        String text;
        try {
            Optional<String> content = readText(depsFile);
            if (content.isEmpty()) return;
            text = content.get();
        } catch (IOException e) {
            log.debug("Skipping unreadable {}: {}", depsFile, e.getMessage());
            return;
        }

        Matcher matcher = QUOTED_JSR.matcher(text);
        while (matcher.find()) {
            String specifier = matcher.group(1);
            if (overrides.containsKey(specifier)) continue;
            Optional<String> local = localPathFor(specifier, fromDir, byName);
            if (local.isPresent()) {
                overrides.put(specifier, local.get());
                log.debug("{} => {}", specifier, local.get());
            } else {
                log.debug("{} has no local match", specifier);
            }
        }
    }

    private Optional<String> localPathFor(String specifier, String fromDir, Map<String, LocalPackage> byName) {
        Matcher matcher = JSR_SPECIFIER.matcher(specifier);
        if (!matcher.matches()) return Optional.empty();
        LocalPackage target = byName.get(matcher.group(1));
        if (target == null) return Optional.empty();

        String subpath = matcher.group(2);
        String importKey = subpath == null ? target.name() : target.name() + "/" + subpath;
        return target.exports().entrySet().stream()
                .filter(export -> target.importKey(export.getKey()).equals(importKey))
                .findFirst()
                .map(export -> importPath(fromDir, locate(target.dir(), export.getValue())));
    }

    /** {@code jsr:} keys of every library's import map, resolved against that library's directory. */
    private Map<String, Path> runtimeOverrides(List<LocalPackage> packages) {
        var overrides = new LinkedHashMap<String, Path>();
        for (LocalPackage library : packages) {
            if (library.kind() != PackageKind.LIBRARY) continue;
            JsonNode manifest;
            try {
                Optional<String> text = readText(library.configPath());
                if (text.isEmpty()) continue;
                manifest = manifestReader.parse(text.get());
            } catch (IOException | ManifestParseException e) {
                log.debug("Skipping {}: {}", library.configPath(), e.getMessage());
                continue;
            }
            manifestReader.imports(manifest).forEach((key, value) -> {
                if (key.startsWith("jsr:")) {
                    overrides.putIfAbsent(key, locate(library.dir(), value));
                }
            });
        }
        return overrides;
    }

    // ── Remote mode ─────────────────────────────────────────────────

    private SyncedConfig applyRemote(String configPath) {
        var loaded = load(configPath);
        if (loaded.outcome() != null) {
            return loaded.outcome();
        }
        if (!loaded.doc().hasPreservedBlock()) {
            return SyncedConfig.skipped(configPath, "No original imports marker block found");
        }
        restore(loaded.doc());
        return write(configPath, loaded.doc());
    }

    /** Replaces the current imports block with the preserved one and removes the markers. */
    private static void restore(ImportMapText doc) {
        List<String> original = doc.preservedBlock().orElseThrow();
        doc.removePreservedBlock();
        doc.importsBlock().ifPresent(range -> doc.replace(range, original));
    }

    // ── File handling ───────────────────────────────────────────────

    private record Loaded(ImportMapText doc, JsonNode manifest, ImportMapText.Range range, SyncedConfig outcome) {
        static Loaded stop(SyncedConfig outcome) {
            return new Loaded(null, null, null, outcome);
        }
    }

    private Loaded load(String configPath) {
        String text;
        try {
            Optional<String> content = readText(configPath);
            if (content.isEmpty()) {
                return Loaded.stop(SyncedConfig.failed(configPath, "File not found: " + configPath));
            }
            text = content.get();
        } catch (IOException e) {
            return Loaded.stop(SyncedConfig.failed(configPath, "Failed to read: " + e.getMessage()));
        }

        JsonNode manifest;
        try {
            manifest = manifestReader.parse(text);
        } catch (ManifestParseException e) {
            return Loaded.stop(SyncedConfig.failed(configPath, "Unable to parse JSONC: " + e.getMessage()));
        }
        JsonNode imports = manifest.get("imports");
        if (imports == null) {
            return Loaded.stop(SyncedConfig.skipped(configPath, "No imports block"));
        }
        if (!imports.isObject()) {
            return Loaded.stop(SyncedConfig.skipped(configPath, "Imports block is not an object"));
        }

        var doc = new ImportMapText(text);
        Optional<ImportMapText.Range> range = doc.importsBlock();
        if (range.isEmpty()) {
            return Loaded.stop(SyncedConfig.skipped(configPath, "Unable to locate imports block"));
        }
        return new Loaded(doc, manifest, range.get(), null);
    }

    private SyncedConfig write(String configPath, ImportMapText doc) {
        try {
            fileSystem.writeFile(configPath, doc.text());
            log.debug("Wrote {}", configPath);
            return SyncedConfig.updated(configPath);
        } catch (IOException | UncheckedIOException e) {
            return SyncedConfig.failed(configPath, "Failed to write: " + e.getMessage());
        }
    }

    private Optional<String> readText(String path) throws IOException {
        var file = fileSystem.getFileInfo(path);
        return file.isPresent() ? Optional.of(file.get().readText()) : Optional.empty();
    }

    private Path locate(String dir, String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute()) {
            return candidate.normalize();
        }
        return fileSystem.resolvePath(dir).resolve(path).normalize();
    }

    /** Relative import path from {@code fromDir} to {@code file}, always starting with {@code .}. */
    private String importPath(String fromDir, Path file) {
        String relative = fileSystem.resolvePath(fromDir).normalize().relativize(file).toString().replace('\\', '/');
        return relative.startsWith(".") ? relative : "./" + relative;
    }
}
