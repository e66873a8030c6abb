package com.depsync.core.references;

import com.depsync.core.deps.SpecifierPatterns;
import com.depsync.core.fs.WalkEntry;
import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.fs.WorkspacePaths;
import com.depsync.core.logging.MdcContext;
import com.depsync.core.model.PackageReference;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.model.ReferenceFilter;
import com.depsync.core.model.ReferenceSource;
import com.depsync.core.model.UpgradeOptions;
import com.depsync.core.model.UpgradeResult;
import com.depsync.core.scanner.ProjectResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Finds every occurrence of a package specifier across the workspace and rewrites them
 * to a target version.
 * <p>
 * Each named project's manifest is scanned, followed by every dependency file, template,
 * document and TypeScript source under a named project's directory. A file belongs to the
 * project with the deepest directory containing it; files outside every named project are
 * not reported. Paths matched by the root {@code .gitignore} are skipped.
 */
public class PackageReferenceService {

    private static final Logger log = LoggerFactory.getLogger(PackageReferenceService.class);

    public static final List<String> ALWAYS_SKIP_DIRS =
            List.of(".git", "node_modules", ".deno", "cov", ".coverage");

    public static final List<Pattern> REFERENCE_FILE_PATTERNS = List.of(
            Pattern.compile("\\.deps\\.ts$"),
            Pattern.compile("\\.hbs$"),
            Pattern.compile("\\.mdx?$"),
            Pattern.compile("\\.tsx?$"));

    private static final List<Pattern> SKIP_PATTERNS = WorkspacePaths.directoryComponents(ALWAYS_SKIP_DIRS);

    private final ProjectResolver resolver;
    private final WorkspaceFileSystem fileSystem;

    public PackageReferenceService(ProjectResolver resolver) {
        this.resolver = resolver;
        this.fileSystem = resolver.fileSystem();
    }

    public List<PackageReference> findReferences(String packageName) {
        return findReferences(packageName, ReferenceFilter.all());
    }

    /**
     * Lists the references to {@code packageName}, one per specifier occurrence.
     *
     * @param packageName full package name, e.g. {@code @scope/pkg}
     * @param filter      narrows results by source category and owning project
     */
    public List<PackageReference> findReferences(String packageName, ReferenceFilter filter) {
        var effective = filter == null ? ReferenceFilter.all() : filter;
        var scan = new Scan(SpecifierPatterns.forPackage(packageName), IgnoreRules.load(fileSystem));

        List<ProjectRef> owners = resolver.resolve().stream()
                .filter(ProjectRef::isNamed)
                .sorted(Comparator.comparingInt((ProjectRef p) -> depth(p.dir())).reversed())
                .toList();

        for (ProjectRef project : owners) {
            scan.file(project.configPath(), project.name());
        }

        try (var entries = fileSystem.walk(REFERENCE_FILE_PATTERNS, SKIP_PATTERNS)) {
            entries.filter(WalkEntry::isFile)
                    .forEach(entry -> ownerOf(entry.path(), owners)
                            .ifPresent(owner -> scan.file(entry.path(), owner.name())));
        } catch (IOException | UncheckedIOException e) {
            log.warn("Workspace walk failed while searching for {}: {}", packageName, e.getMessage());
        }

        Set<String> included = projectNames(effective.projectRefs());
        Set<String> excluded = projectNames(effective.excludedProjectRefs());

        return scan.references.stream()
                .filter(ref -> effective.acceptsSource(ref.source()))
                .filter(ref -> effective.projectRefs().isEmpty() || included.contains(ref.projectName()))
                .filter(ref -> !excluded.contains(ref.projectName()))
                .toList();
    }

    /**
     * Rewrites every reference of {@code packageName} to {@code options.version()}.
     * References already at the target version are left alone and not reported.
     * <p>
     * Each file is read once and written at most once. A failure on one file marks that
     * file's references as failed without affecting the others. In dry-run mode no file is
     * read or written and every result reports success.
     *
     * @return one result per rewritten (or, in dry-run mode, rewritable) reference
     */
    public List<UpgradeResult> upgrade(String packageName, UpgradeOptions options) {
        MdcContext.setPackage(packageName);
        try {
            var byFile = new LinkedHashMap<String, List<PackageReference>>();
            for (PackageReference ref : findReferences(packageName, options.filter())) {
                if (ref.currentVersion().equals(options.version())) continue;
                byFile.computeIfAbsent(ref.file(), k -> new ArrayList<>()).add(ref);
            }

            var results = new ArrayList<UpgradeResult>();
            for (Map.Entry<String, List<PackageReference>> entry : byFile.entrySet()) {
                results.addAll(upgradeFile(entry.getKey(), entry.getValue(), packageName, options));
            }

            long failures = results.stream().filter(r -> !r.success()).count();
            log.info("{} {} reference(s) to {} across {} file(s){}",
                    options.dryRun() ? "Would upgrade" : "Upgraded",
                    results.size() - failures, options.version(), byFile.size(),
                    failures > 0 ? ", " + failures + " failed" : "");
            return results;
        } finally {
            MdcContext.clear();
        }
    }

    private List<UpgradeResult> upgradeFile(String file, List<PackageReference> refs,
                                            String packageName, UpgradeOptions options) {
        String target = options.version();
        if (options.dryRun()) {
            return refs.stream().map(ref -> UpgradeResult.succeeded(ref, target)).toList();
        }

        try {
            var info = fileSystem.getFileInfo(file);
            if (info.isEmpty()) {
                return failAll(refs, target, "File not found: " + file);
            }
            String content = info.get().readText();
            String updated = SpecifierPatterns.replaceVersion(content, packageName, target);
            if (!updated.equals(content)) {
                fileSystem.writeFile(file, updated);
                log.debug("Rewrote {} reference(s) in {}", refs.size(), file);
            }
            return refs.stream().map(ref -> UpgradeResult.succeeded(ref, target)).toList();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Failed to upgrade {} in {}: {}", packageName, file, e.getMessage());
            return failAll(refs, target, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private static List<UpgradeResult> failAll(List<PackageReference> refs, String target, String error) {
        return refs.stream().map(ref -> UpgradeResult.failed(ref, target, error)).toList();
    }

    private Set<String> projectNames(List<String> refs) {
        if (refs.isEmpty()) return Set.of();
        return resolver.resolve(String.join(",", refs)).stream()
                .filter(ProjectRef::isNamed)
                .map(ProjectRef::name)
                .collect(Collectors.toSet());
    }

    /** Owners must be ordered deepest directory first. */
    private static Optional<ProjectRef> ownerOf(String path, List<ProjectRef> owners) {
        return owners.stream()
                .filter(project -> WorkspacePaths.isWithin(path, project.dir()))
                .findFirst();
    }

    private static int depth(String dir) {
        return WorkspacePaths.ROOT_DIR.equals(dir) ? 0 : dir.split("/").length;
    }

    /** Accumulates references across one search, reading each file at most once. */
    private final class Scan {

        private final Pattern pattern;
        private final IgnoreRules ignoreRules;
        private final Set<String> seen = new HashSet<>();
        private final List<PackageReference> references = new ArrayList<>();

        Scan(Pattern pattern, IgnoreRules ignoreRules) {
            this.pattern = pattern;
            this.ignoreRules = ignoreRules;
        }

        void file(String path, String projectName) {
            if (!seen.add(path) || ignoreRules.isIgnored(path)) return;

            String content;
            try {
                var info = fileSystem.getFileInfo(path);
                if (info.isEmpty()) return;
                content = info.get().readText();
            } catch (IOException | UncheckedIOException e) {
                log.debug("Skipping unreadable file {}: {}", path, e.getMessage());
                return;
            }

            ReferenceSource source = ReferenceSource.fromPath(path);
            String[] lines = content.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                Matcher matcher = pattern.matcher(lines[i]);
                while (matcher.find()) {
                    references.add(new PackageReference(path, i + 1,
                            matcher.group(SpecifierPatterns.VERSION_GROUP), source, projectName));
                }
            }
        }
    }
}
