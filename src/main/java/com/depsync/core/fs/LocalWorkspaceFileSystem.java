package com.depsync.core.fs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link WorkspaceFileSystem} over the local disk, rooted at a directory.
 */
public class LocalWorkspaceFileSystem implements WorkspaceFileSystem {

    private static final Logger log = LoggerFactory.getLogger(LocalWorkspaceFileSystem.class);

    private final Path root;

    public LocalWorkspaceFileSystem(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    @Override
    public Path root() {
        return root;
    }

    /**
     * Walks depth-first in name order. A directory matching a skip pattern is not entered,
     * so nothing beneath it is listed. A directory that cannot be listed is logged and
     * skipped; only a failure to list the root itself is thrown.
     */
    @Override
    public Stream<WalkEntry> walk(List<Pattern> match, List<Pattern> skip) throws IOException {
        var walker = new PruningWalker(skip, listDirectory(root));
        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(walker, Spliterator.ORDERED | Spliterator.NONNULL), false)
                .filter(entry -> matchesAny(match, entry.path(), true));
    }

    @Override
    public boolean isDirectory(String path) {
        return Files.isDirectory(resolvePath(path));
    }

    @Override
    public Optional<WorkspaceFile> getFileInfo(String path) {
        var normalized = WorkspacePaths.normalize(path);
        var file = resolvePath(normalized);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(new LocalFile(normalized, file));
    }

    @Override
    public void writeFile(String path, String content) throws IOException {
        var file = resolvePath(path);
        var parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
        log.debug("Wrote {} ({} chars)", path, content.length());
    }

    @Override
    public Path resolvePath(String path) {
        return root.resolve(WorkspacePaths.normalize(path)).normalize();
    }

    private String relativize(Path path) {
        return WorkspacePaths.normalize(root.relativize(path).toString());
    }

    /** Children of {@code dir} in name order. */
    protected List<Path> listDirectory(Path dir) throws IOException {
        var children = new ArrayList<Path>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(children::add);
        }
        children.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return children;
    }

    private static boolean matchesAny(List<Pattern> patterns, String path, boolean whenEmpty) {
        if (patterns == null || patterns.isEmpty()) return whenEmpty;
        for (Pattern pattern : patterns) {
            if (pattern.matcher(path).find()) return true;
        }
        return false;
    }

    /** Pre-order iterator that lists a directory only when it is reached. */
    private final class PruningWalker implements Iterator<WalkEntry> {

        private final List<Pattern> skip;
        private final Deque<Iterator<Path>> pending = new ArrayDeque<>();
        private WalkEntry next;

        PruningWalker(List<Pattern> skip, List<Path> rootChildren) {
            this.skip = skip;
            pending.push(rootChildren.iterator());
        }

        @Override
        public boolean hasNext() {
            while (next == null && !pending.isEmpty()) {
                Iterator<Path> current = pending.peek();
                if (!current.hasNext()) {
                    pending.pop();
                    continue;
                }
                Path path = current.next();
                String relative = relativize(path);
                if (matchesAny(skip, relative, false)) {
                    continue;
                }
                if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
                    descend(path, relative);
                }
                next = new WalkEntry(relative, Files.isRegularFile(path));
            }
            return next != null;
        }

        @Override
        public WalkEntry next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            WalkEntry entry = next;
            next = null;
            return entry;
        }

        private void descend(Path dir, String relative) {
            try {
                pending.push(listDirectory(dir).iterator());
            } catch (IOException e) {
                log.debug("Cannot list {}: {}", relative, e.getMessage());
            }
        }
    }

    private record LocalFile(String path, Path file) implements WorkspaceFile {
        @Override
        public InputStream openContents() throws IOException {
            return Files.newInputStream(file);
        }
    }
}
