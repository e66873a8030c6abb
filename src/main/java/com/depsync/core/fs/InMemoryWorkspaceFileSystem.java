package com.depsync.core.fs;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * {@link WorkspaceFileSystem} held entirely in memory. Directories exist implicitly as the
 * parents of stored files. Walks iterate over a snapshot in sorted path order.
 */
public class InMemoryWorkspaceFileSystem implements WorkspaceFileSystem {

    private final Path root;
    private final TreeMap<String, String> files = new TreeMap<>();

    public InMemoryWorkspaceFileSystem() {
        this(Path.of("/workspace"));
    }

    public InMemoryWorkspaceFileSystem(Path root) {
        this.root = root;
    }

    public InMemoryWorkspaceFileSystem(Map<String, String> initialFiles) {
        this();
        initialFiles.forEach(this::put);
    }

    /** Stores a file without going through {@link #writeFile}. */
    public InMemoryWorkspaceFileSystem put(String path, String content) {
        files.put(WorkspacePaths.normalize(path), content);
        return this;
    }

    /** Current content of a file, or {@code null}. */
    public String read(String path) {
        return files.get(WorkspacePaths.normalize(path));
    }

    public boolean delete(String path) {
        return files.remove(WorkspacePaths.normalize(path)) != null;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public Stream<WalkEntry> walk(List<Pattern> match, List<Pattern> skip) {
        var directories = new TreeSet<String>();
        for (String path : files.keySet()) {
            String dir = WorkspacePaths.dirname(path);
            while (!WorkspacePaths.ROOT_DIR.equals(dir)) {
                directories.add(dir);
                dir = WorkspacePaths.dirname(dir);
            }
        }
        var entries = new ArrayList<WalkEntry>();
        directories.forEach(dir -> entries.add(new WalkEntry(dir, false)));
        files.keySet().forEach(path -> entries.add(new WalkEntry(path, true)));
        entries.sort(Comparator.comparing(WalkEntry::path));

        return entries.stream()
                .filter(entry -> match == null || match.isEmpty()
                        || match.stream().anyMatch(p -> p.matcher(entry.path()).find()))
                .filter(entry -> !pruned(entry.path(), skip));
    }

    /** Whether the path or one of its parent directories matches a skip pattern. */
    private static boolean pruned(String path, List<Pattern> skip) {
        if (skip == null || skip.isEmpty()) return false;
        String current = path;
        while (!WorkspacePaths.ROOT_DIR.equals(current)) {
            String candidate = current;
            if (skip.stream().anyMatch(p -> p.matcher(candidate).find())) return true;
            current = WorkspacePaths.dirname(current);
        }
        return false;
    }

    @Override
    public Optional<WorkspaceFile> getFileInfo(String path) {
        String normalized = WorkspacePaths.normalize(path);
        String content = files.get(normalized);
        if (content == null) {
            return Optional.empty();
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return Optional.of(new MemoryFile(normalized, bytes));
    }

    @Override
    public void writeFile(String path, String content) throws IOException {
        files.put(WorkspacePaths.normalize(path), content);
    }

    @Override
    public Path resolvePath(String path) {
        return root.resolve(WorkspacePaths.normalize(path));
    }

    private record MemoryFile(String path, byte[] bytes) implements WorkspaceFile {
        @Override
        public InputStream openContents() {
            return new ByteArrayInputStream(bytes);
        }
    }
}
