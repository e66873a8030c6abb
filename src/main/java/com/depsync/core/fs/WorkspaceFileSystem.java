package com.depsync.core.fs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * The only I/O boundary of the engine. Paths passed in and out are workspace-relative;
 * implementations normalize them with {@link WorkspacePaths#normalize(String)}.
 */
public interface WorkspaceFileSystem {

    /** Absolute root of the workspace. */
    Path root();

    /**
     * Lazily walks the workspace. An entry is produced when its relative path matches at least
     * one of {@code match} (or {@code match} is empty) and none of {@code skip}. A directory
     * matching {@code skip} is pruned: none of its descendants are produced either.
     * The returned stream must be closed.
     */
    Stream<WalkEntry> walk(List<Pattern> match, List<Pattern> skip) throws IOException;

    default Stream<WalkEntry> walk() throws IOException {
        return walk(List.of(), List.of());
    }

    /** Whether {@code path} names a directory of the workspace. */
    default boolean isDirectory(String path) throws IOException {
        String prefix = WorkspacePaths.normalize(path);
        String dir = prefix.endsWith("/") ? prefix : prefix + "/";
        try (var entries = walk()) {
            return entries.anyMatch(entry -> entry.path().startsWith(dir));
        }
    }

    /** Returns the file at {@code path}, or empty when no regular file exists there. */
    Optional<WorkspaceFile> getFileInfo(String path) throws IOException;

    /** Creates or replaces the file at {@code path}. */
    void writeFile(String path, String content) throws IOException;

    /** Absolute location of a workspace-relative path. */
    Path resolvePath(String path);
}
