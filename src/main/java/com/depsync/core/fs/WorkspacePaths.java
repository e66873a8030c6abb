package com.depsync.core.fs;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Path helpers shared by every component that compares or stores workspace paths.
 * Normalized paths use forward slashes and carry no leading {@code ./} or {@code /},
 * so identifiers are identical on every host OS.
 */
public final class WorkspacePaths {

    /** Directory of a manifest sitting directly at the workspace root. */
    public static final String ROOT_DIR = ".";

    private WorkspacePaths() {}

    public static String normalize(String path) {
        if (path == null) return "";
        String normalized = path.replace('\\', '/');
        if (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        if (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }

    /** Normalized parent directory, {@link #ROOT_DIR} for top-level entries. */
    public static String dirname(String path) {
        String normalized = normalize(path);
        int slash = normalized.lastIndexOf('/');
        return slash < 0 ? ROOT_DIR : normalized.substring(0, slash);
    }

    /** Joins a directory and a child name, treating {@link #ROOT_DIR} and blank as the root. */
    public static String join(String dir, String child) {
        String base = normalize(dir);
        if (base.isEmpty() || ROOT_DIR.equals(base)) {
            return normalize(child);
        }
        return base.endsWith("/") ? base + child : base + "/" + child;
    }

    /** Whether {@code path} is {@code dir} itself or lies beneath it. */
    public static boolean isWithin(String path, String dir) {
        String normalizedDir = stripTrailingSlash(normalize(dir));
        if (normalizedDir.isEmpty() || ROOT_DIR.equals(normalizedDir)) {
            return true;
        }
        String normalizedPath = normalize(path);
        return normalizedPath.equals(normalizedDir) || normalizedPath.startsWith(normalizedDir + "/");
    }

    /**
     * Pattern that matches {@code dirName} only as a whole path component, so
     * {@code .git} matches {@code a/.git/config} but not {@code deno.git.ts}.
     */
    public static Pattern directoryComponent(String dirName) {
        return Pattern.compile("(^|[/\\\\])" + Pattern.quote(dirName) + "([/\\\\]|$)");
    }

    public static List<Pattern> directoryComponents(List<String> dirNames) {
        return dirNames.stream().map(WorkspacePaths::directoryComponent).toList();
    }

    private static String stripTrailingSlash(String path) {
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
