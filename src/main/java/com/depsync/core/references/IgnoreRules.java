package com.depsync.core.references;

import com.depsync.core.fs.WorkspaceFileSystem;
import com.depsync.core.fs.WorkspacePaths;
import org.eclipse.jgit.ignore.IgnoreNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * The workspace-root {@code .gitignore}, compiled once and queried per path.
 * A path is ignored when it, or any directory above it, is ignored.
 */
public final class IgnoreRules {

    private static final Logger log = LoggerFactory.getLogger(IgnoreRules.class);

    public static final String IGNORE_FILE = ".gitignore";

    private static final IgnoreRules NONE = new IgnoreRules(null);

    private final IgnoreNode node;

    private IgnoreRules(IgnoreNode node) {
        this.node = node;
    }

    public static IgnoreRules none() {
        return NONE;
    }

    /** Loads the root ignore file; a missing or unreadable file ignores nothing. */
    public static IgnoreRules load(WorkspaceFileSystem fileSystem) {
        try {
            var file = fileSystem.getFileInfo(IGNORE_FILE);
            if (file.isEmpty()) {
                return NONE;
            }
            try (InputStream in = file.get().openContents()) {
                return compile(in);
            }
        } catch (IOException e) {
            log.debug("Could not read {}: {}", IGNORE_FILE, e.getMessage());
            return NONE;
        }
    }

    public static IgnoreRules parse(String content) {
        try {
            return compile(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new IllegalStateException("In-memory ignore rules could not be read", e);
        }
    }

    private static IgnoreRules compile(InputStream in) throws IOException {
        var node = new IgnoreNode();
        node.parse(in);
        return node.getRules().isEmpty() ? NONE : new IgnoreRules(node);
    }

    public boolean isIgnored(String path) {
        if (node == null) return false;

        String[] segments = WorkspacePaths.normalize(path).split("/");
        var current = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (segments[i].isEmpty()) continue;
            if (current.length() > 0) current.append('/');
            current.append(segments[i]);

            boolean isDirectory = i < segments.length - 1;
            if (Boolean.TRUE.equals(node.checkIgnored(current.toString(), isDirectory))) {
                return true;
            }
        }
        return false;
    }
}
