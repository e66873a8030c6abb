package com.depsync.core.fs;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Handle to a readable file in a {@link WorkspaceFileSystem}.
 */
public interface WorkspaceFile {

    /** Workspace-relative path of the file. */
    String path();

    /** Opens a new stream over the file's bytes. The caller closes it. */
    InputStream openContents() throws IOException;

    default String readText() throws IOException {
        try (InputStream in = openContents()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
