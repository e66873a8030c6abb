package com.depsync.core.fs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class WorkspacePathsTest {

    @Test
    @DisplayName("normalize converts backslashes and strips leading ./ and /")
    void normalize() {
        assertEquals("apps/web/deno.json", WorkspacePaths.normalize("apps\\web\\deno.json"));
        assertEquals("apps/web", WorkspacePaths.normalize("./apps/web"));
        assertEquals("apps/web", WorkspacePaths.normalize("/apps/web"));
        assertEquals("", WorkspacePaths.normalize(null));
    }

    @Test
    @DisplayName("dirname of a top-level file is the root directory")
    void dirnameOfTopLevelFile() {
        assertEquals(".", WorkspacePaths.dirname("deno.json"));
        assertEquals("packages/core", WorkspacePaths.dirname("packages/core/deno.jsonc"));
    }

    @Test
    @DisplayName("join treats root and blank as the workspace root")
    void join() {
        assertEquals("deno.json", WorkspacePaths.join(".", "deno.json"));
        assertEquals("deno.json", WorkspacePaths.join("", "deno.json"));
        assertEquals("apps/web/deno.json", WorkspacePaths.join("apps/web", "deno.json"));
        assertEquals("apps/web/deno.json", WorkspacePaths.join("apps/web/", "deno.json"));
    }

    @Test
    @DisplayName("isWithin respects path component boundaries")
    void isWithin() {
        assertTrue(WorkspacePaths.isWithin("apps/web/main.ts", "apps/web"));
        assertTrue(WorkspacePaths.isWithin("apps/web", "apps/web"));
        assertFalse(WorkspacePaths.isWithin("apps/website/main.ts", "apps/web"));
        assertTrue(WorkspacePaths.isWithin("anything/at/all.ts", "."));
    }

    @Test
    @DisplayName("directoryComponent matches whole segments only")
    void directoryComponent() {
        Pattern git = WorkspacePaths.directoryComponent(".git");
        assertTrue(git.matcher(".git/config").find());
        assertTrue(git.matcher("sub/.git/HEAD").find());
        assertTrue(git.matcher("sub\\.git\\HEAD").find());
        assertFalse(git.matcher("deno.git.ts").find());
        assertFalse(git.matcher("src/my.gitignore").find());
    }
}
