package com.depsync.core.scanner;

import com.depsync.core.fs.InMemoryWorkspaceFileSystem;
import com.depsync.core.fs.LocalWorkspaceFileSystem;
import com.depsync.core.model.DiscoveryDiagnostic;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.model.ProjectResolveOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProjectResolverTest {

    private InMemoryWorkspaceFileSystem fs;
    private List<DiscoveryDiagnostic> diagnostics;
    private ProjectResolver resolver;

    @BeforeEach
    void setUp() {
        fs = new InMemoryWorkspaceFileSystem()
                .put("deno.json", "{ \"workspace\": [\"./apps/*\", \"./packages/*\"] }")
                .put("apps/web/deno.json", """
                        { "name": "@acme/web", "tasks": { "dev": "deno run -A main.ts", "build": "vite build" } }
                        """)
                .put("packages/core/deno.jsonc", """
                        {
                          // core library
                          "name": "@acme/core",
                        }
                        """)
                .put("packages/util/deno.json", "{ \"name\": \"@acme/util\" }")
                .put("packages/broken/deno.json", "{ \"name\": ")
                .put("node_modules/left-pad/deno.json", "{ \"name\": \"left-pad\" }");
        diagnostics = new ArrayList<>();
        resolver = new ProjectResolver(fs, new ManifestReader(), diagnostics::add);
    }

    private static List<String> names(List<ProjectRef> projects) {
        return projects.stream().map(ProjectRef::name).toList();
    }

    // ── Discovery ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("finds every manifest outside skipped directories")
        void discoversAll() {
            var projects = resolver.resolve();

            assertEquals(4, projects.size());
            assertTrue(projects.stream().noneMatch(p -> "left-pad".equals(p.name())));
        }

        @Test
        @DisplayName("root manifest has directory '.'")
        void rootProjectDirectory() {
            var root = resolver.resolve().stream()
                    .filter(p -> p.configPath().equals("deno.json"))
                    .findFirst()
                    .orElseThrow();
            assertEquals(".", root.dir());
            assertFalse(root.isNamed());
        }

        @Test
        @DisplayName("named-only discovery drops nameless manifests")
        void namedOnly() {
            var projects = resolver.resolve(null, ProjectResolveOptions.namedOnly());
            assertEquals(List.of("@acme/web", "@acme/core", "@acme/util"), names(projects));
        }

        @Test
        @DisplayName("reads hasDev and tasks from the manifest")
        void readsTasks() {
            var web = resolver.resolve("@acme/web").get(0);
            assertTrue(web.hasDev());
            assertEquals(Map.of("dev", "deno run -A main.ts", "build", "vite build"), web.tasks());
            assertEquals("apps/web", web.dir());
            assertEquals("apps/web/deno.json", web.configPath());
        }

        @Test
        @DisplayName("malformed manifests are skipped and reported")
        void malformedManifestReported() {
            resolver.resolve();

            assertEquals(1, diagnostics.size());
            assertEquals("packages/broken/deno.json", diagnostics.get(0).path());
            assertNotNull(diagnostics.get(0).cause());
        }

        @Test
        @DisplayName("discovery on disk never lists skipped directories")
        void diskDiscoveryIgnoresSkippedDirectories(@TempDir Path tempDir) throws IOException {
            Files.createDirectories(tempDir.resolve("apps/web"));
            Files.writeString(tempDir.resolve("apps/web/deno.json"), "{ \"name\": \"@acme/web\" }");
            Files.createDirectories(tempDir.resolve("node_modules/.cache"));

            var disk = new LocalWorkspaceFileSystem(tempDir) {
                @Override
                protected List<Path> listDirectory(Path dir) throws IOException {
                    if (dir.toString().contains("node_modules")) {
                        throw new AccessDeniedException(dir.toString());
                    }
                    return super.listDirectory(dir);
                }
            };
            var local = new ProjectResolver(disk, new ManifestReader(), diagnostics::add);

            assertEquals(List.of("@acme/web"), names(local.resolve()));
            assertEquals(List.of("@acme/web"), names(local.resolve("apps")));
            assertTrue(diagnostics.isEmpty());
        }
    }

    // ── Reference forms ──────────────────────────────────────────────

    @Nested
    @DisplayName("Reference forms")
    class ReferenceForms {

        @Test
        @DisplayName("manifest path")
        void manifestPath() {
            assertEquals(List.of("@acme/core"), names(resolver.resolve("packages/core/deno.jsonc")));
        }

        @Test
        @DisplayName("project directory prefers deno.jsonc then deno.json")
        void projectDirectory() {
            fs.put("apps/web/deno.jsonc", "{ \"name\": \"@acme/web-jsonc\" }");
            assertEquals(List.of("@acme/web-jsonc"), names(resolver.resolve("./apps/web")));
        }

        @Test
        @DisplayName("parent directory resolves every project beneath it")
        void parentDirectory() {
            assertEquals(List.of("@acme/core", "@acme/util"), names(resolver.resolve("packages")));
        }

        @Test
        @DisplayName("package name")
        void packageName() {
            assertEquals(List.of("@acme/util"), names(resolver.resolve("@acme/util")));
        }

        @Test
        @DisplayName("'.' resolves every project")
        void rootReference() {
            assertEquals(4, resolver.resolve(".").size());
        }

        @Test
        @DisplayName("unknown reference resolves to nothing")
        void unknownReference() {
            assertTrue(resolver.resolve("@acme/missing").isEmpty());
        }
    }

    // ── Lists and cardinality ────────────────────────────────────────

    @Nested
    @DisplayName("Lists and cardinality")
    class Cardinality {

        @Test
        @DisplayName("comma list is trimmed, merged and deduplicated in first-seen order")
        void commaList() {
            var projects = resolver.resolve("@acme/web, apps/web ,@acme/core,");
            assertEquals(List.of("@acme/web", "@acme/core"), names(projects));
        }

        @Test
        @DisplayName("singleOnly fails with the match count")
        void singleOnlyFails() {
            var ex = assertThrows(MultipleProjectsException.class,
                    () -> resolver.resolve("@acme/web,@acme/core", ProjectResolveOptions.defaults().withSingleOnly()));
            assertEquals(2, ex.getCount());
            assertEquals("@acme/web,@acme/core", ex.getRef());
        }

        @Test
        @DisplayName("singleOnly passes with exactly one match")
        void singleOnlyPasses() {
            var projects = resolver.resolve("@acme/util", ProjectResolveOptions.defaults().withSingleOnly());
            assertEquals(1, projects.size());
        }

        @Test
        @DisplayName("useFirst returns the first match and wins over singleOnly")
        void useFirst() {
            var options = ProjectResolveOptions.defaults().withSingleOnly().withUseFirst();
            assertEquals(List.of("@acme/core"), names(resolver.resolve("packages", options)));
        }
    }
}
