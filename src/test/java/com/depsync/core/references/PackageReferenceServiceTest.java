package com.depsync.core.references;

import com.depsync.core.fs.InMemoryWorkspaceFileSystem;
import com.depsync.core.model.PackageReference;
import com.depsync.core.model.ReferenceFilter;
import com.depsync.core.model.ReferenceSource;
import com.depsync.core.model.UpgradeOptions;
import com.depsync.core.model.UpgradeResult;
import com.depsync.core.scanner.ProjectResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PackageReferenceServiceTest {

    private static final String PKG = "@scope/pkg";

    private InMemoryWorkspaceFileSystem fs;

    private PackageReferenceService service(InMemoryWorkspaceFileSystem fileSystem) {
        return new PackageReferenceService(new ProjectResolver(fileSystem));
    }

    private static List<String> files(List<PackageReference> refs) {
        return refs.stream().map(PackageReference::file).distinct().toList();
    }

    // ── Single-project scenario ──────────────────────────────────────

    @Nested
    @DisplayName("Single project")
    class SingleProject {

        private static final String DEPS = "export * from \"jsr:@scope/pkg@1.0.0\";\n";

        @BeforeEach
        void setUp() {
            fs = new InMemoryWorkspaceFileSystem()
                    .put("proj/deno.json", "{ \"name\": \"test-proj\" }")
                    .put("proj/src/lib.deps.ts", DEPS);
        }

        @Test
        @DisplayName("finds the reference with its project and source")
        void findsReference() {
            var refs = service(fs).findReferences(PKG);

            assertEquals(List.of(new PackageReference("proj/src/lib.deps.ts", 1, "1.0.0",
                    ReferenceSource.DEPS, "test-proj")), refs);
        }

        @Test
        @DisplayName("dry run reports the change and leaves the file alone")
        void dryRun() {
            List<UpgradeResult> results = service(fs).upgrade(PKG, UpgradeOptions.to("2.0.0").asDryRun());

            assertEquals(1, results.size());
            UpgradeResult result = results.get(0);
            assertEquals("1.0.0", result.oldVersion());
            assertEquals("2.0.0", result.newVersion());
            assertTrue(result.success());
            assertNull(result.error());
            assertEquals(DEPS, fs.read("proj/src/lib.deps.ts"));
        }

        @Test
        @DisplayName("live run rewrites the file and a second run has nothing to do")
        void liveRunIsIdempotent() {
            var service = service(fs);

            var first = service.upgrade(PKG, UpgradeOptions.to("2.0.0"));
            assertEquals(1, first.size());
            assertTrue(first.get(0).success());
            assertEquals("export * from \"jsr:@scope/pkg@2.0.0\";\n", fs.read("proj/src/lib.deps.ts"));

            assertTrue(service.upgrade(PKG, UpgradeOptions.to("2.0.0")).isEmpty());
        }
    }

    // ── Workspace scan ───────────────────────────────────────────────

    @Nested
    @DisplayName("Workspace scan")
    class WorkspaceScan {

        @BeforeEach
        void setUp() {
            fs = new InMemoryWorkspaceFileSystem()
                    .put(".gitignore", "dist/\n")
                    .put("deno.json", "{ \"workspace\": [\"./apps/*\"] }")
                    .put("apps/web/deno.json", """
                            {
                              "name": "@acme/web",
                              "imports": { "@scope/pkg": "jsr:@scope/pkg@1.0.0/mod.ts" }
                            }
                            """)
                    .put("apps/web/main.tsx", "import a from \"jsr:@scope/pkg@1.0.0\"; import b from \"npm:@scope/pkg@0.9.0\";")
                    .put("apps/web/templates/page.hbs", "{{! jsr:@scope/pkg@1.0.0 }}")
                    .put("apps/web/README.md", "Install `jsr:@scope/pkg@1.0.0`.")
                    .put("apps/web/dist/bundle.ts", "\"jsr:@scope/pkg@0.1.0\"")
                    .put("apps/web/node_modules/x/index.ts", "\"jsr:@scope/pkg@0.1.0\"")
                    .put("apps/web/deno.git.ts", "\"jsr:@scope/pkg@1.0.0\"")
                    .put("apps/api/deno.json", "{ \"name\": \"@acme/api\" }")
                    .put("apps/api/api.deps.ts", "export * from \"jsr:@scope/pkg@1.0.0\";")
                    .put("apps/api/nested/deno.json", "{ \"name\": \"@acme/api-nested\" }")
                    .put("apps/api/nested/mod.ts", "import \"jsr:@scope/pkg@1.0.0\";")
                    .put("scripts/orphan.ts", "import \"jsr:@scope/pkg@1.0.0\";");
        }

        @Test
        @DisplayName("every reference belongs to a named project")
        void noOrphans() {
            var refs = service(fs).findReferences(PKG);

            assertFalse(refs.isEmpty());
            assertTrue(refs.stream().allMatch(r -> r.projectName() != null && !r.projectName().isEmpty()));
            assertFalse(files(refs).contains("scripts/orphan.ts"));
        }

        @Test
        @DisplayName("manifests are scanned as configuration")
        void manifestIsConfig() {
            var config = service(fs).findReferences(PKG).stream()
                    .filter(r -> r.source() == ReferenceSource.CONFIG)
                    .toList();

            assertEquals(1, config.size());
            assertEquals("apps/web/deno.json", config.get(0).file());
            assertEquals(3, config.get(0).line());
            assertEquals("1.0.0", config.get(0).currentVersion());
        }

        @Test
        @DisplayName("each specifier on a line is reported, on either registry")
        void everyOccurrence() {
            var main = service(fs).findReferences(PKG).stream()
                    .filter(r -> r.file().equals("apps/web/main.tsx"))
                    .map(PackageReference::currentVersion)
                    .toList();
            assertEquals(List.of("1.0.0", "0.9.0"), main);
        }

        @Test
        @DisplayName("skips ignored and vendored paths but not look-alike file names")
        void skipRules() {
            var scanned = files(service(fs).findReferences(PKG));

            assertFalse(scanned.contains("apps/web/dist/bundle.ts"));
            assertFalse(scanned.contains("apps/web/node_modules/x/index.ts"));
            assertTrue(scanned.contains("apps/web/deno.git.ts"));
        }

        @Test
        @DisplayName("files belong to the deepest enclosing project")
        void deepestOwner() {
            var nested = service(fs).findReferences(PKG).stream()
                    .filter(r -> r.file().equals("apps/api/nested/mod.ts"))
                    .findFirst()
                    .orElseThrow();
            assertEquals("@acme/api-nested", nested.projectName());
        }

        @Test
        @DisplayName("classifies templates and docs")
        void classifiesSources() {
            var refs = service(fs).findReferences(PKG);
            assertTrue(refs.stream().anyMatch(r -> r.source() == ReferenceSource.TEMPLATE
                    && r.file().equals("apps/web/templates/page.hbs")));
            assertTrue(refs.stream().anyMatch(r -> r.source() == ReferenceSource.DOCS
                    && r.file().equals("apps/web/README.md")));
        }

        @Test
        @DisplayName("source filter keeps only the requested categories")
        void sourceFilter() {
            var filter = new ReferenceFilter(Set.of(ReferenceSource.DEPS), List.of(), List.of());
            var refs = service(fs).findReferences(PKG, filter);

            assertEquals(List.of("apps/api/api.deps.ts"), files(refs));
        }

        @Test
        @DisplayName("project filters resolve references by name or path")
        void projectFilters() {
            var only = new ReferenceFilter(Set.of(), List.of("apps/api/nested"), List.of());
            assertEquals(Set.of("@acme/api-nested"), projectNames(service(fs).findReferences(PKG, only)));

            var excluding = new ReferenceFilter(Set.of(), List.of(), List.of("@acme/web"));
            var names = projectNames(service(fs).findReferences(PKG, excluding));
            assertFalse(names.contains("@acme/web"));
            assertTrue(names.contains("@acme/api"));
        }

        @Test
        @DisplayName("upgrade keeps subpaths and leaves references already at the target")
        void upgradeKeepsSubpaths() {
            fs.put("apps/api/api.deps.ts", "export * from \"jsr:@scope/pkg@2.0.0\";");

            var results = service(fs).upgrade(PKG, UpgradeOptions.to("2.0.0"));

            assertTrue(results.stream().allMatch(UpgradeResult::success));
            assertTrue(results.stream().noneMatch(r -> r.file().equals("apps/api/api.deps.ts")));
            assertTrue(fs.read("apps/web/deno.json").contains("\"jsr:@scope/pkg@2.0.0/mod.ts\""));
            assertEquals("import a from \"jsr:@scope/pkg@2.0.0\"; import b from \"npm:@scope/pkg@2.0.0\";",
                    fs.read("apps/web/main.tsx"));
            assertEquals("\"jsr:@scope/pkg@0.1.0\"", fs.read("apps/web/dist/bundle.ts"));
            assertEquals("import \"jsr:@scope/pkg@1.0.0\";", fs.read("scripts/orphan.ts"));
        }

        private Set<String> projectNames(List<PackageReference> refs) {
            return refs.stream().map(PackageReference::projectName).collect(Collectors.toSet());
        }
    }

    // ── Failure isolation ────────────────────────────────────────────

    @Test
    @DisplayName("a failing write only fails the references in that file")
    void writeFailureIsIsolated() {
        var failing = new InMemoryWorkspaceFileSystem() {
            @Override
            public void writeFile(String path, String content) throws IOException {
                if (path.endsWith("b.deps.ts")) {
                    throw new IOException("disk full");
                }
                super.writeFile(path, content);
            }
        };
        failing.put("proj/deno.json", "{ \"name\": \"proj\" }")
                .put("proj/a.deps.ts", "\"jsr:@scope/pkg@1.0.0\"")
                .put("proj/b.deps.ts", "\"jsr:@scope/pkg@1.0.0\"\n\"npm:@scope/pkg@1.0.0\"")
                .put("proj/c.deps.ts", "\"jsr:@scope/pkg@1.0.0\"");

        var results = service(failing).upgrade(PKG, UpgradeOptions.to("2.0.0"));

        assertEquals(4, results.size());
        var failed = results.stream().filter(r -> !r.success()).toList();
        assertEquals(2, failed.size());
        assertTrue(failed.stream().allMatch(r -> r.file().equals("proj/b.deps.ts") && "disk full".equals(r.error())));
        assertEquals("\"jsr:@scope/pkg@2.0.0\"", failing.read("proj/a.deps.ts"));
        assertEquals("\"jsr:@scope/pkg@2.0.0\"", failing.read("proj/c.deps.ts"));
        assertEquals("\"jsr:@scope/pkg@1.0.0\"\n\"npm:@scope/pkg@1.0.0\"", failing.read("proj/b.deps.ts"));
    }

    @Test
    @DisplayName("blank target versions are rejected")
    void blankVersionRejected() {
        assertThrows(IllegalArgumentException.class, () -> UpgradeOptions.to(" "));
    }
}
