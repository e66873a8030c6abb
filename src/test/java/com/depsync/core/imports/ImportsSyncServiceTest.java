package com.depsync.core.imports;

import com.depsync.core.fs.InMemoryWorkspaceFileSystem;
import com.depsync.core.scanner.ManifestReader;
import com.depsync.core.scanner.ProjectResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ImportsSyncServiceTest {

    private static final String SERVER = """
            {
              // server
              "name": "@acme/server",
              "exports": "./main.ts",
              "imports": {
                "@acme/utils": "jsr:@acme/utils@^1.0.0",
                "@std/path": "jsr:@std/path@1.0.0"
              },
              "tasks": { "dev": "deno run dev.ts" }
            }
            """;

    private static final String UTILS = """
            {
              "name": "@acme/utils",
              "version": "1.0.0",
              "exports": {
                ".": "./mod.ts",
                "./fmt": "./src/fmt.ts"
              },
              "imports": {
                "@acme/log": "jsr:@acme/log@^1.0.0",
                "@std/path": "jsr:@std/path@1.0.0"
              }
            }
            """;

    private static final String LOG = """
            {
              "name": "@acme/log",
              "exports": "./mod.ts",
              "imports": {
                "@std/fmt": "jsr:@std/fmt@1.0.0"
              }
            }
            """;

    private InMemoryWorkspaceFileSystem fs;
    private ManifestReader manifestReader;
    private ImportsSyncService service;

    @BeforeEach
    void setUp() {
        fs = new InMemoryWorkspaceFileSystem()
                .put("apps/server/deno.jsonc", SERVER)
                .put("apps/server/main.ts", "")
                .put("apps/server/dev.ts", "")
                .put("apps/server/DOCKERFILE", "")
                .put("apps/site/deno.jsonc", "{ \"name\": \"@acme/site\", \"imports\": {} }")
                .put("apps/legacy/deno.json", "{ \"name\": \"@acme/legacy\", \"exports\": \"./mod.ts\" }")
                .put("libs/utils/deno.jsonc", UTILS)
                .put("libs/utils/utils.deps.ts", """
                        export * as log from "jsr:@acme/log@^1.0.0";
                        export { join } from "jsr:@std/path@1.0.0";
                        """)
                .put("libs/log/deno.jsonc", LOG)
                .put("tools/cli/deno.jsonc", "{ \"name\": \"@acme/cli\", \"exports\": { \"./bin\": \"./bin.ts\" } }")
                .put("tools/cli/.cli.json", "{}")
                .put("node_modules/dep/deno.jsonc", "{ \"name\": \"dep\", \"exports\": \"./mod.ts\" }");
        manifestReader = new ManifestReader();
        service = new ImportsSyncService(new ProjectResolver(fs), manifestReader);
    }

    private Map<String, String> importsOf(String path) {
        return manifestReader.imports(manifestReader.parse(fs.read(path)));
    }

    // ── Discovery ────────────────────────────────────────────────────

    @Nested
    @DisplayName("Discovery")
    class Discovery {

        @Test
        @DisplayName("packages need a name and exports, and skipped directories are ignored")
        void discoversPackages() {
            var names = service.discoverLocalPackages().stream().map(LocalPackage::name).toList();
            assertEquals(List.of("@acme/server", "@acme/log", "@acme/utils", "@acme/cli"), names);
        }

        @Test
        @DisplayName("runtimes are recognized by their entry files or a .cli.json")
        void classifiesPackages() {
            var kinds = new LinkedHashMap<String, PackageKind>();
            service.discoverLocalPackages().forEach(p -> kinds.put(p.name(), p.kind()));
            assertEquals(PackageKind.RUNTIME, kinds.get("@acme/server"));
            assertEquals(PackageKind.RUNTIME, kinds.get("@acme/cli"));
            assertEquals(PackageKind.LIBRARY, kinds.get("@acme/utils"));
            assertEquals(PackageKind.LIBRARY, kinds.get("@acme/log"));
        }

        @Test
        @DisplayName("a string export is the root export")
        void stringExport() {
            var log = service.discoverLocalPackages().stream()
                    .filter(p -> p.name().equals("@acme/log"))
                    .findFirst().orElseThrow();
            assertEquals(Map.of(".", "./mod.ts"), log.exports());
            assertEquals("@acme/log", log.importKey("."));
            assertEquals("@acme/log/fmt", log.importKey("./fmt"));
        }
    }

    // ── Local mode ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Local mode")
    class Local {

        @Test
        @DisplayName("workspace imports point at exported source files and the originals are kept")
        void rewritesToLocalPaths() {
            var result = service.sync("@acme/server", ImportsSyncMode.LOCAL);

            assertEquals(1, result.count(SyncedConfig.Status.UPDATED));
            assertEquals(4, result.localPackages().size());
            assertEquals(Map.of(
                    "@std/path", "jsr:@std/path@1.0.0",
                    "@acme/utils", "../../libs/utils/mod.ts",
                    "@acme/utils/fmt", "../../libs/utils/src/fmt.ts"), importsOf("apps/server/deno.jsonc"));

            String text = fs.read("apps/server/deno.jsonc");
            assertTrue(text.contains(ImportMapText.ORIGINAL_BEGIN));
            assertTrue(text.contains("//     \"@acme/utils\": \"jsr:@acme/utils@^1.0.0\","));
            assertTrue(text.contains("// server"));
            assertTrue(text.contains("\"tasks\": { \"dev\": \"deno run dev.ts\" }"));
        }

        @Test
        @DisplayName("a second local sync produces the same file")
        void idempotent() {
            service.sync("@acme/server", ImportsSyncMode.LOCAL);
            String first = fs.read("apps/server/deno.jsonc");

            service.sync("@acme/server", ImportsSyncMode.LOCAL);
            assertEquals(first, fs.read("apps/server/deno.jsonc"));
        }

        @Test
        @DisplayName("libraries map the jsr specifiers of their .deps.ts files")
        void libraryOverrides() {
            service.sync("@acme/utils", ImportsSyncMode.LOCAL);

            assertEquals(Map.of(
                    "@std/path", "jsr:@std/path@1.0.0",
                    "@acme/log", "../log/mod.ts",
                    "jsr:@acme/log@^1.0.0", "../log/mod.ts"), importsOf("libs/utils/deno.jsonc"));
        }

        @Test
        @DisplayName("runtimes inherit the jsr overrides of libraries")
        void runtimeOverrides() {
            service.sync("@acme/utils", ImportsSyncMode.LOCAL);
            service.sync("@acme/server", ImportsSyncMode.LOCAL);

            var imports = importsOf("apps/server/deno.jsonc");
            assertEquals("../../libs/log/mod.ts", imports.get("jsr:@acme/log@^1.0.0"));
            assertEquals("../../libs/utils/mod.ts", imports.get("@acme/utils"));
        }

        @Test
        @DisplayName("a comma list syncs every target")
        void severalTargets() {
            var result = service.sync("@acme/utils,@acme/server", ImportsSyncMode.LOCAL);
            assertEquals(List.of("libs/utils/deno.jsonc", "apps/server/deno.jsonc"),
                    result.configs().stream().map(SyncedConfig::configPath).toList());
        }

        @Test
        @DisplayName("a config without imports is skipped")
        void noImportsBlock() {
            var result = service.sync("@acme/cli", ImportsSyncMode.LOCAL);

            var outcome = result.configs().get(0);
            assertEquals(SyncedConfig.Status.SKIPPED, outcome.status());
            assertEquals("No imports block", outcome.message());
        }
    }

    // ── Remote mode ──────────────────────────────────────────────────

    @Nested
    @DisplayName("Remote mode")
    class Remote {

        @Test
        @DisplayName("restores the original file text exactly")
        void roundTrip() {
            service.sync("@acme/server", ImportsSyncMode.LOCAL);
            service.sync("@acme/server", ImportsSyncMode.LOCAL);
            var result = service.sync("@acme/server", ImportsSyncMode.REMOTE);

            assertEquals(1, result.count(SyncedConfig.Status.UPDATED));
            assertEquals(SERVER, fs.read("apps/server/deno.jsonc"));
        }

        @Test
        @DisplayName("restores a config whose imports close the object")
        void roundTripLastMember() {
            service.sync("libs/utils", ImportsSyncMode.LOCAL);
            service.sync("libs/utils", ImportsSyncMode.REMOTE);
            assertEquals(UTILS, fs.read("libs/utils/deno.jsonc"));
        }

        @Test
        @DisplayName("a config without markers is skipped and left alone")
        void noMarkers() {
            var result = service.sync("@acme/server", ImportsSyncMode.REMOTE);

            var outcome = result.configs().get(0);
            assertEquals(SyncedConfig.Status.SKIPPED, outcome.status());
            assertEquals("No original imports marker block found", outcome.message());
            assertEquals(SERVER, fs.read("apps/server/deno.jsonc"));
        }
    }

    // ── Targets ──────────────────────────────────────────────────────

    @Test
    @DisplayName("unknown targets and deno.json-only projects are rejected")
    void unresolvedTarget() {
        var unknown = assertThrows(ImportsSyncException.class,
                () -> service.sync("@acme/nope", ImportsSyncMode.LOCAL));
        assertTrue(unknown.getMessage().contains("@acme/nope"));

        assertThrows(ImportsSyncException.class, () -> service.sync("apps/legacy", ImportsSyncMode.REMOTE));
    }

    @Test
    @DisplayName("mode names are case-insensitive")
    void modeNames() {
        assertEquals(ImportsSyncMode.LOCAL, ImportsSyncMode.fromName(" Local "));
        assertEquals(ImportsSyncMode.REMOTE, ImportsSyncMode.fromName("remote"));
        assertThrows(IllegalArgumentException.class, () -> ImportsSyncMode.fromName("hybrid"));
    }
}
