package com.depsync.config;

import com.depsync.core.deps.DepsFileParser;
import com.depsync.core.deps.VersionCache;
import com.depsync.core.deps.VersionComparator;
import com.depsync.core.deps.VersionResolver;
import com.depsync.core.scanner.ManifestReader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkspaceSessionFactoryTest {

    @TempDir
    Path tempDir;

    private WorkspaceSessionFactory factory(DepsyncProperties properties) {
        var comparator = new VersionComparator();
        return new WorkspaceSessionFactory(properties, new ManifestReader(), new DepsFileParser(),
                new VersionResolver(List.of(), VersionCache.unbounded(), comparator), comparator);
    }

    @Test
    @DisplayName("opens a session rooted at the given directory")
    void opensExplicitRoot() throws IOException {
        Files.createDirectories(tempDir.resolve("apps/web"));
        Files.writeString(tempDir.resolve("apps/web/deno.json"), "{ \"name\": \"@acme/web\" }");

        var session = factory(new DepsyncProperties()).open(tempDir);

        assertEquals(tempDir.toAbsolutePath().normalize(), session.fileSystem().root());
        assertEquals("@acme/web", session.projects().resolve().get(0).name());
    }

    @Test
    @DisplayName("falls back to the configured workspace root")
    void usesConfiguredRoot() {
        var properties = new DepsyncProperties();
        properties.getWorkspace().setRoot(tempDir.toString());

        assertEquals(tempDir.toAbsolutePath().normalize(), factory(properties).open().fileSystem().root());
    }

    @Test
    @DisplayName("resolve options carry the configured request timeout")
    void resolveOptions() {
        var properties = new DepsyncProperties();
        properties.getRegistry().setRequestTimeoutSeconds(7);

        var options = factory(properties).resolveOptions();
        assertEquals(Duration.ofSeconds(7), options.timeout());
        assertFalse(options.includeYanked());
    }
}
