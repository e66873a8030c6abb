package com.depsync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DepsyncPropertiesTest {

    @Test
    @DisplayName("defaults point at the public registries")
    void defaults() {
        var props = new DepsyncProperties();
        assertEquals(".", props.getWorkspaceRoot());
        assertEquals("https://jsr.io", props.getJsrUrl());
        assertEquals("https://registry.npmjs.org", props.getNpmUrl());
        assertEquals(Duration.ofSeconds(10), props.getConnectTimeout());
    }

    @Test
    @DisplayName("zero request timeout and cache TTL mean unbounded")
    void zeroMeansUnbounded() {
        var props = new DepsyncProperties();
        assertNull(props.getRequestTimeout());
        assertNull(props.getCacheTtl());
    }

    @Test
    @DisplayName("positive values convert to durations")
    void positiveDurations() {
        var props = new DepsyncProperties();
        props.getRegistry().setRequestTimeoutSeconds(30);
        props.getCache().setTtlMinutes(15);
        assertEquals(Duration.ofSeconds(30), props.getRequestTimeout());
        assertEquals(Duration.ofMinutes(15), props.getCacheTtl());
    }

    @Test
    @DisplayName("nested sections can be replaced")
    void nestedSetters() {
        var props = new DepsyncProperties();
        var workspace = new DepsyncProperties.Workspace();
        workspace.setRoot("/srv/monorepo");
        props.setWorkspace(workspace);
        assertEquals("/srv/monorepo", props.getWorkspaceRoot());
    }
}
