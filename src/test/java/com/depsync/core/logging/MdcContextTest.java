package com.depsync.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setPackage puts package in MDC")
    void setPackage() {
        MdcContext.setPackage("@std/path");
        assertEquals("@std/path", MDC.get("package"));
    }

    @Test
    @DisplayName("setProject puts project in MDC")
    void setProject() {
        MdcContext.setProject("@acme/web");
        assertEquals("@acme/web", MDC.get("project"));
    }

    @Test
    @DisplayName("clear removes all depsync MDC keys")
    void clear() {
        MdcContext.setPackage("@std/path");
        MdcContext.setProject("@acme/web");
        MdcContext.clear();
        assertNull(MDC.get("package"));
        assertNull(MDC.get("project"));
    }
}
