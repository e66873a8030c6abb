package com.depsync.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing depsync-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPackage(String packageName) {
        MDC.put("package", packageName);
    }

    public static void setProject(String projectRef) {
        MDC.put("project", projectRef);
    }

    public static void clear() {
        MDC.remove("package");
        MDC.remove("project");
    }
}
