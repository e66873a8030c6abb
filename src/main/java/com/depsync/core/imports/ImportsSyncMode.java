package com.depsync.core.imports;

/**
 * Direction of an import-map sync.
 */
public enum ImportsSyncMode {
    /** Point imports of workspace packages at their local source files. */
    LOCAL,
    /** Restore the registry imports preserved by a previous local sync. */
    REMOTE;

    public static ImportsSyncMode fromName(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
