package com.depsync.core.model;

/**
 * Which dependencies a planned upgrade considers.
 */
public enum UpgradeMode {
    ALL,
    JSR,
    NPM,
    /** Only packages published by projects in the workspace. */
    LOCAL_ONLY
}
