package com.depsync.core.model;

import java.util.regex.Pattern;

/**
 * Category of file a package reference was found in.
 */
public enum ReferenceSource {
    CONFIG,
    DEPS,
    TEMPLATE,
    DOCS,
    OTHER;

    private static final Pattern CONFIG_FILE = Pattern.compile("deno\\.jsonc?$");
    private static final Pattern DEPS_FILE = Pattern.compile("\\.deps\\.ts$");
    private static final Pattern TEMPLATE_FILE = Pattern.compile("\\.hbs$");
    private static final Pattern DOCS_FILE = Pattern.compile("\\.mdx?$");

    public static ReferenceSource fromPath(String path) {
        if (CONFIG_FILE.matcher(path).find()) return CONFIG;
        if (DEPS_FILE.matcher(path).find()) return DEPS;
        if (TEMPLATE_FILE.matcher(path).find()) return TEMPLATE;
        if (DOCS_FILE.matcher(path).find()) return DOCS;
        return OTHER;
    }

    public static ReferenceSource fromName(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
