package com.depsync.core.deps;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the regular expressions that locate registry specifiers in text.
 * <p>
 * Scanning and rewriting both go through {@link #forPackage(String)} so they agree on where
 * the version token ends and the subpath begins. A version stops at the next {@code /},
 * quote, comma or whitespace; anything from that {@code /} onward is the subpath.
 */
public final class SpecifierPatterns {

    static final String REGISTRY = "(jsr|npm)";
    static final String PACKAGE = "(@[^/@\\s\"'`,]+/[^/@\\s\"'`,]+|[^/@\\s\"'`,]+)";
    static final String VERSION = "([^/\"'`\\s,]+)";
    static final String SUBPATH = "(/[^\"'`\\s,]*)?";

    /** Group indexes of {@link #forPackage(String)}. */
    public static final int PREFIX_GROUP = 1;
    public static final int VERSION_GROUP = 3;
    public static final int SUBPATH_GROUP = 4;

    /** Any quoted specifier: registry, package, version, subpath. */
    static final Pattern QUOTED_SPECIFIER =
            Pattern.compile("[\"'`]" + REGISTRY + ":" + PACKAGE + "@" + VERSION + SUBPATH + "[\"'`]");

    /** A bare specifier spanning a whole string. */
    static final Pattern WHOLE_SPECIFIER =
            Pattern.compile("^" + REGISTRY + ":" + PACKAGE + "@" + VERSION + SUBPATH + "$");

    private SpecifierPatterns() {}

    /**
     * Pattern for every specifier of one package, on either registry. Groups: 1 = the
     * {@code registry:name@} prefix, 2 = registry, 3 = version, 4 = optional subpath.
     */
    public static Pattern forPackage(String fullName) {
        return Pattern.compile("(" + REGISTRY + ":" + Pattern.quote(fullName) + "@)" + VERSION + SUBPATH);
    }

    /**
     * Replaces the version of every specifier of {@code fullName} in {@code content},
     * keeping prefix and subpath exactly as written.
     */
    public static String replaceVersion(String content, String fullName, String newVersion) {
        Matcher matcher = forPackage(fullName).matcher(content);
        var result = new StringBuilder(content.length());
        while (matcher.find()) {
            String subpath = matcher.group(SUBPATH_GROUP);
            String replacement = matcher.group(PREFIX_GROUP) + newVersion + (subpath == null ? "" : subpath);
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
