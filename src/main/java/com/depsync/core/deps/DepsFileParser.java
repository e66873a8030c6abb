package com.depsync.core.deps;

import com.depsync.core.model.DepsReference;
import com.depsync.core.model.Registry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts and rewrites registry specifiers ({@code jsr:@scope/name@1.2.3/subpath},
 * {@code npm:name@4.0.0}) in dependency-declaration files such as {@code .deps.ts}.
 * <p>
 * Matching is textual; no syntax tree is built.
 */
public class DepsFileParser {

    /**
     * Finds every quoted specifier in {@code content}.
     *
     * @return references in file order with 1-indexed line and column (column of the opening quote)
     */
    public List<DepsReference> parse(String content) {
        var refs = new ArrayList<DepsReference>();
        String[] lines = content.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            Matcher matcher = SpecifierPatterns.QUOTED_SPECIFIER.matcher(lines[i]);
            while (matcher.find()) {
                refs.add(build(matcher, i + 1, matcher.start() + 1));
            }
        }
        return refs;
    }

    /**
     * Parses a bare specifier string, e.g. an import-map value.
     *
     * @return the reference with line and column 0, or {@code null} if {@code specifier} is not one
     */
    public DepsReference parseOne(String specifier) {
        if (specifier == null) return null;
        Matcher matcher = SpecifierPatterns.WHOLE_SPECIFIER.matcher(specifier);
        if (!matcher.matches()) return null;
        return build(matcher, 0, 0);
    }

    /**
     * Sets new versions for the given packages, keeping any subpath.
     *
     * @param content original text
     * @param updates package full name to new version
     * @return the rewritten text
     */
    public String update(String content, Map<String, String> updates) {
        String result = content;
        for (Map.Entry<String, String> update : updates.entrySet()) {
            result = SpecifierPatterns.replaceVersion(result, update.getKey(), update.getValue());
        }
        return result;
    }

    /** First reference per package full name, in encounter order. */
    public Map<String, DepsReference> getUniquePackages(List<DepsReference> refs) {
        var packages = new LinkedHashMap<String, DepsReference>();
        for (DepsReference ref : refs) {
            packages.putIfAbsent(ref.fullName(), ref);
        }
        return packages;
    }

    public List<DepsReference> filterByRegistry(List<DepsReference> refs, Registry registry) {
        return refs.stream().filter(ref -> ref.registry() == registry).toList();
    }

    /**
     * Keeps references whose full name matches {@code pattern}. Without {@code *} the match
     * is exact; {@code *} matches any run of characters ({@code @scope/*}, {@code @scope/eac*}).
     */
    public List<DepsReference> filterByPattern(List<DepsReference> refs, String pattern) {
        if (!pattern.contains("*")) {
            return refs.stream().filter(ref -> ref.fullName().equals(pattern)).toList();
        }
        Pattern regex = wildcard(pattern);
        return refs.stream().filter(ref -> regex.matcher(ref.fullName()).matches()).toList();
    }

    static Pattern wildcard(String pattern) {
        return Pattern.compile(Arrays.stream(pattern.split("\\*", -1))
                .map(Pattern::quote)
                .collect(Collectors.joining(".*")));
    }

    private static DepsReference build(Matcher matcher, int line, int column) {
        Registry registry = Registry.fromPrefix(matcher.group(1));
        String packagePart = matcher.group(2);
        String version = matcher.group(3);
        String subpath = matcher.group(4);

        String scope = null;
        String name = packagePart;
        if (packagePart.startsWith("@")) {
            int slash = packagePart.indexOf('/');
            scope = packagePart.substring(0, slash);
            name = packagePart.substring(slash + 1);
        }

        String fullSpecifier = registry.prefix() + ":" + packagePart + "@" + version
                + (subpath == null ? "" : subpath);
        return new DepsReference(registry, scope, name, packagePart, version, subpath,
                fullSpecifier, line, column);
    }
}
