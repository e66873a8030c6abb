package com.depsync.core.imports;

import com.fasterxml.jackson.core.io.JsonStringEncoder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level editor for the {@code "imports"} block of a {@code deno.jsonc}.
 * <p>
 * The manifest is never re-serialized: only the lines of the imports block and of the
 * preserved-originals comment are touched, so comments and formatting elsewhere survive.
 * A local sync leaves the file shaped like this:
 * <pre>
 *   "imports": {
 *     "@acme/utils": "../utils/src/.exports.ts"
 *   },
 * /**
 * // &#64;sync-imports BEGIN ORIGINAL IMPORTS
 * //   "imports": {
 * //     "@acme/utils": "jsr:@acme/utils@1.0.0"
 * //   },
 * // &#64;sync-imports END ORIGINAL IMPORTS
 * *&#47;
 * </pre>
 */
final class ImportMapText {

    static final String ORIGINAL_BEGIN = "// @sync-imports BEGIN ORIGINAL IMPORTS";
    static final String ORIGINAL_END = "// @sync-imports END ORIGINAL IMPORTS";

    private static final Pattern LINE_BREAK = Pattern.compile("\r?\n");
    private static final Pattern LEADING_COMMENT = Pattern.compile("^//\\s?");
    private static final Pattern INDENT = Pattern.compile("^(\\s*)");

    /** Inclusive line range. */
    record Range(int start, int end) {}

    private final List<String> lines;

    ImportMapText(String content) {
        this.lines = new ArrayList<>(Arrays.asList(LINE_BREAK.split(content, -1)));
    }

    String text() {
        return String.join("\n", lines);
    }

    /** From the line opening the {@code "imports"} object to the line where its braces balance. */
    Optional<Range> importsBlock() {
        int importsLine = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains("\"imports\"")) {
                importsLine = i;
                break;
            }
        }
        if (importsLine < 0) return Optional.empty();

        int braceStart = -1;
        for (int i = importsLine; i < lines.size(); i++) {
            if (lines.get(i).contains("{")) {
                braceStart = i;
                break;
            }
        }
        if (braceStart < 0) return Optional.empty();

        int depth = 0;
        for (int i = braceStart; i < lines.size(); i++) {
            for (char ch : lines.get(i).toCharArray()) {
                if (ch == '{') depth++;
                if (ch == '}') depth--;
            }
            if (depth == 0) {
                return Optional.of(new Range(braceStart, i));
            }
        }
        return Optional.empty();
    }

    boolean hasPreservedBlock() {
        return markers().isPresent();
    }

    /** The preserved original lines with their comment prefix removed. */
    Optional<List<String>> preservedBlock() {
        return markers().map(range -> lines.subList(range.start() + 1, range.end()).stream()
                .map(ImportMapText::uncomment)
                .toList());
    }

    /** Removes the marker lines, their content, and an enclosing {@code /** ... *&#47;} pair. */
    void removePreservedBlock() {
        markers().ifPresent(range -> {
            int start = range.start();
            int end = range.end();
            if (start > 0 && lines.get(start - 1).trim().equals("/**")) {
                start--;
            }
            if (end + 1 < lines.size() && lines.get(end + 1).trim().startsWith("*/")) {
                end++;
            }
            lines.subList(start, end + 1).clear();
        });
    }

    /** Comments out {@code original} between markers and inserts it before line {@code index}. */
    void insertPreservedBlock(List<String> original, int index) {
        var block = new ArrayList<String>();
        block.add("/**");
        block.add(ORIGINAL_BEGIN);
        original.forEach(line -> block.add(comment(line)));
        block.add(ORIGINAL_END);
        block.add("*/");
        lines.addAll(index, block);
    }

    List<String> lines(Range range) {
        return List.copyOf(lines.subList(range.start(), range.end() + 1));
    }

    void replace(Range range, List<String> replacement) {
        var target = lines.subList(range.start(), range.end() + 1);
        target.clear();
        target.addAll(replacement);
    }

    String indentOf(int line) {
        Matcher matcher = INDENT.matcher(lines.get(line));
        return matcher.find() ? matcher.group(1) : "";
    }

    boolean endsWithComma(int line) {
        return lines.get(line).trim().endsWith(",");
    }

    /** Renders an imports object, two spaces deeper than {@code indent} per entry. */
    static List<String> render(String indent, Map<String, String> imports, boolean trailingComma) {
        var rendered = new ArrayList<String>();
        rendered.add(indent + "\"imports\": {");
        int remaining = imports.size();
        for (Map.Entry<String, String> entry : imports.entrySet()) {
            remaining--;
            rendered.add(indent + "  " + quote(entry.getKey()) + ": " + quote(entry.getValue())
                    + (remaining > 0 ? "," : ""));
        }
        rendered.add(indent + "}" + (trailingComma ? "," : ""));
        return rendered;
    }

    private Optional<Range> markers() {
        int start = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).contains(ORIGINAL_BEGIN)) {
                start = i;
            }
            if (lines.get(i).contains(ORIGINAL_END)) {
                return start >= 0 && i > start ? Optional.of(new Range(start, i)) : Optional.empty();
            }
        }
        return Optional.empty();
    }

    private static String comment(String line) {
        return line.trim().isEmpty() ? line : "// " + line;
    }

    private static String uncomment(String line) {
        return LEADING_COMMENT.matcher(line).replaceFirst("");
    }

    private static String quote(String value) {
        return "\"" + new String(JsonStringEncoder.getInstance().quoteAsString(value)) + "\"";
    }
}
