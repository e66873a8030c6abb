package com.depsync.core.scanner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reads {@code deno.json} / {@code deno.jsonc} manifests. Comments and trailing commas are
 * accepted; the manifest is only ever read here, never re-serialized.
 */
public class ManifestReader {

    /** Matches manifest file names at the end of a path. */
    public static final Pattern MANIFEST_FILE = Pattern.compile("(^|/)deno\\.jsonc?$");

    private final ObjectMapper objectMapper;

    public ManifestReader() {
        this(JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .build());
    }

    public ManifestReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public static boolean isManifestPath(String path) {
        return MANIFEST_FILE.matcher(path.replace('\\', '/')).find();
    }

    /**
     * Parses manifest text into a JSON object.
     *
     * @throws ManifestParseException if the text is not valid JSON(C) or not an object
     */
    public JsonNode parse(String content) {
        JsonNode node;
        try {
            node = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new ManifestParseException("Malformed manifest: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ManifestParseException("Manifest is not a JSON object");
        }
        return node;
    }

    /** The {@code name} field when it is a string, otherwise {@code null}. */
    public String name(JsonNode manifest) {
        JsonNode name = manifest.get("name");
        return name != null && name.isTextual() ? name.asText() : null;
    }

    /** String-valued entries of {@code tasks}; other values are dropped. */
    public Map<String, String> tasks(JsonNode manifest) {
        return stringEntries(manifest.get("tasks"));
    }

    /** String-valued entries of the {@code imports} map. */
    public Map<String, String> imports(JsonNode manifest) {
        return stringEntries(manifest.get("imports"));
    }

    private static Map<String, String> stringEntries(JsonNode node) {
        var entries = new LinkedHashMap<String, String>();
        if (node == null || !node.isObject()) {
            return entries;
        }
        node.fields().forEachRemaining(field -> {
            if (field.getValue().isTextual()) {
                entries.put(field.getKey(), field.getValue().asText());
            }
        });
        return entries;
    }
}
