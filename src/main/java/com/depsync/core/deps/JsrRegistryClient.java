package com.depsync.core.deps;

import com.depsync.core.model.AvailableVersion;
import com.depsync.core.model.Registry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads versions from JSR: {@code GET <base>/@scope/name/meta.json}, which answers
 * {@code {"latest": ..., "versions": {"1.0.0": {"yanked": false, "createdAt": "..."}}}}.
 */
public class JsrRegistryClient extends AbstractRegistryClient {

    public static final String DEFAULT_BASE_URL = "https://jsr.io";

    public JsrRegistryClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        super(httpClient, objectMapper, baseUrl);
    }

    @Override
    public Registry registry() {
        return Registry.JSR;
    }

    @Override
    public List<AvailableVersion> fetchVersions(String packageName, Duration timeout)
            throws IOException, InterruptedException {
        JsonNode meta = getJson("/" + packageName + "/meta.json", packageName, timeout);

        var versions = new ArrayList<AvailableVersion>();
        JsonNode entries = meta.path("versions");
        entries.fields().forEachRemaining(field -> {
            JsonNode info = field.getValue();
            versions.add(new AvailableVersion(
                    field.getKey(),
                    comparator.getChannel(field.getKey()),
                    parseInstant(info.get("createdAt")),
                    info.path("yanked").asBoolean(false)));
        });
        return versions;
    }
}
