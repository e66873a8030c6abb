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
 * Reads versions from the npm registry: {@code GET <base>/<name>}, with the scope slash of
 * scoped names sent as {@code %2F}. A version carrying a {@code deprecated} message is
 * reported as yanked; publish times come from the top-level {@code time} map.
 */
public class NpmRegistryClient extends AbstractRegistryClient {

    public static final String DEFAULT_BASE_URL = "https://registry.npmjs.org";

    public NpmRegistryClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        super(httpClient, objectMapper, baseUrl);
    }

    @Override
    public Registry registry() {
        return Registry.NPM;
    }

    static String encodePackageName(String packageName) {
        return packageName.startsWith("@") ? packageName.replaceFirst("/", "%2F") : packageName;
    }

    @Override
    public List<AvailableVersion> fetchVersions(String packageName, Duration timeout)
            throws IOException, InterruptedException {
        JsonNode document = getJson("/" + encodePackageName(packageName), packageName, timeout);

        JsonNode times = document.path("time");
        var versions = new ArrayList<AvailableVersion>();
        document.path("versions").fields().forEachRemaining(field -> {
            String version = field.getKey();
            JsonNode deprecated = field.getValue().get("deprecated");
            boolean isDeprecated = deprecated != null && !deprecated.isNull()
                    && !(deprecated.isTextual() && deprecated.asText().isEmpty())
                    && !(deprecated.isBoolean() && !deprecated.asBoolean());
            versions.add(new AvailableVersion(
                    version,
                    comparator.getChannel(version),
                    parseInstant(times.get(version)),
                    isDeprecated));
        });
        return versions;
    }
}
