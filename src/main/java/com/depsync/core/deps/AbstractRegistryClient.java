package com.depsync.core.deps;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Shared HTTP plumbing for registry clients: issues a JSON {@code GET}, maps 404 to
 * {@link PackageNotFoundException} and other non-2xx statuses to {@link RegistryFetchException}.
 * Transport failures are not wrapped.
 */
abstract class AbstractRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(AbstractRegistryClient.class);

    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final String baseUrl;
    protected final VersionComparator comparator = new VersionComparator();

    protected AbstractRegistryClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    protected JsonNode getJson(String path, String packageName, Duration timeout)
            throws IOException, InterruptedException {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .header("Accept", "application/json")
                .GET();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }

        log.debug("GET {}{}", baseUrl, path);
        HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());

        int status = response.statusCode();
        if (status == 404) {
            throw new PackageNotFoundException(packageName);
        }
        if (status < 200 || status >= 300) {
            throw new RegistryFetchException("Failed to fetch %s package %s: HTTP %d"
                    .formatted(registry().prefix(), packageName, status), status);
        }
        return objectMapper.readTree(response.body());
    }

    protected static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) return null;
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable timestamp '{}'", node.asText());
            return null;
        }
    }
}
