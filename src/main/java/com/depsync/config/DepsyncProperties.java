package com.depsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "depsync")
public class DepsyncProperties {

    private Workspace workspace = new Workspace();
    private Registry registry = new Registry();
    private Cache cache = new Cache();

    public String getWorkspaceRoot() { return workspace.root; }
    public String getJsrUrl() { return registry.jsrUrl; }
    public String getNpmUrl() { return registry.npmUrl; }
    public Duration getConnectTimeout() { return Duration.ofSeconds(registry.connectTimeoutSeconds); }

    /** Per-request timeout, or {@code null} when requests are bounded only by the connect timeout. */
    public Duration getRequestTimeout() {
        return registry.requestTimeoutSeconds > 0 ? Duration.ofSeconds(registry.requestTimeoutSeconds) : null;
    }

    /** Cache entry lifetime; {@code null} keeps entries until cleared. */
    public Duration getCacheTtl() {
        return cache.ttlMinutes > 0 ? Duration.ofMinutes(cache.ttlMinutes) : null;
    }

    public Workspace getWorkspace() { return workspace; }
    public void setWorkspace(Workspace workspace) { this.workspace = workspace; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Cache getCache() { return cache; }
    public void setCache(Cache cache) { this.cache = cache; }

    public static class Workspace {
        private String root = ".";

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
    }

    public static class Registry {
        private String jsrUrl = "https://jsr.io";
        private String npmUrl = "https://registry.npmjs.org";
        private int connectTimeoutSeconds = 10;
        private int requestTimeoutSeconds = 0;

        public String getJsrUrl() { return jsrUrl; }
        public void setJsrUrl(String jsrUrl) { this.jsrUrl = jsrUrl; }
        public String getNpmUrl() { return npmUrl; }
        public void setNpmUrl(String npmUrl) { this.npmUrl = npmUrl; }
        public int getConnectTimeoutSeconds() { return connectTimeoutSeconds; }
        public void setConnectTimeoutSeconds(int connectTimeoutSeconds) { this.connectTimeoutSeconds = connectTimeoutSeconds; }
        public int getRequestTimeoutSeconds() { return requestTimeoutSeconds; }
        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) { this.requestTimeoutSeconds = requestTimeoutSeconds; }
    }

    public static class Cache {
        private int ttlMinutes = 0;

        public int getTtlMinutes() { return ttlMinutes; }
        public void setTtlMinutes(int ttlMinutes) { this.ttlMinutes = ttlMinutes; }
    }
}
