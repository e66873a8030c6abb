package com.depsync.config;

import com.depsync.core.deps.DepsFileParser;
import com.depsync.core.deps.JsrRegistryClient;
import com.depsync.core.deps.NpmRegistryClient;
import com.depsync.core.deps.RegistryClient;
import com.depsync.core.deps.VersionCache;
import com.depsync.core.deps.VersionComparator;
import com.depsync.core.deps.VersionResolver;
import com.depsync.core.scanner.ManifestReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.List;

@Configuration
public class DepsyncConfig {

    @Bean
    public HttpClient registryHttpClient(DepsyncProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public ObjectMapper registryObjectMapper() {
        return JsonMapper.builder().build();
    }

    @Bean
    public JsrRegistryClient jsrRegistryClient(HttpClient registryHttpClient, ObjectMapper registryObjectMapper,
                                               DepsyncProperties properties) {
        return new JsrRegistryClient(registryHttpClient, registryObjectMapper, properties.getJsrUrl());
    }

    @Bean
    public NpmRegistryClient npmRegistryClient(HttpClient registryHttpClient, ObjectMapper registryObjectMapper,
                                               DepsyncProperties properties) {
        return new NpmRegistryClient(registryHttpClient, registryObjectMapper, properties.getNpmUrl());
    }

    @Bean
    public VersionCache versionCache(DepsyncProperties properties) {
        return new VersionCache(properties.getCacheTtl(), Clock.systemUTC());
    }

    @Bean
    public VersionComparator versionComparator() {
        return new VersionComparator();
    }

    /**
     * One resolver for the lifetime of the context, so lookups made by different commands
     * in the same run share the cache.
     */
    @Bean
    public VersionResolver versionResolver(List<RegistryClient> registryClients, VersionCache versionCache,
                                           VersionComparator versionComparator) {
        return new VersionResolver(registryClients, versionCache, versionComparator);
    }

    @Bean
    public DepsFileParser depsFileParser() {
        return new DepsFileParser();
    }

    @Bean
    public ManifestReader manifestReader() {
        return new ManifestReader();
    }
}
