package com.depsync.core.deps;

import com.depsync.core.model.AvailableVersion;
import com.depsync.core.model.Registry;
import com.depsync.core.model.ResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up published package versions, caching each {@code (registry, package)} list in the
 * {@link VersionCache} supplied at construction.
 * <p>
 * The cache holds the complete list including yanked versions; {@link ResolveOptions#includeYanked()}
 * is applied when reading, so both views are served from one registry call.
 */
public class VersionResolver {

    private static final Logger log = LoggerFactory.getLogger(VersionResolver.class);

    /** Group key used by {@link #getVersionsByChannel} for versions without a channel. */
    public static final String PRODUCTION = "production";

    private final Map<Registry, RegistryClient> clients = new EnumMap<>(Registry.class);
    private final VersionCache cache;
    private final VersionComparator comparator;

    public VersionResolver(List<RegistryClient> clients, VersionCache cache, VersionComparator comparator) {
        for (RegistryClient client : clients) {
            this.clients.put(client.registry(), client);
        }
        this.cache = cache;
        this.comparator = comparator;
    }

    public void clearCache() {
        cache.clear();
    }

    /**
     * All versions of a package, newest first.
     *
     * @throws PackageNotFoundException if the registry does not know the package
     * @throws RegistryFetchException   on any other non-success response
     * @throws IOException              on network failure or timeout
     */
    public List<AvailableVersion> getVersions(Registry registry, String packageName, ResolveOptions options)
            throws IOException, InterruptedException {
        var opts = options == null ? ResolveOptions.defaults() : options;

        Optional<List<AvailableVersion>> cached = cache.get(registry, packageName);
        List<AvailableVersion> all;
        if (cached.isPresent()) {
            all = cached.get();
        } else {
            RegistryClient client = clients.get(registry);
            if (client == null) {
                throw new IllegalStateException("No registry client configured for " + registry.prefix());
            }
            var fetched = new ArrayList<>(client.fetchVersions(packageName, opts.timeout()));
            fetched.sort(Comparator.comparing(AvailableVersion::version, comparator).reversed());
            cache.put(registry, packageName, fetched);
            log.debug("Fetched {} versions of {}:{}", fetched.size(), registry.prefix(), packageName);
            all = fetched;
        }

        if (opts.includeYanked()) {
            return all;
        }
        return all.stream().filter(v -> !v.yanked()).toList();
    }

    /**
     * Newest version on a channel.
     *
     * @param channel channel to target, or {@code null} for production
     */
    public Optional<String> getLatest(Registry registry, String packageName, String channel, ResolveOptions options)
            throws IOException, InterruptedException {
        var versions = getVersions(registry, packageName, options).stream()
                .map(AvailableVersion::version)
                .toList();
        return comparator.findLatest(versions, channel);
    }

    /** Versions grouped by channel, {@link #PRODUCTION} for versions without one; newest first within a group. */
    public Map<String, List<AvailableVersion>> getVersionsByChannel(Registry registry, String packageName,
                                                                    ResolveOptions options)
            throws IOException, InterruptedException {
        var grouped = new LinkedHashMap<String, List<AvailableVersion>>();
        for (AvailableVersion version : getVersions(registry, packageName, options)) {
            String key = version.channel() == null ? PRODUCTION : version.channel();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(version);
        }
        return grouped;
    }

    public boolean hasVersion(Registry registry, String packageName, String version, ResolveOptions options)
            throws IOException, InterruptedException {
        return getVersions(registry, packageName, options).stream()
                .anyMatch(v -> v.version().equals(version));
    }
}
