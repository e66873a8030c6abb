package com.depsync.core.deps;

import com.depsync.core.model.AvailableVersion;
import com.depsync.core.model.Registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds registry version lists keyed by {@code (registry, packageName)}.
 * <p>
 * Entries older than the configured time-to-live are treated as missing. A zero or
 * {@code null} TTL keeps entries until {@link #clear()}.
 */
public class VersionCache {

    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public VersionCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /** A cache that never expires entries on its own. */
    public static VersionCache unbounded() {
        return new VersionCache(Duration.ZERO, Clock.systemUTC());
    }

    public Optional<List<AvailableVersion>> get(Registry registry, String packageName) {
        String key = key(registry, packageName);
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.versions());
    }

    public void put(Registry registry, String packageName, List<AvailableVersion> versions) {
        entries.put(key(registry, packageName), new Entry(List.copyOf(versions), clock.instant()));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return !clock.instant().isBefore(entry.storedAt().plus(ttl));
    }

    private static String key(Registry registry, String packageName) {
        return registry.prefix() + ":" + packageName;
    }

    private record Entry(List<AvailableVersion> versions, Instant storedAt) {}
}
