package com.tenantgate.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Holds the last fetched snapshot of one tenant controller together with its hash.
 * A snapshot is reused while it is younger than the TTL and belongs to the same user.
 * Not thread-safe; the owning controller serializes access.
 */
public class ConfigCache {

    private static final Logger log = LoggerFactory.getLogger(ConfigCache.class);

    private final ConfigFetcher fetcher;
    private final Duration ttl;
    private final Clock clock;

    private CachedConfig current;

    public ConfigCache(ConfigFetcher fetcher, Duration ttl, Clock clock) {
        this.fetcher = fetcher;
        this.ttl = ttl;
        this.clock = clock;
    }

    public CachedConfig current(String tenantId, String userId) {
        Instant now = clock.instant();
        if (current != null
                && current.snapshot().isFor(tenantId, userId)
                && now.isBefore(current.fetchedAt().plus(ttl))) {
            return current;
        }
        ConfigSnapshot snapshot = fetcher.fetch(tenantId, userId);
        current = new CachedConfig(snapshot, ConfigHasher.hash(snapshot), now);
        log.debug("Fetched config for tenant {} user {}: {} skills, {} connectors, hash {}",
                tenantId, userId, snapshot.skills().size(), snapshot.connectors().size(), current.hash());
        return current;
    }

    public void invalidate() {
        current = null;
    }

    public record CachedConfig(ConfigSnapshot snapshot, String hash, Instant fetchedAt) {}
}
