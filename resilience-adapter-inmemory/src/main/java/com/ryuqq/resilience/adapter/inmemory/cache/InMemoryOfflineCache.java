package com.ryuqq.resilience.adapter.inmemory.cache;

import com.ryuqq.resilience.core.model.CacheStats;
import com.ryuqq.resilience.core.spi.OfflineCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link OfflineCache} SPI.
 *
 * <p>Entries carry their own creation time and TTL. Expired entries are evicted lazily on read:
 * an entry is live while {@code now - createdAt <= ttl}.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * OfflineCache cache = new InMemoryOfflineCache();
 * cache.put("listWorkflows:{}", workflows, 60_000);
 *
 * Optional&lt;Object&gt; hit = cache.get("listWorkflows:{}");
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryOfflineCache implements OfflineCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOfflineCache.class);

    /**
     * Default TTL: 5 minutes.
     */
    public static final long DEFAULT_TTL_MS = 5 * 60 * 1000L;

    private final ConcurrentHashMap<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final long defaultTtlMs;
    private final Clock clock;

    public InMemoryOfflineCache() {
        this(DEFAULT_TTL_MS, Clock.systemUTC());
    }

    public InMemoryOfflineCache(long defaultTtlMs, Clock clock) {
        if (defaultTtlMs <= 0) {
            throw new IllegalArgumentException("defaultTtlMs must be positive (current: " + defaultTtlMs + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.defaultTtlMs = defaultTtlMs;
        this.clock = clock;
    }

    @Override
    public void put(String key, Object data) {
        put(key, data, defaultTtlMs);
    }

    @Override
    public void put(String key, Object data, long ttlMs) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
        entries.put(key, new CacheEntry(data, clock.millis(), ttlMs));
    }

    @Override
    public Optional<Object> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.millis() - entry.createdAt > entry.ttlMs) {
            entries.remove(key, entry);
            log.debug("Evicted expired cache entry: key={}", key);
            return Optional.empty();
        }
        return Optional.of(entry.data);
    }

    @Override
    public void invalidate(String key) {
        if (key != null) {
            entries.remove(key);
        }
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public CacheStats stats() {
        List<String> keys = new ArrayList<>(entries.keySet());
        Collections.sort(keys);
        return new CacheStats(keys.size(), keys);
    }

    @Override
    public long getDefaultTtlMs() {
        return defaultTtlMs;
    }

    private static final class CacheEntry {

        private final Object data;
        private final long createdAt;
        private final long ttlMs;

        private CacheEntry(Object data, long createdAt, long ttlMs) {
            this.data = data;
            this.createdAt = createdAt;
            this.ttlMs = ttlMs;
        }
    }
}
