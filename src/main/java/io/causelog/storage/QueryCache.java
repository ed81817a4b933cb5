package io.causelog.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Duration;

/**
 * Size-bounded read cache with a time-to-live, owned by one {@link EventStore}.
 *
 * <p>Entries expire {@code ttlMs} after they were written regardless of how often they are
 * read. The cache is not linked to writes: single-event stores leave it untouched, bulk
 * stores clear it.
 */
public final class QueryCache {
    private final int maxSize;
    private final long ttlMs;
    private final Cache<String, Object> entries;

    public QueryCache(int maxSize, long ttlMs) {
        this(maxSize, ttlMs, Ticker.systemTicker());
    }

    public QueryCache(int maxSize, long ttlMs, Ticker ticker) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        if (ttlMs <= 0L) {
            throw new IllegalArgumentException("ttlMs must be positive");
        }
        this.maxSize = maxSize;
        this.ttlMs = ttlMs;
        // Maintenance runs on the caller so size() and eviction stay deterministic.
        this.entries = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(Duration.ofMillis(ttlMs))
                .ticker(ticker)
                .executor(Runnable::run)
                .build();
    }

    public Object get(String key) {
        return entries.getIfPresent(key);
    }

    public void put(String key, Object value) {
        entries.put(key, value);
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    public int maxSize() {
        return maxSize;
    }

    public long ttlMs() {
        return ttlMs;
    }
}
