package io.causelog.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.causelog.model.MissingParentPolicy;
import io.causelog.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public record StoreSettings(
        boolean walEnabled,
        Cache cache,
        Indexes indexes,
        MissingParentPolicy missingParentPolicy,
        boolean allowReset,
        int pageSize
) {
    public static final int DEFAULT_CACHE_MAX_SIZE = 1000;
    public static final long DEFAULT_CACHE_TTL_MS = 300_000L;
    public static final int DEFAULT_PAGE_SIZE = 1000;

    public StoreSettings {
        if (cache == null) {
            cache = Cache.defaults();
        }
        if (indexes == null) {
            indexes = Indexes.defaults();
        }
        if (missingParentPolicy == null) {
            missingParentPolicy = MissingParentPolicy.NEW_CORRELATION;
        }
        if (pageSize <= 0) {
            pageSize = DEFAULT_PAGE_SIZE;
        }
    }

    public static StoreSettings defaults() {
        return new StoreSettings(true, Cache.defaults(), Indexes.defaults(),
                MissingParentPolicy.NEW_CORRELATION, false, DEFAULT_PAGE_SIZE);
    }

    /**
     * Reads the settings file, falling back to {@link #defaults()} for a missing file and for
     * every field the file leaves out.
     */
    public static StoreSettings load(Path file) {
        StoreSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings file: " + file, e);
        }
    }

    static StoreSettings fromFile(SettingsFile file, StoreSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Cache cache = defaults.cache();
        if (file.cache() != null) {
            CacheFile c = file.cache();
            cache = new Cache(
                    c.enabled() == null ? cache.enabled() : c.enabled(),
                    c.maxSize() == null ? cache.maxSize() : c.maxSize(),
                    c.ttlMs() == null ? cache.ttlMs() : c.ttlMs()
            );
        }
        Indexes indexes = defaults.indexes();
        if (file.indexes() != null) {
            IndexesFile i = file.indexes();
            indexes = new Indexes(
                    pick(i.correlationId(), indexes.correlationId()),
                    pick(i.causationId(), indexes.causationId()),
                    pick(i.command(), indexes.command()),
                    pick(i.actor(), indexes.actor()),
                    pick(i.timestamp(), indexes.timestamp()),
                    pick(i.version(), indexes.version()),
                    pick(i.correlationCommand(), indexes.correlationCommand()),
                    pick(i.actorTimestamp(), indexes.actorTimestamp())
            );
        }
        return new StoreSettings(
                pick(file.walEnabled(), defaults.walEnabled()),
                cache,
                indexes,
                file.missingParentPolicy() == null
                        ? defaults.missingParentPolicy()
                        : MissingParentPolicy.fromString(file.missingParentPolicy()),
                pick(file.allowReset(), defaults.allowReset()),
                file.pageSize() == null ? defaults.pageSize() : file.pageSize()
        );
    }

    private static boolean pick(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    public StoreSettings withWalEnabled(boolean walEnabled) {
        return new StoreSettings(walEnabled, cache, indexes, missingParentPolicy, allowReset, pageSize);
    }

    public StoreSettings withCache(Cache cache) {
        return new StoreSettings(walEnabled, cache, indexes, missingParentPolicy, allowReset, pageSize);
    }

    public StoreSettings withIndexes(Indexes indexes) {
        return new StoreSettings(walEnabled, cache, indexes, missingParentPolicy, allowReset, pageSize);
    }

    public StoreSettings withMissingParentPolicy(MissingParentPolicy policy) {
        return new StoreSettings(walEnabled, cache, indexes, policy, allowReset, pageSize);
    }

    public StoreSettings withAllowReset(boolean allowReset) {
        return new StoreSettings(walEnabled, cache, indexes, missingParentPolicy, allowReset, pageSize);
    }

    public StoreSettings withPageSize(int pageSize) {
        return new StoreSettings(walEnabled, cache, indexes, missingParentPolicy, allowReset, pageSize);
    }

    public record Cache(boolean enabled, int maxSize, long ttlMs) {
        public Cache {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("cache maxSize must be positive");
            }
            if (ttlMs <= 0L) {
                throw new IllegalArgumentException("cache ttlMs must be positive");
            }
        }

        public static Cache defaults() {
            return new Cache(true, DEFAULT_CACHE_MAX_SIZE, DEFAULT_CACHE_TTL_MS);
        }

        public static Cache disabled() {
            return new Cache(false, DEFAULT_CACHE_MAX_SIZE, DEFAULT_CACHE_TTL_MS);
        }
    }

    /**
     * Secondary index toggles. The lineage queries lean on the correlation and causation
     * indices, so those two default to on; the rest trade write speed for read speed.
     */
    public record Indexes(
            boolean correlationId,
            boolean causationId,
            boolean command,
            boolean actor,
            boolean timestamp,
            boolean version,
            boolean correlationCommand,
            boolean actorTimestamp
    ) {
        public static Indexes defaults() {
            return new Indexes(true, true, false, false, false, false, false, false);
        }

        public static Indexes all() {
            return new Indexes(true, true, true, true, true, true, true, true);
        }

        public static Indexes none() {
            return new Indexes(false, false, false, false, false, false, false, false);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Boolean walEnabled,
            CacheFile cache,
            IndexesFile indexes,
            String missingParentPolicy,
            Boolean allowReset,
            Integer pageSize
    ) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CacheFile(Boolean enabled, Integer maxSize, Long ttlMs) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record IndexesFile(
            Boolean correlationId,
            Boolean causationId,
            Boolean command,
            Boolean actor,
            Boolean timestamp,
            Boolean version,
            Boolean correlationCommand,
            Boolean actorTimestamp
    ) {
    }
}
