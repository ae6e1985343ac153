package com.mikov.emailvalidator.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers MX lookup outcomes per domain. Entries never expire; they are only
 * dropped by {@link #clear()}. Disabling the cache stops reads and writes but keeps
 * whatever was stored, so re-enabling it serves the old entries again.
 */
public final class MxRecordCache {
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private volatile boolean enabled;

    public MxRecordCache(final boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return the cached outcome, or null when the cache is disabled or has no entry
     */
    public Boolean get(final String domain) {
        if (!enabled) {
            return null;
        }
        final var entry = cache.get(domain);
        return entry != null ? entry.hasMx : null;
    }

    public void put(final String domain, final boolean hasMx) {
        if (!enabled) {
            return;
        }
        cache.put(domain, new CacheEntry(hasMx, System.currentTimeMillis()));
    }

    public boolean contains(final String domain) {
        return cache.containsKey(domain);
    }

    /**
     * @return insertion time in epoch millis, or -1 when the domain was never cached
     */
    public long getCachedAt(final String domain) {
        final var entry = cache.get(domain);
        return entry != null ? entry.timestamp : -1L;
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(final boolean enabled) {
        this.enabled = enabled;
    }

    private static final class CacheEntry {
        private final boolean hasMx;
        private final long timestamp;

        private CacheEntry(final boolean hasMx, final long timestamp) {
            this.hasMx = hasMx;
            this.timestamp = timestamp;
        }
    }
}
