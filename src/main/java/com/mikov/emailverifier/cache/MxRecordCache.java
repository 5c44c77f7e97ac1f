package com.mikov.emailverifier.cache;

import com.mikov.emailverifier.smtp.dns.MxRecord;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Time-bounded cache of MX lookups keyed by hostname.
 */
public final class MxRecordCache {
    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final long ttl;
    private final int maxSize;
    private final LongSupplier clock;

    public MxRecordCache(final long ttl, final int maxSize) {
        this(ttl, maxSize, System::currentTimeMillis);
    }

    MxRecordCache(final long ttl, final int maxSize, final LongSupplier clock) {
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    public List<MxRecord> get(final String hostname) {
        final var entry = cache.get(hostname);
        if (entry != null && !isExpired(entry)) {
            return entry.records;
        }
        return null;
    }

    public void put(final String hostname, final List<MxRecord> records) {
        if (cache.size() >= maxSize) {
            cleanup();
        }
        cache.put(hostname, new CacheEntry(List.copyOf(records), clock.getAsLong()));
    }

    public int size() {
        return cache.size();
    }

    private boolean isExpired(final CacheEntry entry) {
        return clock.getAsLong() - entry.timestamp > ttl;
    }

    private void cleanup() {
        cache.entrySet().removeIf(entry -> isExpired(entry.getValue()));
        if (cache.size() >= maxSize) {
            cache.clear();
        }
    }

    private static final class CacheEntry {
        private final List<MxRecord> records;
        private final long timestamp;

        CacheEntry(final List<MxRecord> records, final long timestamp) {
            this.records = records;
            this.timestamp = timestamp;
        }
    }
}
