package com.mikov.emailverifier.smtp.dns;

import com.mikov.emailverifier.cache.MxRecordCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Serves repeated lookups from an {@link MxRecordCache}. Failed lookups are not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingMxLookupBackend implements MxLookupBackend {
    private final MxLookupBackend delegate;
    private final MxRecordCache cache;

    @Override
    public List<MxRecord> getMxRecords(final String hostname) {
        final var cached = cache.get(hostname);
        if (cached != null) {
            log.debug("Using cached MX records for {}", hostname);
            return cached;
        }
        final var records = delegate.getMxRecords(hostname);
        cache.put(hostname, records);
        return records;
    }
}
