package com.mikov.emailverifier.smtp.dns;

import com.mikov.emailverifier.exception.ConnectionException;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.MXRecord;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * MX lookups over plain DNS with dnsjava.
 */
@Slf4j
public class DnsJavaLookupBackend implements MxLookupBackend {
    private final Resolver resolver;

    /**
     * @param resolver resolver to query, or null for the system default
     */
    public DnsJavaLookupBackend(final Resolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public List<MxRecord> getMxRecords(final String hostname) {
        final Lookup lookup;
        try {
            lookup = new Lookup(hostname, Type.MX);
        } catch (final TextParseException e) {
            throw new IllegalArgumentException("Invalid hostname " + hostname, e);
        }
        if (resolver != null) {
            lookup.setResolver(resolver);
        }

        final var records = lookup.run();
        switch (lookup.getResult()) {
            case Lookup.SUCCESSFUL:
                return toMxRecords(records);
            case Lookup.HOST_NOT_FOUND:
            case Lookup.TYPE_NOT_FOUND:
                log.debug("No MX records for {}: {}", hostname, lookup.getErrorString());
                return List.of();
            default:
                log.error("DNS lookup for {} failed: {}", hostname, lookup.getErrorString());
                throw new ConnectionException("DNS lookup for " + hostname + " failed: " + lookup.getErrorString());
        }
    }

    static List<MxRecord> toMxRecords(final Record[] records) {
        final var mxRecords = new ArrayList<MxRecord>();
        if (records != null) {
            for (final var record : records) {
                if (record instanceof MXRecord) {
                    final var mx = (MXRecord) record;
                    mxRecords.add(new MxRecord(mx.getTarget().toString(true), mx.getPriority()));
                }
            }
        }
        mxRecords.sort(Comparator.comparingInt(MxRecord::priority));
        return mxRecords;
    }
}
