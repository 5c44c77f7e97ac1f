package com.mikov.emailverifier.smtp.dns;

import java.util.List;

/**
 * Backend for MX record lookups.
 */
public interface MxLookupBackend {

    /**
     * Retrieves the mail exchangers of a hostname.
     *
     * @param hostname the domain to query
     * @return records sorted by ascending priority value; empty when the domain has none
     * @throws com.mikov.emailverifier.exception.ConnectionException if the lookup itself fails
     */
    List<MxRecord> getMxRecords(final String hostname);
}
