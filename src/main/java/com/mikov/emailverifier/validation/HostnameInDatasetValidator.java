package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.DomainsProvider;

import java.net.IDN;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Looks up the hostname and each of its parent domains down to the second level,
 * so {@code a.b.mailinator.com} matches an entry for {@code mailinator.com}.
 * A single-label hostname yields no candidates and never matches. Allow and deny entries may be
 * given in Unicode.
 */
public class HostnameInDatasetValidator extends DatasetValidator {

    public HostnameInDatasetValidator(final String name, final DomainsProvider domainsProvider,
                                      final Collection<String> allowSet, final Collection<String> denySet) {
        super(name, domainsProvider, toAscii(allowSet), toAscii(denySet));
    }

    /**
     * Converts configured domains to the IDNA form used by hostnames and loaded lists.
     *
     * @throws IllegalArgumentException if an entry cannot be IDNA-encoded
     */
    private static List<String> toAscii(final Collection<String> domains) {
        return domains.stream()
                .map(String::trim)
                .filter(domain -> !domain.isEmpty())
                .map(domain -> IDN.toASCII(domain.toLowerCase(Locale.ROOT)))
                .toList();
    }

    @Override
    protected List<String> candidates(final EmailParts email) {
        final var labels = email.hostname().split("\\.");
        final var candidates = new ArrayList<String>();
        for (var i = 0; i <= labels.length - 2; i++) {
            candidates.add(String.join(".", Arrays.asList(labels).subList(i, labels.length)));
        }
        return candidates;
    }
}
