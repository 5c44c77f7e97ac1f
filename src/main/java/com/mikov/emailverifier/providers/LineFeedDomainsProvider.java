package com.mikov.emailverifier.providers;

import lombok.extern.slf4j.Slf4j;

import java.net.IDN;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Provider for line-separated sources. Empty lines and lines starting with "//" are ignored,
 * the rest are lowercased and converted to ASCII with IDNA.
 */
@Slf4j
public abstract class LineFeedDomainsProvider implements DomainsProvider {

    /**
     * Fetches the raw text of the source.
     */
    protected abstract String obtainData();

    @Override
    public Set<String> provide() {
        final var entries = new LinkedHashSet<String>();
        var skipped = 0;
        for (final var line : obtainData().split("\\R")) {
            final var trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("//")) {
                continue;
            }
            try {
                entries.add(IDN.toASCII(trimmed.toLowerCase(Locale.ROOT)));
            } catch (final IllegalArgumentException e) {
                log.warn("Skipping line that cannot be IDNA-encoded: {} ({})", trimmed, e.getMessage());
                skipped++;
            }
        }
        log.debug("Parsed {} entries from {} ({} skipped)", entries.size(), getDescription(), skipped);
        return entries;
    }
}
