package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.RegistrabilityData;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.DomainsProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Validator that checks whether the hostname sits below a public suffix.
 * Rules come from a {@link DomainsProvider} in public suffix list format; custom rules are
 * applied after the provider's so they can add to or override it.
 */
@Slf4j
public class RegistrabilityValidator implements EmailChecker<RegistrabilityData, Void>, Refreshable {

    public static final String MOZILLA_PSL_URL = "https://publicsuffix.org/list/public_suffix_list.dat";
    public static final String MOZILLA_PSL_RESOURCE_FILE = "/offline-data/psl.txt";

    private final DomainsProvider domainsProvider;
    private final Set<String> customRules;
    private final AtomicReference<SuffixTrie> trie = new AtomicReference<>(SuffixTrie.empty());

    public RegistrabilityValidator(final DomainsProvider domainsProvider, final Set<String> customRules) {
        this.domainsProvider = domainsProvider;
        this.customRules = Set.copyOf(customRules);
    }

    @Override
    public synchronized void refresh() {
        log.debug("Building suffix trie from {}", domainsProvider.getDescription());
        final var rules = domainsProvider.provide();
        final var builder = SuffixTrie.builder().addAll(rules);
        if (!customRules.isEmpty()) {
            log.debug("Adding {} custom suffix rules", customRules.size());
            builder.addAll(customRules);
        }
        final var built = builder.build();
        trie.set(built);
        log.info("Suffix trie built with {} rules ({} skipped)", built.getRuleCount(), builder.getRejected().size());
    }

    public String findRegistrableDomain(final String hostname) {
        final var registrableDomain = trie.get().findRegistrableDomain(hostname);
        log.trace("Registrable domain of {}: {}", hostname, registrableDomain);
        return registrableDomain;
    }

    @Override
    public RegistrabilityData check(final EmailParts email, final Void context) {
        return new RegistrabilityData(findRegistrableDomain(email.hostname()));
    }

    @Override
    public String getName() {
        return "registrability";
    }
}
