package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.DatasetData;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.DomainsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Base class for validators that look part of an address up in a dataset.
 * Precedence is allow over deny over the loaded dataset; a key present in both the allow
 * and the deny set is allowed.
 */
public abstract class DatasetValidator implements EmailChecker<DatasetData, Void>, Refreshable {
    private static final Logger logger = LoggerFactory.getLogger(DatasetValidator.class);

    private final String name;
    private final DomainsProvider domainsProvider;
    private final Set<String> allowSet;
    private final Set<String> denySet;
    private final AtomicReference<Set<String>> dataset = new AtomicReference<>(Set.of());

    protected DatasetValidator(final String name, final DomainsProvider domainsProvider,
                               final Collection<String> allowSet, final Collection<String> denySet) {
        this.name = name;
        this.domainsProvider = domainsProvider;
        this.allowSet = normalize(allowSet);
        this.denySet = normalize(denySet);
    }

    /**
     * Keys to look up, in evaluation order.
     */
    protected abstract List<String> candidates(final EmailParts email);

    @Override
    public synchronized void refresh() {
        final var loaded = Set.copyOf(domainsProvider.provide());
        dataset.set(loaded);
        logger.info("[{}] Loaded {} entries from {}", name, loaded.size(), domainsProvider.getDescription());
    }

    @Override
    public DatasetData check(final EmailParts email, final Void context) {
        final var candidates = candidates(email);

        final var allowed = firstIn(candidates, allowSet);
        if (allowed.isPresent()) {
            logger.trace("[{}] {} is in the allow set", name, allowed.get());
            return new DatasetData(false, allowed.get(), DatasetData.Source.ALLOW);
        }

        final var denied = firstIn(candidates, denySet);
        if (denied.isPresent()) {
            logger.trace("[{}] {} is in the deny set", name, denied.get());
            return new DatasetData(true, denied.get(), DatasetData.Source.DENY);
        }

        final var matched = firstIn(candidates, dataset.get());
        logger.trace("[{}] Matched in dataset: {}", name, matched.orElse(null));
        return matched
                .map(candidate -> new DatasetData(true, candidate, DatasetData.Source.DEFAULT))
                .orElseGet(DatasetData::noMatch);
    }

    public int size() {
        return dataset.get().size();
    }

    @Override
    public String getName() {
        return name;
    }

    private static Optional<String> firstIn(final List<String> candidates, final Set<String> set) {
        return candidates.stream().filter(set::contains).findFirst();
    }

    private static Set<String> normalize(final Collection<String> values) {
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .filter(value -> !value.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
