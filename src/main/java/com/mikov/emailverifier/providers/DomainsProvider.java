package com.mikov.emailverifier.providers;

import java.util.Set;

/**
 * Source of a dataset: domain names, usernames or suffix rules.
 */
public interface DomainsProvider {

    /**
     * Loads the dataset.
     *
     * @return lowercase, ASCII-compatible entries
     */
    Set<String> provide();

    /**
     * Human readable origin of the data, used in logs.
     */
    default String getDescription() {
        return getClass().getSimpleName();
    }
}
