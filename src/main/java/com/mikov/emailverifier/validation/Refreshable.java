package com.mikov.emailverifier.validation;

/**
 * A check backed by a dataset that can be reloaded at runtime.
 */
public interface Refreshable {

    /**
     * Reloads the dataset and publishes it atomically. On failure the previous
     * dataset stays in effect and the error propagates.
     */
    void refresh();
}
