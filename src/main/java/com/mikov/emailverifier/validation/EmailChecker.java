package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.model.EmailParts;

/**
 * Interface for all checks run by the validation pipeline.
 * Defines the contract for a single check over a parsed address.
 *
 * @param <T> type of the data the check produces
 * @param <C> type of the extra context the check needs, {@link Void} when none
 */
public interface EmailChecker<T, C> {

    /**
     * Runs the check.
     *
     * @param email   the parsed address
     * @param context extra input, such as MX records for the SMTP probe
     * @return the data produced by the check
     */
    T check(final EmailParts email, final C context);

    /**
     * Returns the name of this check, used for identification in logs.
     *
     * @return The check name
     */
    String getName();
}
