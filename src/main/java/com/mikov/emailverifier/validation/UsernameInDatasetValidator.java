package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.DomainsProvider;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Looks up the username, case-insensitively, as a single exact key.
 */
public class UsernameInDatasetValidator extends DatasetValidator {

    public UsernameInDatasetValidator(final String name, final DomainsProvider domainsProvider,
                                      final Collection<String> allowSet, final Collection<String> denySet) {
        super(name, domainsProvider, allowSet, denySet);
    }

    @Override
    protected List<String> candidates(final EmailParts email) {
        return List.of(email.username().toLowerCase(Locale.ROOT));
    }
}
