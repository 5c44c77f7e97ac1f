package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.ResourceDomainsProvider;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UsernameInDatasetValidatorTest {

    @Test
    void matchesRoleBasedUsernamesCaseInsensitively() {
        final var validator = new UsernameInDatasetValidator("role-based",
                new ResourceDomainsProvider("/offline-data/role-based.txt"), List.of("sales"), List.of("ceo"));
        validator.refresh();

        assertThat(validator.check(new EmailParts("Admin", "", "example.com"), null).match()).isTrue();
        assertThat(validator.check(new EmailParts("john", "", "example.com"), null).match()).isFalse();
        assertThat(validator.check(new EmailParts("sales", "", "example.com"), null).match()).isFalse();
        assertThat(validator.check(new EmailParts("ceo", "", "example.com"), null).match()).isTrue();
    }

    @Test
    void ignoresPlusTagAndHostname() {
        final var validator = new UsernameInDatasetValidator("role-based",
                new ResourceDomainsProvider("/offline-data/role-based.txt"), List.of(), List.of());
        validator.refresh();

        final var data = validator.check(new EmailParts("support", "tickets", "admin.example.com"), null);
        assertThat(data.match()).isTrue();
        assertThat(data.matchedOn()).isEqualTo("support");
    }
}
