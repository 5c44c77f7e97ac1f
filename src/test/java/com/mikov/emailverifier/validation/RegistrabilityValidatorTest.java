package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.exception.ConnectionException;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.providers.DomainsProvider;
import com.mikov.emailverifier.providers.ResourceDomainsProvider;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RegistrabilityValidatorTest {

    @Test
    void findsNothingBeforeFirstRefresh() {
        final var validator = new RegistrabilityValidator(() -> Set.of("com"), Set.of());

        assertThat(validator.findRegistrableDomain("example.com")).isNull();

        validator.refresh();
        assertThat(validator.findRegistrableDomain("example.com")).isEqualTo("example.com");
    }

    @Test
    void customRulesExtendProvidedRules() {
        final var validator = new RegistrabilityValidator(() -> Set.of("com"), Set.of("myhosting.com"));
        validator.refresh();

        assertThat(validator.findRegistrableDomain("myhosting.com")).isNull();
        assertThat(validator.check(new EmailParts("john", "", "shop.myhosting.com"), null).registrableDomain())
                .isEqualTo("shop.myhosting.com");
    }

    @Test
    void failedRefreshKeepsPreviousRules() {
        final var calls = new AtomicInteger();
        final DomainsProvider provider = () -> {
            if (calls.incrementAndGet() > 1) {
                throw new ConnectionException("list unavailable");
            }
            return Set.of("com");
        };
        final var validator = new RegistrabilityValidator(provider, Set.of());
        validator.refresh();

        assertThatThrownBy(validator::refresh).isInstanceOf(ConnectionException.class);
        assertThat(validator.findRegistrableDomain("example.com")).isEqualTo("example.com");
    }

    @Test
    void loadsBundledPublicSuffixList() {
        final var validator = new RegistrabilityValidator(
                new ResourceDomainsProvider(RegistrabilityValidator.MOZILLA_PSL_RESOURCE_FILE), Set.of());
        validator.refresh();

        assertThat(validator.findRegistrableDomain("www.bbc.co.uk")).isEqualTo("bbc.co.uk");
        assertThat(validator.findRegistrableDomain("co.uk")).isNull();
        assertThat(validator.findRegistrableDomain("foo.city.kawasaki.jp")).isEqualTo("city.kawasaki.jp");
        assertThat(validator.findRegistrableDomain("foo.kawasaki.jp")).isNull();
        assertThat(validator.findRegistrableDomain("user.github.io")).isEqualTo("user.github.io");
    }
}
