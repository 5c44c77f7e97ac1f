package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.DatasetData;
import com.mikov.emailverifier.model.EmailParts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.IDN;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class HostnameInDatasetValidatorTest {
    private HostnameInDatasetValidator validator;

    private static EmailParts email(final String hostname) {
        return new EmailParts("john", "", hostname);
    }

    @BeforeEach
    void setUp() {
        validator = new HostnameInDatasetValidator("disposable",
                () -> Set.of("mailinator.com", "yopmail.com"),
                List.of("Allowed.mailinator.com"),
                List.of("blocked.example.com"));
        validator.refresh();
    }

    @Test
    void matchesDatasetEntry() {
        final var data = validator.check(email("mailinator.com"), null);

        assertThat(data.match()).isTrue();
        assertThat(data.matchedOn()).isEqualTo("mailinator.com");
        assertThat(data.source()).isEqualTo(DatasetData.Source.DEFAULT);
    }

    @Test
    void matchesParentDomain() {
        final var data = validator.check(email("a.b.mailinator.com"), null);

        assertThat(data.match()).isTrue();
        assertThat(data.matchedOn()).isEqualTo("mailinator.com");
    }

    @Test
    void allowSetWinsOverDataset() {
        final var data = validator.check(email("allowed.mailinator.com"), null);

        assertThat(data.match()).isFalse();
        assertThat(data.source()).isEqualTo(DatasetData.Source.ALLOW);
    }

    @Test
    void denySetMatchesOutsideDataset() {
        final var data = validator.check(email("mx.blocked.example.com"), null);

        assertThat(data.match()).isTrue();
        assertThat(data.matchedOn()).isEqualTo("blocked.example.com");
        assertThat(data.source()).isEqualTo(DatasetData.Source.DENY);
    }

    @Test
    void unknownHostnameDoesNotMatch() {
        assertThat(validator.check(email("example.com"), null)).isEqualTo(DatasetData.noMatch());
    }

    @Test
    void singleLabelHostnameNeverMatches() {
        final var validator = new HostnameInDatasetValidator("free", () -> Set.of("localhost"), List.of(), List.of());
        validator.refresh();

        assertThat(validator.check(email("localhost"), null).match()).isFalse();
    }

    @Test
    void allowWinsWhenKeyIsAlsoDenied() {
        final var validator = new HostnameInDatasetValidator("free", Set::of,
                List.of("gmail.com"), List.of("gmail.com"));
        validator.refresh();

        assertThat(validator.check(email("gmail.com"), null).match()).isFalse();
        assertThat(validator.getName()).isEqualTo("free");
        assertThat(validator.size()).isZero();
    }

    @Test
    void unicodeAllowAndDenyEntriesMatchPunycodeHostnames() {
        final var allowed = IDN.toASCII("пример.рф");
        final var denied = IDN.toASCII("почта.рф");
        final var validator = new HostnameInDatasetValidator("disposable", () -> Set.of(allowed),
                List.of("Пример.рф"), List.of(" почта.рф "));
        validator.refresh();

        final var allowedData = validator.check(email("mail." + allowed), null);
        assertThat(allowedData.match()).isFalse();
        assertThat(allowedData.matchedOn()).isEqualTo(allowed);
        assertThat(allowedData.source()).isEqualTo(DatasetData.Source.ALLOW);

        final var deniedData = validator.check(email(denied), null);
        assertThat(deniedData.match()).isTrue();
        assertThat(deniedData.source()).isEqualTo(DatasetData.Source.DENY);
    }
}
