package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.exception.EmailFormatException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmailAddressParserTest {

    @Test
    void splitsUsernamePlusTagAndHostname() {
        final var parts = EmailAddressParser.parse("john.doe+news@Example.COM");

        assertThat(parts.username()).isEqualTo("john.doe");
        assertThat(parts.plusTag()).isEqualTo("news");
        assertThat(parts.hostname()).isEqualTo("example.com");
        assertThat(parts.toString()).isEqualTo("john.doe+news@example.com");
        assertThat(parts.toStringNoPlus()).isEqualTo("john.doe@example.com");
    }

    @Test
    void splitsAtFirstPlusOnly() {
        final var parts = EmailAddressParser.parse("a+b+c@example.com");

        assertThat(parts.username()).isEqualTo("a");
        assertThat(parts.plusTag()).isEqualTo("b+c");
    }

    @Test
    void plusTagIsEmptyWhenAbsent() {
        final var parts = EmailAddressParser.parse("john@example.com");

        assertThat(parts.plusTag()).isEmpty();
        assertThat(parts.toString()).isEqualTo("john@example.com");
    }

    @Test
    void convertsUnicodeHostnameToPunycode() {
        final var parts = EmailAddressParser.parse("user@bücher.de");

        assertThat(parts.hostname()).isEqualTo("xn--bcher-kva.de");
    }

    @Test
    void rejectsInputWithoutExactlyOneAt() {
        assertThatThrownBy(() -> EmailAddressParser.parse("bad@@example.com"))
                .isInstanceOf(EmailFormatException.class);
        assertThatThrownBy(() -> EmailAddressParser.parse("no-at-sign"))
                .isInstanceOf(EmailFormatException.class);
        assertThatThrownBy(() -> EmailAddressParser.parse(null))
                .isInstanceOf(EmailFormatException.class);
    }
}
