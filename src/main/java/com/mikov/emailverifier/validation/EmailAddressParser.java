package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.exception.EmailFormatException;
import com.mikov.emailverifier.model.EmailParts;

import java.net.IDN;
import java.util.Locale;

/**
 * Splits raw input into username, plus-tag and hostname.
 */
public final class EmailAddressParser {

    private EmailAddressParser() {
    }

    /**
     * Parses an address. The local part is split at the first '+', the hostname is
     * converted to its ASCII-compatible form and lowercased.
     *
     * @param email the raw address
     * @return the parsed parts
     * @throws EmailFormatException if the input does not contain exactly one '@' or the
     *                              hostname cannot be IDNA-encoded
     */
    public static EmailParts parse(final String email) {
        if (email == null) {
            throw new EmailFormatException("Email is null");
        }
        final var at = email.indexOf('@');
        if (at < 0 || at != email.lastIndexOf('@')) {
            throw new EmailFormatException("Email must have exactly one @ character");
        }

        final var localPart = email.substring(0, at);
        final String hostname;
        try {
            hostname = IDN.toASCII(email.substring(at + 1)).toLowerCase(Locale.ROOT);
        } catch (final IllegalArgumentException e) {
            throw new EmailFormatException("Hostname cannot be encoded: " + e.getMessage());
        }

        final var plus = localPart.indexOf('+');
        if (plus < 0) {
            return new EmailParts(localPart, "", hostname);
        }
        return new EmailParts(localPart.substring(0, plus), localPart.substring(plus + 1), hostname);
    }
}
