package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.SyntaxValidationData;
import com.mikov.emailverifier.model.EmailParts;

import java.util.regex.Pattern;

/**
 * Validator for the syntax of each address part.
 * Implements the practical subset of RFC 5322 (local part) and RFC 1035 (hostname)
 * needed to discard obviously invalid addresses.
 */
public class SyntaxValidator implements EmailChecker<SyntaxValidationData, Void> {

    private static final String ATEXT = "[A-Za-z0-9!#$%&'*+/=?^_`{|}~-]";
    private static final Pattern DOT_ATOM_PATTERN = Pattern.compile("^" + ATEXT + "+(\\." + ATEXT + "+)*$");
    private static final Pattern PLUS_TAG_PATTERN = Pattern.compile("^[A-Za-z0-9!#$%&'*+/=?^_`{|}~.-]+$");
    private static final Pattern HOSTNAME_LABEL_PATTERN = Pattern.compile("^[A-Za-z0-9-]+$");

    private static final int MAX_LOCAL_PART_LENGTH = 64;
    private static final int MAX_DOMAIN_LENGTH = 253;
    private static final int MAX_LABEL_LENGTH = 63;

    @Override
    public SyntaxValidationData check(final EmailParts email, final Void context) {
        return new SyntaxValidationData(
                isUsernameValid(email.username()),
                isPlusTagValid(email.plusTag()),
                isHostnameValid(email.hostname()));
    }

    /**
     * Accepts either a quoted string or a dot-atom of 1 to 64 characters.
     */
    public boolean isUsernameValid(final String username) {
        if (username.isEmpty() || username.length() > MAX_LOCAL_PART_LENGTH) {
            return false;
        }

        if (username.length() >= 2 && username.startsWith("\"") && username.endsWith("\"")) {
            final var inner = username.substring(1, username.length() - 1);
            var i = 0;
            while (i < inner.length()) {
                final var c = inner.charAt(i);
                if (c == '\\') {
                    // quoted-pair needs a following character
                    if (i + 1 >= inner.length()) {
                        return false;
                    }
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\r' || c == '\n') {
                    return false;
                }
                i++;
            }
            return true;
        }

        return DOT_ATOM_PATTERN.matcher(username).matches();
    }

    public boolean isPlusTagValid(final String plusTag) {
        return plusTag.isEmpty() || PLUS_TAG_PATTERN.matcher(plusTag).matches();
    }

    /**
     * Expects the hostname after IDNA conversion, so Unicode labels appear as punycode.
     */
    public boolean isHostnameValid(final String hostname) {
        if (hostname.isEmpty() || hostname.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }

        if (hostname.startsWith(".") || hostname.endsWith(".")) {
            return false;
        }

        for (final var label : hostname.split("\\.", -1)) {
            if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) {
                return false;
            }
            if (label.startsWith("-") || label.endsWith("-")) {
                return false;
            }
            if (!HOSTNAME_LABEL_PATTERN.matcher(label).matches()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getName() {
        return "syntax";
    }
}
