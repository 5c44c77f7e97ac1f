package com.mikov.emailverifier.model;

/**
 * Decomposed parts of a parsed email address.
 *
 * @param username the local part before the first '+'
 * @param plusTag  the sub-address after the first '+', empty when absent
 * @param hostname the domain in ASCII-compatible (punycode) form
 */
public record EmailParts(String username, String plusTag, String hostname) {

    public static final EmailParts EMPTY = new EmailParts("", "", "");

    /**
     * Address without the plus-tag, used for RCPT probes and avatar hashes.
     */
    public String toStringNoPlus() {
        return username + "@" + hostname;
    }

    @Override
    public String toString() {
        if (plusTag.isEmpty()) {
            return toStringNoPlus();
        }
        return username + "+" + plusTag + "@" + hostname;
    }
}
