package com.mikov.emailverifier.smtp.dns;

/**
 * A mail exchanger for a domain.
 *
 * @param exchange hostname of the mail server, without trailing dot
 * @param priority preference value, lower is more preferred
 */
public record MxRecord(String exchange, int priority) {
}
