package com.mikov.emailverifier.exception;

/**
 * Thrown when an address cannot be split into local part and hostname.
 */
public class EmailFormatException extends IllegalArgumentException {

    public EmailFormatException(final String message) {
        super(message);
    }
}
