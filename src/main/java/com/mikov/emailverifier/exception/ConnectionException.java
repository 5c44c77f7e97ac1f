package com.mikov.emailverifier.exception;

/**
 * Signals that a check could not reach an external collaborator (DNS, HTTP endpoint,
 * SMTP server). Never used for a definitive negative verdict.
 */
public class ConnectionException extends RuntimeException {

    public ConnectionException(final String message) {
        super(message);
    }

    public ConnectionException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
