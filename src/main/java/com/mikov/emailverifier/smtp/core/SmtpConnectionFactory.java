package com.mikov.emailverifier.smtp.core;

@FunctionalInterface
public interface SmtpConnectionFactory {

    /**
     * Creates a session to the given mail exchanger. Nothing is sent until {@link SmtpConnection#open()}.
     */
    SmtpConnection create(String host, int port);
}
