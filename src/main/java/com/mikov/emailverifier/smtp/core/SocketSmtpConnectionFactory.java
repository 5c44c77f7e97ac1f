package com.mikov.emailverifier.smtp.core;

import com.mikov.emailverifier.smtp.model.SmtpConfig;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class SocketSmtpConnectionFactory implements SmtpConnectionFactory {
    private final SmtpConfig config;

    @Override
    public SmtpConnection create(String host, int port) {
        return new SocketSmtpConnection(host, port, config);
    }
}
