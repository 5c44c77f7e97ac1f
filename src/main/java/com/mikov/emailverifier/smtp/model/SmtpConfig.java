package com.mikov.emailverifier.smtp.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;

@Getter
@Builder
public class SmtpConfig {
    private final Duration timeout;
    private final int maxRetries;
    private final boolean catchAllCheck;
    private final String heloDomain;
    private final String fromEmail;
    private final ProxyConfig proxy;
}
