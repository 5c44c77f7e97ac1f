package com.mikov.emailverifier.config;

import com.mikov.emailverifier.smtp.core.SmtpConnectionFactory;
import com.mikov.emailverifier.smtp.core.SocketSmtpConnectionFactory;
import com.mikov.emailverifier.smtp.model.ProxyConfig;
import com.mikov.emailverifier.smtp.model.SmtpConfig;
import com.mikov.emailverifier.smtp.verification.SmtpVerifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SmtpConfiguration {

    @Bean
    public SmtpConfig smtpConfig(final EmailVerifierProperties properties) {
        final var smtp = properties.getSmtp();
        final var builder = SmtpConfig.builder()
                .timeout(smtp.getTimeout())
                .maxRetries(smtp.getMaxRetries())
                .catchAllCheck(smtp.isCatchAllCheck())
                .heloDomain(smtp.getHeloDomain())
                .fromEmail(smtp.getFromEmail());
        if (smtp.getProxyHost() != null && !smtp.getProxyHost().isBlank()) {
            builder.proxy(ProxyConfig.builder()
                    .host(smtp.getProxyHost())
                    .port(smtp.getProxyPort())
                    .build());
        }
        return builder.build();
    }

    @Bean
    public SmtpConnectionFactory smtpConnectionFactory(final SmtpConfig config) {
        return new SocketSmtpConnectionFactory(config);
    }

    @Bean
    public SmtpVerifier smtpVerifier(final SmtpConnectionFactory connectionFactory, final SmtpConfig config) {
        return new SmtpVerifier(connectionFactory, config);
    }
}
