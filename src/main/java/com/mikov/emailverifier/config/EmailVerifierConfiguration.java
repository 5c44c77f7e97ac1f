package com.mikov.emailverifier.config;

import com.mikov.emailverifier.http.HttpTextFetcher;
import com.mikov.emailverifier.smtp.dns.MxLookupBackend;
import com.mikov.emailverifier.smtp.verification.SmtpVerifier;
import com.mikov.emailverifier.validation.EmailValidationPipeline;
import com.mikov.emailverifier.validation.GravatarValidator;
import com.mikov.emailverifier.validation.HostnameInDatasetValidator;
import com.mikov.emailverifier.validation.MxRecordValidator;
import com.mikov.emailverifier.validation.RegistrabilityValidator;
import com.mikov.emailverifier.validation.SmtpValidator;
import com.mikov.emailverifier.validation.SyntaxValidator;
import com.mikov.emailverifier.validation.UsernameInDatasetValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Assembles the validation pipeline from {@link EmailVerifierProperties}. Disabled checks are
 * left out of the pipeline; dataset-backed checks are loaded before the bean is handed out.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EmailVerifierProperties.class)
public class EmailVerifierConfiguration {

    @Bean
    public DomainsProviderFactory domainsProviderFactory(final EmailVerifierProperties properties,
                                                         final HttpTextFetcher httpTextFetcher) {
        return new DomainsProviderFactory(properties, httpTextFetcher);
    }

    @Bean
    public EmailValidationPipeline emailValidationPipeline(final EmailVerifierProperties properties,
                                                           final DomainsProviderFactory providerFactory,
                                                           final ThreadPoolTaskExecutor verificationExecutor,
                                                           final MxLookupBackend mxLookupBackend,
                                                           final RestTemplate restTemplate,
                                                           final SmtpVerifier smtpVerifier) {
        final var builder = EmailValidationPipeline.builder()
                .executor(verificationExecutor)
                .syntaxValidator(new SyntaxValidator());

        final var registrability = properties.getRegistrability();
        if (registrability.isEnabled()) {
            builder.registrabilityValidator(new RegistrabilityValidator(
                    providerFactory.create(registrability), registrability.getCustomRules()));
        }
        final var disposable = properties.getDisposable();
        if (disposable.isEnabled()) {
            builder.disposableValidator(new HostnameInDatasetValidator("disposable",
                    providerFactory.create(disposable), disposable.getAllow(), disposable.getDeny()));
        }
        final var free = properties.getFree();
        if (free.isEnabled()) {
            builder.freeValidator(new HostnameInDatasetValidator("free",
                    providerFactory.create(free), free.getAllow(), free.getDeny()));
        }
        final var roleBased = properties.getRoleBased();
        if (roleBased.isEnabled()) {
            builder.roleBasedValidator(new UsernameInDatasetValidator("role-based",
                    providerFactory.create(roleBased), roleBased.getAllow(), roleBased.getDeny()));
        }
        if (properties.isMxActive()) {
            builder.mxRecordValidator(new MxRecordValidator(mxLookupBackend));
        }
        if (properties.isGravatarActive()) {
            builder.gravatarValidator(new GravatarValidator(restTemplate, properties.getGravatar().getBaseUrl()));
        }
        if (properties.isSmtpActive()) {
            builder.smtpValidator(new SmtpValidator(smtpVerifier));
        }

        final var pipeline = builder.build();
        log.info("Loading datasets (offline: {})", properties.isOffline());
        pipeline.refreshAll();
        return pipeline;
    }
}
