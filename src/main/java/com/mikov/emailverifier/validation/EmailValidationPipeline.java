package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.DatasetData;
import com.mikov.emailverifier.dtos.GravatarData;
import com.mikov.emailverifier.dtos.MxRecordData;
import com.mikov.emailverifier.dtos.RegistrabilityData;
import com.mikov.emailverifier.dtos.SmtpData;
import com.mikov.emailverifier.dtos.SyntaxValidationData;
import com.mikov.emailverifier.exception.EmailFormatException;
import com.mikov.emailverifier.model.CheckResult;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.model.EmailValidationResult;
import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.verification.CancellationHandle;
import lombok.Builder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * Pipeline that runs every enabled check for an address, in parallel where the checks are independent.
 * <p>
 * Syntax is validated first and gates the rest: hostname checks need a valid hostname, the
 * role-based check needs a valid username, and Gravatar needs both. SMTP runs after the MX lookup
 * and only when it found records. A checker passed as {@code null} is disabled and its result is
 * always {@link CheckResult.Skipped}.
 */
public class EmailValidationPipeline {
    private static final Logger logger = LoggerFactory.getLogger(EmailValidationPipeline.class);

    private final Executor executor;
    private final SyntaxValidator syntaxValidator;
    private final RegistrabilityValidator registrabilityValidator;
    private final MxRecordValidator mxRecordValidator;
    private final HostnameInDatasetValidator disposableValidator;
    private final GravatarValidator gravatarValidator;
    private final HostnameInDatasetValidator freeValidator;
    private final UsernameInDatasetValidator roleBasedValidator;
    private final SmtpValidator smtpValidator;

    @Builder
    public EmailValidationPipeline(final Executor executor,
                                   final SyntaxValidator syntaxValidator,
                                   final RegistrabilityValidator registrabilityValidator,
                                   final MxRecordValidator mxRecordValidator,
                                   final HostnameInDatasetValidator disposableValidator,
                                   final GravatarValidator gravatarValidator,
                                   final HostnameInDatasetValidator freeValidator,
                                   final UsernameInDatasetValidator roleBasedValidator,
                                   final SmtpValidator smtpValidator) {
        this.executor = executor != null ? executor : Runnable::run;
        this.syntaxValidator = syntaxValidator != null ? syntaxValidator : new SyntaxValidator();
        this.registrabilityValidator = registrabilityValidator;
        this.mxRecordValidator = mxRecordValidator;
        this.disposableValidator = disposableValidator;
        this.gravatarValidator = gravatarValidator;
        this.freeValidator = freeValidator;
        this.roleBasedValidator = roleBasedValidator;
        this.smtpValidator = smtpValidator;
    }

    /**
     * Verifies one address. Interrupting the calling thread cancels the checks still running
     * and closes any open SMTP connection.
     *
     * @throws CancellationException if the calling thread was interrupted while waiting;
     *                               the interrupt flag is restored
     */
    public EmailValidationResult verify(final String email) {
        logger.info("Starting verification for email: {}", email);

        final EmailParts emailParts;
        try {
            emailParts = EmailAddressParser.parse(email);
        } catch (final EmailFormatException e) {
            logger.warn("Failed to parse email: {}. Reason: {}", email, e.getMessage());
            return EmailValidationResult.builder()
                    .email(email)
                    .emailParts(EmailParts.EMPTY)
                    .syntax(CheckResult.failed(new SyntaxValidationData(false, false, false)))
                    .build();
        }
        logger.debug("Parsed email parts: {}", emailParts);

        final var syntaxData = syntaxValidator.check(emailParts, null);
        final CheckResult<SyntaxValidationData> syntax = syntaxData.isValid()
                ? CheckResult.passed(syntaxData)
                : CheckResult.failed(syntaxData);
        logger.debug("Syntax check result: {}", syntax);

        final var hostnameValid = syntaxData.hostname();
        final var usernameValid = syntaxData.username();

        final CompletableFuture<CheckResult<RegistrabilityData>> registrability = submit(
                registrabilityValidator, emailParts, hostnameValid, data -> data.registrableDomain() != null);
        final CompletableFuture<CheckResult<DatasetData>> disposable = submit(
                disposableValidator, emailParts, hostnameValid, data -> !data.match());
        final CompletableFuture<CheckResult<DatasetData>> free = submit(
                freeValidator, emailParts, hostnameValid, data -> !data.match());
        final CompletableFuture<CheckResult<DatasetData>> roleBased = submit(
                roleBasedValidator, emailParts, usernameValid, data -> !data.match());
        final CompletableFuture<CheckResult<GravatarData>> gravatar = submit(
                gravatarValidator, emailParts, usernameValid && hostnameValid, data -> data.gravatarUrl() != null);
        final CompletableFuture<CheckResult<MxRecordData>> mx = submit(
                mxRecordValidator, emailParts, hostnameValid, data -> !data.records().isEmpty());

        final var smtpCancellation = new CancellationHandle();
        final CompletableFuture<CheckResult<SmtpData>> smtp = mx.thenApplyAsync(mxResult -> runCheck(
                smtpValidator,
                emailParts,
                new SmtpValidator.Request(mxRecords(mxResult), smtpCancellation),
                usernameValid && hostnameValid && mxResult.isPassed(),
                SmtpData::isDeliverable), executor);

        final List<CompletableFuture<?>> checks = List.of(registrability, disposable, free, roleBased, gravatar, mx, smtp);
        try {
            CompletableFuture.allOf(checks.toArray(new CompletableFuture<?>[0])).get();
        } catch (final InterruptedException e) {
            logger.warn("Verification interrupted for email: {}", email);
            smtpCancellation.cancel();
            checks.forEach(check -> check.cancel(true));
            Thread.currentThread().interrupt();
            final var cancelled = new CancellationException("Verification interrupted for " + email);
            cancelled.initCause(e);
            throw cancelled;
        } catch (final ExecutionException e) {
            throw new IllegalStateException("Check failed outside its error handling for " + email, e.getCause());
        }

        final var result = EmailValidationResult.builder()
                .email(email)
                .emailParts(emailParts)
                .syntax(syntax)
                .registrability(registrability.join())
                .mx(mx.join())
                .disposable(disposable.join())
                .gravatar(gravatar.join())
                .free(free.join())
                .roleBasedUsername(roleBased.join())
                .smtp(smtp.join())
                .build();
        logger.info("Verification finished for email: {}. Likely deliverable: {}", email, result.isLikelyDeliverable());
        return result;
    }

    /**
     * Reloads every enabled dataset-backed validator. Stops at the first failure and rethrows it;
     * validators already refreshed keep their new data, the rest keep their old data.
     */
    public void refreshAll() {
        for (final var refreshable : refreshables()) {
            refreshable.refresh();
        }
    }

    private List<Refreshable> refreshables() {
        final var refreshables = new ArrayList<Refreshable>();
        if (registrabilityValidator != null) {
            refreshables.add(registrabilityValidator);
        }
        if (disposableValidator != null) {
            refreshables.add(disposableValidator);
        }
        if (freeValidator != null) {
            refreshables.add(freeValidator);
        }
        if (roleBasedValidator != null) {
            refreshables.add(roleBasedValidator);
        }
        return refreshables;
    }

    private <T> CompletableFuture<CheckResult<T>> submit(final EmailChecker<T, Void> checker,
                                                         final EmailParts emailParts,
                                                         final boolean condition,
                                                         final Predicate<T> successCondition) {
        return CompletableFuture.supplyAsync(
                () -> runCheck(checker, emailParts, null, condition, successCondition), executor);
    }

    private static List<MxRecord> mxRecords(final CheckResult<MxRecordData> mxResult) {
        return mxResult.payload().map(MxRecordData::records).orElse(List.of());
    }

    private static <T, C> CheckResult<T> runCheck(final EmailChecker<T, C> checker,
                                                  final EmailParts emailParts,
                                                  final C context,
                                                  final boolean condition,
                                                  final Predicate<T> successCondition) {
        if (checker == null || !condition) {
            return CheckResult.skipped();
        }
        final var name = checker.getName();
        logger.trace("[{}] Running check for {}", name, emailParts);
        try {
            final var data = checker.check(emailParts, context);
            final CheckResult<T> result = successCondition.test(data)
                    ? CheckResult.passed(data)
                    : CheckResult.failed(data);
            logger.debug("[{}] Check result: {}", name, result);
            return result;
        } catch (final Exception e) {
            logger.warn("[{}] Errored for {}: {}", name, emailParts, e.getMessage(), e);
            return CheckResult.errored(e);
        }
    }
}
