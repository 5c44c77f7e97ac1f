package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.SmtpData;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.smtp.dns.MxRecord;
import com.mikov.emailverifier.smtp.verification.CancellationHandle;
import com.mikov.emailverifier.smtp.verification.SmtpVerifier;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Runs the SMTP probe against the MX records found for the hostname.
 */
@RequiredArgsConstructor
public class SmtpValidator implements EmailChecker<SmtpData, SmtpValidator.Request> {
    private final SmtpVerifier smtpVerifier;

    /**
     * @param records      mail exchangers to probe, most preferred first
     * @param cancellation lets the caller abort the probe from another thread
     */
    public record Request(List<MxRecord> records, CancellationHandle cancellation) {
    }

    @Override
    public SmtpData check(final EmailParts email, final Request request) {
        return smtpVerifier.verify(email.username(), email.hostname(), request.records(), request.cancellation());
    }

    @Override
    public String getName() {
        return "smtp";
    }
}
