package com.mikov.emailverifier.validation;

import com.mikov.emailverifier.dtos.MxRecordData;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.smtp.dns.MxLookupBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validator that checks if a domain has MX records for email delivery.
 */
public class MxRecordValidator implements EmailChecker<MxRecordData, Void> {
    private static final Logger logger = LoggerFactory.getLogger(MxRecordValidator.class);

    private final MxLookupBackend lookupBackend;

    public MxRecordValidator(final MxLookupBackend lookupBackend) {
        this.lookupBackend = lookupBackend;
    }

    @Override
    public MxRecordData check(final EmailParts email, final Void context) {
        logger.debug("Looking up MX records for hostname: {}", email.hostname());
        final var records = lookupBackend.getMxRecords(email.hostname());
        logger.debug("Found {} MX records for {}: {}", records.size(), email.hostname(), records);
        return new MxRecordData(records);
    }

    @Override
    public String getName() {
        return "mx-record";
    }
}
