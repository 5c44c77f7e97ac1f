package com.mikov.emailverifier.dtos;

import lombok.Builder;
import lombok.Data;

/**
 * Data Transfer Object holding the outcome of an SMTP probe.
 * {@code catchAll} is null when the probe was disabled or the server answered inconclusively.
 */
@Data
@Builder
public class SmtpData {
    private final boolean deliverable;
    private final Boolean catchAll;
    private final int smtpCode;
    private final String smtpMessage;
    private final String mxHost;

    public static SmtpData noRecords() {
        return SmtpData.builder()
                .deliverable(false)
                .smtpCode(0)
                .smtpMessage("")
                .build();
    }
}
