package com.mikov.emailverifier.smtp.core;

import lombok.Getter;
import lombok.ToString;

/**
 * A complete server reply. Multi-line replies keep every line in {@code message}, joined by newlines.
 */
@Getter
@ToString
public class SmtpResponse {
    private final int code;
    private final String message;
    private final SmtpResponseCode type;

    public SmtpResponse(String response) {
        this.code = extractCode(response);
        this.message = response == null ? "" : response;
        this.type = SmtpResponseCode.fromCode(code);
    }

    private static int extractCode(String response) {
        if (response == null || response.length() < 3) {
            return 0;
        }
        try {
            return Integer.parseInt(response.substring(0, 3));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    public boolean isSuccess() {
        return type == SmtpResponseCode.SUCCESS;
    }

    public boolean isTemporaryFailure() {
        return type == SmtpResponseCode.TEMPORARY_FAILURE;
    }

    public boolean isPermanentFailure() {
        return type == SmtpResponseCode.PERMANENT_FAILURE;
    }
}
