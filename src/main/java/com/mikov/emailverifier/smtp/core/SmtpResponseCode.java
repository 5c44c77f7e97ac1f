package com.mikov.emailverifier.smtp.core;

/**
 * Reply category, taken from the first digit of the reply code (RFC 5321, section 4.2.1).
 */
public enum SmtpResponseCode {
    SUCCESS(2),
    INTERMEDIATE(3),
    TEMPORARY_FAILURE(4),
    PERMANENT_FAILURE(5);

    private final int firstDigit;

    SmtpResponseCode(int firstDigit) {
        this.firstDigit = firstDigit;
    }

    public boolean matches(int code) {
        return code >= 100 && code <= 599 && code / 100 == firstDigit;
    }

    public static SmtpResponseCode fromCode(int code) {
        for (SmtpResponseCode responseCode : values()) {
            if (responseCode.matches(code)) {
                return responseCode;
            }
        }
        return null;
    }
}
