package com.mikov.emailverifier.dtos;

/**
 * Validity of each part of the address as reported by the syntax validator.
 */
public record SyntaxValidationData(boolean username, boolean plusTag, boolean hostname) {

    public boolean isValid() {
        return username && plusTag && hostname;
    }
}
