package com.mikov.emailverifier.utils;

import com.mikov.emailverifier.model.CheckResult;
import com.mikov.emailverifier.model.EmailValidationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility class for flattening an {@link EmailValidationResult} into plain maps, ready for JSON rendering.
 */
public final class ValidationResultConverter {

    private ValidationResultConverter() {
    }

    /**
     * Converts a result to an ordered map with one entry per check.
     *
     * @param result The verification result
     * @return map of field name to value
     */
    public static Map<String, Object> toMap(final EmailValidationResult result) {
        final var map = new LinkedHashMap<String, Object>();
        map.put("email", result.getEmail());
        map.put("normalized", result.getEmailParts().toString());
        map.put("likelyDeliverable", result.isLikelyDeliverable());
        map.put("syntax", toMap(result.getSyntax()));
        map.put("registrability", toMap(result.getRegistrability()));
        map.put("mx", toMap(result.getMx()));
        map.put("disposable", toMap(result.getDisposable()));
        map.put("gravatar", toMap(result.getGravatar()));
        map.put("free", toMap(result.getFree()));
        map.put("roleBasedUsername", toMap(result.getRoleBasedUsername()));
        map.put("smtp", toMap(result.getSmtp()));
        return map;
    }

    /**
     * Converts a single check result to a map holding its status and either its data or its error.
     */
    public static Map<String, Object> toMap(final CheckResult<?> checkResult) {
        final var map = new LinkedHashMap<String, Object>();
        map.put("status", checkResult.status().name());
        checkResult.fold(
                data -> map.put("data", data),
                data -> map.put("data", data),
                () -> null,
                error -> map.put("error", describe(error)));
        return map;
    }

    private static String describe(final Throwable error) {
        final var message = error.getMessage();
        return message == null ? error.getClass().getSimpleName() : message;
    }
}
