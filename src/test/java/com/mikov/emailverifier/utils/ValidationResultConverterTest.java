package com.mikov.emailverifier.utils;

import com.mikov.emailverifier.dtos.RegistrabilityData;
import com.mikov.emailverifier.dtos.SyntaxValidationData;
import com.mikov.emailverifier.exception.ConnectionException;
import com.mikov.emailverifier.model.CheckResult;
import com.mikov.emailverifier.model.EmailParts;
import com.mikov.emailverifier.model.EmailValidationResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationResultConverterTest {

    @Test
    void flattensEveryCheck() {
        final var result = EmailValidationResult.builder()
                .email("john+x@example.com")
                .emailParts(new EmailParts("john", "x", "example.com"))
                .syntax(CheckResult.passed(new SyntaxValidationData(true, true, true)))
                .registrability(CheckResult.passed(new RegistrabilityData("example.com")))
                .mx(CheckResult.errored(new ConnectionException("DoH server unreachable")))
                .build();

        final var map = ValidationResultConverter.toMap(result);

        assertThat(map).containsEntry("email", "john+x@example.com")
                .containsEntry("normalized", "john+x@example.com")
                .containsEntry("likelyDeliverable", true)
                .containsKeys("syntax", "registrability", "mx", "disposable", "gravatar", "free", "roleBasedUsername", "smtp");
        assertThat(map.get("registrability")).isEqualTo(Map.of(
                "status", "PASSED", "data", new RegistrabilityData("example.com")));
        assertThat(map.get("mx")).isEqualTo(Map.of(
                "status", "ERRORED", "error", "DoH server unreachable"));
        assertThat(map.get("smtp")).isEqualTo(Map.of("status", "SKIPPED"));
    }
}
