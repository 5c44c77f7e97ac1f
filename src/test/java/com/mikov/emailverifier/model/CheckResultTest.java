package com.mikov.emailverifier.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CheckResultTest {

    private static String describe(final CheckResult<String> result) {
        return result.fold(
                data -> "passed:" + data,
                data -> "failed:" + data,
                () -> "skipped",
                error -> "errored:" + error.getMessage());
    }

    @Test
    void foldVisitsExactlyOneBranch() {
        assertThat(describe(CheckResult.passed("a"))).isEqualTo("passed:a");
        assertThat(describe(CheckResult.failed("b"))).isEqualTo("failed:b");
        assertThat(describe(CheckResult.skipped())).isEqualTo("skipped");
        assertThat(describe(CheckResult.errored(new IllegalStateException("boom")))).isEqualTo("errored:boom");
    }

    @Test
    void payloadOnlyForPassedAndFailed() {
        assertThat(CheckResult.passed("a").payload()).contains("a");
        assertThat(CheckResult.failed("b").payload()).contains("b");
        assertThat(CheckResult.<String>skipped().payload()).isEmpty();
        assertThat(CheckResult.<String>errored(new RuntimeException()).payload()).isEmpty();
    }

    @Test
    void statusPredicates() {
        assertThat(CheckResult.passed("a").isPassed()).isTrue();
        assertThat(CheckResult.failed("a").isFailed()).isTrue();
        assertThat(CheckResult.skipped().isSkipped()).isTrue();
        assertThat(CheckResult.errored(new RuntimeException()).status()).isEqualTo(CheckResult.Status.ERRORED);
    }
}
