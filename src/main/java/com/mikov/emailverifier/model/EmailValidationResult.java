package com.mikov.emailverifier.model;

import com.mikov.emailverifier.dtos.DatasetData;
import com.mikov.emailverifier.dtos.GravatarData;
import com.mikov.emailverifier.dtos.MxRecordData;
import com.mikov.emailverifier.dtos.RegistrabilityData;
import com.mikov.emailverifier.dtos.SmtpData;
import com.mikov.emailverifier.dtos.SyntaxValidationData;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of verifying one address. Checks that did not run are {@link CheckResult.Skipped}.
 */
@Getter
@Builder
@ToString
public class EmailValidationResult {
    private final String email;
    private final EmailParts emailParts;
    private final CheckResult<SyntaxValidationData> syntax;
    @Builder.Default
    private final CheckResult<RegistrabilityData> registrability = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<MxRecordData> mx = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<DatasetData> disposable = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<GravatarData> gravatar = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<DatasetData> free = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<DatasetData> roleBasedUsername = CheckResult.skipped();
    @Builder.Default
    private final CheckResult<SmtpData> smtp = CheckResult.skipped();

    /**
     * True unless a strong indicator (syntax, registrability, mx or disposable) failed.
     * Skipped and errored checks never count against the address.
     */
    public boolean isLikelyDeliverable() {
        return !syntax.isFailed()
                && !registrability.isFailed()
                && !mx.isFailed()
                && !disposable.isFailed();
    }
}
