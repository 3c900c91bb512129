package com.docproof.audit.fingerprint;

import com.docproof.filter.result.StepResult;

/** Per-check outcome recorded in a fingerprint. */
public enum VerificationStatus {
    VERIFIED,
    /** Verified against a live external service. */
    VERIFIED_LIVE,
    UNVERIFIED,
    FAILED,
    SKIPPED,
    NOT_APPLICABLE;

    public static VerificationStatus of(StepResult step) {
        switch (step.getStatus()) {
            case PASSED:
            case WARNING:
                return Boolean.TRUE.equals(step.getMetadata().get(StepResult.LIVE_VERIFIED)) ? VERIFIED_LIVE : VERIFIED;
            case FAILED:
                return FAILED;
            case SKIPPED:
                return SKIPPED;
            default:
                return UNVERIFIED;
        }
    }
}
