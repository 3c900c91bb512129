package com.docproof.audit.fingerprint;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.Severity;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;

import java.util.Collection;

/** Overall outcome of a run. */
public enum ValidationStatus {
    APPROVED,
    APPROVED_WITH_WARNINGS,
    REJECTED,
    ERROR,
    TIMEOUT;

    /**
     * First match wins: run deadline passed → TIMEOUT; any step errored → ERROR; any error
     * diagnostic or failed step → REJECTED; any warning → APPROVED_WITH_WARNINGS; else APPROVED.
     */
    public static ValidationStatus derive(boolean timedOut, Collection<StepResult> steps,
                                          Collection<Diagnostic> diagnostics) {
        if (timedOut) {
            return TIMEOUT;
        }
        if (steps.stream().anyMatch(s -> s.getStatus() == StepStatus.ERROR)) {
            return ERROR;
        }
        if (steps.stream().anyMatch(s -> s.getStatus() == StepStatus.FAILED)
                || diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.ERROR)) {
            return REJECTED;
        }
        if (steps.stream().anyMatch(s -> s.getStatus() == StepStatus.WARNING)
                || diagnostics.stream().anyMatch(d -> d.getSeverity() == Severity.WARNING)) {
            return APPROVED_WITH_WARNINGS;
        }
        return APPROVED;
    }
}
