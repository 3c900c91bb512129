package com.docproof.plan.policy;

import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FailurePoliciesTest {

    @Test
    void resolve_explicitPolicyWinsOverContinueOnFailure() {
        ExecutionStep step = ExecutionStep.builder("vies")
                .failurePolicy(FailurePolicy.FAIL_FAST)
                .continueOnFailure(true)
                .build();

        assertEquals(FailurePolicy.FAIL_FAST, FailurePolicies.resolve(step));
    }

    @Test
    void resolve_continueOnFailureWinsOverIdentityDefault() {
        assertEquals(FailurePolicy.SOFT_FAIL,
                FailurePolicies.resolve(ExecutionStep.builder("parser").continueOnFailure(true).build()));
        assertEquals(FailurePolicy.FAIL_FAST,
                FailurePolicies.resolve(ExecutionStep.builder("vies").continueOnFailure(false).build()));
    }

    @Test
    void resolve_identityDefaults() {
        assertEquals(FailurePolicy.FAIL_FAST, FailurePolicies.resolve(ExecutionStep.builder("kosit").build()));
        assertEquals(FailurePolicy.ALWAYS_RUN, FailurePolicies.resolve(ExecutionStep.builder("fingerprint").build()));
        assertEquals(FailurePolicy.SOFT_FAIL, FailurePolicies.resolve(ExecutionStep.builder("ecb-rates").build()));
    }

    @Test
    void fromValue_acceptsSnakeCaseAndRejectsUnknown() {
        assertEquals(FailurePolicy.ALWAYS_RUN, FailurePolicy.fromValue("always_run"));
        assertEquals(FailurePolicy.SOFT_FAIL, FailurePolicy.fromValue("SOFT_FAIL"));
        assertThrows(IllegalArgumentException.class, () -> FailurePolicy.fromValue("retry"));
    }
}
