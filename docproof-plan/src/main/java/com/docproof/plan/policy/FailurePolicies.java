package com.docproof.plan.policy;

import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;

import java.util.Set;

/**
 * Effective failure policy of a step. Precedence:
 * <ol>
 *   <li>explicit {@code failurePolicy}</li>
 *   <li>deprecated {@code continueOnFailure}: false → fail_fast, true → soft_fail</li>
 *   <li>default by filter id: structural checks (parsing, schema) fail fast; risk and fingerprint
 *       steps always run; everything else soft-fails</li>
 * </ol>
 */
public final class FailurePolicies {

    public static final Set<String> FAIL_FAST_IDS = Set.of("parser", "steps-parser", "kosit");
    public static final Set<String> ALWAYS_RUN_IDS = Set.of("semantic-risk", "fingerprint");

    private FailurePolicies() {
    }

    public static FailurePolicy resolve(ExecutionStep step) {
        if (step.getFailurePolicy() != null) {
            return step.getFailurePolicy();
        }
        if (step.getContinueOnFailure() != null) {
            return step.getContinueOnFailure() ? FailurePolicy.SOFT_FAIL : FailurePolicy.FAIL_FAST;
        }
        return defaultFor(step.getFilterId());
    }

    public static FailurePolicy defaultFor(String filterId) {
        if (filterId != null && FAIL_FAST_IDS.contains(filterId)) return FailurePolicy.FAIL_FAST;
        if (filterId != null && ALWAYS_RUN_IDS.contains(filterId)) return FailurePolicy.ALWAYS_RUN;
        return FailurePolicy.SOFT_FAIL;
    }
}
