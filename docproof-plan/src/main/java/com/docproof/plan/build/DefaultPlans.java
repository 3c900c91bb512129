package com.docproof.plan.build;

import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;

import java.util.List;

/**
 * Built-in plans.
 */
public final class DefaultPlans {

    public static final String STANDARD_PLAN_ID = "standard-validation";

    private DefaultPlans() {
    }

    /**
     * Parser, schema validation, live verifiers in parallel (VIES, ECB rates, Peppol), amount validation,
     * semantic risk, fingerprint, then the policy gate which always runs.
     */
    public static ExecutionPlan standard() {
        return new PlanBuilder()
                .setId(STANDARD_PLAN_ID)
                .setVersion("1.0.0")
                .setName("Standard e-invoice validation")
                .setGlobalConfig(ExecutionPlan.GLOBAL_DEFAULT_TIMEOUT, 10_000)
                .setGlobalConfig(ExecutionPlan.GLOBAL_MAX_PARALLELISM, 5)
                .addStep(ExecutionStep.builder("steps-parser").order(10).failurePolicy(FailurePolicy.FAIL_FAST).build())
                .addStep(ExecutionStep.builder("kosit").order(20).failurePolicy(FailurePolicy.FAIL_FAST).build())
                .addStep(ExecutionStep.builder("live-verifiers")
                        .order(30)
                        .parallel(true)
                        .children(List.of(
                                ExecutionStep.builder("vies").failurePolicy(FailurePolicy.SOFT_FAIL).build(),
                                ExecutionStep.builder("ecb-rates").failurePolicy(FailurePolicy.SOFT_FAIL).build(),
                                ExecutionStep.builder("peppol").failurePolicy(FailurePolicy.SOFT_FAIL).build()))
                        .build())
                .addStep(ExecutionStep.builder("steps-amount-validation").order(35).failurePolicy(FailurePolicy.SOFT_FAIL).build())
                .addStep(ExecutionStep.builder("semantic-risk").order(40).failurePolicy(FailurePolicy.ALWAYS_RUN).build())
                .addStep(ExecutionStep.builder("fingerprint").order(50).failurePolicy(FailurePolicy.ALWAYS_RUN).build())
                .addStep(ExecutionStep.builder("steps-policy-gate").order(60).failurePolicy(FailurePolicy.ALWAYS_RUN).build())
                .build();
    }
}
