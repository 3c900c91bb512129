package com.docproof.plan;

import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ConditionType;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanConfigTest {

    private static final String SAMPLE_PLAN_JSON = """
            {
              "id": "de-xrechnung",
              "version": "2.1.0",
              "name": "XRechnung",
              "globalConfig": { "defaultTimeout": 5000, "maxParallelism": 3 },
              "steps": [
                { "filterId": "parser", "order": 10, "failurePolicy": "fail_fast" },
                { "filterId": "verifiers", "order": 20, "parallel": true, "children": [
                    { "filterId": "vies", "timeoutMs": 2000, "config": { "live": true } },
                    { "filterId": "peppol", "enabled": false }
                ]},
                { "filterId": "semantic-risk", "continueOnFailure": true,
                  "condition": { "type": "filter-passed", "filterId": "parser" } }
              ]
            }
            """;

    @Test
    void fromJson_readsNestedStepsAndEnums() {
        ExecutionPlan plan = PlanConfig.fromJson(SAMPLE_PLAN_JSON);

        assertEquals("de-xrechnung", plan.getId());
        assertEquals(3, plan.getSteps().size());
        assertEquals(FailurePolicy.FAIL_FAST, plan.getSteps().get(0).getFailurePolicy());
        ExecutionStep verifiers = plan.getSteps().get(1);
        assertTrue(verifiers.runsChildrenInParallel());
        assertEquals(2000L, verifiers.getChildren().get(0).getTimeoutMs());
        assertFalse(verifiers.getChildren().get(1).isActive());
        assertEquals(ConditionType.FILTER_PASSED, plan.getSteps().get(2).getCondition().getType());
        assertEquals(5000L, plan.getGlobalLong(ExecutionPlan.GLOBAL_DEFAULT_TIMEOUT));
        assertNull(plan.getConfigHash());
    }

    @Test
    void toJson_roundTripKeepsHash() {
        ExecutionPlan plan = PlanConfig.fromJson(SAMPLE_PLAN_JSON);
        ExecutionPlan again = PlanConfig.fromJson(PlanConfig.toJson(plan));

        assertEquals(plan, again);
        assertEquals(ConfigHasher.hashPlan(plan), ConfigHasher.hashPlan(again));
    }

    @Test
    void toJson_omitsAbsentOptionalFields() {
        ExecutionPlan plan = PlanConfig.fromJson(SAMPLE_PLAN_JSON);
        String json = PlanConfig.toJson(plan);

        assertFalse(json.contains("\"active\""));
        assertFalse(json.contains("\"group\""));
        assertFalse(json.contains("\"configHash\""));
    }
}
