package com.docproof.audit.snapshot;

import com.docproof.plan.build.DefaultPlans;
import com.docproof.plan.build.PlanBuilder;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PlanHasherTest {

    private static final Clock T1 = Clock.fixed(Instant.parse("2026-01-05T10:00:00Z"), ZoneOffset.UTC);
    private static final Clock T2 = Clock.fixed(Instant.parse("2026-03-17T18:30:00Z"), ZoneOffset.UTC);

    private static final Map<String, String> VERSIONS = Map.of(
            "steps-parser", "2.1.0", "kosit", "1.5.0", "vies", "1.0.0");

    @Test
    void createSnapshot_planHashIgnoresCreatedAt() {
        ExecutionPlan plan = DefaultPlans.standard();
        EngineVersions versions = new EngineVersions("1.4.0", "17.0.9+9", null);

        ExecutionPlanSnapshot first = PlanHasher.createSnapshot(plan, Map.of("locale", "en-US"), versions, VERSIONS, T1);
        ExecutionPlanSnapshot second = PlanHasher.createSnapshot(plan, Map.of("locale", "en-US"), versions, VERSIONS, T2);

        assertNotEquals(first.getCreatedAt(), second.getCreatedAt());
        assertEquals(first.getPlanHash(), second.getPlanHash());
        assertTrue(first.getPlanHash().startsWith("sha256:"));
    }

    @Test
    void createSnapshot_planHashIgnoresRuntimeVersionButNotKernelVersion() {
        ExecutionPlan plan = DefaultPlans.standard();
        String base = PlanHasher.createSnapshot(plan, Map.of(), new EngineVersions("1.4.0", "17.0.9", null), VERSIONS, T1)
                .getPlanHash();

        String otherRuntime = PlanHasher.createSnapshot(plan, Map.of(),
                new EngineVersions("1.4.0", "17.0.12", Map.of("kosit", "1.5.0")), VERSIONS, T1).getPlanHash();
        String otherKernel = PlanHasher.createSnapshot(plan, Map.of(),
                new EngineVersions("1.5.0", "17.0.9", null), VERSIONS, T1).getPlanHash();

        assertEquals(base, otherRuntime);
        assertNotEquals(base, otherKernel);
    }

    @Test
    void createSnapshot_effectiveConfigKeyOrderDoesNotMatter() {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("locale", "de-DE");
        a.put("maxParallelism", 3);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("maxParallelism", 3);
        b.put("locale", "de-DE");
        EngineVersions versions = new EngineVersions("1.0.0", null, null);

        ExecutionPlanSnapshot sa = PlanHasher.createSnapshot(DefaultPlans.standard(), a, versions, VERSIONS, T1);
        ExecutionPlanSnapshot sb = PlanHasher.createSnapshot(DefaultPlans.standard(), b, versions, VERSIONS, T1);

        assertEquals(sa.getConfigSnapshotHash(), sb.getConfigSnapshotHash());
        assertEquals(sa.getPlanHash(), sb.getPlanHash());
    }

    @Test
    void createSnapshot_recordsStepDetailsAndExcludesDisabledSteps() {
        ExecutionPlan plan = new PlanBuilder()
                .setId("p")
                .addStep(ExecutionStep.builder("steps-parser").order(1).build())
                .addStep(ExecutionStep.builder("verifiers").order(2).parallel(true).children(List.of(
                        ExecutionStep.builder("vies").config(Map.of("endpoint", "live")).build(),
                        ExecutionStep.builder("peppol").enabled(false).build())).build())
                .addStep(ExecutionStep.builder("legacy").enabled(false).build())
                .build();

        ExecutionPlanSnapshot snapshot = PlanHasher.createSnapshot(plan, Map.of(),
                new EngineVersions("1.0.0", null, null), VERSIONS, T1);

        assertEquals(2, snapshot.getSteps().size());
        StepSnapshot parser = snapshot.getSteps().get(0);
        assertEquals("steps-parser", parser.getStepName());
        assertEquals(FailurePolicy.FAIL_FAST, parser.getFailurePolicy());
        assertEquals("2.1.0", parser.getFilterVersion());
        assertNull(parser.getConfigHash());
        assertNull(parser.getParallel());

        StepSnapshot group = snapshot.getSteps().get(1);
        assertEquals(Boolean.TRUE, group.getParallel());
        assertEquals(StepSnapshot.UNKNOWN_VERSION, group.getFilterVersion());
        assertEquals(1, group.getChildren().size());
        StepSnapshot vies = group.getChildren().get(0);
        assertEquals("1.0.0", vies.getFilterVersion());
        assertTrue(vies.getConfigHash().startsWith("sha256:"));
    }

    @Test
    void createSnapshot_changingStepConfigChangesPlanHash() {
        EngineVersions versions = new EngineVersions("1.0.0", null, null);
        ExecutionPlan base = DefaultPlans.standard();
        ExecutionPlan tuned = PlanBuilder.from(base).setStepConfig("vies", Map.of("cacheTtl", 300)).build();

        assertNotEquals(
                PlanHasher.createSnapshot(base, Map.of(), versions, VERSIONS, T1).getPlanHash(),
                PlanHasher.createSnapshot(tuned, Map.of(), versions, VERSIONS, T1).getPlanHash());
    }

    @Test
    void verifyPlanHash_detectsTampering() {
        ExecutionPlanSnapshot snapshot = PlanHasher.createSnapshot(DefaultPlans.standard(), Map.of(),
                new EngineVersions("1.0.0", null, null), VERSIONS, T1);
        ExecutionPlanSnapshot tampered = new ExecutionPlanSnapshot(snapshot.getPlanId(), "9.9.9",
                snapshot.getPlanName(), snapshot.getPlanHash(), snapshot.getConfigSnapshotHash(),
                snapshot.getCreatedAt(), snapshot.getSteps(), snapshot.getEngineVersions());

        assertTrue(PlanHasher.verifyPlanHash(snapshot));
        assertFalse(PlanHasher.verifyPlanHash(tampered));
    }

    @Test
    void stepConfigHashes_coverNestedStepsWithConfig() {
        ExecutionPlan plan = PlanBuilder.from(DefaultPlans.standard())
                .setStepConfig("kosit", Map.of("scenario", "xrechnung"))
                .setStepConfig("ecb-rates", Map.of("tolerance", 0.01))
                .build();

        Map<String, String> hashes = PlanHasher.stepConfigHashes(plan);

        assertEquals(2, hashes.size());
        assertTrue(hashes.containsKey("kosit"));
        assertTrue(hashes.containsKey("ecb-rates"));
    }

    @Test
    void current_readsPackagedKernelVersion() {
        EngineVersions current = EngineVersions.current();

        assertFalse(current.getKernelVersion().isBlank());
        assertFalse(current.getKernelVersion().startsWith("${"));
        assertEquals(Runtime.version().toString(), current.getRuntimeVersion());
    }
}
