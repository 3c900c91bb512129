package com.docproof.audit.snapshot;

import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.policy.FailurePolicies;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link ExecutionPlanSnapshot}s and computes their {@code planHash}.
 */
public final class PlanHasher {

    private PlanHasher() {
    }

    /**
     * Snapshot of the enabled steps of {@code plan} as they will run.
     *
     * @param plan             plan about to execute
     * @param effectiveConfig  merged runtime config; its hash becomes {@code configSnapshotHash}
     * @param engineVersions   versions of the executing code
     * @param filterVersions   filter id → registered version; missing ids are recorded as {@code unknown}
     * @param clock            source of {@code createdAt}
     */
    public static ExecutionPlanSnapshot createSnapshot(ExecutionPlan plan, Map<String, Object> effectiveConfig,
                                                       EngineVersions engineVersions,
                                                       Map<String, String> filterVersions, Clock clock) {
        String configSnapshotHash = ConfigHasher.hash(effectiveConfig != null ? effectiveConfig : Map.of());
        Map<String, String> versions = filterVersions != null ? filterVersions : Map.of();
        List<StepSnapshot> steps = snapshotSteps(plan.getSteps(), versions);
        ExecutionPlanSnapshot unhashed = new ExecutionPlanSnapshot(plan.getId(), plan.getVersion(), plan.getName(),
                null, configSnapshotHash, clock.instant().toString(), steps, engineVersions);
        return unhashed.withPlanHash(calculatePlanHash(unhashed));
    }

    /** Hash over plan id and version, config snapshot hash, step snapshots and kernel version only. */
    public static String calculatePlanHash(ExecutionPlanSnapshot snapshot) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("planId", snapshot.getPlanId());
        input.put("planVersion", snapshot.getPlanVersion());
        input.put("configSnapshotHash", snapshot.getConfigSnapshotHash());
        input.put("steps", snapshot.getSteps());
        input.put("kernelVersion", snapshot.getEngineVersions().getKernelVersion());
        return ConfigHasher.hash(input);
    }

    public static boolean verifyPlanHash(ExecutionPlanSnapshot snapshot) {
        return snapshot.getPlanHash() != null && snapshot.getPlanHash().equals(calculatePlanHash(snapshot));
    }

    /** Config hash per step that carries a config, keyed by filter id. Disabled steps are skipped. */
    public static Map<String, String> stepConfigHashes(ExecutionPlan plan) {
        Map<String, String> out = new LinkedHashMap<>();
        collectConfigHashes(plan.getSteps(), out);
        return out;
    }

    private static void collectConfigHashes(List<ExecutionStep> steps, Map<String, String> out) {
        for (ExecutionStep step : steps) {
            if (!step.isActive()) continue;
            if (!step.getConfig().isEmpty()) {
                out.put(step.getFilterId(), ConfigHasher.hashStepConfig(step.getConfig()));
            }
            collectConfigHashes(step.getChildren(), out);
        }
    }

    private static List<StepSnapshot> snapshotSteps(List<ExecutionStep> steps, Map<String, String> versions) {
        List<StepSnapshot> out = new ArrayList<>();
        for (ExecutionStep step : steps) {
            if (!step.isActive()) continue;
            String configHash = step.getConfig().isEmpty() ? null : ConfigHasher.hashStepConfig(step.getConfig());
            out.add(new StepSnapshot(
                    step.getFilterId(),
                    FailurePolicies.resolve(step),
                    versions.get(step.getFilterId()),
                    configHash,
                    step.getOrder(),
                    step.getParallel(),
                    snapshotSteps(step.getChildren(), versions)));
        }
        return out;
    }
}
