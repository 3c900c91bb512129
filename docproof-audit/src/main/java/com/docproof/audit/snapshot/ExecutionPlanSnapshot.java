package com.docproof.audit.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Audit record of the plan a run executed. {@code planHash} covers plan id and version, the
 * effective config hash, the step snapshots and the kernel version; {@code createdAt} and the
 * runtime version are recorded but not hashed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ExecutionPlanSnapshot {

    private final String planId;
    private final String planVersion;
    private final String planName;
    private final String planHash;
    private final String configSnapshotHash;
    private final String createdAt;
    private final List<StepSnapshot> steps;
    private final EngineVersions engineVersions;

    @JsonCreator
    public ExecutionPlanSnapshot(
            @JsonProperty("planId") String planId,
            @JsonProperty("planVersion") String planVersion,
            @JsonProperty("planName") String planName,
            @JsonProperty("planHash") String planHash,
            @JsonProperty("configSnapshotHash") String configSnapshotHash,
            @JsonProperty("createdAt") String createdAt,
            @JsonProperty("steps") List<StepSnapshot> steps,
            @JsonProperty("engineVersions") EngineVersions engineVersions) {
        this.planId = Objects.requireNonNull(planId, "planId");
        this.planVersion = planVersion;
        this.planName = planName;
        this.planHash = planHash;
        this.configSnapshotHash = Objects.requireNonNull(configSnapshotHash, "configSnapshotHash");
        this.createdAt = createdAt;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.engineVersions = Objects.requireNonNull(engineVersions, "engineVersions");
    }

    ExecutionPlanSnapshot withPlanHash(String hash) {
        return new ExecutionPlanSnapshot(planId, planVersion, planName, hash, configSnapshotHash, createdAt, steps,
                engineVersions);
    }

    public String getPlanId() {
        return planId;
    }

    public String getPlanVersion() {
        return planVersion;
    }

    public String getPlanName() {
        return planName;
    }

    public String getPlanHash() {
        return planHash;
    }

    public String getConfigSnapshotHash() {
        return configSnapshotHash;
    }

    /** ISO-8601 instant the snapshot was taken. */
    public String getCreatedAt() {
        return createdAt;
    }

    public List<StepSnapshot> getSteps() {
        return steps;
    }

    public EngineVersions getEngineVersions() {
        return engineVersions;
    }

    @Override
    public String toString() {
        return "ExecutionPlanSnapshot{planId=" + planId + ", planHash=" + planHash + ", steps=" + steps.size() + "}";
    }
}
