package com.docproof.audit.snapshot;

import com.docproof.plan.model.FailurePolicy;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/** What one plan step looked like when the run started. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class StepSnapshot {

    public static final String UNKNOWN_VERSION = "unknown";

    private final String stepName;
    private final FailurePolicy failurePolicy;
    private final String filterVersion;
    private final String configHash;
    private final Integer order;
    private final Boolean parallel;
    private final List<StepSnapshot> children;

    @JsonCreator
    public StepSnapshot(
            @JsonProperty("stepName") String stepName,
            @JsonProperty("failurePolicy") FailurePolicy failurePolicy,
            @JsonProperty("filterVersion") String filterVersion,
            @JsonProperty("configHash") String configHash,
            @JsonProperty("order") Integer order,
            @JsonProperty("parallel") Boolean parallel,
            @JsonProperty("children") List<StepSnapshot> children) {
        this.stepName = Objects.requireNonNull(stepName, "stepName");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
        this.filterVersion = filterVersion != null ? filterVersion : UNKNOWN_VERSION;
        this.configHash = configHash;
        this.order = order;
        this.parallel = Boolean.TRUE.equals(parallel) ? Boolean.TRUE : null;
        this.children = children != null ? List.copyOf(children) : List.of();
    }

    public String getStepName() {
        return stepName;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public String getFilterVersion() {
        return filterVersion;
    }

    public String getConfigHash() {
        return configHash;
    }

    public Integer getOrder() {
        return order;
    }

    public Boolean getParallel() {
        return parallel;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<StepSnapshot> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StepSnapshot that = (StepSnapshot) o;
        return stepName.equals(that.stepName) && failurePolicy == that.failurePolicy
                && filterVersion.equals(that.filterVersion) && Objects.equals(configHash, that.configHash)
                && Objects.equals(order, that.order) && Objects.equals(parallel, that.parallel)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stepName, failurePolicy, filterVersion, configHash, order, parallel, children);
    }

    @Override
    public String toString() {
        return "StepSnapshot{" + stepName + ", " + failurePolicy.toValue() + ", v" + filterVersion + "}";
    }
}
