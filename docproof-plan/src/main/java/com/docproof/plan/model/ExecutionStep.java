package com.docproof.plan.model;

import com.docproof.plan.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One step of an {@link ExecutionPlan}. A leaf step invokes the filter named by {@code filterId};
 * a step with children is a group whose children run in order, or concurrently when {@code parallel} is true.
 * <p>
 * Optional fields stay null when absent so the serialized form (and therefore the plan hash)
 * reflects exactly what was configured.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"filterId", "enabled", "order", "parallel", "timeoutMs", "failurePolicy",
        "continueOnFailure", "condition", "config", "children"})
public final class ExecutionStep {

    private final String filterId;
    private final Boolean enabled;
    private final Map<String, Object> config;
    private final Integer order;
    private final Long timeoutMs;
    private final FailurePolicy failurePolicy;
    private final Boolean continueOnFailure;
    private final StepCondition condition;
    private final List<ExecutionStep> children;
    private final Boolean parallel;

    @JsonCreator
    public ExecutionStep(
            @JsonProperty("filterId") String filterId,
            @JsonProperty("enabled") Boolean enabled,
            @JsonProperty("config") Map<String, Object> config,
            @JsonProperty("order") Integer order,
            @JsonProperty("timeoutMs") Long timeoutMs,
            @JsonProperty("failurePolicy") FailurePolicy failurePolicy,
            @JsonProperty("continueOnFailure") Boolean continueOnFailure,
            @JsonProperty("condition") StepCondition condition,
            @JsonProperty("children") List<ExecutionStep> children,
            @JsonProperty("parallel") Boolean parallel) {
        this.filterId = filterId;
        this.enabled = enabled;
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
        this.order = order;
        this.timeoutMs = timeoutMs;
        this.failurePolicy = failurePolicy;
        this.continueOnFailure = continueOnFailure;
        this.condition = condition;
        this.children = copySteps(children, "step " + filterId);
        this.parallel = parallel;
    }

    /**
     * Immutable copy of a step list.
     *
     * @throws ConfigurationException if an entry is null
     */
    static List<ExecutionStep> copySteps(List<ExecutionStep> steps, String owner) {
        if (steps == null) {
            return List.of();
        }
        for (int i = 0; i < steps.size(); i++) {
            if (steps.get(i) == null) {
                throw new ConfigurationException(owner + ": step at index " + i + " is null");
            }
        }
        return List.copyOf(steps);
    }

    public static Builder builder(String filterId) {
        return new Builder(filterId);
    }

    public Builder toBuilder() {
        return new Builder(filterId)
                .enabled(enabled)
                .config(config)
                .order(order)
                .timeoutMs(timeoutMs)
                .failurePolicy(failurePolicy)
                .continueOnFailure(continueOnFailure)
                .condition(condition)
                .children(children)
                .parallel(parallel);
    }

    public String getFilterId() {
        return filterId;
    }

    /** Raw configured value; null means enabled. See {@link #isActive()}. */
    public Boolean getEnabled() {
        return enabled;
    }

    /** Step-level filter config. Unmodifiable, never null. Values may be null. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getConfig() {
        return config;
    }

    public Integer getOrder() {
        return order;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    /** Deprecated fallback for {@link #getFailurePolicy()}. */
    public Boolean getContinueOnFailure() {
        return continueOnFailure;
    }

    public StepCondition getCondition() {
        return condition;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public List<ExecutionStep> getChildren() {
        return children;
    }

    public Boolean getParallel() {
        return parallel;
    }

    /** True unless explicitly disabled. */
    @JsonIgnore
    public boolean isActive() {
        return !Boolean.FALSE.equals(enabled);
    }

    @JsonIgnore
    public boolean isGroup() {
        return !children.isEmpty();
    }

    @JsonIgnore
    public boolean runsChildrenInParallel() {
        return Boolean.TRUE.equals(parallel);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionStep that = (ExecutionStep) o;
        return Objects.equals(filterId, that.filterId) && Objects.equals(enabled, that.enabled)
                && Objects.equals(config, that.config) && Objects.equals(order, that.order)
                && Objects.equals(timeoutMs, that.timeoutMs) && failurePolicy == that.failurePolicy
                && Objects.equals(continueOnFailure, that.continueOnFailure)
                && Objects.equals(condition, that.condition) && Objects.equals(children, that.children)
                && Objects.equals(parallel, that.parallel);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filterId, enabled, config, order, timeoutMs, failurePolicy, continueOnFailure,
                condition, children, parallel);
    }

    @Override
    public String toString() {
        return "ExecutionStep{" + filterId + (children.isEmpty() ? "" : ", children=" + children.size()) + "}";
    }

    public static final class Builder {
        private final String filterId;
        private Boolean enabled;
        private Map<String, Object> config;
        private Integer order;
        private Long timeoutMs;
        private FailurePolicy failurePolicy;
        private Boolean continueOnFailure;
        private StepCondition condition;
        private List<ExecutionStep> children;
        private Boolean parallel;

        private Builder(String filterId) {
            this.filterId = filterId;
        }

        public Builder enabled(Boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder order(Integer order) {
            this.order = order;
            return this;
        }

        public Builder timeoutMs(Long timeoutMs) {
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder failurePolicy(FailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
            return this;
        }

        public Builder continueOnFailure(Boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        public Builder condition(StepCondition condition) {
            this.condition = condition;
            return this;
        }

        public Builder children(List<ExecutionStep> children) {
            this.children = children;
            return this;
        }

        public Builder parallel(Boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public ExecutionStep build() {
            return new ExecutionStep(filterId, enabled, config, order, timeoutMs, failurePolicy, continueOnFailure,
                    condition, children, parallel);
        }
    }
}
