package com.docproof.plan.build;

import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Fluent builder for {@link ExecutionPlan}. Step edits (enable, disable, config) address top-level
 * steps and children alike by filterId. {@link #build()} stamps the plan's {@code configHash} and
 * {@code createdAt}.
 */
public final class PlanBuilder {

    private String id;
    private String version = "1.0.0";
    private String name;
    private final List<ExecutionStep> steps = new ArrayList<>();
    private final Map<String, Object> globalConfig = new LinkedHashMap<>();
    private final Clock clock;

    public PlanBuilder() {
        this(Clock.systemUTC());
    }

    public PlanBuilder(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Starts from an existing plan (its hash is recomputed on build). */
    public static PlanBuilder from(ExecutionPlan plan) {
        PlanBuilder b = new PlanBuilder()
                .setId(plan.getId())
                .setVersion(plan.getVersion())
                .setName(plan.getName());
        b.steps.addAll(plan.getSteps());
        b.globalConfig.putAll(plan.getGlobalConfig());
        return b;
    }

    public PlanBuilder setId(String id) {
        this.id = id;
        return this;
    }

    public PlanBuilder setVersion(String version) {
        this.version = version;
        return this;
    }

    public PlanBuilder setName(String name) {
        this.name = name;
        return this;
    }

    public PlanBuilder setGlobalConfig(String key, Object value) {
        globalConfig.put(Objects.requireNonNull(key, "key"), value);
        return this;
    }

    public PlanBuilder addStep(ExecutionStep step) {
        steps.add(Objects.requireNonNull(step, "step"));
        return this;
    }

    /** Removes every step (at any depth) with the given filterId. */
    public PlanBuilder removeStep(String filterId) {
        List<ExecutionStep> kept = new ArrayList<>();
        for (ExecutionStep s : steps) {
            ExecutionStep r = remove(s, filterId);
            if (r != null) kept.add(r);
        }
        steps.clear();
        steps.addAll(kept);
        return this;
    }

    public PlanBuilder enableStep(String filterId) {
        return replace(filterId, s -> s.toBuilder().enabled(true).build());
    }

    public PlanBuilder disableStep(String filterId) {
        return replace(filterId, s -> s.toBuilder().enabled(false).build());
    }

    /** Merges the given entries into the step's config. */
    public PlanBuilder setStepConfig(String filterId, Map<String, Object> config) {
        return replace(filterId, s -> {
            Map<String, Object> merged = new LinkedHashMap<>(s.getConfig());
            if (config != null) merged.putAll(config);
            return s.toBuilder().config(merged).build();
        });
    }

    public ExecutionPlan build() {
        if (id == null || id.isBlank()) {
            throw new IllegalStateException("plan id is required");
        }
        ExecutionPlan plan = new ExecutionPlan(id, version, name, steps, globalConfig, null,
                clock.instant().toString());
        return plan.withConfigHash(ConfigHasher.hashPlan(plan));
    }

    private PlanBuilder replace(String filterId, UnaryOperator<ExecutionStep> edit) {
        steps.replaceAll(s -> replaceIn(s, filterId, edit));
        return this;
    }

    private static ExecutionStep replaceIn(ExecutionStep step, String filterId,
                                           UnaryOperator<ExecutionStep> edit) {
        ExecutionStep current = step;
        if (step.isGroup()) {
            List<ExecutionStep> children = new ArrayList<>();
            for (ExecutionStep c : step.getChildren()) {
                children.add(replaceIn(c, filterId, edit));
            }
            current = step.toBuilder().children(children).build();
        }
        return Objects.equals(current.getFilterId(), filterId) ? edit.apply(current) : current;
    }

    private static ExecutionStep remove(ExecutionStep step, String filterId) {
        if (Objects.equals(step.getFilterId(), filterId)) return null;
        if (!step.isGroup()) return step;
        List<ExecutionStep> children = new ArrayList<>();
        for (ExecutionStep c : step.getChildren()) {
            ExecutionStep r = remove(c, filterId);
            if (r != null) children.add(r);
        }
        return step.toBuilder().children(children).build();
    }
}
