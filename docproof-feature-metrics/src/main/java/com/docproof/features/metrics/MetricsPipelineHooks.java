package com.docproof.features.metrics;

import com.docproof.engine.hooks.PipelineHooks;
import com.docproof.engine.report.ValidationReport;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.storage.cleanup.CleanupResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Hooks that record pipeline metrics on a Micrometer registry:
 * <ul>
 *   <li>{@value #STEP_EXECUTIONS} counter, tagged filterId and status</li>
 *   <li>{@value #STEP_DURATION} timer, tagged filterId; skipped steps are not timed</li>
 *   <li>{@value #RUN_COMPLETED} counter, tagged status</li>
 *   <li>{@value #CLEANUP_QUEUED} counter of temp entries whose deletion had to be queued</li>
 * </ul>
 * Tags carry ids and statuses only, never document data.
 */
public final class MetricsPipelineHooks implements PipelineHooks {

    public static final String STEP_EXECUTIONS = "docproof.step.executions";
    public static final String STEP_DURATION = "docproof.step.duration";
    public static final String RUN_COMPLETED = "docproof.run.completed";
    public static final String CLEANUP_QUEUED = "docproof.cleanup.queued";

    private final MeterRegistry registry;

    public MetricsPipelineHooks() {
        this(new SimpleMeterRegistry());
    }

    public MetricsPipelineHooks(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void onStepComplete(String runId, StepResult result) {
        String filterId = nullToUnknown(result.getFilterId());
        registry.counter(STEP_EXECUTIONS,
                "filterId", filterId,
                "status", result.getStatus().toValue()
        ).increment();
        if (result.getStatus() != StepStatus.SKIPPED) {
            Timer.builder(STEP_DURATION)
                    .tag("filterId", filterId)
                    .register(registry)
                    .record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void onComplete(ValidationReport report) {
        registry.counter(RUN_COMPLETED, "status", report.getStatus().name()).increment();
    }

    @Override
    public void onCleanup(String runId, CleanupResult cleanup) {
        if (cleanup.queued() > 0) {
            registry.counter(CLEANUP_QUEUED).increment(cleanup.queued());
        }
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
