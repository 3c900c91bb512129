package com.docproof.features.metrics;

import com.docproof.engine.PipelineEngine;
import com.docproof.engine.PipelineInput;
import com.docproof.filter.Filter;
import com.docproof.filter.FilterContext;
import com.docproof.filter.RawDocument;
import com.docproof.filter.registry.FilterRegistry;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.plan.build.PlanBuilder;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import com.docproof.storage.cleanup.CleanupResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class MetricsPipelineHooksTest {

    private static Filter filter(String id, boolean pass) {
        return new Filter() {
            @Override
            public String getId() {
                return id;
            }

            @Override
            public String getName() {
                return id;
            }

            @Override
            public String getVersion() {
                return "1.0.0";
            }

            @Override
            public StepResult execute(FilterContext context) {
                return pass ? StepResult.passed(id)
                        : StepResult.failed(id, List.of(Diagnostic.error("BAD", "rejected")));
            }
        };
    }

    @Test
    void engineRun_recordsStepAndRunMetrics() {
        SimpleMeterRegistry meters = new SimpleMeterRegistry();
        FilterRegistry registry = new FilterRegistry();
        registry.register(filter("kosit", false));
        registry.register(filter("vies", true));
        registry.initializeAll();
        PipelineEngine engine = PipelineEngine.builder(registry)
                .addHooks(new MetricsPipelineHooks(meters))
                .build();

        engine.execute(PipelineInput.of(RawDocument.of("<Invoice/>"), new PlanBuilder().setId("m")
                .addStep(ExecutionStep.builder("kosit").order(1).failurePolicy(FailurePolicy.FAIL_FAST).build())
                .addStep(ExecutionStep.builder("vies").order(2).build())
                .build()));

        assertEquals(1.0, meters.get(MetricsPipelineHooks.STEP_EXECUTIONS)
                .tags("filterId", "kosit", "status", "failed").counter().count());
        assertEquals(1.0, meters.get(MetricsPipelineHooks.STEP_EXECUTIONS)
                .tags("filterId", "vies", "status", "skipped").counter().count());
        assertEquals(1L, meters.get(MetricsPipelineHooks.STEP_DURATION).tags("filterId", "kosit").timer().count());
        assertNull(meters.find(MetricsPipelineHooks.STEP_DURATION).tags("filterId", "vies").timer());
        assertEquals(1.0, meters.get(MetricsPipelineHooks.RUN_COMPLETED).tags("status", "REJECTED").counter().count());
        assertNull(meters.find(MetricsPipelineHooks.CLEANUP_QUEUED).counter());
    }

    @Test
    void onCleanup_countsQueuedEntries() {
        MetricsPipelineHooks hooks = new MetricsPipelineHooks();

        hooks.onCleanup("run_1", new CleanupResult(true, 1, 0, 2, 0, 3L, List.of(), "zero-retention"));

        assertEquals(2.0, hooks.getRegistry().get(MetricsPipelineHooks.CLEANUP_QUEUED).counter().count());
    }
}
