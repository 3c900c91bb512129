package com.docproof.executioncontext;

import com.docproof.filter.FilterContext;
import com.docproof.filter.RawDocument;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class ValidationContextTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(T0, ZoneOffset.UTC);

    private static ExecutionPlan plan() {
        return new ExecutionPlan("p", "1", null, List.of(
                ExecutionStep.builder("parser").config(Map.of("strict", true)).build(),
                ExecutionStep.builder("verifiers").parallel(true).children(List.of(
                        ExecutionStep.builder("vies").config(Map.of("live", true)).build())).build()),
                Map.of(), null);
    }

    private static ValidationContext newContext(String correlationId) {
        ContextInit init = ContextInit.builder(RawDocument.of("<Invoice/>"), plan())
                .correlationId(correlationId)
                .locale("de-DE")
                .build();
        return ValidationContext.create(init, new SequentialIdGenerator(), CLOCK);
    }

    @Test
    void create_assignsRunIdAndDefaultsCorrelationId() {
        ValidationContext ctx = newContext(null);

        assertEquals("run_1", ctx.getRunId());
        assertEquals("run_1", ctx.getCorrelationId());
        assertEquals(T0, ctx.getStartedAt());
        assertFalse(ctx.isAborted());
    }

    @Test
    void create_keepsCallerCorrelationId() {
        assertEquals("req-77", newContext("req-77").getCorrelationId());
    }

    @Test
    void getFilterConfig_includesNestedSteps() {
        ValidationContext ctx = newContext(null);

        assertEquals(Map.of("live", true), ctx.getFilterConfig("vies"));
        assertEquals(Map.of("strict", true), ctx.getFilterConfig("parser"));
        assertEquals(Map.of(), ctx.getFilterConfig("unknown"));
    }

    @Test
    void abort_keepsFirstReasonButRecordsEveryRequest() {
        ValidationContext ctx = newContext(null);

        ctx.abort("parser failed");
        ctx.abort("pipeline timeout");

        assertTrue(ctx.isAborted());
        assertEquals("parser failed", ctx.getAbortReason());
        assertEquals(List.of("parser failed", "pipeline timeout"), ctx.getAbortRequests());
    }

    @Test
    void addStepResult_appendsDiagnosticsWithResult() {
        ValidationContext ctx = newContext(null);
        StepResult result = StepResult.failed("kosit", List.of(Diagnostic.error("BR-01", "x")));

        ctx.addStepResult(result);

        assertTrue(ctx.hasExecuted("kosit"));
        assertSame(result, ctx.getStepResult("kosit"));
        assertEquals(1, ctx.getDiagnostics().size());
        assertFalse(ctx.hasExecuted("vies"));
    }

    @Test
    void snapshots_doNotChangeAfterLaterAppends() {
        ValidationContext ctx = newContext(null);
        ctx.addStepResult(StepResult.passed("parser"));
        List<StepResult> before = ctx.getCompletedSteps();

        ctx.addStepResult(StepResult.passed("kosit"));

        assertEquals(1, before.size());
        assertEquals(2, ctx.getCompletedSteps().size());
    }

    @Test
    void concurrentAppends_keepResultsAndDiagnosticsConsistent() throws Exception {
        ValidationContext ctx = newContext(null);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 200; i++) {
                String id = "f" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    ctx.addStepResult(new StepResult(id, StepStatus.WARNING,
                            List.of(Diagnostic.warning("W", id)), 1L, null, null));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(200, ctx.getCompletedSteps().size());
        assertEquals(200, ctx.getDiagnostics().size());
    }

    @Test
    void forStep_exposesResolvedConfigAndLiveState() {
        ValidationContext ctx = newContext(null);
        FilterContext view = ctx.forStep(Map.of("live", false));
        ctx.setParsedDocument(Map.of("invoiceNumber", "INV-1"));
        ctx.abort("stop");

        assertEquals(Map.of("live", false), view.getConfig());
        assertEquals("INV-1", view.getParsedDocument().get("invoiceNumber"));
        assertTrue(view.isAborted());
        assertEquals("de-DE", view.getLocale());
        assertEquals(ctx.getRunId(), view.getRunId());
    }
}
