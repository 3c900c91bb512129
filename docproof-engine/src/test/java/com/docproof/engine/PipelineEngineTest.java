package com.docproof.engine;

import com.docproof.audit.fingerprint.ValidationStatus;
import com.docproof.config.EngineSettings;
import com.docproof.engine.hooks.PipelineHooks;
import com.docproof.engine.report.ReportState;
import com.docproof.engine.report.ValidationReport;
import com.docproof.executioncontext.SequentialIdGenerator;
import com.docproof.filter.Filter;
import com.docproof.filter.RawDocument;
import com.docproof.filter.registry.FilterRegistry;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.ledger.InMemoryLedgerStore;
import com.docproof.ledger.LedgerEntry;
import com.docproof.plan.ConfigurationException;
import com.docproof.plan.build.PlanBuilder;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import com.docproof.plan.model.StepCondition;
import com.docproof.storage.TempKeys;
import com.docproof.storage.cleanup.CleanupResult;
import com.docproof.storage.cleanup.RetentionWarning;
import com.docproof.storage.cleanup.RunCleanupEnforcer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineEngineTest {

    private static final RawDocument INVOICE = new RawDocument("<Invoice/>", "application/xml", "invoice.xml");

    private static FilterRegistry registry(Filter... filters) {
        FilterRegistry registry = new FilterRegistry();
        for (Filter f : filters) {
            registry.register(f);
        }
        registry.initializeAll();
        return registry;
    }

    private static PipelineEngine.Builder engine(FilterRegistry registry) {
        return PipelineEngine.builder(registry).idGenerator(new SequentialIdGenerator());
    }

    private static ExecutionStep step(String id, int order, FailurePolicy policy) {
        return ExecutionStep.builder(id).order(order).failurePolicy(policy).build();
    }

    private static ExecutionPlan plan(ExecutionStep... steps) {
        PlanBuilder b = new PlanBuilder().setId("test-plan").setVersion("1.0.0");
        for (ExecutionStep s : steps) {
            b.addStep(s);
        }
        return b.build();
    }

    @Test
    void execute_failFastFailure_skipsLaterStepsAndRejects() {
        StubFilter a = StubFilter.failing("a");
        StubFilter b = StubFilter.passing("b");
        PipelineEngine engine = engine(registry(a, b)).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                step("a", 1, FailurePolicy.FAIL_FAST),
                step("b", 2, FailurePolicy.SOFT_FAIL))));

        assertEquals(ValidationStatus.REJECTED, report.getStatus());
        assertEquals(ReportState.INCOMPLETE, report.getReportState());
        assertEquals(StepStatus.FAILED, report.step("a").getStatus());
        assertEquals(StepStatus.SKIPPED, report.step("b").getStatus());
        assertEquals(PipelineRun.SKIP_ABORTED, report.step("b").getMetadata().get(StepResult.SKIPPED_REASON));
        assertEquals(0, b.calls.get());
        assertNotNull(report.getAbortReason());
    }

    @Test
    void execute_alwaysRunStep_runsAfterAbort() {
        StubFilter fingerprint = StubFilter.passing("fingerprint");
        PipelineEngine engine = engine(registry(StubFilter.failing("kosit"), fingerprint)).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                ExecutionStep.builder("kosit").order(1).build(),
                ExecutionStep.builder("fingerprint").order(2).build())));

        assertEquals(StepStatus.PASSED, report.step("fingerprint").getStatus());
        assertEquals(1, fingerprint.calls.get());
        assertEquals(ValidationStatus.REJECTED, report.getStatus());
    }

    @Test
    void execute_parallelGroup_failingSiblingDoesNotStopTheOther() {
        PipelineEngine engine = engine(registry(StubFilter.failing("x"), StubFilter.passing("y"))).build();
        ExecutionStep group = ExecutionStep.builder("verifiers").order(1).parallel(true)
                .children(List.of(
                        ExecutionStep.builder("x").failurePolicy(FailurePolicy.SOFT_FAIL).build(),
                        ExecutionStep.builder("y").failurePolicy(FailurePolicy.SOFT_FAIL).build()))
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(group)));

        assertEquals(StepStatus.FAILED, report.step("x").getStatus());
        assertEquals(StepStatus.PASSED, report.step("y").getStatus());
        assertNull(report.step("verifiers"));
        assertEquals(ValidationStatus.REJECTED, report.getStatus());
        assertEquals(ReportState.COMPLETE, report.getReportState());
        assertTrue(report.getScore() < 100);
    }

    @Test
    void execute_sequentialGroup_failFastChildStopsRemainingChildren() {
        StubFilter second = StubFilter.passing("second");
        PipelineEngine engine = engine(registry(StubFilter.failing("first"), second)).build();
        ExecutionStep group = ExecutionStep.builder("chain").order(1)
                .children(List.of(step("first", 1, FailurePolicy.FAIL_FAST), step("second", 2, FailurePolicy.SOFT_FAIL)))
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(group)));

        assertEquals(StepStatus.SKIPPED, report.step("second").getStatus());
        assertEquals(0, second.calls.get());
    }

    @Test
    void execute_sequentialGroup_sameOrderChildrenRunOneAtATime() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StubFilter first = new StubFilter("first", ctx -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(150);
            } finally {
                inFlight.decrementAndGet();
            }
            return StepResult.failed("first", List.of(Diagnostic.error("BAD_first", "first rejected")));
        });
        StubFilter second = new StubFilter("second", ctx -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                Thread.sleep(150);
            } finally {
                inFlight.decrementAndGet();
            }
            return StepResult.passed("second");
        });
        PipelineEngine engine = engine(registry(first, second)).build();
        ExecutionStep group = ExecutionStep.builder("chain").order(1).parallel(false)
                .children(List.of(step("first", 1, FailurePolicy.FAIL_FAST), step("second", 1, FailurePolicy.SOFT_FAIL)))
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(group)));

        assertEquals(1, peak.get());
        assertEquals(0, second.calls.get());
        assertEquals(StepStatus.FAILED, report.step("first").getStatus());
        assertEquals(StepStatus.SKIPPED, report.step("second").getStatus());
    }

    @Test
    void execute_stepTimeout_recordsErrorAndContinues() {
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        PipelineEngine engine = engine(registry(StubFilter.sleeping("slow", 2_000), StubFilter.passing("next")))
                .addHooks(new PipelineHooks() {
                    @Override
                    public void onError(String runId, String filterId, Throwable error) {
                        errors.add(error);
                    }
                })
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                ExecutionStep.builder("slow").order(1).timeoutMs(50L).failurePolicy(FailurePolicy.SOFT_FAIL).build(),
                step("next", 2, FailurePolicy.SOFT_FAIL))));

        StepResult slow = report.step("slow");
        assertEquals(StepStatus.ERROR, slow.getStatus());
        assertEquals("STEP_TIMEOUT", slow.getDiagnostics().get(0).getCode());
        assertEquals("internal", slow.getDiagnostics().get(0).getCategory());
        assertEquals(StepStatus.PASSED, report.step("next").getStatus());
        assertEquals(ValidationStatus.ERROR, report.getStatus());
        assertEquals(ReportState.ERRORED, report.getReportState());
        assertEquals(1, errors.size());
        assertInstanceOf(StepTimeoutException.class, errors.get(0));
    }

    @Test
    void execute_pipelineTimeout_stopsDispatchButAlwaysRunStillRuns() {
        StubFilter later = StubFilter.passing("later");
        StubFilter fingerprint = StubFilter.passing("fingerprint");
        PipelineEngine engine = engine(registry(StubFilter.sleeping("slow", 400), later, fingerprint))
                .settings(EngineSettings.builder().pipelineTimeoutMs(100).build())
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                ExecutionStep.builder("slow").order(1).timeoutMs(5_000L).failurePolicy(FailurePolicy.SOFT_FAIL).build(),
                step("later", 2, FailurePolicy.SOFT_FAIL),
                step("fingerprint", 3, FailurePolicy.ALWAYS_RUN))));

        assertEquals(ValidationStatus.TIMEOUT, report.getStatus());
        assertEquals(ReportState.TIMED_OUT, report.getReportState());
        assertEquals(StepStatus.PASSED, report.step("slow").getStatus());
        assertEquals(StepStatus.SKIPPED, report.step("later").getStatus());
        assertEquals(0, later.calls.get());
        assertEquals(StepStatus.PASSED, report.step("fingerprint").getStatus());
        assertEquals(ValidationStatus.TIMEOUT, report.getFingerprint().getStatus());
    }

    @Test
    void execute_missingFilter_isStepErrorNotException() {
        PipelineEngine engine = engine(registry(StubFilter.passing("present"))).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                step("absent", 1, FailurePolicy.SOFT_FAIL),
                step("present", 2, FailurePolicy.SOFT_FAIL))));

        StepResult absent = report.step("absent");
        assertEquals(StepStatus.ERROR, absent.getStatus());
        assertEquals("FILTER_NOT_FOUND", absent.getDiagnostics().get(0).getCode());
        assertEquals("absent", absent.getDiagnostics().get(0).getSource());
        assertEquals(StepStatus.PASSED, report.step("present").getStatus());
        assertEquals(ValidationStatus.ERROR, report.getStatus());
    }

    @Test
    void execute_throwingFilter_isRecordedAsInternalError() {
        PipelineEngine engine = engine(registry(StubFilter.throwing("boom"))).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(step("boom", 1, FailurePolicy.SOFT_FAIL))));

        StepResult boom = report.step("boom");
        assertEquals(StepStatus.ERROR, boom.getStatus());
        assertEquals("INTERNAL_ERROR", boom.getDiagnostics().get(0).getCode());
        assertTrue(boom.getDiagnostics().get(0).getMessage().contains("boom in boom"));
        assertEquals("1.0.0", boom.getFilterVersion());
    }

    @Test
    void execute_uninitializedRegistry_throwsConfigurationException() {
        FilterRegistry registry = new FilterRegistry();
        registry.register(StubFilter.passing("a"));
        PipelineEngine engine = engine(registry).build();

        assertThrows(ConfigurationException.class,
                () -> engine.execute(PipelineInput.of(INVOICE, plan(step("a", 1, FailurePolicy.SOFT_FAIL)))));
    }

    @Test
    void execute_tamperedPlanHash_throwsConfigurationException() {
        PipelineEngine engine = engine(registry(StubFilter.passing("a"))).build();
        ExecutionPlan tampered = plan(step("a", 1, FailurePolicy.SOFT_FAIL)).withConfigHash("sha256:0000");

        assertThrows(ConfigurationException.class, () -> engine.execute(PipelineInput.of(INVOICE, tampered)));
    }

    @Test
    void execute_planWithoutHash_isHashedBeforeRunning() {
        PipelineEngine engine = engine(registry(StubFilter.passing("a"))).build();
        ExecutionPlan unhashed = new ExecutionPlan("p", "1", null, List.of(step("a", 1, FailurePolicy.SOFT_FAIL)), null, null);

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, unhashed));

        assertNotNull(report.getFingerprint().getExecutionPlan().getConfigHash());
        assertEquals(ValidationStatus.APPROVED, report.getStatus());
    }

    @Test
    void execute_parsedDocument_isSharedThenRemovedWithRawInput() {
        Map<String, Object> parsed = new LinkedHashMap<>();
        parsed.put("format", "xrechnung-ubl");
        parsed.put("invoiceNumber", "INV-1");
        parsed.put("seller", Map.of("vatId", "DE123456789"));
        StubFilter parser = new StubFilter("parser", ctx -> StepResult.builder("parser", StepStatus.PASSED)
                .metadata(StepResult.PARSED_DOCUMENT, parsed).build());
        StubFilter reader = new StubFilter("reader", ctx -> ctx.getParsedDocument() != null
                ? StepResult.passed("reader")
                : StepResult.failed("reader", List.of(Diagnostic.error("NO_DOC", "no parsed document"))));
        List<CleanupResult> cleanups = Collections.synchronizedList(new ArrayList<>());
        PipelineEngine engine = engine(registry(parser, reader))
                .addHooks(new PipelineHooks() {
                    @Override
                    public void onCleanup(String runId, CleanupResult cleanup) {
                        cleanups.add(cleanup);
                    }
                })
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                step("parser", 1, FailurePolicy.FAIL_FAST),
                step("reader", 2, FailurePolicy.SOFT_FAIL))));

        assertEquals(ValidationStatus.APPROVED, report.getStatus());
        assertFalse(report.step("parser").getMetadata().containsKey(StepResult.PARSED_DOCUMENT));
        assertEquals("INV-1", report.getInvoiceSummary().getInvoiceNumber());
        assertEquals("DE***89", report.getInvoiceSummary().getSellerVatId());
        assertFalse(engine.getTempStore().has(TempKeys.rawInvoice(report.getRunId())));
        assertFalse(engine.getTempStore().has(TempKeys.parsedInvoice(report.getRunId())));
        assertEquals(1, cleanups.size());
        assertEquals(2, cleanups.get(0).deleted());
        assertEquals(RunCleanupEnforcer.ZERO_RETENTION, report.getAppliedRetentionPolicy());
        assertTrue(report.getRetentionWarnings().isEmpty());
    }

    @Test
    void execute_failedSecureDelete_isQueuedAndReportedAsRetentionWarning() {
        FlakyTempStore store = new FlakyTempStore();
        store.failDeletesOf(TempKeys.RAW_INVOICE);
        PipelineEngine engine = engine(registry(StubFilter.passing("a"))).tempStore(store).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(step("a", 1, FailurePolicy.SOFT_FAIL))));

        assertEquals(ValidationStatus.APPROVED, report.getStatus());
        assertEquals(RetentionWarning.CLEANUP_QUEUED, report.getRetentionWarnings().get(0).code());
        assertEquals(1, engine.getCleanupQueue().size());
        assertFalse(report.getCleanup().isClean());
    }

    @Test
    void execute_conditions_gateStepsOnEarlierResults() {
        StubFilter onPass = StubFilter.passing("on-pass");
        StubFilter onFail = StubFilter.passing("on-fail");
        StubFilter needsField = StubFilter.passing("needs-field");
        PipelineEngine engine = engine(registry(StubFilter.failing("check"), onPass, onFail, needsField)).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                step("check", 1, FailurePolicy.SOFT_FAIL),
                ExecutionStep.builder("on-pass").order(2).condition(StepCondition.filterPassed("check")).build(),
                ExecutionStep.builder("on-fail").order(3).condition(StepCondition.filterFailed("check")).build(),
                ExecutionStep.builder("needs-field").order(4).condition(StepCondition.fieldExists("seller.vatId")).build())));

        assertEquals(StepStatus.SKIPPED, report.step("on-pass").getStatus());
        assertEquals(PipelineRun.SKIP_CONDITION, report.step("on-pass").getMetadata().get(StepResult.SKIPPED_REASON));
        assertEquals(StepStatus.PASSED, report.step("on-fail").getStatus());
        assertEquals(StepStatus.SKIPPED, report.step("needs-field").getStatus());
        assertEquals(0, onPass.calls.get());
        assertEquals(0, needsField.calls.get());
    }

    @Test
    void execute_customCondition_usesConfiguredEvaluator() {
        StubFilter gated = StubFilter.passing("gated");
        PipelineEngine engine = engine(registry(gated))
                .customConditions((expression, context) -> expression.equals("run-it"))
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                ExecutionStep.builder("gated").order(1).condition(StepCondition.custom("skip-it")).build())));

        assertEquals(StepStatus.SKIPPED, report.step("gated").getStatus());
        assertEquals(0, gated.calls.get());
    }

    @Test
    void execute_disabledStep_isSkippedWithoutInvokingFilter() {
        StubFilter off = StubFilter.passing("off");
        PipelineEngine engine = engine(registry(off)).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                ExecutionStep.builder("off").order(1).enabled(false).build())));

        assertEquals(StepStatus.SKIPPED, report.step("off").getStatus());
        assertEquals("STEP_DISABLED", report.step("off").getDiagnostics().get(0).getCode());
        assertEquals(0, off.calls.get());
        assertEquals(ValidationStatus.APPROVED, report.getStatus());
    }

    @Test
    void execute_sameOrderSteps_respectMaxParallelism() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Filter> filters = new ArrayList<>();
        List<ExecutionStep> steps = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String id = "v" + i;
            filters.add(new StubFilter(id, ctx -> {
                peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                try {
                    Thread.sleep(80);
                } finally {
                    inFlight.decrementAndGet();
                }
                return StepResult.passed(id);
            }));
            steps.add(step(id, 1, FailurePolicy.SOFT_FAIL));
        }
        PlanBuilder b = new PlanBuilder().setId("wide").setGlobalConfig(ExecutionPlan.GLOBAL_MAX_PARALLELISM, 2);
        steps.forEach(b::addStep);
        PipelineEngine engine = engine(registry(filters.toArray(new Filter[0]))).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, b.build()));

        assertEquals(5, report.getStepStatistics().getRan());
        assertTrue(peak.get() <= 2, "peak concurrency " + peak.get());
    }

    @Test
    void execute_timedOutStepIgnoringInterrupts_keepsItsPermitUntilItReturns() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        StubFilter slow = new StubFilter("slow", ctx -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            try {
                long until = System.nanoTime() + 400_000_000L;
                while (System.nanoTime() < until) {
                    Thread.onSpinWait();
                }
            } finally {
                inFlight.decrementAndGet();
            }
            return StepResult.passed("slow");
        });
        StubFilter next = new StubFilter("next", ctx -> {
            peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            inFlight.decrementAndGet();
            return StepResult.passed("next");
        });
        ExecutionPlan plan = new PlanBuilder().setId("narrow").setGlobalConfig(ExecutionPlan.GLOBAL_MAX_PARALLELISM, 1)
                .addStep(ExecutionStep.builder("slow").order(1).timeoutMs(50L).failurePolicy(FailurePolicy.SOFT_FAIL).build())
                .addStep(step("next", 2, FailurePolicy.SOFT_FAIL))
                .build();
        PipelineEngine engine = engine(registry(slow, next)).build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan));

        assertEquals("STEP_TIMEOUT", report.step("slow").getDiagnostics().get(0).getCode());
        assertEquals(StepStatus.PASSED, report.step("next").getStatus());
        assertEquals(1, peak.get());
    }

    @Test
    void execute_throwingHooks_doNotAffectTheRun() {
        List<String> completed = new ArrayList<>();
        PipelineHooks broken = new PipelineHooks() {
            @Override
            public void onStart(String runId, PipelineInput input) {
                throw new IllegalStateException("hook");
            }

            @Override
            public void onStepComplete(String runId, StepResult result) {
                throw new IllegalStateException("hook");
            }

            @Override
            public void onComplete(ValidationReport report) {
                throw new IllegalStateException("hook");
            }
        };
        PipelineEngine engine = engine(registry(StubFilter.passing("a")))
                .addHooks(broken)
                .addHooks(new PipelineHooks() {
                    @Override
                    public void onComplete(ValidationReport report) {
                        completed.add(report.getRunId());
                    }
                })
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(step("a", 1, FailurePolicy.SOFT_FAIL))));

        assertEquals(ValidationStatus.APPROVED, report.getStatus());
        assertEquals(List.of(report.getRunId()), completed);
    }

    @Test
    void execute_ledger_recordsSnapshotStepsAndOutcome() {
        InMemoryLedgerStore ledger = new InMemoryLedgerStore();
        PipelineEngine engine = engine(registry(StubFilter.passing("a"), StubFilter.warning("b")))
                .ledgerStore(ledger)
                .build();

        ValidationReport report = engine.execute(PipelineInput.of(INVOICE, plan(
                step("a", 1, FailurePolicy.SOFT_FAIL),
                step("b", 2, FailurePolicy.SOFT_FAIL))));

        LedgerEntry entry = ledger.find(report.getRunId()).orElseThrow();
        assertTrue(entry.isEnded());
        assertEquals("APPROVED_WITH_WARNINGS", entry.getStatus());
        assertEquals(report.getPlanSnapshot().getPlanHash(), entry.getSnapshot().getPlanHash());
        assertEquals(2, entry.getSteps().size());
        assertEquals(report.getFingerprint().getId(), entry.getFingerprint().getId());
    }

    @Test
    void execute_report_carriesIdentityAndFingerprint() {
        PipelineEngine engine = engine(registry(StubFilter.passing("a"))).build();

        ValidationReport report = engine.execute(PipelineInput.builder(INVOICE, plan(step("a", 1, FailurePolicy.SOFT_FAIL)))
                .correlationId("corr-42")
                .build());

        assertEquals("corr-42", report.getCorrelationId());
        assertEquals("FL-" + report.getRunId(), report.getFingerprint().getId());
        assertEquals(100, report.getScore());
        assertEquals(ReportState.COMPLETE, report.getReportState());
        assertTrue(report.getFingerprint().getFingerprint().startsWith("sha256:"));
        assertEquals(report.getPlanSnapshot().getPlanHash(), report.getFingerprint().getPlanHash());
    }
}
