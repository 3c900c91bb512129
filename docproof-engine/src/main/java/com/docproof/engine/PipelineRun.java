package com.docproof.engine;

import com.docproof.engine.condition.ConditionEvaluator;
import com.docproof.engine.hooks.PipelineHooks;
import com.docproof.executioncontext.ValidationContext;
import com.docproof.filter.FilterContext;
import com.docproof.filter.FilterNotFoundException;
import com.docproof.filter.registry.FilterRegistry;
import com.docproof.filter.registry.RegisteredFilter;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.ledger.RunLedger;
import com.docproof.plan.model.ExecutionStep;
import com.docproof.plan.model.FailurePolicy;
import com.docproof.plan.policy.FailurePolicies;
import com.docproof.plan.timeout.StepTimeoutResolver;
import com.docproof.storage.TempKeys;
import com.docproof.storage.TempStore;
import com.docproof.storage.TempStoreOptions;
import com.docproof.storage.cleanup.TempKeyTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Walks one plan for one run. Owns the run's worker threads, the in-flight permit pool and the
 * pipeline deadline timer; {@link #close()} releases all of them.
 * <p>
 * Top-level steps that share an {@code order} and the children of a parallel group are dispatched
 * concurrently; everything else, including the children of a sequential group, runs in the calling
 * thread. Only filter invocations hold a permit, so a group waiting on its children never starves them.
 * A permit stays taken until the filter body returns, even after its step has timed out.
 */
final class PipelineRun implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    static final String SKIP_ABORTED = "pipeline_aborted";
    static final String SKIP_DISABLED = "disabled";
    static final String SKIP_CONDITION = "condition_not_met";
    static final String SKIP_FILTER_DISABLED = "filter_disabled";
    static final String INTERNAL_CATEGORY = "internal";

    private final ValidationContext context;
    private final String runId;
    private final FilterRegistry registry;
    private final ConditionEvaluator conditions;
    private final PipelineHooks hooks;
    private final RunLedger ledger;
    private final TempStore store;
    private final TempKeyTracker tracker;
    private final long tempTtlMs;
    private final Map<ExecutionStep, Long> timeouts;
    private final long defaultTimeoutMs;
    private final Semaphore permits;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;
    private final AtomicBoolean timedOut = new AtomicBoolean();
    private final AtomicBoolean finished = new AtomicBoolean();
    private final Object storeLock = new Object();

    PipelineRun(ValidationContext context, FilterRegistry registry, ConditionEvaluator conditions,
                PipelineHooks hooks, RunLedger ledger, TempStore store, TempKeyTracker tracker,
                long tempTtlMs, long defaultTimeoutMs, int maxParallelism, long pipelineTimeoutMs) {
        this.context = context;
        this.runId = context.getRunId();
        this.registry = registry;
        this.conditions = conditions;
        this.hooks = hooks;
        this.ledger = ledger;
        this.store = store;
        this.tracker = tracker;
        this.tempTtlMs = tempTtlMs;
        this.defaultTimeoutMs = defaultTimeoutMs;
        this.timeouts = StepTimeoutResolver.resolve(context.getPlan(), defaultTimeoutMs);
        this.permits = new Semaphore(Math.max(1, maxParallelism));
        this.workers = Executors.newCachedThreadPool(threads(runId + "-worker"));
        if (pipelineTimeoutMs > 0) {
            this.timer = Executors.newSingleThreadScheduledExecutor(threads(runId + "-deadline"));
            this.timer.schedule(() -> expire(pipelineTimeoutMs), pipelineTimeoutMs, TimeUnit.MILLISECONDS);
        } else {
            this.timer = null;
        }
    }

    /** Runs every top-level step. Returns when no step is left to dispatch. */
    void execute() {
        runSequence(context.getPlan().getSteps(), false);
    }

    boolean isTimedOut() {
        return timedOut.get();
    }

    @Override
    public void close() {
        synchronized (storeLock) {
            finished.set(true);
        }
        if (timer != null) {
            timer.shutdownNow();
        }
        workers.shutdownNow();
    }

    /**
     * Stores a value the run created in the temp store and tracks it for cleanup. Ignored once the run is
     * closed, since cleanup has then already taken the tracked keys.
     */
    void storeTemp(String category, Object value) {
        String key = TempKeys.key(category, runId);
        synchronized (storeLock) {
            if (finished.get()) {
                log.warn("Run {} is closed; not storing {}", runId, category);
                return;
            }
            tracker.track(key, category);
            try {
                store.set(key, value, TempStoreOptions.of(category, tempTtlMs, context.getCorrelationId()));
            } catch (RuntimeException e) {
                log.warn("Temp store write failed (runId={}, category={}); execution continues. Error: {}",
                        runId, category, e.getMessage(), e);
                hooks.onError(runId, null, e);
            }
        }
    }

    private void expire(long pipelineTimeoutMs) {
        if (finished.get()) {
            return;
        }
        timedOut.set(true);
        log.warn("Run {} exceeded pipeline timeout of {}ms; no further steps are dispatched", runId, pipelineTimeoutMs);
        context.abort("Pipeline timeout after " + pipelineTimeoutMs + "ms");
    }

    /** Runs a sequential group's children one at a time in order, stopping dispatch after a fail_fast abort. */
    private void runChildrenInOrder(List<ExecutionStep> children, boolean forced) {
        for (ExecutionStep child : StepOrdering.sequence(children)) {
            visit(child, forced);
        }
    }

    private void runSequence(List<ExecutionStep> steps, boolean forced) {
        for (List<ExecutionStep> unit : StepOrdering.units(steps)) {
            if (unit.size() == 1) {
                visit(unit.get(0), forced);
            } else {
                runConcurrently(unit, forced);
            }
        }
    }

    /** Dispatches each step on a worker and waits until all have settled. */
    private void runConcurrently(List<ExecutionStep> steps, boolean forced) {
        Map<String, Future<?>> futures = new LinkedHashMap<>();
        int i = 0;
        for (ExecutionStep step : steps) {
            futures.put(step.getFilterId() + "#" + i++, workers.submit(() -> visit(step, forced)));
        }
        RuntimeException failure = null;
        for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
            try {
                entry.getValue().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Run {} concurrent branch {} failed: {}", runId, entry.getKey(), cause.toString(), cause);
                if (failure == null) {
                    failure = cause instanceof RuntimeException ? (RuntimeException) cause
                            : new IllegalStateException("Concurrent branch " + entry.getKey() + " failed", cause);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                context.abort("Run interrupted");
                return;
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void visit(ExecutionStep step, boolean forced) {
        String filterId = step.getFilterId();
        FailurePolicy policy = FailurePolicies.resolve(step);

        if (context.isAborted() && !forced && policy != FailurePolicy.ALWAYS_RUN) {
            record(StepResult.skipped(filterId, SKIP_ABORTED,
                    Diagnostic.info("STEP_SKIPPED", "Step not run: " + context.getAbortReason()).withSource(filterId)));
            return;
        }
        if (!step.isActive()) {
            record(StepResult.skipped(filterId, SKIP_DISABLED,
                    Diagnostic.info("STEP_DISABLED", "Step is disabled in the plan").withSource(filterId)));
            return;
        }
        if (!conditions.evaluate(step.getCondition(), context)) {
            record(StepResult.skipped(filterId, SKIP_CONDITION,
                    Diagnostic.info("CONDITION_NOT_MET", "Step condition "
                            + step.getCondition().getType().toValue() + " not met").withSource(filterId)));
            return;
        }

        if (step.isGroup()) {
            boolean childrenForced = forced || policy == FailurePolicy.ALWAYS_RUN;
            if (step.runsChildrenInParallel()) {
                runConcurrently(step.getChildren(), childrenForced);
            } else {
                runChildrenInOrder(step.getChildren(), childrenForced);
            }
            return;
        }

        StepResult result = invoke(step);
        record(result);
        if (result.getStatus().isFailure() && policy == FailurePolicy.FAIL_FAST) {
            context.abort("Step " + filterId + " " + result.getStatus().toValue() + " (fail_fast)");
        }
    }

    private StepResult invoke(ExecutionStep step) {
        String filterId = step.getFilterId();
        RegisteredFilter entry = registry.get(filterId);
        if (entry == null) {
            FilterNotFoundException e = new FilterNotFoundException(filterId);
            log.warn("Run {} step {}: {}", runId, filterId, e.getMessage());
            hooks.onError(runId, filterId, e);
            return StepResult.error(filterId, internal("FILTER_NOT_FOUND", e.getMessage(), filterId), 0L);
        }
        if (!entry.isEnabled()) {
            return StepResult.skipped(filterId, SKIP_FILTER_DISABLED,
                    Diagnostic.info("FILTER_DISABLED", "Filter is disabled in the registry").withSource(filterId));
        }

        FilterContext stepContext = context.forStep(registry.configure(filterId, step.getConfig()));
        long timeoutMs = timeouts.getOrDefault(step, defaultTimeoutMs);

        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepResult.error(filterId, internal("INTERRUPTED", "Interrupted before the step started", filterId), 0L)
                    .withExecution(filterId, entry.getVersion(), 0L);
        }
        // whoever claims first owns the permit: the task when it starts, or this thread if it never will
        AtomicBoolean claimed = new AtomicBoolean();
        long start = System.nanoTime();
        Future<StepResult> future = null;
        try {
            hooks.onStepStart(runId, filterId);
            future = workers.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return null;
                }
                try {
                    return entry.getFilter().execute(stepContext);
                } finally {
                    permits.release();
                }
            });
            StepResult result;
            try {
                result = future.get(timeoutMs, TimeUnit.MILLISECONDS);
                if (result == null) {
                    result = StepResult.error(filterId,
                            internal("INTERNAL_ERROR", "Filter returned no result", filterId), 0L);
                }
            } catch (TimeoutException e) {
                future.cancel(true);
                StepTimeoutException timeout = new StepTimeoutException(filterId, timeoutMs);
                log.warn("Run {} step {} timed out after {}ms", runId, filterId, timeoutMs);
                hooks.onError(runId, filterId, timeout);
                result = StepResult.error(filterId, internal("STEP_TIMEOUT", timeout.getMessage(), filterId), 0L);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Run {} step {} threw: {}", runId, filterId, cause.toString(), cause);
                hooks.onError(runId, filterId, cause);
                result = StepResult.error(filterId, internal("INTERNAL_ERROR",
                        "Filter " + filterId + " failed: " + cause.getMessage(), filterId), 0L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                result = StepResult.error(filterId, internal("INTERRUPTED", "Interrupted while the step ran", filterId), 0L);
            }
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            return result.withExecution(filterId, entry.getVersion(), durationMs);
        } catch (RejectedExecutionException e) {
            log.warn("Run {} step {} could not be dispatched: {}", runId, filterId, e.getMessage());
            return StepResult.error(filterId, internal("INTERRUPTED", "Run closed before the step started", filterId), 0L)
                    .withExecution(filterId, entry.getVersion(), 0L);
        } finally {
            if (claimed.compareAndSet(false, true)) {
                if (future != null) {
                    future.cancel(true);
                }
                permits.release();
            }
        }
    }

    /** Appends the result to the context and publishes it. A parsed document in the metadata is lifted out. */
    private void record(StepResult result) {
        StepResult recorded = result;
        Object parsed = result.getMetadata().get(StepResult.PARSED_DOCUMENT);
        if (parsed instanceof Map<?, ?> map) {
            Map<String, Object> document = new LinkedHashMap<>();
            map.forEach((k, v) -> document.put(String.valueOf(k), v));
            context.setParsedDocument(document);
            storeTemp(TempKeys.PARSED_INVOICE, document);
            Map<String, Object> metadata = new LinkedHashMap<>(result.getMetadata());
            metadata.remove(StepResult.PARSED_DOCUMENT);
            recorded = new StepResult(result.getFilterId(), result.getStatus(), result.getDiagnostics(),
                    result.getDurationMs(), metadata, result.getFilterVersion());
        }
        context.addStepResult(recorded);
        hooks.onStepComplete(runId, recorded);
        ledger.stepEnded(runId, recorded.getFilterId(), recorded.getStatus().toValue(), recorded.getDurationMs());
    }

    private static Diagnostic internal(String code, String message, String filterId) {
        return Diagnostic.error(code, message).withCategory(INTERNAL_CATEGORY).withSource(filterId);
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
