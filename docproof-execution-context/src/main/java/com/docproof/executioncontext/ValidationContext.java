package com.docproof.executioncontext;

import com.docproof.filter.FilterContext;
import com.docproof.filter.RawDocument;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.plan.model.ExecutionStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-run state shared by the engine and the filters of one run.
 * <p>
 * Identity (run id, correlation id, start time, input, plan) is fixed at creation. Step results and
 * diagnostics are append-only; appends from concurrent steps are serialized under one lock so a
 * result and its diagnostics always appear together. The abort flag only moves from false to true
 * and keeps the first reason given.
 */
public final class ValidationContext {

    private static final Logger log = LoggerFactory.getLogger(ValidationContext.class);
    public static final String RUN_ID_PREFIX = "run";

    private final String runId;
    private final String correlationId;
    private final Instant startedAt;
    private final RawDocument rawDocument;
    private final ExecutionPlan plan;
    private final String locale;
    private final Map<String, Object> requestMetadata;
    private final Map<String, Map<String, Object>> filterConfigs;
    private final Clock clock;

    private final Object lock = new Object();
    private final List<StepResult> completedSteps = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final List<String> abortRequests = new ArrayList<>();
    private volatile Map<String, Object> parsedDocument;
    private volatile String abortReason;

    private ValidationContext(ContextInit init, String runId, Clock clock) {
        this.runId = runId;
        this.correlationId = init.getCorrelationId() != null && !init.getCorrelationId().isBlank()
                ? init.getCorrelationId()
                : runId;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.rawDocument = init.getRawDocument();
        this.plan = init.getPlan();
        this.locale = init.getLocale();
        this.requestMetadata = init.getRequestMetadata();
        this.filterConfigs = flattenConfigs(init.getPlan());
    }

    /**
     * Creates the context for a new run.
     *
     * @param init   input, plan and request options
     * @param ids    run id source (prefix {@value #RUN_ID_PREFIX})
     * @param clock  time source for {@link #getStartedAt()} and {@link #elapsed()}
     */
    public static ValidationContext create(ContextInit init, IdGenerator ids, Clock clock) {
        Objects.requireNonNull(init, "init");
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(clock, "clock");
        return new ValidationContext(init, ids.newId(RUN_ID_PREFIX), clock);
    }

    private static Map<String, Map<String, Object>> flattenConfigs(ExecutionPlan plan) {
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();
        Deque<ExecutionStep> work = new ArrayDeque<>(plan.getSteps());
        while (!work.isEmpty()) {
            ExecutionStep step = work.pollFirst();
            if (step.getFilterId() != null && !step.getConfig().isEmpty()) {
                out.putIfAbsent(step.getFilterId(), step.getConfig());
            }
            List<ExecutionStep> children = step.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                work.addFirst(children.get(i));
            }
        }
        return Collections.unmodifiableMap(out);
    }

    public String getRunId() {
        return runId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public RawDocument getRawDocument() {
        return rawDocument;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    public String getLocale() {
        return locale;
    }

    public Map<String, Object> getRequestMetadata() {
        return requestMetadata;
    }

    public Clock getClock() {
        return clock;
    }

    /** Time since {@link #getStartedAt()} on the context clock. */
    public Duration elapsed() {
        return Duration.between(startedAt, clock.instant());
    }

    /** Plan config for a filter id, or an empty map. */
    public Map<String, Object> getFilterConfig(String filterId) {
        Map<String, Object> config = filterConfigs.get(filterId);
        return config != null ? config : Map.of();
    }

    public Map<String, Object> getParsedDocument() {
        return parsedDocument;
    }

    public void setParsedDocument(Map<String, Object> parsedDocument) {
        this.parsedDocument = parsedDocument != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parsedDocument))
                : null;
    }

    /** Appends a result and its diagnostics as one unit. */
    public void addStepResult(StepResult result) {
        Objects.requireNonNull(result, "result");
        synchronized (lock) {
            completedSteps.add(result);
            diagnostics.addAll(result.getDiagnostics());
        }
    }

    /** Appends diagnostics that do not belong to a step result. */
    public void addDiagnostics(List<Diagnostic> more) {
        if (more == null || more.isEmpty()) return;
        synchronized (lock) {
            diagnostics.addAll(more);
        }
    }

    public List<StepResult> getCompletedSteps() {
        synchronized (lock) {
            return List.copyOf(completedSteps);
        }
    }

    public List<Diagnostic> getDiagnostics() {
        synchronized (lock) {
            return List.copyOf(diagnostics);
        }
    }

    /** Latest recorded result for the filter id, or null. */
    public StepResult getStepResult(String filterId) {
        synchronized (lock) {
            for (int i = completedSteps.size() - 1; i >= 0; i--) {
                if (Objects.equals(completedSteps.get(i).getFilterId(), filterId)) {
                    return completedSteps.get(i);
                }
            }
            return null;
        }
    }

    public boolean hasExecuted(String filterId) {
        return getStepResult(filterId) != null;
    }

    /**
     * Marks the run aborted. Only the first reason is kept; later requests are recorded in
     * {@link #getAbortRequests()}.
     */
    public void abort(String reason) {
        String r = reason != null ? reason : "aborted";
        synchronized (lock) {
            abortRequests.add(r);
            if (abortReason == null) {
                abortReason = r;
                log.info("Run {} aborted: {}", runId, r);
            }
        }
    }

    public boolean isAborted() {
        return abortReason != null;
    }

    public String getAbortReason() {
        return abortReason;
    }

    /** Every abort request in arrival order, the first being the effective reason. */
    public List<String> getAbortRequests() {
        synchronized (lock) {
            return List.copyOf(abortRequests);
        }
    }

    /**
     * View handed to a filter for one step.
     *
     * @param resolvedConfig the step's config after registry defaults were applied
     */
    public FilterContext forStep(Map<String, Object> resolvedConfig) {
        Map<String, Object> config = resolvedConfig != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(resolvedConfig))
                : Map.of();
        return new StepView(config);
    }

    private final class StepView implements FilterContext {
        private final Map<String, Object> config;

        private StepView(Map<String, Object> config) {
            this.config = config;
        }

        @Override
        public String getRunId() {
            return runId;
        }

        @Override
        public String getCorrelationId() {
            return correlationId;
        }

        @Override
        public Instant getStartedAt() {
            return startedAt;
        }

        @Override
        public RawDocument getRawDocument() {
            return rawDocument;
        }

        @Override
        public Map<String, Object> getParsedDocument() {
            return parsedDocument;
        }

        @Override
        public List<StepResult> getCompletedSteps() {
            return ValidationContext.this.getCompletedSteps();
        }

        @Override
        public List<Diagnostic> getDiagnostics() {
            return ValidationContext.this.getDiagnostics();
        }

        @Override
        public boolean isAborted() {
            return ValidationContext.this.isAborted();
        }

        @Override
        public String getAbortReason() {
            return abortReason;
        }

        @Override
        public StepResult getStepResult(String filterId) {
            return ValidationContext.this.getStepResult(filterId);
        }

        @Override
        public boolean hasExecuted(String filterId) {
            return ValidationContext.this.hasExecuted(filterId);
        }

        @Override
        public Map<String, Object> getFilterConfig(String filterId) {
            return ValidationContext.this.getFilterConfig(filterId);
        }

        @Override
        public Map<String, Object> getConfig() {
            return config;
        }

        @Override
        public String getLocale() {
            return locale;
        }

        @Override
        public Map<String, Object> getRequestMetadata() {
            return requestMetadata;
        }
    }
}
