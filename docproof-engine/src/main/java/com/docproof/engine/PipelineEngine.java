package com.docproof.engine;

import com.docproof.audit.config.EffectiveConfig;
import com.docproof.audit.fingerprint.ComplianceFingerprint;
import com.docproof.audit.fingerprint.FingerprintGenerator;
import com.docproof.audit.fingerprint.InvoiceSummary;
import com.docproof.audit.fingerprint.ValidationStatus;
import com.docproof.audit.score.ScoreCalculator;
import com.docproof.audit.snapshot.EngineVersions;
import com.docproof.audit.snapshot.ExecutionPlanSnapshot;
import com.docproof.audit.snapshot.PlanHasher;
import com.docproof.config.EngineSettings;
import com.docproof.engine.condition.ConditionEvaluator;
import com.docproof.engine.condition.CustomConditionEvaluator;
import com.docproof.engine.hooks.CompositePipelineHooks;
import com.docproof.engine.hooks.PipelineHooks;
import com.docproof.engine.report.ReportState;
import com.docproof.engine.report.ValidationReport;
import com.docproof.executioncontext.ContextInit;
import com.docproof.executioncontext.IdGenerator;
import com.docproof.executioncontext.RandomIdGenerator;
import com.docproof.executioncontext.ValidationContext;
import com.docproof.filter.registry.FilterRegistry;
import com.docproof.filter.registry.RegisteredFilter;
import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.filter.result.StepStatus;
import com.docproof.ledger.LedgerStore;
import com.docproof.ledger.RunLedger;
import com.docproof.plan.ConfigurationException;
import com.docproof.plan.PlanValidator;
import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ExecutionPlan;
import com.docproof.storage.TempKeys;
import com.docproof.storage.TempStore;
import com.docproof.storage.cleanup.CleanupQueue;
import com.docproof.storage.cleanup.CleanupQueueResult;
import com.docproof.storage.cleanup.CleanupResult;
import com.docproof.storage.cleanup.InMemoryCleanupQueue;
import com.docproof.storage.cleanup.RunCleanupEnforcer;
import com.docproof.storage.cleanup.SecureCleanup;
import com.docproof.storage.cleanup.TempKeyTracker;
import com.docproof.storage.memory.InMemoryTempStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs validation plans against documents.
 * <p>
 * {@link #execute(PipelineInput)} either rejects the request up front with a
 * {@link ConfigurationException} (invalid plan, registry not initialized) or returns a
 * {@link ValidationReport}; failures inside the run are carried in the report, never thrown. Temp data
 * the run created is removed exactly once when the run ends, whatever the exit path.
 * <p>
 * One engine serves many runs; each run gets its own context, worker threads and key tracker.
 */
public final class PipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(PipelineEngine.class);

    private final FilterRegistry registry;
    private final EngineSettings settings;
    private final TempStore tempStore;
    private final CleanupQueue cleanupQueue;
    private final RunCleanupEnforcer cleanupEnforcer;
    private final RunLedger ledger;
    private final PipelineHooks hooks;
    private final ConditionEvaluator conditions;
    private final IdGenerator ids;
    private final Clock clock;
    private final EngineVersions engineVersions;
    private final FingerprintGenerator fingerprints;

    private PipelineEngine(Builder b) {
        this.registry = Objects.requireNonNull(b.registry, "registry");
        this.settings = b.settings != null ? b.settings : EngineSettings.defaults();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.tempStore = b.tempStore != null ? b.tempStore
                : new InMemoryTempStore(clock, settings.getTempTtlMs(), settings.getSensitiveCategories());
        this.cleanupQueue = b.cleanupQueue != null ? b.cleanupQueue : new InMemoryCleanupQueue(clock, null);
        this.cleanupEnforcer = new RunCleanupEnforcer(
                new SecureCleanup(tempStore, cleanupQueue, settings.getCleanupMaxRetries(), clock), clock);
        this.ledger = new RunLedger(b.ledgerStore);
        this.hooks = new CompositePipelineHooks(b.hooks);
        this.conditions = new ConditionEvaluator(b.customConditions);
        this.ids = b.ids != null ? b.ids : RandomIdGenerator.INSTANCE;
        this.engineVersions = EngineVersions.current();
        this.fingerprints = new FingerprintGenerator(clock);
    }

    public static Builder builder(FilterRegistry registry) {
        return new Builder(registry);
    }

    public TempStore getTempStore() {
        return tempStore;
    }

    public CleanupQueue getCleanupQueue() {
        return cleanupQueue;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    /** Retries queued deletions once. Meant for a periodic maintenance task. */
    public CleanupQueueResult processCleanupQueue() {
        return cleanupQueue.process(tempStore);
    }

    /**
     * Runs the input's plan against its document.
     *
     * @throws ConfigurationException when the registry is not initialized or the plan is invalid
     */
    public ValidationReport execute(PipelineInput input) {
        Objects.requireNonNull(input, "input");
        if (!registry.isInitialized()) {
            throw new ConfigurationException("Filter registry is not initialized; call initializeAll() first");
        }
        ExecutionPlan plan = input.getPlan();
        PlanValidator.validate(plan);
        if (plan.getConfigHash() == null || plan.getConfigHash().isBlank()) {
            plan = plan.withConfigHash(ConfigHasher.hashPlan(plan));
        }

        EffectiveConfig effective = EffectiveConfig.resolve(settings, input.getTenant(), input.getOverrides());
        ContextInit init = ContextInit.builder(input.getRawDocument(), plan)
                .correlationId(input.getCorrelationId())
                .locale(effective.getLocale())
                .requestMetadata(effective.getRequestMetadata())
                .build();
        ValidationContext context = ValidationContext.create(init, ids, clock);
        String runId = context.getRunId();
        TempKeyTracker tracker = new TempKeyTracker();

        ExecutionPlanSnapshot snapshot = PlanHasher.createSnapshot(plan, effective.getConfig(), engineVersions,
                filterVersions(), clock);
        ledger.runStarted(runId, input.getTenant().getTenantId(), snapshot, context.getStartedAt().toEpochMilli());
        hooks.onStart(runId, input);
        log.info("Run {} started | correlationId={} plan={} planHash={}", runId, context.getCorrelationId(),
                plan.getId(), snapshot.getPlanHash());

        Integer planParallelism = intOrNull(plan.getGlobalLong(ExecutionPlan.GLOBAL_MAX_PARALLELISM));
        PipelineRun run = new PipelineRun(context, registry, conditions, hooks, ledger, tempStore, tracker,
                settings.getTempTtlMs(), effective.getDefaultFilterTimeoutMs(),
                planParallelism != null ? planParallelism : effective.getMaxParallelism(),
                settings.getPipelineTimeoutMs());

        Throwable internalFailure = null;
        CleanupResult cleanup;
        try {
            run.storeTemp(TempKeys.RAW_INVOICE, input.getRawDocument().getContent());
            run.execute();
        } catch (RuntimeException e) {
            internalFailure = e;
            log.error("Run {} failed internally; report is marked errored. Error: {}", runId, e.getMessage(), e);
            hooks.onError(runId, null, e);
            context.addDiagnostics(List.of(Diagnostic.error("INTERNAL_ERROR", "Pipeline failed: " + e.getMessage())
                    .withCategory(PipelineRun.INTERNAL_CATEGORY)));
        } finally {
            run.close();
            cleanup = cleanupEnforcer.enforce(runId, context.getCorrelationId(), tracker);
            hooks.onCleanup(runId, cleanup);
            tracker.clear();
        }

        ValidationReport report = assemble(context, plan, snapshot, run.isTimedOut(), internalFailure, cleanup);
        ledger.runEnded(runId, clock.millis(), report.getStatus().name(), report.getFingerprint(),
                report.getTiming().getDurationMs());
        hooks.onComplete(report);
        return report;
    }

    private ValidationReport assemble(ValidationContext context, ExecutionPlan plan, ExecutionPlanSnapshot snapshot,
                                      boolean timedOut, Throwable internalFailure, CleanupResult cleanup) {
        List<StepResult> steps = context.getCompletedSteps();
        List<Diagnostic> diagnostics = context.getDiagnostics();

        ValidationStatus status;
        if (timedOut) {
            status = ValidationStatus.TIMEOUT;
        } else if (internalFailure != null) {
            status = ValidationStatus.ERROR;
        } else {
            status = ValidationStatus.derive(false, steps, diagnostics);
        }
        int score = ScoreCalculator.calculate(diagnostics, steps);
        InvoiceSummary summary = InvoiceSummary.from(context.getParsedDocument());
        Instant completedAt = clock.instant();
        ValidationReport.Timing timing = new ValidationReport.Timing(context.getStartedAt(), completedAt);

        ComplianceFingerprint fingerprint = fingerprints.generate(context.getRunId(), status, score, steps,
                diagnostics, plan, snapshot.getPlanHash(), summary, timing.getDurationMs());

        return ValidationReport.builder(context.getRunId())
                .correlationId(context.getCorrelationId())
                .reportState(reportState(timedOut, internalFailure, steps, context.isAborted()))
                .status(status)
                .score(score)
                .diagnostics(diagnostics)
                .steps(steps)
                .invoiceSummary(summary)
                .planSnapshot(snapshot)
                .stepConfigHashes(PlanHasher.stepConfigHashes(plan))
                .fingerprint(fingerprint)
                .timing(timing)
                .metadata(context.getRequestMetadata())
                .abortReason(context.getAbortReason())
                .cleanup(cleanup)
                .build();
    }

    static ReportState reportState(boolean timedOut, Throwable internalFailure, List<StepResult> steps,
                                   boolean aborted) {
        if (timedOut) {
            return ReportState.TIMED_OUT;
        }
        if (internalFailure != null || steps.stream().anyMatch(s -> s.getStatus() == StepStatus.ERROR)) {
            return ReportState.ERRORED;
        }
        if (aborted) {
            return ReportState.INCOMPLETE;
        }
        return ReportState.COMPLETE;
    }

    private Map<String, String> filterVersions() {
        Map<String, String> versions = new LinkedHashMap<>();
        for (RegisteredFilter f : registry.list()) {
            versions.put(f.getId(), f.getVersion());
        }
        return versions;
    }

    private static Integer intOrNull(Long value) {
        return value != null ? (int) Math.min(Integer.MAX_VALUE, value) : null;
    }

    public static final class Builder {
        private final FilterRegistry registry;
        private EngineSettings settings;
        private TempStore tempStore;
        private CleanupQueue cleanupQueue;
        private LedgerStore ledgerStore;
        private final List<PipelineHooks> hooks = new ArrayList<>();
        private CustomConditionEvaluator customConditions;
        private IdGenerator ids;
        private Clock clock;

        private Builder(FilterRegistry registry) {
            this.registry = registry;
        }

        public Builder settings(EngineSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder tempStore(TempStore tempStore) {
            this.tempStore = tempStore;
            return this;
        }

        public Builder cleanupQueue(CleanupQueue cleanupQueue) {
            this.cleanupQueue = cleanupQueue;
            return this;
        }

        /** Store for the run ledger; none means the ledger is disabled. */
        public Builder ledgerStore(LedgerStore ledgerStore) {
            this.ledgerStore = ledgerStore;
            return this;
        }

        public Builder addHooks(PipelineHooks hooks) {
            this.hooks.add(Objects.requireNonNull(hooks, "hooks"));
            return this;
        }

        public Builder customConditions(CustomConditionEvaluator customConditions) {
            this.customConditions = customConditions;
            return this;
        }

        public Builder idGenerator(IdGenerator ids) {
            this.ids = ids;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PipelineEngine build() {
            return new PipelineEngine(this);
        }
    }
}
