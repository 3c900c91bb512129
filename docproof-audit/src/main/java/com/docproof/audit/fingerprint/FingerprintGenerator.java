package com.docproof.audit.fingerprint;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import com.docproof.plan.hash.ConfigHasher;
import com.docproof.plan.model.ExecutionPlan;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Assembles {@link ComplianceFingerprint}s. The fingerprint hash covers run id, status, score, checks,
 * invoice summary, plan config hash, plan hash and timestamp; durations are not hashed.
 */
public final class FingerprintGenerator {

    private final Clock clock;

    public FingerprintGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ComplianceFingerprint generate(String runId, ValidationStatus status, int score,
                                          List<StepResult> steps, List<Diagnostic> diagnostics,
                                          ExecutionPlan plan, String planHash,
                                          InvoiceSummary invoiceSummary, long durationMs) {
        String timestamp = clock.instant().toString();
        Map<String, VerificationStatus> checks = checks(steps);
        List<RiskNote> riskNotes = diagnostics.stream()
                .filter(RiskNote::isRisk)
                .map(RiskNote::from)
                .collect(Collectors.toList());

        Map<String, String> filterVersions = new LinkedHashMap<>();
        for (StepResult step : steps) {
            if (step.getFilterId() != null && step.getFilterVersion() != null) {
                filterVersions.put(step.getFilterId(), step.getFilterVersion());
            }
        }

        ComplianceFingerprint.PlanReference planRef =
                new ComplianceFingerprint.PlanReference(plan.getId(), plan.getVersion(), plan.getConfigHash());

        Map<String, Object> digest = new LinkedHashMap<>();
        digest.put("runId", runId);
        digest.put("status", status);
        digest.put("score", score);
        digest.put("checks", checks);
        digest.put("invoiceSummary", invoiceSummary);
        digest.put("planConfigHash", plan.getConfigHash());
        digest.put("planHash", planHash);
        digest.put("timestamp", timestamp);

        return new ComplianceFingerprint(
                ComplianceFingerprint.ID_PREFIX + runId,
                status,
                score,
                timestamp,
                checks,
                riskNotes,
                ConfigHasher.hash(digest),
                planRef,
                planHash,
                invoiceSummary,
                filterVersions,
                durationMs);
    }

    /** Filter id → outcome; a filter that ran more than once reports its last result. */
    static Map<String, VerificationStatus> checks(List<StepResult> steps) {
        Map<String, VerificationStatus> checks = new LinkedHashMap<>();
        for (StepResult step : steps) {
            if (step.getFilterId() != null) {
                checks.put(step.getFilterId(), VerificationStatus.of(step));
            }
        }
        return checks;
    }
}
