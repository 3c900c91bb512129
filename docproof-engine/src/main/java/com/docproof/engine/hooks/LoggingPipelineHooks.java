package com.docproof.engine.hooks;

import com.docproof.engine.PipelineInput;
import com.docproof.engine.report.ValidationReport;
import com.docproof.filter.result.StepResult;
import com.docproof.storage.cleanup.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs lifecycle events. Never logs document content or parsed fields, only ids, statuses and counts.
 */
public final class LoggingPipelineHooks implements PipelineHooks {

    private static final Logger log = LoggerFactory.getLogger(LoggingPipelineHooks.class);

    @Override
    public void onStart(String runId, PipelineInput input) {
        log.info("Run {} started | plan={} version={} | documentBytes={}", runId,
                input.getPlan().getId(), input.getPlan().getVersion(), input.getRawDocument().getSizeBytes());
    }

    @Override
    public void onStepStart(String runId, String filterId) {
        log.debug("Run {} step {} started", runId, filterId);
    }

    @Override
    public void onStepComplete(String runId, StepResult result) {
        log.info("Run {} step {} -> {} in {}ms ({} diagnostics)", runId, result.getFilterId(),
                result.getStatus().toValue(), result.getDurationMs(), result.getDiagnostics().size());
    }

    @Override
    public void onComplete(ValidationReport report) {
        log.info("Run {} completed | status={} state={} score={} durationMs={}", report.getRunId(),
                report.getStatus(), report.getReportState().toValue(), report.getScore(),
                report.getTiming().getDurationMs());
    }

    @Override
    public void onError(String runId, String filterId, Throwable error) {
        log.warn("Run {} error{}: {}", runId, filterId != null ? " in step " + filterId : "", error.toString());
    }

    @Override
    public void onCleanup(String runId, CleanupResult cleanup) {
        if (cleanup.isClean()) {
            log.debug("Run {} temp data removed: deleted={} missing={}", runId, cleanup.deleted(), cleanup.missing());
        } else {
            log.warn("Run {} temp data not fully removed: queued={} unresolved={}", runId,
                    cleanup.queued(), cleanup.unresolved());
        }
    }
}
