package com.docproof.engine.hooks;

import com.docproof.engine.PipelineInput;
import com.docproof.engine.report.ValidationReport;
import com.docproof.filter.result.StepResult;
import com.docproof.storage.cleanup.CleanupResult;

/**
 * Observer of pipeline lifecycle events. Every method has a no-op default so implementations override
 * only what they need.
 * <p>
 * Hooks are observers: an exception thrown from a hook is logged by the engine and never changes the
 * run's outcome. Step hooks may be called from worker threads concurrently when steps run in parallel.
 */
public interface PipelineHooks {

    PipelineHooks NONE = new PipelineHooks() {
    };

    default void onStart(String runId, PipelineInput input) {
    }

    default void onStepStart(String runId, String filterId) {
    }

    /** Called for every recorded step result, including skipped and errored steps. */
    default void onStepComplete(String runId, StepResult result) {
    }

    default void onComplete(ValidationReport report) {
    }

    /**
     * @param filterId failing step, or null when the failure is not tied to a step
     */
    default void onError(String runId, String filterId, Throwable error) {
    }

    default void onCleanup(String runId, CleanupResult cleanup) {
    }
}
