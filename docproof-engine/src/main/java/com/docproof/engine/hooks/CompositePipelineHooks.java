package com.docproof.engine.hooks;

import com.docproof.engine.PipelineInput;
import com.docproof.engine.report.ValidationReport;
import com.docproof.filter.result.StepResult;
import com.docproof.storage.cleanup.CleanupResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Fans each event out to several hooks in registration order. A hook that throws is logged and the
 * remaining hooks still receive the event.
 */
public final class CompositePipelineHooks implements PipelineHooks {

    private static final Logger log = LoggerFactory.getLogger(CompositePipelineHooks.class);

    private final List<PipelineHooks> hooks;

    public CompositePipelineHooks(List<PipelineHooks> hooks) {
        List<PipelineHooks> copy = new ArrayList<>();
        if (hooks != null) {
            for (PipelineHooks h : hooks) {
                if (h != null) copy.add(h);
            }
        }
        this.hooks = List.copyOf(copy);
    }

    public List<PipelineHooks> getHooks() {
        return hooks;
    }

    @Override
    public void onStart(String runId, PipelineInput input) {
        dispatch("onStart", runId, h -> h.onStart(runId, input));
    }

    @Override
    public void onStepStart(String runId, String filterId) {
        dispatch("onStepStart", runId, h -> h.onStepStart(runId, filterId));
    }

    @Override
    public void onStepComplete(String runId, StepResult result) {
        dispatch("onStepComplete", runId, h -> h.onStepComplete(runId, result));
    }

    @Override
    public void onComplete(ValidationReport report) {
        dispatch("onComplete", report.getRunId(), h -> h.onComplete(report));
    }

    @Override
    public void onError(String runId, String filterId, Throwable error) {
        dispatch("onError", runId, h -> h.onError(runId, filterId, error));
    }

    @Override
    public void onCleanup(String runId, CleanupResult cleanup) {
        dispatch("onCleanup", runId, h -> h.onCleanup(runId, cleanup));
    }

    private void dispatch(String event, String runId, Consumer<PipelineHooks> call) {
        for (PipelineHooks h : hooks) {
            try {
                call.accept(h);
            } catch (Throwable t) {
                log.warn("Hook {}.{} failed (runId={}); execution continues. Error: {}",
                        h.getClass().getSimpleName(), event, runId, t.getMessage(), t);
            }
        }
    }
}
