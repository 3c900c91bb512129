package com.docproof.filter;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * What a filter sees while executing: run identity, the input, results so far and its own config.
 * Collections returned are snapshots; they never change after being returned.
 */
public interface FilterContext {

    String getRunId();

    String getCorrelationId();

    Instant getStartedAt();

    RawDocument getRawDocument();

    /** Parsed document set by an earlier step, or null. */
    Map<String, Object> getParsedDocument();

    List<StepResult> getCompletedSteps();

    List<Diagnostic> getDiagnostics();

    boolean isAborted();

    /** First abort reason, or null when not aborted. */
    String getAbortReason();

    /** Latest recorded result for the filter, or null when it has not run. */
    StepResult getStepResult(String filterId);

    boolean hasExecuted(String filterId);

    /** Plan-level config of any step in the run (empty map when none). */
    Map<String, Object> getFilterConfig(String filterId);

    /** This step's resolved config: registry defaults overlaid with the step's plan config. */
    Map<String, Object> getConfig();

    String getLocale();

    Map<String, Object> getRequestMetadata();
}
