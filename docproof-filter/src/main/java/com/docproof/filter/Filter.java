package com.docproof.filter;

import com.docproof.filter.result.StepResult;

import java.util.Map;
import java.util.Set;

/**
 * A single validation check. The engine invokes {@link #execute} once per step that names this filter,
 * possibly concurrently with other filters of the same run.
 * <p>
 * <b>Threading and state:</b> one instance serves every run; implementations must be thread-safe and
 * should keep no per-run state. Report findings through the returned {@link StepResult}. Throwing is
 * allowed and is recorded as a step error, never propagated to the caller.
 */
public interface Filter {

    /** Stable identifier that plan steps reference. */
    String getId();

    String getName();

    /** Version recorded in plan snapshots and fingerprints. */
    String getVersion();

    default String getDescription() {
        return "";
    }

    default Set<String> getTags() {
        return Set.of();
    }

    /** Filter ids this filter expects to have run earlier. Informational. */
    default Set<String> getDependsOn() {
        return Set.of();
    }

    /** JSON-schema-like description of accepted config. Informational; null when undocumented. */
    default Map<String, Object> getConfigSchema() {
        return null;
    }

    /**
     * Runs the check.
     *
     * @param context read-only view of the run plus this step's resolved config
     * @return result; status and diagnostics are the filter's verdict
     * @throws Exception on failure to complete the check
     */
    StepResult execute(FilterContext context) throws Exception;

    /** Called once by {@code FilterRegistry.initializeAll}. */
    default void onInit() throws Exception {
    }

    /** Called once by {@code FilterRegistry.destroyAll}. */
    default void onDestroy() throws Exception {
    }
}
