package com.docproof.filter.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of running a lifecycle hook on every registered filter. Every hook runs; failures are
 * collected rather than stopping the others.
 */
public final class LifecycleResult {

    private final List<String> succeeded;
    private final Map<String, Throwable> failures;

    LifecycleResult(List<String> succeeded, Map<String, Throwable> failures) {
        this.succeeded = List.copyOf(succeeded);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<String> getSucceeded() {
        return succeeded;
    }

    /** Filter id → exception thrown by its hook. */
    public Map<String, Throwable> getFailures() {
        return failures;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }
}
