package com.docproof.engine;

/**
 * A filter did not return within its step deadline. Reported to hooks; the step is recorded as an error.
 */
public final class StepTimeoutException extends RuntimeException {

    private final String filterId;
    private final long timeoutMs;

    public StepTimeoutException(String filterId, long timeoutMs) {
        super("Filter " + filterId + " timed out after " + timeoutMs + "ms");
        this.filterId = filterId;
        this.timeoutMs = timeoutMs;
    }

    public String getFilterId() {
        return filterId;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
