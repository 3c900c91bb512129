package com.docproof.filter;

/**
 * A plan step references a filter id (or alias) that is not registered.
 */
public final class FilterNotFoundException extends RuntimeException {

    private final String filterId;

    public FilterNotFoundException(String filterId) {
        super("Filter not registered: " + filterId);
        this.filterId = filterId;
    }

    public String getFilterId() {
        return filterId;
    }
}
