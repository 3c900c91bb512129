package com.docproof.filter.registry;

import com.docproof.filter.Filter;

import java.util.Map;
import java.util.Set;

/**
 * Registry entry: the filter plus the options it was registered with.
 */
public final class RegisteredFilter {

    private final Filter filter;
    private final Set<String> aliases;
    private final int priority;
    private final boolean enabled;
    private final Map<String, Object> defaultConfig;
    private final long sequence;

    RegisteredFilter(Filter filter, FilterRegistrationOptions options, long sequence) {
        this.filter = filter;
        this.aliases = options.getAliases();
        this.priority = options.getPriority();
        this.enabled = options.isEnabled();
        this.defaultConfig = options.getDefaultConfig();
        this.sequence = sequence;
    }

    public Filter getFilter() {
        return filter;
    }

    public String getId() {
        return filter.getId();
    }

    public String getVersion() {
        return filter.getVersion();
    }

    public Set<String> getAliases() {
        return aliases;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Map<String, Object> getDefaultConfig() {
        return defaultConfig;
    }

    /** Registration order, used as the tie-breaker when priorities are equal. */
    long getSequence() {
        return sequence;
    }
}
