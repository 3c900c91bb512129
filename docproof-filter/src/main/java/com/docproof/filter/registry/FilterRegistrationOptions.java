package com.docproof.filter.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Options for {@link FilterRegistry#register}. Lower priority sorts first in listings.
 */
public final class FilterRegistrationOptions {

    public static final int DEFAULT_PRIORITY = 0;

    private static final FilterRegistrationOptions DEFAULTS = builder().build();

    private final Set<String> aliases;
    private final int priority;
    private final boolean enabled;
    private final Map<String, Object> defaultConfig;

    private FilterRegistrationOptions(Builder b) {
        this.aliases = Set.copyOf(b.aliases);
        this.priority = b.priority;
        this.enabled = b.enabled;
        this.defaultConfig = b.defaultConfig.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.defaultConfig));
    }

    public static FilterRegistrationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
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

    public static final class Builder {
        private final Set<String> aliases = new LinkedHashSet<>();
        private int priority = DEFAULT_PRIORITY;
        private boolean enabled = true;
        private final Map<String, Object> defaultConfig = new LinkedHashMap<>();

        public Builder aliases(String... aliases) {
            this.aliases.addAll(List.of(aliases));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder defaultConfig(Map<String, Object> defaultConfig) {
            if (defaultConfig != null) this.defaultConfig.putAll(defaultConfig);
            return this;
        }

        public FilterRegistrationOptions build() {
            return new FilterRegistrationOptions(this);
        }
    }
}
