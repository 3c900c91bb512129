package com.docproof.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Engine-wide defaults loaded from environment variables.
 * <p>
 * Timeouts: DOCPROOF_DEFAULT_FILTER_TIMEOUT_MS, DOCPROOF_PIPELINE_TIMEOUT_MS (0 disables the run deadline).
 * Concurrency: DOCPROOF_MAX_PARALLELISM. Temp data: DOCPROOF_TEMP_TTL_MS, DOCPROOF_SENSITIVE_CATEGORIES,
 * DOCPROOF_CLEANUP_MAX_RETRIES. Locale: DOCPROOF_LOCALE.
 */
public final class EngineSettings {

    static final String ENV_DEFAULT_FILTER_TIMEOUT_MS = "DOCPROOF_DEFAULT_FILTER_TIMEOUT_MS";
    static final String ENV_MAX_PARALLELISM = "DOCPROOF_MAX_PARALLELISM";
    static final String ENV_PIPELINE_TIMEOUT_MS = "DOCPROOF_PIPELINE_TIMEOUT_MS";
    static final String ENV_TEMP_TTL_MS = "DOCPROOF_TEMP_TTL_MS";
    static final String ENV_CLEANUP_MAX_RETRIES = "DOCPROOF_CLEANUP_MAX_RETRIES";
    static final String ENV_SENSITIVE_CATEGORIES = "DOCPROOF_SENSITIVE_CATEGORIES";
    static final String ENV_LOCALE = "DOCPROOF_LOCALE";

    public static final long DEFAULT_FILTER_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_MAX_PARALLELISM = 5;
    public static final long DEFAULT_PIPELINE_TIMEOUT_MS = 60_000L;
    public static final long DEFAULT_TEMP_TTL_MS = 60_000L;
    public static final int DEFAULT_CLEANUP_MAX_RETRIES = 3;
    public static final String DEFAULT_LOCALE = "en-US";
    public static final List<String> DEFAULT_SENSITIVE_CATEGORIES = List.of("raw-invoice", "parsed-invoice");

    private final long defaultFilterTimeoutMs;
    private final int maxParallelism;
    private final long pipelineTimeoutMs;
    private final long tempTtlMs;
    private final int cleanupMaxRetries;
    private final Set<String> sensitiveCategories;
    private final String locale;

    private EngineSettings(Builder b) {
        this.defaultFilterTimeoutMs = b.defaultFilterTimeoutMs;
        this.maxParallelism = b.maxParallelism;
        this.pipelineTimeoutMs = b.pipelineTimeoutMs;
        this.tempTtlMs = b.tempTtlMs;
        this.cleanupMaxRetries = b.cleanupMaxRetries;
        this.sensitiveCategories = Collections.unmodifiableSet(new LinkedHashSet<>(b.sensitiveCategories));
        this.locale = b.locale;
    }

    /** Global fallback deadline for a single step when neither the step nor the plan sets one. */
    public long getDefaultFilterTimeoutMs() {
        return defaultFilterTimeoutMs;
    }

    /** Upper bound on simultaneously in-flight steps within one run. */
    public int getMaxParallelism() {
        return maxParallelism;
    }

    /** Deadline for a whole run in milliseconds; 0 means no run deadline. */
    public long getPipelineTimeoutMs() {
        return pipelineTimeoutMs;
    }

    public long getTempTtlMs() {
        return tempTtlMs;
    }

    public int getCleanupMaxRetries() {
        return cleanupMaxRetries;
    }

    /** Temp-store categories that must be overwritten before removal. */
    public Set<String> getSensitiveCategories() {
        return sensitiveCategories;
    }

    public String getLocale() {
        return locale;
    }

    /** Defaults only, ignoring the process environment. */
    public static EngineSettings defaults() {
        return builder().build();
    }

    public static EngineSettings fromEnvironment() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads settings from the given variable map. Unparseable or out-of-range values fall back to defaults.
     *
     * @param env variable name to value (typically {@link System#getenv()})
     */
    public static EngineSettings fromEnv(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> sensitive = parseCommaSeparated(env.get(ENV_SENSITIVE_CATEGORIES));
        return builder()
                .defaultFilterTimeoutMs(parsePositiveLong(env.get(ENV_DEFAULT_FILTER_TIMEOUT_MS), DEFAULT_FILTER_TIMEOUT_MS))
                .maxParallelism((int) parsePositiveLong(env.get(ENV_MAX_PARALLELISM), DEFAULT_MAX_PARALLELISM))
                .pipelineTimeoutMs(parseNonNegativeLong(env.get(ENV_PIPELINE_TIMEOUT_MS), DEFAULT_PIPELINE_TIMEOUT_MS))
                .tempTtlMs(parsePositiveLong(env.get(ENV_TEMP_TTL_MS), DEFAULT_TEMP_TTL_MS))
                .cleanupMaxRetries((int) parsePositiveLong(env.get(ENV_CLEANUP_MAX_RETRIES), DEFAULT_CLEANUP_MAX_RETRIES))
                .sensitiveCategories(sensitive.isEmpty() ? DEFAULT_SENSITIVE_CATEGORIES : sensitive)
                .locale(getOrDefault(env, ENV_LOCALE, DEFAULT_LOCALE))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static long parsePositiveLong(String value, long defaultValue) {
        long parsed = parseNonNegativeLong(value, defaultValue);
        return parsed > 0 ? parsed : defaultValue;
    }

    private static long parseNonNegativeLong(String value, long defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getOrDefault(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private long defaultFilterTimeoutMs = DEFAULT_FILTER_TIMEOUT_MS;
        private int maxParallelism = DEFAULT_MAX_PARALLELISM;
        private long pipelineTimeoutMs = DEFAULT_PIPELINE_TIMEOUT_MS;
        private long tempTtlMs = DEFAULT_TEMP_TTL_MS;
        private int cleanupMaxRetries = DEFAULT_CLEANUP_MAX_RETRIES;
        private List<String> sensitiveCategories = new ArrayList<>(DEFAULT_SENSITIVE_CATEGORIES);
        private String locale = DEFAULT_LOCALE;

        public Builder defaultFilterTimeoutMs(long defaultFilterTimeoutMs) {
            if (defaultFilterTimeoutMs <= 0) {
                throw new IllegalArgumentException("defaultFilterTimeoutMs must be positive: " + defaultFilterTimeoutMs);
            }
            this.defaultFilterTimeoutMs = defaultFilterTimeoutMs;
            return this;
        }

        public Builder maxParallelism(int maxParallelism) {
            if (maxParallelism < 1) {
                throw new IllegalArgumentException("maxParallelism must be at least 1: " + maxParallelism);
            }
            this.maxParallelism = maxParallelism;
            return this;
        }

        public Builder pipelineTimeoutMs(long pipelineTimeoutMs) {
            if (pipelineTimeoutMs < 0) {
                throw new IllegalArgumentException("pipelineTimeoutMs must not be negative: " + pipelineTimeoutMs);
            }
            this.pipelineTimeoutMs = pipelineTimeoutMs;
            return this;
        }

        public Builder tempTtlMs(long tempTtlMs) {
            if (tempTtlMs <= 0) {
                throw new IllegalArgumentException("tempTtlMs must be positive: " + tempTtlMs);
            }
            this.tempTtlMs = tempTtlMs;
            return this;
        }

        public Builder cleanupMaxRetries(int cleanupMaxRetries) {
            if (cleanupMaxRetries < 1) {
                throw new IllegalArgumentException("cleanupMaxRetries must be at least 1: " + cleanupMaxRetries);
            }
            this.cleanupMaxRetries = cleanupMaxRetries;
            return this;
        }

        public Builder sensitiveCategories(List<String> sensitiveCategories) {
            this.sensitiveCategories = sensitiveCategories != null ? new ArrayList<>(sensitiveCategories) : new ArrayList<>();
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale != null && !locale.isBlank() ? locale : DEFAULT_LOCALE;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(this);
        }
    }
}
