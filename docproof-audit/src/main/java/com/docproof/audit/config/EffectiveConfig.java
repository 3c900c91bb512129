package com.docproof.audit.config;

import com.docproof.config.EngineSettings;
import com.docproof.config.TenantSettings;
import com.docproof.plan.hash.ConfigHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration of one run: engine defaults, then tenant settings, then request overrides.
 * The engine reads its step timeout and parallelism from here, so {@link #getConfigHash()} describes
 * the configuration that actually ran.
 * <p>
 * Request metadata is carried alongside but is not part of the hash.
 */
public final class EffectiveConfig {

    private static final Logger log = LoggerFactory.getLogger(EffectiveConfig.class);

    public static final String DEFAULT_FILTER_TIMEOUT = "defaultFilterTimeout";
    public static final String MAX_PARALLELISM = "maxParallelism";
    public static final String LOCALE = "locale";
    public static final String STRICT_MODE = "strictMode";
    public static final String RETRY_ON_ERROR = "retryOnError";
    public static final String MAX_RETRIES = "maxRetries";
    public static final String CUSTOM = "custom";

    public static final String SOURCE_DEFAULT = "default";
    public static final String SOURCE_TENANT = "tenant";
    public static final String SOURCE_REQUEST = "request";

    private static final Set<String> KNOWN_KEYS = Set.of(
            DEFAULT_FILTER_TIMEOUT, MAX_PARALLELISM, LOCALE, STRICT_MODE, RETRY_ON_ERROR, MAX_RETRIES);

    private final Map<String, Object> config;
    private final Map<String, Object> requestMetadata;
    private final List<String> sources;
    private final String configHash;

    private EffectiveConfig(Map<String, Object> config, Map<String, Object> requestMetadata, List<String> sources) {
        this.config = Collections.unmodifiableMap(config);
        this.requestMetadata = requestMetadata;
        this.sources = List.copyOf(sources);
        this.configHash = ConfigHasher.hash(this.config);
    }

    public static EffectiveConfig resolve(EngineSettings settings, TenantSettings tenant, RequestOverrides request) {
        List<String> sources = new ArrayList<>();
        sources.add(SOURCE_DEFAULT);

        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(DEFAULT_FILTER_TIMEOUT, settings.getDefaultFilterTimeoutMs());
        merged.put(MAX_PARALLELISM, settings.getMaxParallelism());
        merged.put(LOCALE, settings.getLocale());
        merged.put(STRICT_MODE, false);
        merged.put(RETRY_ON_ERROR, false);
        merged.put(MAX_RETRIES, 0);

        if (tenant != null && tenant != TenantSettings.EMPTY) {
            sources.add(SOURCE_TENANT);
            Map<String, Object> custom = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : tenant.getSettingsMap().entrySet()) {
                if (e.getValue() == null) continue;
                if (KNOWN_KEYS.contains(e.getKey())) {
                    applyKnown(merged, e.getKey(), e.getValue(), tenant.getTenantId());
                } else {
                    custom.put(e.getKey(), e.getValue());
                }
            }
            if (!custom.isEmpty()) {
                merged.put(CUSTOM, custom);
            }
        }

        Map<String, Object> metadata = Map.of();
        if (request != null && !request.isEmpty()) {
            sources.add(SOURCE_REQUEST);
            if (request.getLocale() != null) {
                merged.put(LOCALE, request.getLocale());
            }
            if (request.getTimeoutMs() != null) {
                merged.put(DEFAULT_FILTER_TIMEOUT, request.getTimeoutMs());
            }
            metadata = request.getMetadata();
        }
        return new EffectiveConfig(merged, metadata, sources);
    }

    private static void applyKnown(Map<String, Object> merged, String key, Object value, String tenantId) {
        switch (key) {
            case DEFAULT_FILTER_TIMEOUT, MAX_PARALLELISM, MAX_RETRIES -> {
                Long n = toLong(value);
                long min = MAX_RETRIES.equals(key) ? 0L : 1L;
                if (n == null || n < min) {
                    log.warn("Ignoring tenant setting {}={} for tenant {}: not a number >= {}", key, value, tenantId, min);
                    return;
                }
                merged.put(key, MAX_PARALLELISM.equals(key) || MAX_RETRIES.equals(key) ? (Object) n.intValue() : n);
            }
            case STRICT_MODE, RETRY_ON_ERROR -> merged.put(key, Boolean.parseBoolean(String.valueOf(value)));
            default -> merged.put(key, String.valueOf(value));
        }
    }

    private static Long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Merged settings (unmodifiable); the input of {@link #getConfigHash()}. */
    public Map<String, Object> getConfig() {
        return config;
    }

    public Map<String, Object> getRequestMetadata() {
        return requestMetadata;
    }

    /** Which layers contributed: {@code default}, then {@code tenant} and {@code request} when present. */
    public List<String> getSources() {
        return sources;
    }

    public String getConfigHash() {
        return configHash;
    }

    public long getDefaultFilterTimeoutMs() {
        return ((Number) config.get(DEFAULT_FILTER_TIMEOUT)).longValue();
    }

    public int getMaxParallelism() {
        return ((Number) config.get(MAX_PARALLELISM)).intValue();
    }

    public String getLocale() {
        return (String) config.get(LOCALE);
    }

    public boolean isStrictMode() {
        return Boolean.TRUE.equals(config.get(STRICT_MODE));
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getCustom() {
        Object custom = config.get(CUSTOM);
        return custom instanceof Map ? (Map<String, Object>) custom : Map.of();
    }

    @Override
    public String toString() {
        return "EffectiveConfig{sources=" + sources + ", configHash=" + configHash + "}";
    }
}
