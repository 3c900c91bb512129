package com.docproof.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tenant-level overrides applied on top of {@link EngineSettings} when a run's effective
 * configuration is computed. Known keys: {@code defaultFilterTimeout}, {@code maxParallelism},
 * {@code locale}, {@code strictMode}, {@code retryOnError}, {@code maxRetries}; anything else is
 * carried through as tenant custom settings.
 */
public interface TenantSettings {

    /** No tenant overrides. */
    TenantSettings EMPTY = new TenantSettings() {
        @Override
        public String getTenantId() {
            return "";
        }
        @Override
        public Object get(String key) {
            return null;
        }
        @Override
        public Map<String, Object> getSettingsMap() {
            return Collections.emptyMap();
        }
    };

    String getTenantId();

    /**
     * @param key setting key
     * @return value or null if absent
     */
    Object get(String key);

    /** Unmodifiable view of every tenant setting, in insertion order. */
    Map<String, Object> getSettingsMap();

    /**
     * Creates tenant settings from a map (e.g. parsed from a tenant registry document).
     *
     * @param tenantId tenant id
     * @param settings settings map (may be null; copied and made unmodifiable)
     */
    static TenantSettings of(String tenantId, Map<String, Object> settings) {
        if ((tenantId == null || tenantId.isBlank()) && (settings == null || settings.isEmpty())) {
            return EMPTY;
        }
        String tid = tenantId != null ? tenantId.trim() : "";
        Map<String, Object> copy = settings != null && !settings.isEmpty()
                ? Collections.unmodifiableMap(new LinkedHashMap<>(settings))
                : Collections.emptyMap();
        return new TenantSettings() {
            @Override
            public String getTenantId() {
                return tid;
            }
            @Override
            public Object get(String key) {
                return copy.get(Objects.requireNonNull(key, "key"));
            }
            @Override
            public Map<String, Object> getSettingsMap() {
                return copy;
            }
        };
    }
}
