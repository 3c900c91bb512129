package com.docproof.audit.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The per-request settings a caller may change: locale, step timeout and free-form metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RequestOverrides {

    public static final RequestOverrides NONE = new RequestOverrides(null, null, null);

    private final String locale;
    private final Long timeoutMs;
    private final Map<String, Object> metadata;

    @JsonCreator
    public RequestOverrides(
            @JsonProperty("locale") String locale,
            @JsonProperty("timeoutMs") Long timeoutMs,
            @JsonProperty("metadata") Map<String, Object> metadata) {
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive: " + timeoutMs);
        }
        this.locale = locale != null && !locale.isBlank() ? locale.trim() : null;
        this.timeoutMs = timeoutMs;
        this.metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }

    public String getLocale() {
        return locale;
    }

    public Long getTimeoutMs() {
        return timeoutMs;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public boolean isEmpty() {
        return locale == null && timeoutMs == null && metadata.isEmpty();
    }
}
