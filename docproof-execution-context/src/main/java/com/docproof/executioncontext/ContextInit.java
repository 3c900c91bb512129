package com.docproof.executioncontext;

import com.docproof.filter.RawDocument;
import com.docproof.plan.model.ExecutionPlan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Inputs for creating a {@link ValidationContext}.
 */
public final class ContextInit {

    private final RawDocument rawDocument;
    private final ExecutionPlan plan;
    private final String correlationId;
    private final String locale;
    private final Map<String, Object> requestMetadata;

    private ContextInit(Builder b) {
        this.rawDocument = Objects.requireNonNull(b.rawDocument, "rawDocument");
        this.plan = Objects.requireNonNull(b.plan, "plan");
        this.correlationId = b.correlationId;
        this.locale = b.locale;
        this.requestMetadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.requestMetadata));
    }

    public static Builder builder(RawDocument rawDocument, ExecutionPlan plan) {
        return new Builder(rawDocument, plan);
    }

    public RawDocument getRawDocument() {
        return rawDocument;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    /** Caller-supplied correlation id; null → the run id is used. */
    public String getCorrelationId() {
        return correlationId;
    }

    public String getLocale() {
        return locale;
    }

    public Map<String, Object> getRequestMetadata() {
        return requestMetadata;
    }

    public static final class Builder {
        private final RawDocument rawDocument;
        private final ExecutionPlan plan;
        private String correlationId;
        private String locale;
        private final Map<String, Object> requestMetadata = new LinkedHashMap<>();

        private Builder(RawDocument rawDocument, ExecutionPlan plan) {
            this.rawDocument = rawDocument;
            this.plan = plan;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder locale(String locale) {
            this.locale = locale;
            return this;
        }

        public Builder requestMetadata(Map<String, Object> metadata) {
            if (metadata != null) requestMetadata.putAll(metadata);
            return this;
        }

        public ContextInit build() {
            return new ContextInit(this);
        }
    }
}
