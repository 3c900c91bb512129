package com.docproof.engine;

import com.docproof.audit.config.RequestOverrides;
import com.docproof.config.TenantSettings;
import com.docproof.filter.RawDocument;
import com.docproof.plan.model.ExecutionPlan;

import java.util.Objects;

/**
 * One validation request: the document, the plan to run it through and optional per-request settings.
 */
public final class PipelineInput {

    private final RawDocument rawDocument;
    private final ExecutionPlan plan;
    private final String correlationId;
    private final TenantSettings tenant;
    private final RequestOverrides overrides;

    private PipelineInput(Builder b) {
        this.rawDocument = Objects.requireNonNull(b.rawDocument, "rawDocument");
        this.plan = Objects.requireNonNull(b.plan, "plan");
        this.correlationId = b.correlationId;
        this.tenant = b.tenant != null ? b.tenant : TenantSettings.EMPTY;
        this.overrides = b.overrides != null ? b.overrides : RequestOverrides.NONE;
    }

    public static Builder builder(RawDocument rawDocument, ExecutionPlan plan) {
        return new Builder(rawDocument, plan);
    }

    public static PipelineInput of(RawDocument rawDocument, ExecutionPlan plan) {
        return builder(rawDocument, plan).build();
    }

    public RawDocument getRawDocument() {
        return rawDocument;
    }

    public ExecutionPlan getPlan() {
        return plan;
    }

    /** Caller-supplied correlation id, or null to use the run id. */
    public String getCorrelationId() {
        return correlationId;
    }

    public TenantSettings getTenant() {
        return tenant;
    }

    public RequestOverrides getOverrides() {
        return overrides;
    }

    public static final class Builder {
        private final RawDocument rawDocument;
        private final ExecutionPlan plan;
        private String correlationId;
        private TenantSettings tenant;
        private RequestOverrides overrides;

        private Builder(RawDocument rawDocument, ExecutionPlan plan) {
            this.rawDocument = rawDocument;
            this.plan = plan;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder tenant(TenantSettings tenant) {
            this.tenant = tenant;
            return this;
        }

        public Builder overrides(RequestOverrides overrides) {
            this.overrides = overrides;
            return this;
        }

        public PipelineInput build() {
            return new PipelineInput(this);
        }
    }
}
