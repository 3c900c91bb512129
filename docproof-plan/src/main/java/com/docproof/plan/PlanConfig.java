package com.docproof.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.docproof.plan.model.ExecutionPlan;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of execution plans. JSON excludes null values when serializing.
 */
public final class PlanConfig {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private PlanConfig() {
    }

    /**
     * @param json plan JSON (e.g. from file or API)
     * @throws UncheckedIOException on parse failure
     */
    public static ExecutionPlan fromJson(String json) {
        try {
            return MAPPER.readValue(json, ExecutionPlan.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ExecutionPlan fromJson(InputStream in) {
        try {
            return MAPPER.readValue(in, ExecutionPlan.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(ExecutionPlan plan) {
        try {
            return MAPPER.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(ExecutionPlan plan) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
