package com.docproof.plan.model;

import com.docproof.plan.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A versioned, ordered description of which filters to run. Immutable.
 * {@code configHash} covers {@code id}, {@code version}, {@code steps} and {@code globalConfig};
 * {@code name} and {@code createdAt} are descriptive only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "version", "name", "configHash", "createdAt", "globalConfig", "steps"})
public final class ExecutionPlan {

    /** Key in {@link #getGlobalConfig()} for the pipeline-wide step timeout in milliseconds. */
    public static final String GLOBAL_DEFAULT_TIMEOUT = "defaultTimeout";
    /** Key in {@link #getGlobalConfig()} for the in-flight step cap. */
    public static final String GLOBAL_MAX_PARALLELISM = "maxParallelism";

    private final String id;
    private final String version;
    private final String name;
    private final List<ExecutionStep> steps;
    private final Map<String, Object> globalConfig;
    private final String configHash;
    private final String createdAt;

    /**
     * @throws ConfigurationException if {@code steps} contains a null entry
     */
    @JsonCreator
    public ExecutionPlan(
            @JsonProperty("id") String id,
            @JsonProperty("version") String version,
            @JsonProperty("name") String name,
            @JsonProperty("steps") List<ExecutionStep> steps,
            @JsonProperty("globalConfig") Map<String, Object> globalConfig,
            @JsonProperty("configHash") String configHash,
            @JsonProperty("createdAt") String createdAt) {
        this.id = id;
        this.version = version;
        this.name = name;
        this.steps = ExecutionStep.copySteps(steps, "plan " + id);
        this.globalConfig = globalConfig != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(globalConfig))
                : Map.of();
        this.configHash = configHash;
        this.createdAt = createdAt;
    }

    /** Plan without a creation timestamp. */
    public ExecutionPlan(String id, String version, String name, List<ExecutionStep> steps,
                         Map<String, Object> globalConfig, String configHash) {
        this(id, version, name, steps, globalConfig, configHash, null);
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public String getName() {
        return name;
    }

    public List<ExecutionStep> getSteps() {
        return steps;
    }

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public Map<String, Object> getGlobalConfig() {
        return globalConfig;
    }

    /** {@code sha256:<hex>} of the canonical plan content, or null if never computed. */
    public String getConfigHash() {
        return configHash;
    }

    /** ISO-8601 instant the plan was built at, or null. */
    public String getCreatedAt() {
        return createdAt;
    }

    /** Same plan with the given hash; used by builders after hashing. */
    public ExecutionPlan withConfigHash(String hash) {
        return new ExecutionPlan(id, version, name, steps, globalConfig, hash, createdAt);
    }

    /** Positive integer value of a global config key, or null when absent or not a positive number. */
    @JsonIgnore
    public Long getGlobalLong(String key) {
        Object v = globalConfig.get(key);
        if (v instanceof Number n && n.longValue() > 0) {
            return n.longValue();
        }
        if (v instanceof String s && !s.isBlank()) {
            try {
                long parsed = Long.parseLong(s.trim());
                return parsed > 0 ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExecutionPlan that = (ExecutionPlan) o;
        return Objects.equals(id, that.id) && Objects.equals(version, that.version)
                && Objects.equals(name, that.name) && Objects.equals(steps, that.steps)
                && Objects.equals(globalConfig, that.globalConfig) && Objects.equals(configHash, that.configHash)
                && Objects.equals(createdAt, that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version, name, steps, globalConfig, configHash, createdAt);
    }

    @Override
    public String toString() {
        return "ExecutionPlan{" + id + "@" + version + ", steps=" + steps.size() + "}";
    }
}
