package com.docproof.plan.hash;

import com.docproof.plan.model.ExecutionPlan;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SHA-256 hashing over {@link CanonicalJson}. Every hash is rendered as {@code sha256:<lowercase hex>}.
 */
public final class ConfigHasher {

    public static final String PREFIX = "sha256:";

    private ConfigHasher() {
    }

    /** Hash of the canonical form of any value. Key order and absent-vs-null never change the result. */
    public static String hash(Object value) {
        return sha256(CanonicalJson.canonicalize(value));
    }

    public static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            return PREFIX + HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /**
     * Plan config hash over {@code id}, {@code version}, {@code steps} and {@code globalConfig}.
     * The plan's own {@code name} and {@code configHash} are not part of the input.
     */
    public static String hashPlan(ExecutionPlan plan) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("id", plan.getId());
        content.put("version", plan.getVersion());
        content.put("steps", plan.getSteps());
        content.put("globalConfig", plan.getGlobalConfig());
        return hash(content);
    }

    /** Hash of a single step's effective config map. */
    public static String hashStepConfig(Map<String, Object> config) {
        return hash(config != null ? config : Map.of());
    }

    /**
     * @return true when the plan carries no hash, or its hash matches the recomputed value
     */
    public static boolean verify(ExecutionPlan plan) {
        String stored = plan.getConfigHash();
        return stored == null || stored.isBlank() || stored.equals(hashPlan(plan));
    }
}
