package com.docproof.audit.snapshot;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Versions of the code that executed a run. Only {@code kernelVersion} is part of the plan hash;
 * {@code runtimeVersion} and {@code components} are recorded for audit.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class EngineVersions {

    private static final Logger log = LoggerFactory.getLogger(EngineVersions.class);

    static final String VERSION_RESOURCE = "/docproof-version.properties";
    public static final String UNKNOWN_VERSION = "0.0.0-unknown";

    private static volatile String cachedKernelVersion;

    private final String kernelVersion;
    private final String runtimeVersion;
    private final Map<String, String> components;

    @JsonCreator
    public EngineVersions(
            @JsonProperty("kernelVersion") String kernelVersion,
            @JsonProperty("runtimeVersion") String runtimeVersion,
            @JsonProperty("components") Map<String, String> components) {
        this.kernelVersion = Objects.requireNonNull(kernelVersion, "kernelVersion");
        this.runtimeVersion = runtimeVersion;
        this.components = components != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(components))
                : Map.of();
    }

    /** Versions of this process: packaged kernel version and the running JVM. */
    public static EngineVersions current() {
        return new EngineVersions(kernelVersion(), Runtime.version().toString(), null);
    }

    public EngineVersions withComponent(String name, String version) {
        Map<String, String> next = new LinkedHashMap<>(components);
        next.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(version, "version"));
        return new EngineVersions(kernelVersion, runtimeVersion, next);
    }

    /** Packaged project version, read once from the filtered version resource. */
    public static String kernelVersion() {
        String v = cachedKernelVersion;
        if (v == null) {
            v = loadKernelVersion();
            cachedKernelVersion = v;
        }
        return v;
    }

    private static String loadKernelVersion() {
        try (InputStream in = EngineVersions.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                log.warn("Version resource {} not found; kernel version is {}", VERSION_RESOURCE, UNKNOWN_VERSION);
                return UNKNOWN_VERSION;
            }
            Properties props = new Properties();
            props.load(in);
            String version = props.getProperty("version");
            if (version == null || version.isBlank() || version.startsWith("${")) {
                return UNKNOWN_VERSION;
            }
            return version.trim();
        } catch (IOException e) {
            log.warn("Failed to read version resource {}. Error: {}", VERSION_RESOURCE, e.getMessage(), e);
            return UNKNOWN_VERSION;
        }
    }

    public String getKernelVersion() {
        return kernelVersion;
    }

    public String getRuntimeVersion() {
        return runtimeVersion;
    }

    public Map<String, String> getComponents() {
        return components;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EngineVersions that = (EngineVersions) o;
        return kernelVersion.equals(that.kernelVersion) && Objects.equals(runtimeVersion, that.runtimeVersion)
                && components.equals(that.components);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kernelVersion, runtimeVersion, components);
    }

    @Override
    public String toString() {
        return "EngineVersions{kernel=" + kernelVersion + ", runtime=" + runtimeVersion + "}";
    }
}
