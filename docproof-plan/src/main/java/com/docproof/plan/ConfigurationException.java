package com.docproof.plan;

import java.util.List;

/**
 * Thrown when a plan or engine setup is invalid. This is the only failure a caller of the
 * pipeline sees as an exception; everything that happens inside a step becomes report data.
 */
public final class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
