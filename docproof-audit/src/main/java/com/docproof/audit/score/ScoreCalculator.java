package com.docproof.audit.score;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;

import java.util.Collection;

/**
 * Compliance score 0..100. Starts at 100; each error diagnostic costs 20, each warning 5; each
 * failed step 15, each warning step 3, each errored step 10.
 */
public final class ScoreCalculator {

    static final int ERROR_WEIGHT = -20;
    static final int WARNING_WEIGHT = -5;
    static final int STEP_FAILED_WEIGHT = -15;
    static final int STEP_WARNING_WEIGHT = -3;
    static final int STEP_ERROR_WEIGHT = -10;

    private ScoreCalculator() {
    }

    public static int calculate(Collection<Diagnostic> diagnostics, Collection<StepResult> steps) {
        int score = 100;
        for (Diagnostic d : diagnostics) {
            switch (d.getSeverity()) {
                case ERROR -> score += ERROR_WEIGHT;
                case WARNING -> score += WARNING_WEIGHT;
                default -> { }
            }
        }
        for (StepResult s : steps) {
            switch (s.getStatus()) {
                case FAILED -> score += STEP_FAILED_WEIGHT;
                case WARNING -> score += STEP_WARNING_WEIGHT;
                case ERROR -> score += STEP_ERROR_WEIGHT;
                default -> { }
            }
        }
        return Math.max(0, Math.min(100, score));
    }

    /** {@code excellent} ≥ 95, {@code good} ≥ 80, {@code fair} ≥ 50, {@code poor} ≥ 20, else {@code critical}. */
    public static String category(int score) {
        if (score >= 95) return "excellent";
        if (score >= 80) return "good";
        if (score >= 50) return "fair";
        if (score >= 20) return "poor";
        return "critical";
    }
}
