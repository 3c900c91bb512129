package com.docproof.audit.score;

import com.docproof.filter.result.Diagnostic;
import com.docproof.filter.result.StepResult;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ScoreCalculatorTest {

    @Test
    void calculate_cleanRunScoresFull() {
        assertEquals(100, ScoreCalculator.calculate(List.of(Diagnostic.info("I", "i")), List.of(StepResult.passed("a"))));
    }

    @Test
    void calculate_appliesWeights() {
        List<Diagnostic> diagnostics = List.of(Diagnostic.error("E", "e"), Diagnostic.warning("W", "w"));
        List<StepResult> steps = List.of(
                StepResult.failed("a", List.of()),
                StepResult.warning("b", List.of()),
                StepResult.error("c", Diagnostic.error("X", "x"), 1));

        assertEquals(100 - 20 - 5 - 15 - 3 - 10, ScoreCalculator.calculate(diagnostics, steps));
    }

    @Test
    void calculate_clampsAtZero() {
        List<Diagnostic> diagnostics = Collections.nCopies(8, Diagnostic.error("E", "e"));

        assertEquals(0, ScoreCalculator.calculate(diagnostics, List.of()));
    }

    @Test
    void category_boundaries() {
        assertEquals("excellent", ScoreCalculator.category(95));
        assertEquals("good", ScoreCalculator.category(80));
        assertEquals("fair", ScoreCalculator.category(50));
        assertEquals("poor", ScoreCalculator.category(20));
        assertEquals("critical", ScoreCalculator.category(19));
    }
}
