package com.docproof.filter.result;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepResultTest {

    @Test
    void withExecution_fillsMissingDiagnosticSource() {
        StepResult raw = StepResult.failed(null, List.of(
                Diagnostic.error("BR-01", "missing invoice number"),
                Diagnostic.warning("W-1", "odd").withSource("upstream")));

        StepResult stamped = raw.withExecution("kosit", "2.0.1", 42L);

        assertEquals("kosit", stamped.getFilterId());
        assertEquals("2.0.1", stamped.getFilterVersion());
        assertEquals(42L, stamped.getDurationMs());
        assertEquals("kosit", stamped.getDiagnostics().get(0).getSource());
        assertEquals("upstream", stamped.getDiagnostics().get(1).getSource());
        assertTrue(stamped.hasErrors());
    }

    @Test
    void skipped_recordsReason() {
        StepResult skipped = StepResult.skipped("vies", "disabled", Diagnostic.info("STEP_DISABLED", "disabled"));

        assertEquals(StepStatus.SKIPPED, skipped.getStatus());
        assertEquals("disabled", skipped.getMetadata().get(StepResult.SKIPPED_REASON));
        assertFalse(skipped.hasErrors());
    }

    @Test
    void statusFailure_onlyFailedAndError() {
        assertTrue(StepStatus.FAILED.isFailure());
        assertTrue(StepStatus.ERROR.isFailure());
        assertFalse(StepStatus.WARNING.isFailure());
        assertFalse(StepStatus.SKIPPED.isFailure());
        assertEquals("passed", StepStatus.PASSED.toValue());
    }
}
