package com.docproof.engine;

import com.docproof.engine.condition.ConditionEvaluator;
import com.docproof.engine.hooks.PipelineHooks;
import com.docproof.executioncontext.ContextInit;
import com.docproof.executioncontext.SequentialIdGenerator;
import com.docproof.executioncontext.ValidationContext;
import com.docproof.filter.RawDocument;
import com.docproof.filter.registry.FilterRegistry;
import com.docproof.ledger.RunLedger;
import com.docproof.plan.build.PlanBuilder;
import com.docproof.storage.TempKeys;
import com.docproof.storage.cleanup.TempKeyTracker;
import com.docproof.storage.memory.InMemoryTempStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineRunTest {

    private final InMemoryTempStore store = new InMemoryTempStore();
    private final TempKeyTracker tracker = new TempKeyTracker();

    private PipelineRun newRun() {
        ContextInit init = ContextInit.builder(RawDocument.of("<Invoice/>"),
                new PlanBuilder().setId("run-test").build()).build();
        ValidationContext context = ValidationContext.create(init, new SequentialIdGenerator(), Clock.systemUTC());
        return new PipelineRun(context, new FilterRegistry(), new ConditionEvaluator(), PipelineHooks.NONE,
                RunLedger.disabled(), store, tracker, 60_000L, 1_000L, 2, 0L);
    }

    @Test
    void storeTemp_whileOpen_writesAndTracksKey() {
        try (PipelineRun run = newRun()) {
            run.storeTemp(TempKeys.PARSED_INVOICE, Map.of("id", "INV-1"));

            assertEquals(1, tracker.size());
            assertTrue(store.has(tracker.keys().get(0)));
        }
    }

    @Test
    void storeTemp_afterClose_isIgnored() {
        PipelineRun run = newRun();
        run.close();

        run.storeTemp(TempKeys.PARSED_INVOICE, Map.of("id", "INV-1"));

        assertEquals(0, tracker.size());
        assertEquals(0, store.stats().totalEntries());
        assertFalse(run.isTimedOut());
    }
}
