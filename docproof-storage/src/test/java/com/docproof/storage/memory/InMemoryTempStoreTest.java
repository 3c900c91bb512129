package com.docproof.storage.memory;

import com.docproof.storage.MutableClock;
import com.docproof.storage.TempKeys;
import com.docproof.storage.TempStoreEntry;
import com.docproof.storage.TempStoreOptions;
import com.docproof.storage.TempStoreStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTempStoreTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final InMemoryTempStore store = new InMemoryTempStore(clock, 60_000L,
            InMemoryTempStore.DEFAULT_SENSITIVE_CATEGORIES);

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void set_thenGetReturnsValue() {
        store.set("parsed-invoice:run_1", Map.of("invoiceNumber", "INV-1"), TempStoreOptions.of(TempKeys.PARSED_INVOICE));

        Optional<Object> value = store.get("parsed-invoice:run_1");

        assertTrue(value.isPresent());
        assertEquals(Map.of("invoiceNumber", "INV-1"), value.get());
    }

    @Test
    void rawInvoiceWithShortTtl_isAbsentAfterExpiry() {
        store.set("raw-invoice:run_1", "<Invoice>secret</Invoice>",
                TempStoreOptions.of(TempKeys.RAW_INVOICE, 50L, "corr-1"));

        clock.advanceMillis(100);

        assertTrue(store.get("raw-invoice:run_1").isEmpty());
        assertFalse(store.has("raw-invoice:run_1"));
        assertEquals(-1, store.ttl("raw-invoice:run_1"));
        assertEquals(0, store.stats().totalEntries());
    }

    @Test
    void expiredEntry_isNeverReturnedByAnyRead() {
        store.set("intermediate:a", "x", TempStoreOptions.of(TempKeys.INTERMEDIATE, 10L, null));
        clock.advanceMillis(10);

        assertTrue(store.getMetadata("intermediate:a").isEmpty());
        assertTrue(store.extendTtl("intermediate:a", 1000L).isEmpty());
        assertTrue(store.get("intermediate:a").isEmpty());
    }

    @Test
    void ttl_reportsRemainingLifetime() {
        store.set("k", "v", TempStoreOptions.of(TempKeys.INTERMEDIATE, 1_000L, null));
        clock.advanceMillis(400);

        assertEquals(600L, store.ttl("k"));
        assertEquals(-1L, store.ttl("missing"));
    }

    @Test
    void extendTtl_pushesExpiryOut() {
        TempStoreEntry created = store.set("k", "v", TempStoreOptions.of(TempKeys.INTERMEDIATE, 100L, null));

        TempStoreEntry extended = store.extendTtl("k", 500L).orElseThrow();
        clock.advanceMillis(300);

        assertEquals(created.expiresAt().plusMillis(500), extended.expiresAt());
        assertEquals(600L, extended.ttlMs());
        assertTrue(store.has("k"));
    }

    @Test
    void secureDelete_missingKeyReturnsFalse() {
        assertFalse(store.secureDelete("raw-invoice:never-written"));
    }

    @Test
    void secureDelete_removesEntry() {
        store.set("raw-invoice:run_2", "<Invoice/>", TempStoreOptions.of(TempKeys.RAW_INVOICE));

        assertTrue(store.secureDelete("raw-invoice:run_2"));
        assertTrue(store.get("raw-invoice:run_2").isEmpty());
        assertFalse(store.secureDelete("raw-invoice:run_2"));
    }

    @Test
    void cleanup_removesOnlyExpiredEntries() {
        store.set("a", "1", TempStoreOptions.of(TempKeys.RAW_INVOICE, 10L, null));
        store.set("b", "2", TempStoreOptions.of(TempKeys.INTERMEDIATE, 10L, null));
        store.set("c", "3", TempStoreOptions.of(TempKeys.INTERMEDIATE, 10_000L, null));
        clock.advanceMillis(20);

        TempStoreStats before = store.stats();
        int removed = store.cleanup();
        TempStoreStats after = store.stats();

        assertEquals(2, before.expiredPending());
        assertEquals(2, removed);
        assertEquals(1, after.totalEntries());
        assertEquals(0, after.expiredPending());
        assertEquals(clock.instant(), after.lastCleanupAt());
        assertEquals(Map.of(TempKeys.INTERMEDIATE, 1), after.byCategory());
    }

    @Test
    void stats_countsCategoriesAndSize() {
        store.set("raw-invoice:r", "<Invoice/>", TempStoreOptions.of(TempKeys.RAW_INVOICE));
        store.set("parsed-invoice:r", Map.of("a", 1), TempStoreOptions.of(TempKeys.PARSED_INVOICE));

        TempStoreStats stats = store.stats();

        assertEquals(2, stats.totalEntries());
        assertTrue(stats.totalSizeBytes() > 0);
        assertEquals(1, stats.byCategory().get(TempKeys.RAW_INVOICE));
        assertNull(stats.lastCleanupAt());
    }

    @Test
    void set_replacesExistingEntry() {
        store.set("k", "old", TempStoreOptions.of(TempKeys.INTERMEDIATE));
        store.set("k", "new", TempStoreOptions.of(TempKeys.INTERMEDIATE));

        assertEquals("new", store.get("k", String.class).orElseThrow());
        assertEquals(1, store.stats().totalEntries());
    }

    @Test
    void operationsAfterClose_throw() {
        store.set("k", "v", TempStoreOptions.of(TempKeys.INTERMEDIATE));
        store.close();

        assertThrows(IllegalStateException.class, () -> store.get("k"));
        assertThrows(IllegalStateException.class, () -> store.set("k", "v", null));
        assertThrows(IllegalStateException.class, store::stats);
        assertDoesNotThrow(store::close);
    }
}
