package com.docproof.storage.memory;

import com.docproof.storage.TempKeys;
import com.docproof.storage.TempStore;
import com.docproof.storage.TempStoreEntry;
import com.docproof.storage.TempStoreException;
import com.docproof.storage.TempStoreOptions;
import com.docproof.storage.TempStoreStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local {@link TempStore}. Values are held as their JSON bytes so that an overwrite really
 * replaces the stored content: secure deletion zero-fills the byte array before dropping it.
 * <p>
 * Expiry is lazy (checked on every read) with an optional background sweep
 * ({@link #startSweeper(Duration)}). Time comes from the injected {@link Clock}.
 */
public final class InMemoryTempStore implements TempStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTempStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final long DEFAULT_TTL_MS = 60_000L;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(10);
    public static final Set<String> DEFAULT_SENSITIVE_CATEGORIES = Set.of(TempKeys.RAW_INVOICE, TempKeys.PARSED_INVOICE);

    private final Map<String, Slot> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long defaultTtlMs;
    private final Set<String> sensitiveCategories;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Instant lastCleanupAt;
    private volatile ScheduledExecutorService sweeper;

    public InMemoryTempStore() {
        this(Clock.systemUTC(), DEFAULT_TTL_MS, DEFAULT_SENSITIVE_CATEGORIES);
    }

    /**
     * @param clock               time source for expiry
     * @param defaultTtlMs        TTL when an entry does not set one
     * @param sensitiveCategories categories overwritten before removal on expiry and close
     */
    public InMemoryTempStore(Clock clock, long defaultTtlMs, Set<String> sensitiveCategories) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (defaultTtlMs <= 0) {
            throw new IllegalArgumentException("defaultTtlMs must be positive: " + defaultTtlMs);
        }
        this.defaultTtlMs = defaultTtlMs;
        this.sensitiveCategories = Set.copyOf(sensitiveCategories);
    }

    /** Starts a daemon thread that calls {@link #cleanup()} at the given interval. No-op if already running. */
    public synchronized void startSweeper(Duration interval) {
        checkClosed();
        if (sweeper != null) return;
        ScheduledExecutorService s = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "docproof-temp-sweeper");
            t.setDaemon(true);
            return t;
        });
        long ms = interval.toMillis();
        s.scheduleAtFixedRate(this::sweepQuietly, ms, ms, TimeUnit.MILLISECONDS);
        sweeper = s;
    }

    private void sweepQuietly() {
        try {
            int removed = cleanup();
            if (removed > 0) {
                log.debug("Temp store sweep removed {} expired entries", removed);
            }
        } catch (IllegalStateException closedMeanwhile) {
            log.debug("Temp store sweep skipped: store closed");
        } catch (RuntimeException e) {
            log.warn("Temp store sweep failed; next sweep will retry. Error: {}", e.toString(), e);
        }
    }

    @Override
    public TempStoreEntry set(String key, Object value, TempStoreOptions options) {
        checkClosed();
        Objects.requireNonNull(key, "key");
        TempStoreOptions opts = options != null ? options : TempStoreOptions.of(TempKeys.UNKNOWN);
        byte[] payload;
        try {
            payload = MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new TempStoreException("Value for temp entry is not serializable", e);
        }
        long ttl = opts.getTtlMs() != null ? opts.getTtlMs() : defaultTtlMs;
        Instant now = clock.instant();
        Slot slot = new Slot(key, payload, now, now.plusMillis(ttl), ttl, opts.getCategory(), opts.getCorrelationId());
        Slot previous = entries.put(key, slot);
        if (previous != null) {
            previous.wipe();
        }
        return slot.toEntry();
    }

    @Override
    public Optional<Object> get(String key) {
        return get(key, Object.class);
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        checkClosed();
        Slot slot = live(key);
        if (slot == null) return Optional.empty();
        synchronized (slot) {
            if (slot.payload == null) return Optional.empty();
            try {
                return Optional.ofNullable(MAPPER.readValue(slot.payload, type));
            } catch (IOException e) {
                throw new TempStoreException("Temp entry could not be decoded as " + type.getSimpleName(), e);
            }
        }
    }

    @Override
    public boolean has(String key) {
        checkClosed();
        return live(key) != null;
    }

    @Override
    public boolean delete(String key) {
        checkClosed();
        return entries.remove(key) != null;
    }

    @Override
    public boolean secureDelete(String key) {
        checkClosed();
        Slot slot = entries.remove(key);
        if (slot == null) return false;
        slot.wipe();
        return true;
    }

    @Override
    public long ttl(String key) {
        checkClosed();
        Slot slot = live(key);
        if (slot == null) return -1;
        long remaining = Duration.between(clock.instant(), slot.expiresAt).toMillis();
        return remaining > 0 ? remaining : -1;
    }

    @Override
    public Optional<TempStoreEntry> extendTtl(String key, long additionalMs) {
        checkClosed();
        if (additionalMs <= 0) {
            throw new IllegalArgumentException("additionalMs must be positive: " + additionalMs);
        }
        Slot slot = live(key);
        if (slot == null) return Optional.empty();
        synchronized (slot) {
            slot.expiresAt = slot.expiresAt.plusMillis(additionalMs);
            slot.ttlMs += additionalMs;
            return Optional.of(slot.toEntry());
        }
    }

    @Override
    public Optional<TempStoreEntry> getMetadata(String key) {
        checkClosed();
        Slot slot = live(key);
        return slot != null ? Optional.of(slot.toEntry()) : Optional.empty();
    }

    @Override
    public int cleanup() {
        checkClosed();
        Instant now = clock.instant();
        int removed = 0;
        for (Slot slot : List.copyOf(entries.values())) {
            if (slot.isExpired(now) && entries.remove(slot.key, slot)) {
                dispose(slot);
                removed++;
            }
        }
        lastCleanupAt = now;
        return removed;
    }

    @Override
    public TempStoreStats stats() {
        checkClosed();
        Instant now = clock.instant();
        Map<String, Integer> byCategory = new HashMap<>();
        long totalSize = 0;
        int expired = 0;
        int total = 0;
        for (Slot slot : entries.values()) {
            total++;
            totalSize += slot.sizeBytes;
            byCategory.merge(slot.category, 1, Integer::sum);
            if (slot.isExpired(now)) expired++;
        }
        return new TempStoreStats(total, totalSize, byCategory, expired, lastCleanupAt);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        ScheduledExecutorService s = sweeper;
        if (s != null) {
            s.shutdownNow();
        }
        int count = entries.size();
        for (Slot slot : List.copyOf(entries.values())) {
            slot.wipe();
        }
        entries.clear();
        log.debug("Temp store closed; {} entries wiped", count);
    }

    /** Live slot for the key; an expired one is removed (and wiped when sensitive) and null returned. */
    private Slot live(String key) {
        if (key == null) return null;
        Slot slot = entries.get(key);
        if (slot == null) return null;
        if (slot.isExpired(clock.instant())) {
            if (entries.remove(key, slot)) {
                dispose(slot);
            }
            return null;
        }
        return slot;
    }

    private void dispose(Slot slot) {
        if (sensitiveCategories.contains(slot.category)) {
            slot.wipe();
        }
    }

    private void checkClosed() {
        if (closed.get()) {
            throw new IllegalStateException("TempStore is closed");
        }
    }

    private static final class Slot {
        private final String key;
        private byte[] payload;
        private final Instant createdAt;
        private volatile Instant expiresAt;
        private long ttlMs;
        private final String category;
        private final String correlationId;
        private final long sizeBytes;

        Slot(String key, byte[] payload, Instant createdAt, Instant expiresAt, long ttlMs,
             String category, String correlationId) {
            this.key = key;
            this.payload = payload;
            this.createdAt = createdAt;
            this.expiresAt = expiresAt;
            this.ttlMs = ttlMs;
            this.category = category;
            this.correlationId = correlationId;
            this.sizeBytes = payload.length;
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }

        synchronized void wipe() {
            if (payload != null) {
                Arrays.fill(payload, (byte) 0);
                payload = null;
            }
        }

        synchronized TempStoreEntry toEntry() {
            return new TempStoreEntry(key, createdAt, expiresAt, ttlMs, category, correlationId, sizeBytes);
        }
    }
}
