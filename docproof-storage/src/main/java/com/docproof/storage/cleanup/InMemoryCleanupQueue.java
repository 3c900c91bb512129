package com.docproof.storage.cleanup;

import com.docproof.storage.TempStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Process-local {@link CleanupQueue}. Not durable: pending records are lost on restart, so production
 * deployments should back the queue with persistent storage.
 */
public final class InMemoryCleanupQueue implements CleanupQueue {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCleanupQueue.class);

    private final Map<String, FailedDeleteRecord> pending = new LinkedHashMap<>();
    private final Map<String, FailedDeleteRecord> abandoned = new LinkedHashMap<>();
    private final Clock clock;
    private final AbandonedKeyListener listener;

    public InMemoryCleanupQueue() {
        this(Clock.systemUTC(), null);
    }

    /**
     * @param listener notified once per abandoned key; null for none
     */
    public InMemoryCleanupQueue(Clock clock, AbandonedKeyListener listener) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.listener = listener;
    }

    @Override
    public EnqueueOutcome enqueue(FailedDeleteRecord record) {
        Objects.requireNonNull(record, "record");
        FailedDeleteRecord toAbandon;
        synchronized (this) {
            if (abandoned.containsKey(record.key())) {
                log.warn("Ignoring cleanup failure for an already abandoned {} entry", record.category());
                return EnqueueOutcome.IGNORED;
            }
            FailedDeleteRecord existing = pending.get(record.key());
            FailedDeleteRecord next = existing != null ? existing.nextFailure(record) : record;
            if (!next.isExhausted()) {
                pending.put(next.key(), next);
                log.debug("Queued {} entry for cleanup retry ({}/{})", next.category(), next.retryCount(), next.maxRetries());
                return EnqueueOutcome.QUEUED;
            }
            pending.remove(next.key());
            abandoned.put(next.key(), next);
            toAbandon = next;
        }
        alert(toAbandon, toAbandon.lastError());
        return EnqueueOutcome.ABANDONED;
    }

    @Override
    public synchronized List<FailedDeleteRecord> getPending() {
        return List.copyOf(pending.values());
    }

    @Override
    public synchronized int size() {
        return pending.size();
    }

    @Override
    public synchronized void markCompleted(String key) {
        pending.remove(key);
    }

    @Override
    public void markFailed(String key, String reason) {
        FailedDeleteRecord record;
        synchronized (this) {
            record = pending.remove(key);
            if (record == null) return;
            abandoned.put(key, record);
        }
        alert(record, reason);
    }

    @Override
    public CleanupQueueResult process(TempStore store) {
        Objects.requireNonNull(store, "store");
        List<FailedDeleteRecord> batch = getPending();
        int succeeded = 0;
        int requeued = 0;
        int abandonedCount = 0;
        List<String> abandonedKeys = new ArrayList<>();
        for (FailedDeleteRecord record : batch) {
            if (record.isExhausted()) {
                markFailed(record.key(), "retries exhausted");
                abandonedCount++;
                abandonedKeys.add(record.key());
                continue;
            }
            try {
                store.secureDelete(record.key());
                markCompleted(record.key());
                succeeded++;
            } catch (RuntimeException e) {
                FailedDeleteRecord failure = FailedDeleteRecord.firstFailure(record.key(), record.category(),
                        clock.instant(), record.maxRetries(), e.toString(), record.correlationId());
                EnqueueOutcome outcome = enqueue(failure);
                if (outcome == EnqueueOutcome.QUEUED) {
                    requeued++;
                } else {
                    abandonedCount++;
                    abandonedKeys.add(record.key());
                }
            }
        }
        if (!batch.isEmpty()) {
            log.info("Cleanup queue pass: processed={} succeeded={} requeued={} abandoned={}",
                    batch.size(), succeeded, requeued, abandonedCount);
        }
        return new CleanupQueueResult(batch.size(), succeeded, requeued, abandonedCount, abandonedKeys);
    }

    @Override
    public synchronized List<FailedDeleteRecord> getAbandoned() {
        return List.copyOf(abandoned.values());
    }

    @Override
    public synchronized List<String> getAbandonedKeys() {
        return List.copyOf(abandoned.keySet());
    }

    private void alert(FailedDeleteRecord record, String reason) {
        log.error("[ALERT] Abandoned secure delete of {} entry after {} attempts (correlationId={}): {}",
                record.category(), record.retryCount(), record.correlationId(), reason);
        if (listener != null) {
            try {
                listener.onAbandoned(record);
            } catch (RuntimeException e) {
                log.warn("Abandoned-key listener failed. Error: {}", e.toString(), e);
            }
        }
    }
}
