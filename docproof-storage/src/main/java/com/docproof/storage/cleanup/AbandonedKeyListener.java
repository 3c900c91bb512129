package com.docproof.storage.cleanup;

/**
 * Notified once when a key is abandoned after exhausting its retries. Operator alerting hook.
 */
@FunctionalInterface
public interface AbandonedKeyListener {

    void onAbandoned(FailedDeleteRecord record);
}
