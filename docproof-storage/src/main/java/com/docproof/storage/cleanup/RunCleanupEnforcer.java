package com.docproof.storage.cleanup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Removes every temp entry a run created, once, when the run ends. Never throws: any problem becomes a
 * {@link RetentionWarning} on the returned {@link CleanupResult}.
 */
public final class RunCleanupEnforcer {

    private static final Logger log = LoggerFactory.getLogger(RunCleanupEnforcer.class);
    public static final String ZERO_RETENTION = "zero-retention";

    private final SecureCleanup secureCleanup;
    private final Clock clock;
    private final String policy;

    public RunCleanupEnforcer(SecureCleanup secureCleanup, Clock clock) {
        this(secureCleanup, clock, ZERO_RETENTION);
    }

    public RunCleanupEnforcer(SecureCleanup secureCleanup, Clock clock, String policy) {
        this.secureCleanup = Objects.requireNonNull(secureCleanup, "secureCleanup");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.policy = policy != null ? policy : ZERO_RETENTION;
    }

    public String getPolicy() {
        return policy;
    }

    public CleanupResult enforce(String runId, String correlationId, TempKeyTracker tracker) {
        Instant start = clock.instant();
        List<RetentionWarning> warnings = new ArrayList<>();
        int tracked = tracker != null ? tracker.size() : 0;
        try {
            if (tracker == null || tracked == 0) {
                return new CleanupResult(true, 0, 0, 0, 0, elapsed(start), warnings, policy);
            }
            SecureCleanup.Outcome outcome = secureCleanup.deleteAll(tracker, correlationId);
            Instant now = clock.instant();
            if (outcome.queued() > 0) {
                warnings.add(new RetentionWarning(RetentionWarning.CLEANUP_QUEUED,
                        outcome.queued() + " temp entries queued for retry cleanup", now, outcome.queued()));
                log.warn("Run {} cleanup: {} entries queued for retry", runId, outcome.queued());
            }
            if (outcome.queued() > 0 && outcome.deleted() > 0) {
                warnings.add(new RetentionWarning(RetentionWarning.CLEANUP_PARTIAL,
                        "Partial cleanup: " + outcome.deleted() + " deleted, " + outcome.queued() + " pending",
                        now, outcome.queued()));
            }
            if (outcome.unresolved() > 0) {
                warnings.add(new RetentionWarning(RetentionWarning.CLEANUP_ERROR,
                        outcome.unresolved() + " temp entries could not be deleted or queued", now, outcome.unresolved()));
                log.error("Run {} cleanup: {} entries neither deleted nor queued", runId, outcome.unresolved());
            }
            log.debug("Run {} cleanup done: deleted={} missing={} queued={} categories={}", runId,
                    outcome.deleted(), outcome.missing(), outcome.queued(), tracker.countsByCategory());
            return new CleanupResult(true, outcome.deleted(), outcome.missing(), outcome.queued(),
                    outcome.unresolved(), elapsed(start), warnings, policy);
        } catch (Throwable t) {
            log.warn("Run {} cleanup failed; run result unaffected. Error: {}", runId, t.toString(), t);
            warnings.add(new RetentionWarning(RetentionWarning.CLEANUP_ERROR, "Cleanup failed: " + t.getMessage(),
                    clock.instant(), tracked));
            return new CleanupResult(false, 0, 0, 0, tracked, elapsed(start), warnings, policy);
        }
    }

    private long elapsed(Instant start) {
        return Math.max(0L, Duration.between(start, clock.instant()).toMillis());
    }
}
