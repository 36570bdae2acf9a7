package com.umitunal.pipeq.queue;

import com.umitunal.pipeq.model.DeadLetterEntry;
import com.umitunal.pipeq.model.QueuedJob;
import com.umitunal.pipeq.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Resolves a leased job: complete it, count a failure and retry, or dead-letter it.
 *
 * The store has no multi-key transactions, so each transition is a sequence of single-key
 * writes ordered so that stopping after any one of them leaves a state the next poll repairs.
 * A crash after the dead letter is written but before the entry is deleted leaves the job in
 * both places; the next attempt finds attempts already at the maximum and rewrites the same
 * dead-letter key, which converges.
 *
 * @param <T> the payload type of the queue this controller resolves
 */
public class RetryController<T extends QueuedJob> {
    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final QueueStore<T> queue;
    private final LeaseManager leases;
    private final Duration deadLetterRetention;
    private final Clock clock;

    public RetryController(QueueStore<T> queue, LeaseManager leases, Duration deadLetterRetention) {
        this(queue, leases, deadLetterRetention, Clock.systemUTC());
    }

    public RetryController(QueueStore<T> queue, LeaseManager leases, Duration deadLetterRetention, Clock clock) {
        this.queue = queue;
        this.leases = leases;
        this.deadLetterRetention = deadLetterRetention;
        this.clock = clock;
    }

    /**
     * Remove the entry and release the lease. Safe to call more than once; a crash between
     * the two deletes leaves a lease that expires on its own.
     */
    public void complete(String entryKey, String subjectUrl) throws StoreException {
        queue.delete(entryKey);
        leases.release(subjectUrl);
    }

    /**
     * Record a failed attempt and release the lease either way, so the job is visible again
     * (for retry, or in the dead-letter queue) on the very next poll.
     *
     * @param entryKey the queue entry
     * @param subjectUrl subject whose lease to release
     * @param error what went wrong
     * @param maxAttempts attempts allowed before dead-lettering
     */
    public FailureOutcome fail(String entryKey, String subjectUrl, String error, int maxAttempts)
            throws StoreException {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }

        Optional<T> current = queue.getJob(entryKey);
        if (current.isEmpty()) {
            leases.release(subjectUrl);
            log.debug("Entry {} already gone, released lease for {}", entryKey, subjectUrl);
            return FailureOutcome.ENTRY_MISSING;
        }

        T job = current.get();
        Instant now = Instant.now(clock);
        int attempts = job.recordFailure(error, now);

        if (attempts >= maxAttempts) {
            queue.putDeadLetter(subjectUrl, new DeadLetterEntry<>(job, now, attempts, error), deadLetterRetention);
            queue.delete(entryKey);
            leases.release(subjectUrl);
            log.error("[{}] Dead-lettered after {} attempts: {} ({})", queue.getQueue(), attempts, subjectUrl, error);
            return FailureOutcome.DEAD_LETTERED;
        }

        queue.update(entryKey, job);
        leases.release(subjectUrl);
        log.warn("[{}] Attempt {}/{} failed for {}: {}", queue.getQueue(), attempts, maxAttempts, subjectUrl, error);
        return FailureOutcome.RETRY_SCHEDULED;
    }

    /**
     * Park an entry that can never become a job, so it stops taking a batch slot on every
     * poll. Kept as long as a dead letter. No lease is touched: nothing could be claimed for it.
     */
    public void quarantine(String entryKey, String reason) throws StoreException {
        if (queue.quarantine(entryKey, deadLetterRetention)) {
            log.error("[{}] Quarantined unreadable entry {}: {}", queue.getQueue(), entryKey, reason);
        }
    }

    /**
     * Give the lease back without spending an attempt, for conditions expected to clear by
     * the next poll (rate limiting).
     */
    public void release(String subjectUrl) throws StoreException {
        leases.release(subjectUrl);
    }

    public QueueStore<T> getQueue() {
        return queue;
    }

    public LeaseManager getLeases() {
        return leases;
    }
}
