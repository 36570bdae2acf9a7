package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.model.QueuedJob;
import com.umitunal.pipeq.queue.CorruptEntryException;
import com.umitunal.pipeq.queue.LeaseManager;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.queue.RetryController;
import com.umitunal.pipeq.store.StoreException;
import com.umitunal.pipeq.transform.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Poll-lease-process-resolve loop shared by the stages that consume a queue.
 *
 * For each listed key: load the job (gone means someone finished it), claim its subject
 * (taken means another runner has it), hand it to {@link #process}, then complete it. A
 * failure is recorded through the retry controller; a rate limit only releases the lease.
 * An entry that is not a usable job is quarantined. No single job can abort the batch.
 *
 * @param <T> the payload type of the consumed queue
 */
public abstract class QueueStage<T extends QueuedJob> implements StageRunner {
    private static final Logger log = LoggerFactory.getLogger(QueueStage.class);

    private final String name;
    private final QueueStore<T> queue;
    private final LeaseManager leases;
    private final RetryController<T> retries;
    private final int batchSize;
    private final int maxAttempts;
    protected final Clock clock;

    protected QueueStage(String name, RetryController<T> retries, int batchSize, int maxAttempts, Clock clock) {
        this.name = name;
        this.retries = retries;
        this.queue = retries.getQueue();
        this.leases = retries.getLeases();
        this.batchSize = batchSize;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Check required bindings. Runs before any job is touched.
     */
    protected abstract void preflight();

    /**
     * Do the stage's work for one leased job. Returning normally means success.
     */
    protected abstract void process(String entryKey, T job) throws Exception;

    /**
     * Hook after a job completed, e.g. to pace outbound calls.
     */
    protected void afterSuccess(T job) throws InterruptedException {
    }

    @Override
    public StageReport runOnce() throws Exception {
        preflight();

        long start = clock.millis();
        StageReport.Tally tally = new StageReport.Tally();

        List<String> pending = queue.listPending(batchSize);
        log.info("[{}] Found {} pending jobs (limit: {})", name, pending.size(), batchSize);

        for (String entryKey : pending) {
            try {
                handle(entryKey, tally);
            } catch (StoreException e) {
                tally.failed++;
                log.error("[{}] Store error on {}, moving on", name, entryKey, e);
            } catch (RuntimeException e) {
                tally.failed++;
                log.error("[{}] Unexpected error on {}, moving on", name, entryKey, e);
            }
        }

        StageReport report = tally.toReport(name, Duration.ofMillis(clock.millis() - start));
        log.info("{}", report);
        return report;
    }

    private void handle(String entryKey, StageReport.Tally tally) throws StoreException, InterruptedException {
        Optional<T> loaded;
        try {
            loaded = queue.getJob(entryKey);
        } catch (CorruptEntryException e) {
            tally.processed++;
            tally.failed++;
            retries.quarantine(entryKey, e.getMessage());
            return;
        }
        if (loaded.isEmpty()) {
            log.warn("[{}] Job disappeared: {}", name, entryKey);
            return;
        }

        T job = loaded.get();
        String subjectUrl = job.subjectUrl();
        tally.processed++;

        if (!leases.claim(subjectUrl)) {
            log.info("[{}] Job already claimed: {}", name, subjectUrl);
            tally.skipped++;
            return;
        }

        try {
            process(entryKey, job);
        } catch (RateLimitedException e) {
            log.warn("[{}] Rate limited, releasing claim for retry: {}", name, subjectUrl);
            retries.release(subjectUrl);
            tally.skipped++;
            return;
        } catch (InterruptedException e) {
            retries.release(subjectUrl);
            throw e;
        } catch (Exception e) {
            tally.failed++;
            log.error("[{}] Error processing {}: {}", name, subjectUrl, describe(e));
            retries.fail(entryKey, subjectUrl, describe(e), maxAttempts);
            return;
        }

        retries.complete(entryKey, subjectUrl);
        tally.succeeded++;
        log.info("[{}] Successfully processed: {}", name, job);
        afterSuccess(job);
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
