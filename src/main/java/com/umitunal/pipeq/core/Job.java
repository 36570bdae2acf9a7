package com.umitunal.pipeq.core;

import java.time.Instant;

/**
 * Retry bookkeeping every queued payload carries alongside its own data.
 */
public interface Job {

    /**
     * Failed attempts so far. Starts at 0 and only ever grows.
     */
    int getAttempts();

    /**
     * When the most recent failed attempt happened, or null if none has.
     */
    Instant getLastAttempt();

    /**
     * Error text from the most recent failed attempt, or null.
     */
    String getError();

    /**
     * The canonical URL that identifies this job across queues, leases and the dedup ledger,
     * or null if the payload carries no subject.
     */
    String subjectUrl();
}
