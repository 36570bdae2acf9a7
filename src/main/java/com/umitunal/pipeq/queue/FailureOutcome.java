package com.umitunal.pipeq.queue;

/**
 * What {@link RetryController#fail} did with a failed job.
 */
public enum FailureOutcome {
    /** The entry was already gone; only the lease was released. */
    ENTRY_MISSING,
    /** Attempt recorded, lease released, the job is eligible on the next poll. */
    RETRY_SCHEDULED,
    /** Attempts exhausted; the job now lives in the dead-letter queue. */
    DEAD_LETTERED
}
