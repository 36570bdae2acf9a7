package com.umitunal.pipeq.model;

import java.time.Instant;

/**
 * Terminal record of a job that used up its attempts. Written once, never updated.
 *
 * @param <T> the payload type of the queue the job died on
 */
public class DeadLetterEntry<T extends QueuedJob> {
    private T job;
    private Instant failedAt;
    private int attempts;
    private String lastError;

    public DeadLetterEntry() {
    }

    public DeadLetterEntry(T job, Instant failedAt, int attempts, String lastError) {
        this.job = job;
        this.failedAt = failedAt;
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public T getJob() { return job; }
    public void setJob(T job) { this.job = job; }
    public Instant getFailedAt() { return failedAt; }
    public void setFailedAt(Instant failedAt) { this.failedAt = failedAt; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    @Override
    public String toString() {
        return String.format("DeadLetterEntry{subject='%s', attempts=%d, failedAt=%s, lastError='%s'}",
                job == null ? null : job.subjectUrl(), attempts, failedAt, lastError);
    }
}
