package com.umitunal.pipeq.model;

import com.umitunal.pipeq.core.Job;

import java.time.Instant;

/**
 * Base class for queue payloads; holds the attempt counter and last error.
 */
public abstract class QueuedJob implements Job {
    private int attempts;
    private Instant lastAttempt;
    private String error;

    @Override
    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0, got " + attempts);
        }
        this.attempts = attempts;
    }

    @Override
    public Instant getLastAttempt() {
        return lastAttempt;
    }

    public void setLastAttempt(Instant lastAttempt) {
        this.lastAttempt = lastAttempt;
    }

    @Override
    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    /**
     * Count one more failed attempt.
     *
     * @return the new attempt count
     */
    public int recordFailure(String reason, Instant at) {
        this.attempts++;
        this.lastAttempt = at;
        this.error = reason;
        return attempts;
    }
}
