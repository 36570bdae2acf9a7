package com.umitunal.pipeq.model;

import java.time.Instant;

/**
 * Payload on the enrichment queue: a freshly discovered subject waiting for its text.
 */
public class EnrichmentJob extends QueuedJob {
    private Subject subject;
    private Instant enqueued;

    public EnrichmentJob() {
    }

    public EnrichmentJob(Subject subject, Instant enqueued) {
        this.subject = subject;
        this.enqueued = enqueued;
    }

    public Subject getSubject() { return subject; }
    public void setSubject(Subject subject) { this.subject = subject; }
    public Instant getEnqueued() { return enqueued; }
    public void setEnqueued(Instant enqueued) { this.enqueued = enqueued; }

    @Override
    public String subjectUrl() {
        return subject != null ? subject.getUrl() : null;
    }

    @Override
    public String toString() {
        return String.format("EnrichmentJob{subject=%s, attempts=%d}", subject != null ? subject.label() : "-", getAttempts());
    }
}
