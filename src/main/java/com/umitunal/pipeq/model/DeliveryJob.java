package com.umitunal.pipeq.model;

import java.time.Instant;

/**
 * Payload on the delivery queue: an enriched subject ready to post.
 */
public class DeliveryJob extends QueuedJob {
    private Subject subject;
    private String enrichedText;
    private Instant enriched;

    public DeliveryJob() {
    }

    public DeliveryJob(Subject subject, String enrichedText, Instant enriched) {
        this.subject = subject;
        this.enrichedText = enrichedText;
        this.enriched = enriched;
    }

    public Subject getSubject() { return subject; }
    public void setSubject(Subject subject) { this.subject = subject; }
    public String getEnrichedText() { return enrichedText; }
    public void setEnrichedText(String enrichedText) { this.enrichedText = enrichedText; }
    public Instant getEnriched() { return enriched; }
    public void setEnriched(Instant enriched) { this.enriched = enriched; }

    @Override
    public String subjectUrl() {
        return subject != null ? subject.getUrl() : null;
    }

    @Override
    public String toString() {
        return String.format("DeliveryJob{subject=%s, attempts=%d}", subject != null ? subject.label() : "-", getAttempts());
    }
}
