package com.umitunal.pipeq.model;

import java.time.Instant;

/**
 * Dedup ledger record for one subject. Kept small: enough to recognise it when debugging.
 */
public class SeenRecord {
    private String url;
    private Instant firstSeen;
    private String identifier;
    private String title;

    public SeenRecord() {
    }

    public SeenRecord(String url, Instant firstSeen, String identifier, String title) {
        this.url = url;
        this.firstSeen = firstSeen;
        this.identifier = identifier;
        this.title = title;
    }

    public static SeenRecord of(Subject subject, Instant firstSeen) {
        return new SeenRecord(subject.getUrl(), firstSeen, subject.getIdentifier(), subject.getTitle());
    }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public Instant getFirstSeen() { return firstSeen; }
    public void setFirstSeen(Instant firstSeen) { this.firstSeen = firstSeen; }
    public String getIdentifier() { return identifier; }
    public void setIdentifier(String identifier) { this.identifier = identifier; }
    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    @Override
    public String toString() {
        return String.format("SeenRecord{url='%s', firstSeen=%s, identifier='%s'}", url, firstSeen, identifier);
    }
}
