package com.umitunal.pipeq.queue;

/**
 * Key layout shared by everything that writes to the store.
 */
public final class QueueKeys {
    public static final String LEASE_PREFIX = "processing:";
    public static final String SEEN_PREFIX = "seen:subject:";
    public static final String SEEN_LEDGER_KEY = "seen:all";
    public static final String ENRICHED_PREFIX = "enriched:";

    // Epoch millis stay 13 digits until the year 2286
    private static final int TIMESTAMP_WIDTH = 13;

    private QueueKeys() {
    }

    /**
     * Entry key: {@code prefix + zero-padded millis + ":" + hash}. Fixed width keeps
     * lexicographic order chronological.
     */
    public static String entryKey(QueueName queue, long enqueuedAtMillis, String subjectUrl) {
        return queue.prefix() + String.format("%0" + TIMESTAMP_WIDTH + "d", enqueuedAtMillis)
                + ":" + SubjectHash.of(subjectUrl);
    }

    public static String leaseKey(String subjectUrl) {
        return LEASE_PREFIX + SubjectHash.of(subjectUrl);
    }

    public static String deadLetterKey(QueueName queue, String subjectUrl) {
        return queue.deadLetterPrefix() + SubjectHash.of(subjectUrl);
    }

    /**
     * Quarantine key for an entry key of the same queue: the entry's timestamp and hash
     * under the quarantine prefix.
     */
    public static String quarantineKey(QueueName queue, String entryKey) {
        String suffix = entryKey.startsWith(queue.prefix())
                ? entryKey.substring(queue.prefix().length())
                : entryKey;
        return queue.quarantinePrefix() + suffix;
    }

    public static String seenKey(String subjectUrl) {
        return SEEN_PREFIX + SubjectHash.of(subjectUrl);
    }

    /**
     * Keyed by the full URL, so subjects whose hashes collide never share cached text.
     */
    public static String enrichedKey(String subjectUrl) {
        return ENRICHED_PREFIX + subjectUrl;
    }
}
