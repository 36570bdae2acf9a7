package com.umitunal.pipeq.queue;

/**
 * The two hand-off queues between stages, each with its own dead-letter and quarantine prefix.
 * Discovery feeds ENRICHMENT, enrichment feeds DELIVERY.
 */
public enum QueueName {
    ENRICHMENT("queue:summarize:", "dlq:summarize:", "quarantine:summarize:"),
    DELIVERY("queue:notify:", "dlq:notify:", "quarantine:notify:");

    private final String prefix;
    private final String deadLetterPrefix;
    private final String quarantinePrefix;

    QueueName(String prefix, String deadLetterPrefix, String quarantinePrefix) {
        this.prefix = prefix;
        this.deadLetterPrefix = deadLetterPrefix;
        this.quarantinePrefix = quarantinePrefix;
    }

    public String prefix() {
        return prefix;
    }

    public String deadLetterPrefix() {
        return deadLetterPrefix;
    }

    /**
     * Where entries that cannot be decoded into a job are parked, raw bytes untouched.
     */
    public String quarantinePrefix() {
        return quarantinePrefix;
    }
}
