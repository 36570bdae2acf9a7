package com.umitunal.pipeq.core;

/**
 * Point-in-time counts across the pipeline's queues.
 * Counts are capped by the scan limit used to take them.
 */
public class QueueMetrics {
    private final long enrichmentPending;
    private final long enrichmentDeadLettered;
    private final long deliveryPending;
    private final long deliveryDeadLettered;
    private final long activeLeases;

    public QueueMetrics(long enrichmentPending, long enrichmentDeadLettered,
                        long deliveryPending, long deliveryDeadLettered, long activeLeases) {
        this.enrichmentPending = enrichmentPending;
        this.enrichmentDeadLettered = enrichmentDeadLettered;
        this.deliveryPending = deliveryPending;
        this.deliveryDeadLettered = deliveryDeadLettered;
        this.activeLeases = activeLeases;
    }

    public long getEnrichmentPending() { return enrichmentPending; }
    public long getEnrichmentDeadLettered() { return enrichmentDeadLettered; }
    public long getDeliveryPending() { return deliveryPending; }
    public long getDeliveryDeadLettered() { return deliveryDeadLettered; }
    public long getActiveLeases() { return activeLeases; }

    @Override
    public String toString() {
        return String.format(
            "QueueMetrics{enrichment=%d (dlq %d), delivery=%d (dlq %d), leases=%d}",
            enrichmentPending, enrichmentDeadLettered, deliveryPending, deliveryDeadLettered, activeLeases
        );
    }
}
