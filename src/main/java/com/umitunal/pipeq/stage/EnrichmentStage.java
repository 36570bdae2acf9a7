package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.config.PipelineConfigurationException;
import com.umitunal.pipeq.model.DeliveryJob;
import com.umitunal.pipeq.model.EnrichmentJob;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueKeys;
import com.umitunal.pipeq.queue.QueueStore;
import com.umitunal.pipeq.queue.RetryController;
import com.umitunal.pipeq.serialization.StringCodec;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.transform.EnrichmentException;
import com.umitunal.pipeq.transform.EnrichmentTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Consumes the enrichment queue: obtains each subject's text and hands it on to delivery.
 *
 * Generated text is cached per subject, so a job that failed after enrichment (say, while
 * enqueueing for delivery) does not pay for a second generation on retry.
 */
public class EnrichmentStage extends QueueStage<EnrichmentJob> {
    private static final Logger log = LoggerFactory.getLogger(EnrichmentStage.class);

    private final KeyValueStore store;
    private final EnrichmentTransform transform;
    private final QueueStore<DeliveryJob> deliveryQueue;
    private final Duration cacheRetention;

    public EnrichmentStage(KeyValueStore store, RetryController<EnrichmentJob> retries,
                           QueueStore<DeliveryJob> deliveryQueue, EnrichmentTransform transform,
                           int batchSize, int maxAttempts, Duration cacheRetention, Clock clock) {
        super("Enrichment", retries, batchSize, maxAttempts, clock);
        this.store = store;
        this.transform = transform;
        this.deliveryQueue = deliveryQueue;
        this.cacheRetention = cacheRetention;
    }

    @Override
    protected void preflight() {
        if (store == null) {
            throw new PipelineConfigurationException("No key-value store configured");
        }
        if (transform == null) {
            throw new PipelineConfigurationException("No enrichment endpoint configured");
        }
    }

    @Override
    protected void process(String entryKey, EnrichmentJob job) throws Exception {
        Subject subject = job.getSubject();
        String url = subject.getUrl();
        String cacheKey = QueueKeys.enrichedKey(url);

        Optional<String> cached = store.get(cacheKey).map(StringCodec.INSTANCE::decode);
        String text;
        if (cached.isPresent()) {
            log.info("Using cached enrichment for: {}", subject.label());
            text = cached.get();
        } else {
            log.info("Generating enrichment for: {}", subject.label());
            text = transform.enrich(url, subject)
                    .orElseThrow(() -> new EnrichmentException("Failed to enrich (no text returned)"));
            store.put(cacheKey, StringCodec.INSTANCE.encode(text), cacheRetention);
        }

        deliveryQueue.enqueue(url, new DeliveryJob(subject, text, Instant.now(clock)));
    }
}
