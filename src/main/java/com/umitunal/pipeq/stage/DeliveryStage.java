package com.umitunal.pipeq.stage;

import com.umitunal.pipeq.config.PipelineConfigurationException;
import com.umitunal.pipeq.model.DeliveryJob;
import com.umitunal.pipeq.queue.RetryController;
import com.umitunal.pipeq.transform.DeliveryTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Consumes the delivery queue. Rate-limited deliveries keep their attempt budget; after each
 * successful delivery the stage pauses briefly to avoid bursting the destination.
 */
public class DeliveryStage extends QueueStage<DeliveryJob> {
    private static final Logger log = LoggerFactory.getLogger(DeliveryStage.class);

    private final DeliveryTransform transform;
    private final Duration pacing;

    public DeliveryStage(RetryController<DeliveryJob> retries, DeliveryTransform transform,
                         int batchSize, int maxAttempts, Duration pacing, Clock clock) {
        super("Delivery", retries, batchSize, maxAttempts, clock);
        this.transform = transform;
        this.pacing = pacing;
    }

    @Override
    protected void preflight() {
        if (transform == null) {
            throw new PipelineConfigurationException("No webhook URL configured");
        }
    }

    @Override
    protected void process(String entryKey, DeliveryJob job) throws Exception {
        log.info("Delivering: {}", job.getSubject().label());
        transform.deliver(job);
    }

    @Override
    protected void afterSuccess(DeliveryJob job) throws InterruptedException {
        if (!pacing.isZero()) {
            Thread.sleep(pacing.toMillis());
        }
    }
}
