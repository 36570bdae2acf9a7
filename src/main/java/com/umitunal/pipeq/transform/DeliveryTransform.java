package com.umitunal.pipeq.transform;

import com.umitunal.pipeq.model.DeliveryJob;

/**
 * Sends an enriched subject to its destination. Returning normally means delivered.
 */
@FunctionalInterface
public interface DeliveryTransform {

    /**
     * @throws RateLimitedException when the destination asks us to slow down; the job is
     *         retried without spending an attempt
     * @throws Exception any other failure, counted as an attempt
     */
    void deliver(DeliveryJob job) throws Exception;
}
