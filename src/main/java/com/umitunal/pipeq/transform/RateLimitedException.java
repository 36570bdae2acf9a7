package com.umitunal.pipeq.transform;

import java.time.Duration;
import java.util.Optional;

/**
 * The destination is rate limiting us. Not a real failure: the lease is released and the
 * job is picked up again on the next poll.
 */
public class RateLimitedException extends DeliveryException {
    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message, 429);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
