package com.umitunal.pipeq.queue;

import com.umitunal.pipeq.serialization.StringCodec;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.store.StoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Advisory, self-expiring exclusive claims over subjects.
 *
 * A lease is keyed by the subject hash rather than the queue key, so it covers the subject
 * whichever queue entry currently carries it. There is no renewal: a holder that crashes or
 * hangs simply loses the lease when its TTL elapses, and that is the only recovery path for
 * stuck work. Callers that skip {@link #claim(String)} are not blocked.
 */
public class LeaseManager {
    private final KeyValueStore store;
    private final Duration ttl;
    private final Clock clock;

    public LeaseManager(KeyValueStore store, Duration ttl) {
        this(store, ttl, Clock.systemUTC());
    }

    public LeaseManager(KeyValueStore store, Duration ttl, Clock clock) {
        this.store = store;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Try to become the exclusive holder of the subject.
     *
     * Atomic when the store supports conditional writes; otherwise a narrow window remains
     * where two callers both win, which downstream idempotency absorbs.
     *
     * @return true if this call created the lease
     */
    public boolean claim(String subjectUrl) throws StoreException {
        byte[] marker = StringCodec.INSTANCE.encode(Instant.now(clock).toString());
        return store.putIfAbsent(QueueKeys.leaseKey(subjectUrl), marker, ttl);
    }

    /**
     * Drop the lease. Releasing a lease that does not exist is fine.
     */
    public void release(String subjectUrl) throws StoreException {
        store.delete(QueueKeys.leaseKey(subjectUrl));
    }

    public boolean isLeased(String subjectUrl) throws StoreException {
        return store.get(QueueKeys.leaseKey(subjectUrl)).isPresent();
    }

    public int countLeases(int scanLimit) throws StoreException {
        return store.list(QueueKeys.LEASE_PREFIX, scanLimit).size();
    }

    public Duration getTtl() {
        return ttl;
    }
}
