package com.umitunal.pipeq.store;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Minimal key-value contract the queue, lease and dedup layers are built on.
 *
 * No transactions and no multi-key atomicity. Every key carries its own time-to-live and
 * disappears once it elapses. Same-process read-after-write must be consistent.
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Write a value, replacing any previous one and resetting its time-to-live.
     *
     * @param key the key
     * @param value the value bytes
     * @param ttl how long the key lives; must be positive
     */
    void put(String key, byte[] value, Duration ttl) throws StoreException;

    /**
     * Point lookup.
     *
     * @return the value, or empty if the key is absent or expired
     */
    Optional<byte[]> get(String key) throws StoreException;

    /**
     * Delete a key. Deleting an absent key is not an error.
     */
    void delete(String key) throws StoreException;

    /**
     * List live keys starting with {@code prefix} in ascending lexicographic order.
     *
     * @param prefix key prefix
     * @param limit maximum number of keys to return
     * @return a snapshot of matching keys, at most {@code limit} long
     */
    List<String> list(String prefix, int limit) throws StoreException;

    /**
     * Create the key only if no live value exists.
     *
     * The default is a plain check-then-write: two callers racing between the read and
     * the write can both see {@code true}. Stores with conditional writes override this
     * with an atomic create-if-absent.
     *
     * @return true if this call created the key
     */
    default boolean putIfAbsent(String key, byte[] value, Duration ttl) throws StoreException {
        if (get(key).isPresent()) {
            return false;
        }
        put(key, value, ttl);
        return true;
    }

    @Override
    void close();

    static void checkTtl(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
    }
}
