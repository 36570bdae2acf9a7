package com.umitunal.pipeq.queue;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.pipeq.model.DeadLetterEntry;
import com.umitunal.pipeq.model.QueuedJob;
import com.umitunal.pipeq.serialization.CodecException;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.serialization.PayloadCodec;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.store.StoreException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Pending jobs of one queue, stored as JSON under timestamp-prefixed keys.
 *
 * Listing is a snapshot and does not lock anything: two runners can see the same key in
 * the same poll window. The {@link LeaseManager} resolves that race, not the listing.
 *
 * @param <T> the payload type of this queue
 */
public class QueueStore<T extends QueuedJob> {
    private final KeyValueStore store;
    private final QueueName queue;
    private final PayloadCodec<T> codec;
    private final PayloadCodec<DeadLetterEntry<T>> deadLetterCodec;
    private final Duration retention;
    private final Clock clock;

    public QueueStore(KeyValueStore store, QueueName queue, Class<T> jobType, Duration retention) {
        this(store, queue, jobType, JsonCodec.defaultMapper(), retention, Clock.systemUTC());
    }

    public QueueStore(KeyValueStore store, QueueName queue, Class<T> jobType,
                      ObjectMapper mapper, Duration retention, Clock clock) {
        this.store = store;
        this.queue = queue;
        this.codec = new JsonCodec<>(jobType, mapper);
        JavaType deadLetterType = mapper.getTypeFactory()
                .constructParametricType(DeadLetterEntry.class, jobType);
        this.deadLetterCodec = new JsonCodec<>(deadLetterType, mapper);
        this.retention = retention;
        this.clock = clock;
    }

    public QueueName getQueue() {
        return queue;
    }

    /**
     * Add a job. It is visible to {@link #listPending(int)} as soon as this returns.
     *
     * @param subjectUrl canonical URL of the job's subject
     * @param job the payload
     * @return the entry key
     */
    public String enqueue(String subjectUrl, T job) throws StoreException {
        String key = QueueKeys.entryKey(queue, clock.millis(), subjectUrl);
        store.put(key, codec.encode(job), retention);
        return key;
    }

    /**
     * Oldest-first snapshot of pending entry keys. Entries enqueued in the same
     * millisecond are ordered by subject hash.
     */
    public List<String> listPending(int limit) throws StoreException {
        return store.list(queue.prefix(), limit);
    }

    /**
     * @return the payload, or empty if the job already completed, expired or was dead-lettered
     * @throws CorruptEntryException if the entry does not decode or names no subject
     */
    public Optional<T> getJob(String entryKey) throws StoreException {
        Optional<byte[]> raw = store.get(entryKey);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        T job;
        try {
            job = codec.decode(raw.get());
        } catch (CodecException e) {
            throw new CorruptEntryException(entryKey, "Corrupt queue entry " + entryKey, e);
        }
        if (job == null || job.subjectUrl() == null || job.subjectUrl().isBlank()) {
            throw new CorruptEntryException(entryKey, "Queue entry " + entryKey + " has no subject");
        }
        return Optional.of(job);
    }

    /**
     * Move an entry's raw bytes out of the pending range so it is never listed again.
     *
     * @return false if the entry was already gone
     */
    public boolean quarantine(String entryKey, Duration quarantineRetention) throws StoreException {
        Optional<byte[]> raw = store.get(entryKey);
        if (raw.isEmpty()) {
            return false;
        }
        store.put(QueueKeys.quarantineKey(queue, entryKey), raw.get(), quarantineRetention);
        store.delete(entryKey);
        return true;
    }

    /**
     * Raw bytes parked for an entry key by {@link #quarantine}.
     */
    public Optional<byte[]> getQuarantined(String entryKey) throws StoreException {
        return store.get(QueueKeys.quarantineKey(queue, entryKey));
    }

    public int countQuarantined(int scanLimit) throws StoreException {
        return store.list(queue.quarantinePrefix(), scanLimit).size();
    }

    /**
     * Rewrite an entry in place, refreshing its retention.
     */
    public void update(String entryKey, T job) throws StoreException {
        store.put(entryKey, codec.encode(job), retention);
    }

    public void delete(String entryKey) throws StoreException {
        store.delete(entryKey);
    }

    /**
     * Write a dead letter, overwriting any previous one for the same subject.
     */
    public void putDeadLetter(String subjectUrl, DeadLetterEntry<T> entry, Duration deadLetterRetention)
            throws StoreException {
        store.put(QueueKeys.deadLetterKey(queue, subjectUrl), deadLetterCodec.encode(entry), deadLetterRetention);
    }

    public Optional<DeadLetterEntry<T>> getDeadLetter(String subjectUrl) throws StoreException {
        return readDeadLetter(QueueKeys.deadLetterKey(queue, subjectUrl));
    }

    /**
     * Dead letters of this queue in key order, for postmortem inspection.
     */
    public List<DeadLetterEntry<T>> listDeadLetters(int limit) throws StoreException {
        List<DeadLetterEntry<T>> entries = new ArrayList<>();
        for (String key : store.list(queue.deadLetterPrefix(), limit)) {
            readDeadLetter(key).ifPresent(entries::add);
        }
        return entries;
    }

    /**
     * Count pending entries, scanning at most {@code scanLimit} keys.
     */
    public int countPending(int scanLimit) throws StoreException {
        return store.list(queue.prefix(), scanLimit).size();
    }

    public int countDeadLetters(int scanLimit) throws StoreException {
        return store.list(queue.deadLetterPrefix(), scanLimit).size();
    }

    private Optional<DeadLetterEntry<T>> readDeadLetter(String key) throws StoreException {
        Optional<byte[]> raw = store.get(key);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(deadLetterCodec.decode(raw.get()));
        } catch (CodecException e) {
            throw new StoreException("Corrupt dead letter " + key, e);
        }
    }
}
