package com.umitunal.pipeq.dedup;

import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueKeys;
import com.umitunal.pipeq.serialization.CodecException;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.serialization.PayloadCodec;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.store.StoreException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * One store key per subject hash. Each write touches only its own key, so overlapping
 * discovery runs cannot lose each other's updates.
 */
public class KeyedSeenLedger implements SeenLedger {
    private final KeyValueStore store;
    private final PayloadCodec<SeenRecord> codec;
    private final Duration retention;
    private final Clock clock;

    public KeyedSeenLedger(KeyValueStore store, Duration retention) {
        this(store, new JsonCodec<>(SeenRecord.class), retention, Clock.systemUTC());
    }

    public KeyedSeenLedger(KeyValueStore store, PayloadCodec<SeenRecord> codec, Duration retention, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public boolean isSeen(String url) throws StoreException {
        return store.get(QueueKeys.seenKey(url)).isPresent();
    }

    @Override
    public Set<String> filterSeen(Collection<String> urls) throws StoreException {
        Set<String> seen = new LinkedHashSet<>();
        for (String url : urls) {
            if (isSeen(url)) {
                seen.add(url);
            }
        }
        return seen;
    }

    @Override
    public void markSeen(Subject subject) throws StoreException {
        write(subject, Instant.now(clock));
    }

    @Override
    public void markSeenBatch(Collection<Subject> subjects) throws StoreException {
        Instant now = Instant.now(clock);
        for (Subject subject : subjects) {
            write(subject, now);
        }
    }

    @Override
    public Optional<SeenRecord> getSeenRecord(String url) throws StoreException {
        Optional<byte[]> raw = store.get(QueueKeys.seenKey(url));
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(raw.get()));
        } catch (CodecException e) {
            throw new StoreException("Corrupt seen record for " + url, e);
        }
    }

    private void write(Subject subject, Instant at) throws StoreException {
        store.put(QueueKeys.seenKey(subject.getUrl()), codec.encode(SeenRecord.of(subject, at)), retention);
    }
}
