package com.umitunal.pipeq.dedup;

import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueKeys;
import com.umitunal.pipeq.queue.SubjectHash;
import com.umitunal.pipeq.serialization.CodecException;
import com.umitunal.pipeq.serialization.PayloadCodec;
import com.umitunal.pipeq.store.KeyValueStore;
import com.umitunal.pipeq.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * All seen records in a single document, loaded once per call.
 *
 * A bulk check costs one read however many subjects it tests. Writes are a read-modify-write
 * of the whole document with no conflict detection: two writers running at once lose one of
 * their updates. Only one discovery run may write at a time.
 */
public class ConsolidatedSeenLedger implements SeenLedger {
    private static final Logger log = LoggerFactory.getLogger(ConsolidatedSeenLedger.class);

    private final KeyValueStore store;
    private final PayloadCodec<SeenDocument> codec;
    private final Duration retention;
    private final Clock clock;

    public ConsolidatedSeenLedger(KeyValueStore store, PayloadCodec<SeenDocument> codec, Duration retention) {
        this(store, codec, retention, Clock.systemUTC());
    }

    public ConsolidatedSeenLedger(KeyValueStore store, PayloadCodec<SeenDocument> codec,
                                  Duration retention, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public boolean isSeen(String url) throws StoreException {
        return load().getRecords().containsKey(SubjectHash.of(url));
    }

    @Override
    public Set<String> filterSeen(Collection<String> urls) throws StoreException {
        SeenDocument document = load();
        Set<String> seen = new LinkedHashSet<>();
        for (String url : urls) {
            if (document.getRecords().containsKey(SubjectHash.of(url))) {
                seen.add(url);
            }
        }
        return seen;
    }

    @Override
    public void markSeen(Subject subject) throws StoreException {
        markSeenBatch(List.of(subject));
    }

    @Override
    public void markSeenBatch(Collection<Subject> subjects) throws StoreException {
        if (subjects.isEmpty()) {
            return;
        }
        SeenDocument document = load();
        Instant now = Instant.now(clock);
        for (Subject subject : subjects) {
            document.getRecords().put(SubjectHash.of(subject.getUrl()), SeenRecord.of(subject, now));
        }
        store.put(QueueKeys.SEEN_LEDGER_KEY, codec.encode(document), retention);
        log.debug("Seen ledger now holds {} subjects", document.getRecords().size());
    }

    @Override
    public Optional<SeenRecord> getSeenRecord(String url) throws StoreException {
        return Optional.ofNullable(load().getRecords().get(SubjectHash.of(url)));
    }

    private SeenDocument load() throws StoreException {
        Optional<byte[]> raw = store.get(QueueKeys.SEEN_LEDGER_KEY);
        if (raw.isEmpty()) {
            return new SeenDocument();
        }
        try {
            return codec.decode(raw.get());
        } catch (CodecException e) {
            throw new StoreException("Corrupt seen ledger document", e);
        }
    }
}
