package com.umitunal.pipeq.dedup;

import com.umitunal.pipeq.MutableClock;
import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.queue.QueueKeys;
import com.umitunal.pipeq.serialization.JsonCodec;
import com.umitunal.pipeq.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class KeyedSeenLedgerTest extends SeenLedgerContract {

    @Override
    protected SeenLedger createLedger(InMemoryKeyValueStore store, MutableClock clock) {
        return new KeyedSeenLedger(store, new JsonCodec<>(SeenRecord.class), RETENTION, clock);
    }

    @Test
    @DisplayName("Should write one key per subject")
    void testOneKeyPerSubject() throws Exception {
        ledger.markSeenBatch(List.of(
                new Subject("https://example.com/a", null, null),
                new Subject("https://example.com/b", null, null)));

        assertThat(store.list(QueueKeys.SEEN_PREFIX, 10)).containsExactlyInAnyOrder(
                QueueKeys.seenKey("https://example.com/a"),
                QueueKeys.seenKey("https://example.com/b"));
        assertThat(store.get(QueueKeys.SEEN_LEDGER_KEY)).isEmpty();
    }
}
