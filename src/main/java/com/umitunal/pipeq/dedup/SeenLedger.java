package com.umitunal.pipeq.dedup;

import com.umitunal.pipeq.model.SeenRecord;
import com.umitunal.pipeq.model.Subject;
import com.umitunal.pipeq.store.StoreException;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Record of subjects already discovered, so repeated discovery runs enqueue each subject once.
 *
 * Independent of the job queues: a subject stays seen long after its queue entry is gone,
 * until the ledger's retention lapses and it counts as new again.
 */
public interface SeenLedger {

    boolean isSeen(String url) throws StoreException;

    /**
     * Bulk membership test.
     *
     * @return the subset of {@code urls} already seen
     */
    Set<String> filterSeen(Collection<String> urls) throws StoreException;

    /**
     * Mark a subject seen. Marking it again refreshes its record; it never duplicates.
     */
    void markSeen(Subject subject) throws StoreException;

    void markSeenBatch(Collection<Subject> subjects) throws StoreException;

    Optional<SeenRecord> getSeenRecord(String url) throws StoreException;
}
