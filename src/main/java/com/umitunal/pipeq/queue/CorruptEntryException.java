package com.umitunal.pipeq.queue;

import com.umitunal.pipeq.store.StoreException;

/**
 * A queue entry exists but does not hold a usable job: the payload does not decode, or it
 * decodes without a subject. Retrying cannot fix it.
 */
public class CorruptEntryException extends StoreException {
    private final String entryKey;

    public CorruptEntryException(String entryKey, String message) {
        super(message);
        this.entryKey = entryKey;
    }

    public CorruptEntryException(String entryKey, String message, Throwable cause) {
        super(message, cause);
        this.entryKey = entryKey;
    }

    public String getEntryKey() {
        return entryKey;
    }
}
