package com.umitunal.pipeq.store;

/**
 * Raised when the backing key-value store cannot complete a read or write.
 * Store failures always propagate to the caller; nothing in the queue layer retries them.
 */
public class StoreException extends Exception {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
