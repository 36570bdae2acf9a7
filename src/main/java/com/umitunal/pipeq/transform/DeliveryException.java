package com.umitunal.pipeq.transform;

/**
 * Delivery failed; counts as an attempt.
 */
public class DeliveryException extends Exception {
    private final int statusCode;

    public DeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed call, or -1 if no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
