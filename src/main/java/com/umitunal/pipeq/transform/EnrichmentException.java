package com.umitunal.pipeq.transform;

/**
 * The enrichment service could not be reached or answered with an error.
 */
public class EnrichmentException extends Exception {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
