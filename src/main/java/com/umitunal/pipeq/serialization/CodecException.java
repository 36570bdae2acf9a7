package com.umitunal.pipeq.serialization;

/**
 * A value could not be encoded, or stored bytes could not be decoded.
 */
public class CodecException extends RuntimeException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
