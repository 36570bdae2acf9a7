package com.umitunal.pipeq.serialization;

/**
 * Converts stored values to and from bytes.
 *
 * @param <T> the type of value
 */
public interface PayloadCodec<T> {

    /**
     * @throws CodecException if the value cannot be encoded
     */
    byte[] encode(T value);

    /**
     * @throws CodecException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
