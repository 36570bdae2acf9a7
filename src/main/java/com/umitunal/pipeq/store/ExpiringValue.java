package com.umitunal.pipeq.store;

import java.nio.ByteBuffer;

/**
 * Value envelope carrying a per-key expiry for stores without native TTL.
 *
 * Binary format:
 * - expiresAt (8 bytes, epoch millis)
 * - value length (4 bytes) + value bytes
 */
final class ExpiringValue {
    private final long expiresAt;
    private final byte[] value;

    ExpiringValue(long expiresAt, byte[] value) {
        this.expiresAt = expiresAt;
        this.value = value;
    }

    long getExpiresAt() { return expiresAt; }
    byte[] getValue() { return value; }

    boolean isExpired(long nowMillis) {
        return nowMillis >= expiresAt;
    }

    byte[] serialize() {
        ByteBuffer buffer = ByteBuffer.allocate(8 + 4 + value.length);
        buffer.putLong(expiresAt);
        buffer.putInt(value.length);
        buffer.put(value);
        return buffer.array();
    }

    static ExpiringValue deserialize(byte[] bytes) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        long expiresAt = buffer.getLong();
        int length = buffer.getInt();
        if (length < 0 || length > buffer.remaining()) {
            throw new IllegalArgumentException("Corrupt value envelope: length " + length);
        }
        byte[] value = new byte[length];
        buffer.get(value);
        return new ExpiringValue(expiresAt, value);
    }
}
