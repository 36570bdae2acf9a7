package com.umitunal.pipeq.serialization;

import java.nio.charset.StandardCharsets;

/**
 * UTF-8 strings, used for lease markers and cached enrichment text.
 */
public class StringCodec implements PayloadCodec<String> {
    public static final StringCodec INSTANCE = new StringCodec();

    @Override
    public byte[] encode(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
