package com.umitunal.pipeq.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * JSON codec using Jackson. Queue payloads, dead letters and seen records are all stored
 * as JSON so they stay readable when inspecting the store by hand.
 *
 * @param <T> the type to serialize
 */
public class JsonCodec<T> implements PayloadCodec<T> {
    private final ObjectMapper mapper;
    private final JavaType type;

    public JsonCodec(Class<T> type) {
        this(type, defaultMapper());
    }

    public JsonCodec(Class<T> type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = mapper.constructType(type);
    }

    /**
     * Codec for a generic type such as {@code DeadLetterEntry<EnrichmentJob>}, built with
     * the mapper's type factory.
     */
    public JsonCodec(JavaType type, ObjectMapper mapper) {
        this.mapper = mapper;
        this.type = type;
    }

    @Override
    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new CodecException("Failed to serialize " + type + " to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new CodecException("Failed to deserialize " + type + " from JSON", e);
        }
    }

    /**
     * Mapper shared by every JSON codec in the pipeline: ISO-8601 instants, unknown
     * properties ignored so older entries still load after a payload gains a field.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
