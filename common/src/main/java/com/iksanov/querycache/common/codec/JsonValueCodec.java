package com.iksanov.querycache.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.iksanov.querycache.common.exception.SerializationException;

import java.util.Objects;

/**
 * JSON codec for cached values.
 * <p>
 * The durable tier stores payloads as JSON text; the fast tier keeps live objects.
 * {@link #adapt(Object, JavaType)} bridges the two when a caller reads a fast-tier
 * value under a type other than the one it was written with.
 */
public final class JsonValueCodec {

    private final ObjectMapper mapper;

    public JsonValueCodec() {
        this(defaultMapper());
    }

    public JsonValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public static ObjectMapper defaultMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public String encode(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode value of type " + typeName(value), e);
        }
    }

    public <T> T decode(String payload, JavaType type) {
        Objects.requireNonNull(payload, "payload");
        try {
            return mapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to decode payload as " + type, e);
        }
    }

    @SuppressWarnings("unchecked")
    public <T> T adapt(Object value, JavaType type) {
        if (value == null) return null;
        if (type.getRawClass().isInstance(value)) return (T) value;
        try {
            return mapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new SerializationException("Cannot convert " + typeName(value) + " to " + type, e);
        }
    }

    public JavaType typeOf(Class<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    public JavaType typeOf(TypeReference<?> type) {
        return mapper.getTypeFactory().constructType(type);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
