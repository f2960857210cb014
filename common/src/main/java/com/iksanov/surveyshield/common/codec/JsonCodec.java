package com.iksanov.surveyshield.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.iksanov.surveyshield.common.exception.SerializationException;

import java.io.IOException;

/**
 * JSON codec shared by the HTTP server and the transfer transport.
 * <p>
 * Error messages name the target type only, never the payload, since payloads may carry answers.
 */
public final class JsonCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonCodec() {
    }

    public static byte[] encode(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to encode " + typeName(value));
        }
    }

    public static <T> T decode(byte[] json, Class<T> type) {
        if (json == null || json.length == 0) throw new SerializationException("Empty body for " + type.getSimpleName());
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to decode " + type.getSimpleName());
        }
    }

    public static <T> T decode(byte[] json, TypeReference<T> type) {
        if (json == null || json.length == 0) throw new SerializationException("Empty body for " + type.getType().getTypeName());
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new SerializationException("Failed to decode " + type.getType().getTypeName());
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
