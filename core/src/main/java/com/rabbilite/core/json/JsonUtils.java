package com.rabbilite.core.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.rabbilite.core.error.SerializationException;

import java.io.IOException;

/** Shared Jackson mapper for message payloads. */
public final class JsonUtils {
    public static final String CONTENT_TYPE = "application/json";

    public static final ObjectMapper M = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private JsonUtils() {}

    /**
     * @throws SerializationException if Jackson cannot represent the value (no serializable properties,
     *                                self-referencing graph, failing getter...)
     */
    public static byte[] toBytes(Object value) {
        try {
            return M.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Cannot encode " + typeName(value) + " as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public static <T> T fromBytes(byte[] body, Class<T> type) {
        try {
            return M.readValue(body, type);
        } catch (IOException e) {
            throw new SerializationException("Cannot decode JSON payload as " + type.getSimpleName(), e);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
