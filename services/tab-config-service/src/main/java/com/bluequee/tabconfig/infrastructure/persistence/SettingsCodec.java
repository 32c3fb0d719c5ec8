package com.bluequee.tabconfig.infrastructure.persistence;

import com.bluequee.tabconfig.domain.error.InvalidTabException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;

/**
 * Encodes the free-form {@code settings} map as JSON text for the {@code settings} column.
 *
 * <p>WHY JSON text instead of a native JSON column: the same migration runs on PostgreSQL and on H2
 * in tests.
 */
public final class SettingsCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    /** Width of the {@code settings} column. */
    public static final int MAX_ENCODED_LENGTH = 4000;

    private final ObjectMapper objectMapper;

    public SettingsCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidTabException if the encoded settings do not fit the column
     */
    public String encode(Map<String, Object> settings) {
        String json;
        try {
            json = objectMapper.writeValueAsString(settings == null ? Map.of() : settings);
        } catch (JsonProcessingException e) {
            throw new SettingsSerializationException("Failed to encode tab settings", e);
        }
        if (json.length() > MAX_ENCODED_LENGTH) {
            throw new InvalidTabException(
                    List.of("settings must encode to at most " + MAX_ENCODED_LENGTH + " characters"));
        }
        return json;
    }

    public Map<String, Object> decode(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new SettingsSerializationException("Failed to decode tab settings", e);
        }
    }

    /** Thrown when settings cannot be converted to or from JSON. */
    public static class SettingsSerializationException extends RuntimeException {
        public SettingsSerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
