package com.bluequee.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Base64;

/**
 * Serializes and deserializes {@link ClinicSecurityContext} for the gateway-to-service hop.
 *
 * <p>WHY JSON + Base64: the gateway validates the session and forwards the resulting identity in a
 * single HTTP header ({@link #HEADER}). Base64 keeps the JSON header-safe.
 */
public final class SecurityContextSerializer {

    /** HTTP header carrying the encoded context. */
    public static final String HEADER = "X-Security-Context";

    private static final ObjectMapper MAPPER =
            new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private SecurityContextSerializer() {
        // utility class
    }

    /**
     * Serializes a security context to a Base64-encoded JSON string.
     *
     * @throws SecuritySerializationException if serialization fails
     */
    public static String serialize(ClinicSecurityContext context) {
        try {
            byte[] json = MAPPER.writeValueAsBytes(context);
            return Base64.getEncoder().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new SecuritySerializationException("Failed to serialize security context", e);
        }
    }

    /**
     * Deserializes a Base64-encoded JSON string back to a security context.
     *
     * @throws SecuritySerializationException if the value is not Base64 or not a valid context
     */
    public static ClinicSecurityContext deserialize(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new SecuritySerializationException("Security context header is empty", null);
        }
        try {
            byte[] json = Base64.getDecoder().decode(encoded.strip());
            return MAPPER.readValue(json, ClinicSecurityContext.class);
        } catch (IllegalArgumentException | IOException e) {
            throw new SecuritySerializationException("Failed to deserialize security context", e);
        }
    }

    /** Thrown when the security context cannot be encoded or decoded. */
    public static class SecuritySerializationException extends RuntimeException {
        public SecuritySerializationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
