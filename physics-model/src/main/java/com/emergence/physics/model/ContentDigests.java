package com.emergence.physics.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Content identity of an operation payload: SHA-256 over its canonical JSON form (map keys sorted).
 * Two events are content-identical when their digests are equal.
 */
public final class ContentDigests {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private ContentDigests() {
    }

    /**
     * Returns the hex SHA-256 digest of the payload's canonical JSON. A null payload digests as an empty map.
     *
     * @throws IllegalArgumentException if the payload cannot be serialized to JSON
     */
    public static String digest(Map<String, Object> payload) {
        byte[] canonical;
        try {
            canonical = CANONICAL.writeValueAsString(payload != null ? payload : Map.of())
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not serializable to JSON: " + e.getOriginalMessage(), e);
        }
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
