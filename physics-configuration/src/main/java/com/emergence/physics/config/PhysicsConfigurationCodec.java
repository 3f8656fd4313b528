package com.emergence.physics.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Serialization and deserialization of the configuration document. JSON is the primary format;
 * YAML is accepted for files ending in {@code .yaml} or {@code .yml}. Nulls are excluded when serializing.
 */
public final class PhysicsConfigurationCodec {

    private static final ObjectMapper JSON = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private PhysicsConfigurationCodec() {
    }

    /**
     * Deserializes the configuration document from a JSON string.
     *
     * @throws UncheckedIOException on parse failure (syntax error or wrongly typed value)
     */
    public static PhysicsConfiguration fromJson(String json) {
        try {
            return JSON.readValue(json, PhysicsConfiguration.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Deserializes the configuration document from a YAML string.
     *
     * @throws UncheckedIOException on parse failure
     */
    public static PhysicsConfiguration fromYaml(String yaml) {
        try {
            return YAML.readValue(yaml, PhysicsConfiguration.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Parses by file name: YAML for {@code .yaml}/{@code .yml}, JSON otherwise. */
    public static PhysicsConfiguration fromContent(String fileName, String content) {
        String lower = fileName != null ? fileName.toLowerCase(Locale.ROOT) : "";
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            return fromYaml(content);
        }
        return fromJson(content);
    }

    /**
     * Serializes the configuration document to pretty-printed JSON (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(PhysicsConfiguration config) {
        try {
            return JSON.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
