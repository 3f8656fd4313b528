package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of resource an entity can be budgeted for. Parsed case-insensitively so configuration
 * documents may write {@code memory}, {@code Memory} or {@code MEMORY}.
 */
public enum ResourceKind {
    /** Working memory, in megabytes. */
    MEMORY,
    /** CPU share, in percent. */
    CPU,
    /** Network bandwidth, in KB/s. */
    NETWORK;

    @JsonValue
    public String toValue() {
        return name();
    }

    /**
     * Parses a kind name ignoring case.
     *
     * @throws IllegalArgumentException if the name is not a known kind
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ResourceKind fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown resource kind: " + value));
    }

    /** Parses a kind name ignoring case; empty if null, blank or unknown. */
    public static Optional<ResourceKind> parse(String value) {
        if (value == null || value.isBlank()) return Optional.empty();
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (ResourceKind kind : values()) {
            if (kind.name().equals(normalized)) return Optional.of(kind);
        }
        return Optional.empty();
    }
}
