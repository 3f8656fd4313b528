package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

/**
 * Identifier of an agent or actor. Subject of resource budgets and capability grants.
 * Opaque to the engine: only equality, hashing and ordering are used.
 */
public record EntityId(String value) implements Comparable<EntityId> {

    public EntityId {
        Objects.requireNonNull(value, "value");
        value = value.trim();
        if (value.isEmpty()) {
            throw new IllegalArgumentException("EntityId must be non-blank");
        }
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static EntityId of(String value) {
        return new EntityId(value);
    }

    /** Random entity id (UUID based), for tests and ad hoc agents. */
    public static EntityId random() {
        return new EntityId(UUID.randomUUID().toString());
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public int compareTo(EntityId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
