package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable handle of a live resource allocation, returned in the admission receipt and used to
 * release the allocation later.
 */
public record AllocationRef(long id) {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AllocationRef of(long id) {
        return new AllocationRef(id);
    }

    @JsonValue
    @Override
    public long id() {
        return id;
    }

    @Override
    public String toString() {
        return "alloc-" + id;
    }
}
