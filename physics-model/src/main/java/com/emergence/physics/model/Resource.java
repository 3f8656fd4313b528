package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A quantity of one resource kind. Used both for resource requests carried by an operation and
 * for reporting usage. The quantity is expected to be finite and non-negative; that is checked by
 * schema validation, not here, so malformed requests can still be reported.
 */
public record Resource(
        @JsonProperty("kind") ResourceKind kind,
        @JsonProperty("quantity") double quantity
) {

    public static Resource of(ResourceKind kind, double quantity) {
        return new Resource(kind, quantity);
    }

    public static Resource memory(double quantity) {
        return new Resource(ResourceKind.MEMORY, quantity);
    }

    public static Resource cpu(double quantity) {
        return new Resource(ResourceKind.CPU, quantity);
    }

    public static Resource network(double quantity) {
        return new Resource(ResourceKind.NETWORK, quantity);
    }
}
