package com.emergence.physics.model;

/**
 * Live allocation of an amount of one resource kind to an entity. For every entity and kind the
 * sum of live allocation amounts never exceeds the entity's budget for that kind.
 *
 * @param ref               handle used to release the allocation
 * @param entity            owning entity
 * @param kind              resource kind
 * @param amount            allocated amount (positive)
 * @param allocatedAtMillis wall-clock time of the commit, epoch millis
 */
public record ResourceAllocation(
        AllocationRef ref,
        EntityId entity,
        ResourceKind kind,
        double amount,
        long allocatedAtMillis
) {
}
