package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Immutable record of an admitted event. Created only by a successful admission commit and kept
 * for the lifetime of the engine.
 *
 * @param id            event id (unique in the ledger)
 * @param timestamp     event timestamp; never below any parent's timestamp
 * @param parentIds     parents, all of which were already in the ledger at insertion time
 * @param contentDigest digest of the admitting operation's payload (see {@link ContentDigests}); may be null
 * @param sequence      position in the ledger (0-based, insertion order)
 */
public record EventNode(
        String id,
        long timestamp,
        List<String> parentIds,
        String contentDigest,
        long sequence
) {
    public EventNode {
        parentIds = parentIds != null ? List.copyOf(parentIds) : List.of();
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentIds.isEmpty();
    }
}
