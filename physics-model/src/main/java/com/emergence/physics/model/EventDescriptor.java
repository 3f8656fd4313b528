package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Causal event carried by an operation: the id the event will have in the ledger, the events it
 * depends on, and its timestamp. A missing parent list means a root event. Entries are kept as
 * given (including null or blank ones) so that schema validation can report them.
 */
public record EventDescriptor(
        @JsonProperty("eventId") String eventId,
        @JsonProperty("parentIds") List<String> parentIds,
        @JsonProperty("timestamp") Long timestamp
) {
    public EventDescriptor {
        parentIds = parentIds != null ? Collections.unmodifiableList(new ArrayList<>(parentIds)) : List.of();
    }

    /** Root event (no parents). */
    public static EventDescriptor root(String eventId, long timestamp) {
        return new EventDescriptor(eventId, List.of(), timestamp);
    }

    public static EventDescriptor of(String eventId, List<String> parentIds, long timestamp) {
        return new EventDescriptor(eventId, parentIds, timestamp);
    }

    @JsonIgnore
    public boolean isRoot() {
        return parentIds.isEmpty();
    }
}
