package com.emergence.physics.ledger.snapshot;

import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.EventNode;
import com.emergence.physics.model.ResourceAllocation;
import com.emergence.physics.model.ResourceKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable copy of the ledgers handed to a {@link SnapshotSink}. Each ledger is copied under its
 * own locks; the snapshot is not a single global cut across the three.
 * Entity keys are plain strings so the JSON form reads back without custom key handling.
 */
public final class LedgerSnapshot {

    private final String instanceId;
    private final long takenAtMillis;
    private final String reason;
    private final List<EventNode> events;
    private final List<ResourceAllocation> allocations;
    private final Map<String, Map<ResourceKind, Double>> usage;
    private final Map<String, Set<String>> capabilities;

    @JsonCreator
    public LedgerSnapshot(
            @JsonProperty("instanceId") String instanceId,
            @JsonProperty("takenAtMillis") long takenAtMillis,
            @JsonProperty("reason") String reason,
            @JsonProperty("events") List<EventNode> events,
            @JsonProperty("allocations") List<ResourceAllocation> allocations,
            @JsonProperty("usage") Map<String, Map<ResourceKind, Double>> usage,
            @JsonProperty("capabilities") Map<String, Set<String>> capabilities) {
        this.instanceId = instanceId != null ? instanceId : "";
        this.takenAtMillis = takenAtMillis;
        this.reason = reason != null ? reason : "";
        this.events = events != null ? List.copyOf(events) : List.of();
        this.allocations = allocations != null ? List.copyOf(allocations) : List.of();
        this.usage = usage != null ? Collections.unmodifiableMap(new LinkedHashMap<>(usage)) : Map.of();
        this.capabilities = capabilities != null ? Collections.unmodifiableMap(new LinkedHashMap<>(capabilities)) : Map.of();
    }

    /**
     * Copies the current state of the three ledgers.
     *
     * @param instanceId engine instance id
     * @param reason     why the snapshot was taken (e.g. "admission", "shutdown")
     */
    public static LedgerSnapshot capture(String instanceId, String reason,
                                         EventLedger events, ResourceLedger resources, CapabilityRegistry capabilities) {
        Map<String, Map<ResourceKind, Double>> usage = new LinkedHashMap<>();
        for (Map.Entry<EntityId, Map<ResourceKind, Double>> e : resources.usageByEntity().entrySet()) {
            usage.put(e.getKey().value(), e.getValue());
        }
        Map<String, Set<String>> grants = new LinkedHashMap<>();
        for (Map.Entry<EntityId, Set<String>> e : capabilities.snapshot().entrySet()) {
            grants.put(e.getKey().value(), new TreeSet<>(e.getValue()));
        }
        return new LedgerSnapshot(instanceId, System.currentTimeMillis(), reason,
                events.events(), resources.liveAllocations(), usage, grants);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getTakenAtMillis() {
        return takenAtMillis;
    }

    public String getReason() {
        return reason;
    }

    public List<EventNode> getEvents() {
        return events;
    }

    public List<ResourceAllocation> getAllocations() {
        return allocations;
    }

    public Map<String, Map<ResourceKind, Double>> getUsage() {
        return usage;
    }

    public Map<String, Set<String>> getCapabilities() {
        return capabilities;
    }

    @Override
    public String toString() {
        return "LedgerSnapshot{instanceId=" + instanceId + ", reason=" + reason + ", events=" + events.size()
                + ", allocations=" + allocations.size() + ", entities=" + usage.size() + "}";
    }
}
