package com.emergence.physics.engine;

import com.emergence.physics.model.ResourceKind;
import com.emergence.physics.validation.ViolationType;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only view of an engine: identity, uptime, ledger sizes, usage per entity and the admission
 * counters. Values are read one after another, not as a single atomic cut.
 */
public final class EngineStatistics {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String instanceId;
    private final long startedAtMillis;
    private final long uptimeMillis;
    private final int eventCount;
    private final int liveAllocations;
    private final Map<String, Map<ResourceKind, Double>> usage;
    private final long admitted;
    private final long rejected;
    private final Map<ViolationType, Long> violations;

    @JsonCreator
    public EngineStatistics(
            @JsonProperty("instanceId") String instanceId,
            @JsonProperty("startedAtMillis") long startedAtMillis,
            @JsonProperty("uptimeMillis") long uptimeMillis,
            @JsonProperty("eventCount") int eventCount,
            @JsonProperty("liveAllocations") int liveAllocations,
            @JsonProperty("usage") Map<String, Map<ResourceKind, Double>> usage,
            @JsonProperty("admitted") long admitted,
            @JsonProperty("rejected") long rejected,
            @JsonProperty("violations") Map<ViolationType, Long> violations) {
        this.instanceId = instanceId;
        this.startedAtMillis = startedAtMillis;
        this.uptimeMillis = uptimeMillis;
        this.eventCount = eventCount;
        this.liveAllocations = liveAllocations;
        this.usage = usage != null ? Collections.unmodifiableMap(new LinkedHashMap<>(usage)) : Map.of();
        this.admitted = admitted;
        this.rejected = rejected;
        this.violations = violations != null ? Collections.unmodifiableMap(new LinkedHashMap<>(violations)) : Map.of();
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getStartedAtMillis() {
        return startedAtMillis;
    }

    public long getUptimeMillis() {
        return uptimeMillis;
    }

    public int getEventCount() {
        return eventCount;
    }

    public int getLiveAllocations() {
        return liveAllocations;
    }

    /** Entity id → kind → current usage. */
    public Map<String, Map<ResourceKind, Double>> getUsage() {
        return usage;
    }

    public long getAdmitted() {
        return admitted;
    }

    public long getRejected() {
        return rejected;
    }

    /** Reported violations per type; absent types were never reported. */
    public Map<ViolationType, Long> getViolations() {
        return violations;
    }

    /** Usage of one entity and kind; 0 when nothing is on record. */
    public double usageOf(String entityId, ResourceKind kind) {
        Map<ResourceKind, Double> byKind = usage.get(entityId);
        Double v = byKind != null ? byKind.get(kind) : null;
        return v != null ? v : 0.0;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    @Override
    public String toString() {
        return "EngineStatistics{instanceId=" + instanceId + ", uptimeMillis=" + uptimeMillis + ", events=" + eventCount
                + ", liveAllocations=" + liveAllocations + ", admitted=" + admitted + ", rejected=" + rejected
                + ", violations=" + violations + "}";
    }
}
