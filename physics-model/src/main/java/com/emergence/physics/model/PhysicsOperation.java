package com.emergence.physics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unit submitted for admission: an entity proposes a state change and declares what it needs.
 * <ul>
 *   <li>{@code event} – optional causal event to append to the event ledger</li>
 *   <li>{@code resource} – optional resource request to allocate against the entity's budget</li>
 *   <li>{@code requiredCapability} – optional capability the entity must hold</li>
 *   <li>{@code timeLimitMillis} – optional execution time limit the executor will enforce; bounded by configuration</li>
 *   <li>{@code payload} – opaque content authorized once the operation is admitted</li>
 * </ul>
 * Fields are kept as given so that schema validation can report malformed operations; use
 * {@link PhysicsOperationBuilder} to create operations in code.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PhysicsOperation {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String operationId;
    private final EntityId entity;
    private final EventDescriptor event;
    private final Resource resource;
    private final String requiredCapability;
    private final Long timeLimitMillis;
    private final Map<String, Object> payload;

    @JsonCreator
    public PhysicsOperation(
            @JsonProperty("operationId") String operationId,
            @JsonProperty("entity") EntityId entity,
            @JsonProperty("event") EventDescriptor event,
            @JsonProperty("resource") Resource resource,
            @JsonProperty("requiredCapability") String requiredCapability,
            @JsonProperty("timeLimitMillis") Long timeLimitMillis,
            @JsonProperty("payload") Map<String, Object> payload) {
        this.operationId = operationId;
        this.entity = entity;
        this.event = event;
        this.resource = resource;
        this.requiredCapability = requiredCapability;
        this.timeLimitMillis = timeLimitMillis;
        this.payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    public static PhysicsOperationBuilder builder() {
        return new PhysicsOperationBuilder();
    }

    public String getOperationId() {
        return operationId;
    }

    public EntityId getEntity() {
        return entity;
    }

    public EventDescriptor getEvent() {
        return event;
    }

    public Resource getResource() {
        return resource;
    }

    public String getRequiredCapability() {
        return requiredCapability;
    }

    public Long getTimeLimitMillis() {
        return timeLimitMillis;
    }

    /** Opaque payload; unmodifiable, never null. */
    public Map<String, Object> getPayload() {
        return payload;
    }

    public boolean hasEvent() {
        return event != null;
    }

    public boolean hasResource() {
        return resource != null;
    }

    public boolean hasRequiredCapability() {
        return requiredCapability != null;
    }

    /**
     * Deserializes from JSON string. Throws {@link UncheckedIOException} on failure.
     */
    public static PhysicsOperation fromJson(String json) {
        try {
            return MAPPER.readValue(json, PhysicsOperation.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes this operation to a JSON string (nulls excluded). Throws {@link UncheckedIOException} on failure.
     */
    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    @Override
    public String toString() {
        return "PhysicsOperation{" +
                "operationId='" + operationId + '\'' +
                ", entity=" + entity +
                ", event=" + (event != null ? event.eventId() : null) +
                ", resource=" + resource +
                ", requiredCapability='" + requiredCapability + '\'' +
                '}';
    }
}
