package com.emergence.physics.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Fluent builder for {@link PhysicsOperation}. Assigns a random operation id when none is set.
 */
public final class PhysicsOperationBuilder {

    private String operationId;
    private EntityId entity;
    private EventDescriptor event;
    private Resource resource;
    private String requiredCapability;
    private Long timeLimitMillis;
    private final Map<String, Object> payload = new LinkedHashMap<>();

    PhysicsOperationBuilder() {
    }

    public PhysicsOperationBuilder operationId(String operationId) {
        this.operationId = operationId;
        return this;
    }

    public PhysicsOperationBuilder entity(EntityId entity) {
        this.entity = entity;
        return this;
    }

    public PhysicsOperationBuilder entity(String entityId) {
        this.entity = EntityId.of(entityId);
        return this;
    }

    public PhysicsOperationBuilder event(EventDescriptor event) {
        this.event = event;
        return this;
    }

    /** Convenience: causal event with the given parents and timestamp. */
    public PhysicsOperationBuilder event(String eventId, List<String> parentIds, long timestamp) {
        this.event = EventDescriptor.of(eventId, parentIds, timestamp);
        return this;
    }

    /** Convenience: root causal event. */
    public PhysicsOperationBuilder rootEvent(String eventId, long timestamp) {
        this.event = EventDescriptor.root(eventId, timestamp);
        return this;
    }

    public PhysicsOperationBuilder resource(Resource resource) {
        this.resource = resource;
        return this;
    }

    public PhysicsOperationBuilder resource(ResourceKind kind, double amount) {
        this.resource = Resource.of(kind, amount);
        return this;
    }

    public PhysicsOperationBuilder requiredCapability(String capability) {
        this.requiredCapability = capability;
        return this;
    }

    public PhysicsOperationBuilder timeLimitMillis(long timeLimitMillis) {
        this.timeLimitMillis = timeLimitMillis;
        return this;
    }

    public PhysicsOperationBuilder payload(String key, Object value) {
        this.payload.put(key, value);
        return this;
    }

    public PhysicsOperationBuilder payload(Map<String, Object> payload) {
        this.payload.clear();
        if (payload != null) this.payload.putAll(payload);
        return this;
    }

    public PhysicsOperation build() {
        String id = operationId != null ? operationId : UUID.randomUUID().toString();
        return new PhysicsOperation(id, entity, event, resource, requiredCapability, timeLimitMillis, payload);
    }
}
