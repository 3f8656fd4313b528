package com.emergence.physics.validation;

import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.ResourceKind;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A single reason for rejecting an operation: its type, a human-readable message and typed details
 * (e.g. {@code kind}, {@code required}, {@code available} for {@link ViolationType#INSUFFICIENT_RESOURCE}).
 * Create instances through the static factories so details are always keyed consistently.
 */
public final class Violation {

    public static final String DETAIL_REASON = "reason";
    public static final String DETAIL_EVENT_ID = "eventId";
    public static final String DETAIL_PARENT_ID = "parentId";
    public static final String DETAIL_TIMESTAMP = "timestamp";
    public static final String DETAIL_PARENT_TIMESTAMP = "parentTimestamp";
    public static final String DETAIL_ENTITY = "entity";
    public static final String DETAIL_KIND = "kind";
    public static final String DETAIL_REQUIRED = "required";
    public static final String DETAIL_AVAILABLE = "available";
    public static final String DETAIL_ALLOCATION = "allocation";
    public static final String DETAIL_CAPABILITY = "capability";
    public static final String DETAIL_LIMIT = "limit";

    private final ViolationType type;
    private final String message;
    private final Map<String, Object> details;

    private Violation(ViolationType type, String message, Map<String, Object> details) {
        this.type = Objects.requireNonNull(type, "type");
        this.message = Objects.requireNonNull(message, "message");
        this.details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static Violation schemaInvalid(String reason) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_REASON, reason);
        return new Violation(ViolationType.SCHEMA_INVALID, "Schema invalid: " + reason, d);
    }

    public static Violation timeLimitExceeded(long requestedMillis, long limitMillis) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_REQUIRED, requestedMillis);
        d.put(DETAIL_LIMIT, limitMillis);
        return new Violation(ViolationType.TIME_LIMIT_EXCEEDED,
                String.format("Time limit exceeded: requested %dms, limit is %dms", requestedMillis, limitMillis), d);
    }

    public static Violation unknownParent(String eventId, String parentId) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_EVENT_ID, eventId);
        d.put(DETAIL_PARENT_ID, parentId);
        return new Violation(ViolationType.UNKNOWN_PARENT,
                "Event " + eventId + " references unknown parent " + parentId, d);
    }

    public static Violation duplicateEvent(String eventId) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_EVENT_ID, eventId);
        return new Violation(ViolationType.DUPLICATE_EVENT, "Event " + eventId + " already exists", d);
    }

    public static Violation causalOrderViolation(String eventId, long timestamp, String parentId, long parentTimestamp, boolean tie) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_EVENT_ID, eventId);
        d.put(DETAIL_TIMESTAMP, timestamp);
        d.put(DETAIL_PARENT_ID, parentId);
        d.put(DETAIL_PARENT_TIMESTAMP, parentTimestamp);
        String message = tie
                ? String.format("Event %s at t=%d ties with non-identical parent %s (strict ordering)", eventId, timestamp, parentId)
                : String.format("Event %s at t=%d precedes parent %s at t=%d", eventId, timestamp, parentId, parentTimestamp);
        return new Violation(ViolationType.CAUSAL_ORDER_VIOLATION, message, d);
    }

    public static Violation insufficientResource(EntityId entity, ResourceKind kind, double required, double available) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_ENTITY, entity != null ? entity.value() : null);
        d.put(DETAIL_KIND, kind);
        d.put(DETAIL_REQUIRED, required);
        d.put(DETAIL_AVAILABLE, available);
        return new Violation(ViolationType.INSUFFICIENT_RESOURCE,
                String.format("Insufficient %s for entity %s: required %s, available %s", kind, entity, required, available), d);
    }

    public static Violation unknownAllocation(AllocationRef ref) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_ALLOCATION, ref != null ? ref.id() : null);
        return new Violation(ViolationType.UNKNOWN_ALLOCATION, "Unknown allocation " + ref, d);
    }

    public static Violation capabilityDenied(EntityId entity, String capability) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put(DETAIL_ENTITY, entity != null ? entity.value() : null);
        d.put(DETAIL_CAPABILITY, capability);
        return new Violation(ViolationType.CAPABILITY_DENIED,
                "Capability denied: " + capability + " (entity " + entity + ")", d);
    }

    public ViolationType getType() {
        return type;
    }

    public ViolationClass getViolationClass() {
        return type.getViolationClass();
    }

    public String getMessage() {
        return message;
    }

    /** Typed details; unmodifiable. */
    public Map<String, Object> getDetails() {
        return details;
    }

    /** Reason of a {@link ViolationType#SCHEMA_INVALID} violation, else null. */
    public String getReason() {
        return (String) details.get(DETAIL_REASON);
    }

    /** Resource kind of an {@link ViolationType#INSUFFICIENT_RESOURCE} violation, else null. */
    public ResourceKind getResourceKind() {
        return (ResourceKind) details.get(DETAIL_KIND);
    }

    /** Required amount (resource) or requested time limit; null if not applicable. */
    public Double getRequired() {
        Object v = details.get(DETAIL_REQUIRED);
        return v instanceof Number ? ((Number) v).doubleValue() : null;
    }

    /** Available headroom of an {@link ViolationType#INSUFFICIENT_RESOURCE} violation, else null. */
    public Double getAvailable() {
        Object v = details.get(DETAIL_AVAILABLE);
        return v instanceof Number ? ((Number) v).doubleValue() : null;
    }

    /** Denied capability of a {@link ViolationType#CAPABILITY_DENIED} violation, else null. */
    public String getCapability() {
        return (String) details.get(DETAIL_CAPABILITY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Violation that = (Violation) o;
        return type == that.type && message.equals(that.message) && details.equals(that.details);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, details);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
