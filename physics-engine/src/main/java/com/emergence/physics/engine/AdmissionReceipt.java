package com.emergence.physics.engine;

import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Proof of admission handed back to the caller together with the payload for the external
 * executor. Carries what the commit created: the event node's id and ledger sequence, and the
 * allocation handle to release later.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AdmissionReceipt {

    private final String operationId;
    private final EntityId entity;
    private final String eventId;
    private final Long sequence;
    private final AllocationRef allocationRef;
    private final String requiredCapability;
    private final long timeLimitMillis;
    private final long admittedAtMillis;
    private final Map<String, Object> payload;

    AdmissionReceipt(String operationId, EntityId entity, String eventId, Long sequence,
                     AllocationRef allocationRef, String requiredCapability, long timeLimitMillis,
                     long admittedAtMillis, Map<String, Object> payload) {
        this.operationId = operationId;
        this.entity = entity;
        this.eventId = eventId;
        this.sequence = sequence;
        this.allocationRef = allocationRef;
        this.requiredCapability = requiredCapability;
        this.timeLimitMillis = timeLimitMillis;
        this.admittedAtMillis = admittedAtMillis;
        this.payload = payload != null ? payload : Map.of();
    }

    public String getOperationId() {
        return operationId;
    }

    public EntityId getEntity() {
        return entity;
    }

    /** Admitted event id; null when the operation carried no event. */
    public String getEventId() {
        return eventId;
    }

    /** Ledger sequence of the admitted event; null when no event. */
    public Long getSequence() {
        return sequence;
    }

    /** Handle of the new allocation; null when nothing (or zero) was requested. */
    public AllocationRef getAllocationRef() {
        return allocationRef;
    }

    public String getRequiredCapability() {
        return requiredCapability;
    }

    /** Execution time limit for the external executor: requested limit, or the configured maximum. */
    public long getTimeLimitMillis() {
        return timeLimitMillis;
    }

    public long getAdmittedAtMillis() {
        return admittedAtMillis;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    @Override
    public String toString() {
        return "AdmissionReceipt{operationId=" + operationId + ", entity=" + entity + ", eventId=" + eventId
                + ", sequence=" + sequence + ", allocationRef=" + allocationRef + "}";
    }
}
