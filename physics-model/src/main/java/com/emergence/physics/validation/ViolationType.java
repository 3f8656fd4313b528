package com.emergence.physics.validation;

/**
 * Every way an operation, a release or a configuration document can be rejected.
 */
public enum ViolationType {
    /** Malformed input; not retryable without changing it. */
    SCHEMA_INVALID(ViolationClass.SCHEMA),
    /** Requested execution time limit is above the configured maximum. */
    TIME_LIMIT_EXCEEDED(ViolationClass.SCHEMA),
    /** A parent event id does not resolve to an event in the ledger. */
    UNKNOWN_PARENT(ViolationClass.CAUSALITY),
    /** The event id is already in the ledger. */
    DUPLICATE_EVENT(ViolationClass.CAUSALITY),
    /** The event timestamp precedes (or, in strict mode, ties with a different) parent. */
    CAUSAL_ORDER_VIOLATION(ViolationClass.CAUSALITY),
    /** Allocation would take the entity's usage above its budget. */
    INSUFFICIENT_RESOURCE(ViolationClass.RESOURCE),
    /** Release of an allocation that is not live. */
    UNKNOWN_ALLOCATION(ViolationClass.RESOURCE),
    /** The entity does not hold the required capability. */
    CAPABILITY_DENIED(ViolationClass.SECURITY);

    private final ViolationClass violationClass;

    ViolationType(ViolationClass violationClass) {
        this.violationClass = violationClass;
    }

    public ViolationClass getViolationClass() {
        return violationClass;
    }
}
