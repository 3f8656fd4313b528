package com.emergence.physics.engine;

import com.emergence.physics.validation.Violation;

/**
 * Thrown by {@link AdmissionPipeline#admitOrThrow} when an operation is rejected.
 * Nothing was committed for the operation.
 */
public final class PhysicsViolationException extends RuntimeException {

    private final ValidationFailure failure;

    public PhysicsViolationException(ValidationFailure failure) {
        super(String.format("Operation %s rejected at stage=%s: %s",
                failure.getOperationId(), failure.getStage(), failure.getMessage()));
        this.failure = failure;
    }

    public ValidationFailure getFailure() {
        return failure;
    }

    public Violation getPrimaryViolation() {
        return failure.getPrimaryViolation();
    }
}
