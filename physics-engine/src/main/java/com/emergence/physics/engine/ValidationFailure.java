package com.emergence.physics.engine;

import com.emergence.physics.validation.ValidationResult;
import com.emergence.physics.validation.Violation;
import com.emergence.physics.validation.ViolationClass;
import com.emergence.physics.validation.ViolationType;

import java.util.List;
import java.util.Objects;

/**
 * Why an operation was not admitted: the stage that rejected it and every violation that stage
 * reported. The first violation is the primary one. Nothing was committed.
 */
public final class ValidationFailure {

    private final String operationId;
    private final String stage;
    private final List<Violation> violations;

    public ValidationFailure(String operationId, String stage, ValidationResult result) {
        Objects.requireNonNull(result, "result");
        if (result.isValid()) {
            throw new IllegalArgumentException("ValidationFailure needs a failed result");
        }
        this.operationId = operationId;
        this.stage = Objects.requireNonNull(stage, "stage");
        this.violations = result.getViolations();
    }

    /** Id of the rejected operation; null when the operation itself was missing. */
    public String getOperationId() {
        return operationId;
    }

    /** Name of the rejecting stage (schema, causality, resource, security). */
    public String getStage() {
        return stage;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    public Violation getPrimaryViolation() {
        return violations.get(0);
    }

    public ViolationType getType() {
        return getPrimaryViolation().getType();
    }

    public ViolationClass getViolationClass() {
        return getPrimaryViolation().getViolationClass();
    }

    public String getMessage() {
        return getPrimaryViolation().getMessage();
    }

    @Override
    public String toString() {
        return "ValidationFailure{operationId=" + operationId + ", stage=" + stage + ", violations=" + violations + "}";
    }
}
