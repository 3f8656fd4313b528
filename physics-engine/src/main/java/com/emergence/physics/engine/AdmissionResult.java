package com.emergence.physics.engine;

import com.emergence.physics.validation.Violation;

import java.util.Objects;

/**
 * Outcome of an admission: a receipt when accepted, a {@link ValidationFailure} when rejected.
 */
public final class AdmissionResult {

    private final AdmissionReceipt receipt;
    private final ValidationFailure failure;

    private AdmissionResult(AdmissionReceipt receipt, ValidationFailure failure) {
        this.receipt = receipt;
        this.failure = failure;
    }

    public static AdmissionResult accepted(AdmissionReceipt receipt) {
        return new AdmissionResult(Objects.requireNonNull(receipt, "receipt"), null);
    }

    public static AdmissionResult rejected(ValidationFailure failure) {
        return new AdmissionResult(null, Objects.requireNonNull(failure, "failure"));
    }

    public boolean isAccepted() {
        return receipt != null;
    }

    /** Receipt when accepted, else null. */
    public AdmissionReceipt getReceipt() {
        return receipt;
    }

    /** Failure when rejected, else null. */
    public ValidationFailure getFailure() {
        return failure;
    }

    /** Primary violation when rejected, else null. */
    public Violation getPrimaryViolation() {
        return failure != null ? failure.getPrimaryViolation() : null;
    }

    @Override
    public String toString() {
        return isAccepted() ? "ACCEPTED " + receipt : "REJECTED " + failure;
    }
}
