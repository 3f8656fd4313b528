package com.emergence.physics.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Result of a validation: pass, or fail with a non-empty list of violations.
 */
public final class ValidationResult {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of());

    private final boolean valid;
    private final List<Violation> violations;

    private ValidationResult(boolean valid, List<Violation> violations) {
        this.valid = valid;
        this.violations = Collections.unmodifiableList(new ArrayList<>(violations));
    }

    public static ValidationResult success() {
        return SUCCESS;
    }

    /**
     * @throws IllegalArgumentException if {@code violations} is null or empty
     */
    public static ValidationResult failure(List<Violation> violations) {
        if (violations == null || violations.isEmpty()) {
            throw new IllegalArgumentException("A failed validation needs at least one violation");
        }
        return new ValidationResult(false, violations);
    }

    public static ValidationResult failure(Violation violation) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(violation, "violation")));
    }

    /** Success if {@code violations} is empty, failure otherwise. */
    public static ValidationResult of(List<Violation> violations) {
        return violations == null || violations.isEmpty() ? SUCCESS : failure(violations);
    }

    public boolean isValid() {
        return valid;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    /** Violation messages, in reporting order. */
    public List<String> getErrors() {
        return violations.stream().map(Violation::getMessage).collect(Collectors.toUnmodifiableList());
    }

    /** First reported violation, or null when valid. */
    public Violation getPrimaryViolation() {
        return violations.isEmpty() ? null : violations.get(0);
    }

    /** True if any violation has the given type. */
    public boolean hasViolation(ViolationType type) {
        for (Violation v : violations) {
            if (v.getType() == type) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return valid ? "VALID" : "INVALID " + getErrors();
    }
}
