package com.emergence.physics.validation;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.PhysicsOperation;

import java.util.Objects;

/** Capability gate: an operation that names a required capability passes only if its entity holds it. */
@AdmissionStage(name = "security", order = 4)
public final class SecurityValidator implements AdmissionCheck {

    private final CapabilityRegistry registry;

    public SecurityValidator(CapabilityRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Null capability means none is required. */
    public ValidationResult validateCapability(EntityId entity, String capability) {
        if (capability == null) {
            return ValidationResult.success();
        }
        return registry.holds(entity, capability)
                ? ValidationResult.success()
                : ValidationResult.failure(Violation.capabilityDenied(entity, capability));
    }

    @Override
    public boolean appliesTo(PhysicsOperation operation) {
        return operation.hasRequiredCapability();
    }

    @Override
    public ValidationResult check(PhysicsOperation operation) {
        return validateCapability(operation.getEntity(), operation.getRequiredCapability());
    }
}
