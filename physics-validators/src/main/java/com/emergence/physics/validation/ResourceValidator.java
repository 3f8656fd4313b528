package com.emergence.physics.validation;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.Resource;
import com.emergence.physics.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Checks resource requests against the entity's remaining budget and release requests against
 * the live allocations.
 */
@AdmissionStage(name = "resource", order = 3)
public final class ResourceValidator implements AdmissionCheck {

    private static final Logger log = LoggerFactory.getLogger(ResourceValidator.class);

    private final ResourceLedger ledger;

    public ResourceValidator(ResourceLedger ledger) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
    }

    /**
     * Fails with {@code INSUFFICIENT_RESOURCE} when {@code usage + amount > budget}. A zero amount always passes;
     * a negative or non-finite amount fails with {@code SCHEMA_INVALID}.
     */
    public ValidationResult validateAllocation(EntityId entity, ResourceKind kind, double amount) {
        if (!Double.isFinite(amount) || amount < 0) {
            return ValidationResult.failure(Violation.schemaInvalid(
                    "resource amount must be finite and non-negative: " + amount));
        }
        if (amount == 0) {
            return ValidationResult.success();
        }
        Optional<Lock> accountLock = ledger.accountLock(entity, kind);
        if (accountLock.isEmpty()) {
            log.debug("Allocation against unconfigured pair | entity={} | kind={} | required={}", entity, kind, amount);
            return ValidationResult.failure(Violation.insufficientResource(entity, kind, amount, 0.0));
        }
        Lock lock = accountLock.get();
        lock.lock();
        try {
            if (ledger.fits(entity, kind, amount)) {
                return ValidationResult.success();
            }
            double available = ledger.available(entity, kind);
            log.debug("Allocation does not fit | entity={} | kind={} | required={} | available={}", entity, kind, amount, available);
            return ValidationResult.failure(Violation.insufficientResource(entity, kind, amount, available));
        } finally {
            lock.unlock();
        }
    }

    /** Fails with {@code UNKNOWN_ALLOCATION} when the ref is not live. */
    public ValidationResult validateRelease(AllocationRef ref) {
        return ledger.isLive(ref) ? ValidationResult.success() : ValidationResult.failure(Violation.unknownAllocation(ref));
    }

    @Override
    public boolean appliesTo(PhysicsOperation operation) {
        return operation.hasResource();
    }

    @Override
    public ValidationResult check(PhysicsOperation operation) {
        Resource resource = operation.getResource();
        return validateAllocation(operation.getEntity(), resource.kind(), resource.quantity());
    }
}
