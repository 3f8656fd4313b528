package com.emergence.physics.validation;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.model.ContentDigests;
import com.emergence.physics.model.EventDescriptor;
import com.emergence.physics.model.EventNode;
import com.emergence.physics.model.PhysicsOperation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Checks a proposed event against the event ledger: every parent must exist, the event must not
 * precede its latest parent and its id must be new. With strict ordering, a timestamp equal to a
 * parent's is accepted only when both carry the same content digest.
 * <p>
 * Reads under the ledger's read lock; when the caller already holds the write lock (the admission
 * pipeline does), the reentrant lock lets the check see exactly the state the commit will extend.
 */
@AdmissionStage(name = "causality", order = 2)
public final class CausalityValidator implements AdmissionCheck {

    private final EventLedger ledger;
    private final boolean strictOrdering;

    public CausalityValidator(EventLedger ledger, boolean strictOrdering) {
        this.ledger = Objects.requireNonNull(ledger, "ledger");
        this.strictOrdering = strictOrdering;
    }

    public boolean isStrictOrdering() {
        return strictOrdering;
    }

    /** Validates without content identity; under strict ordering any tie is then a violation. */
    public ValidationResult validateEvent(String eventId, List<String> parentIds, long timestamp) {
        return validateEvent(eventId, parentIds, timestamp, null);
    }

    /**
     * @param contentDigest digest of the event's content, compared with tied parents under strict ordering; may be null
     */
    public ValidationResult validateEvent(String eventId, List<String> parentIds, long timestamp, String contentDigest) {
        List<String> parents = parentIds != null ? parentIds : List.of();
        Lock read = ledger.readLock();
        read.lock();
        try {
            List<Violation> missing = new ArrayList<>();
            List<EventNode> resolved = new ArrayList<>(parents.size());
            for (String parentId : parents) {
                Optional<EventNode> parent = ledger.get(parentId);
                if (parent.isPresent()) {
                    resolved.add(parent.get());
                } else {
                    missing.add(Violation.unknownParent(eventId, parentId));
                }
            }
            if (!missing.isEmpty()) {
                return ValidationResult.failure(missing);
            }

            EventNode latest = null;
            for (EventNode parent : resolved) {
                if (latest == null || parent.timestamp() > latest.timestamp()) latest = parent;
            }
            if (latest != null && timestamp < latest.timestamp()) {
                return ValidationResult.failure(
                        Violation.causalOrderViolation(eventId, timestamp, latest.id(), latest.timestamp(), false));
            }
            if (strictOrdering) {
                for (EventNode parent : resolved) {
                    if (parent.timestamp() == timestamp
                            && (contentDigest == null || !contentDigest.equals(parent.contentDigest()))) {
                        return ValidationResult.failure(
                                Violation.causalOrderViolation(eventId, timestamp, parent.id(), parent.timestamp(), true));
                    }
                }
            }

            if (ledger.contains(eventId)) {
                return ValidationResult.failure(Violation.duplicateEvent(eventId));
            }
            return ValidationResult.success();
        } finally {
            read.unlock();
        }
    }

    @Override
    public boolean appliesTo(PhysicsOperation operation) {
        return operation.hasEvent();
    }

    @Override
    public ValidationResult check(PhysicsOperation operation) {
        EventDescriptor event = operation.getEvent();
        String digest = strictOrdering ? ContentDigests.digest(operation.getPayload()) : null;
        return validateEvent(event.eventId(), event.parentIds(), event.timestamp(), digest);
    }
}
