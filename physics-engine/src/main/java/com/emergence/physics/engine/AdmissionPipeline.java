package com.emergence.physics.engine;

import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.ledger.snapshot.LedgerSnapshot;
import com.emergence.physics.ledger.snapshot.SnapshotPublisher;
import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.ContentDigests;
import com.emergence.physics.model.EventDescriptor;
import com.emergence.physics.model.EventNode;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.Resource;
import com.emergence.physics.model.ResourceAllocation;
import com.emergence.physics.validation.AdmissionCheck;
import com.emergence.physics.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Validates an operation through every stage and commits its effects only when all of them pass.
 * <p>
 * Lock-free stages (schema) run first. Then the ledger locks the operation needs are taken in a
 * fixed order: event ledger write lock (operation carries an event), the (entity, kind) account
 * lock (positive resource request), the entity's capability read lock (required capability).
 * The remaining stages and the commit run while those locks are held, so the state they checked
 * is the state the commit extends. A rejected operation leaves every ledger untouched.
 */
public final class AdmissionPipeline {

    private static final Logger log = LoggerFactory.getLogger(AdmissionPipeline.class);

    private final EventLedger events;
    private final ResourceLedger resources;
    private final CapabilityRegistry capabilities;
    private final List<AdmissionStages.Stage> stages;
    private final AdmissionMetrics metrics;
    private final SnapshotPublisher publisher;
    private final Supplier<LedgerSnapshot> snapshotCapture;
    private final long defaultTimeLimitMillis;
    private final LongSupplier clock;

    private AdmissionPipeline(Builder b) {
        this.events = Objects.requireNonNull(b.events, "events");
        this.resources = Objects.requireNonNull(b.resources, "resources");
        this.capabilities = Objects.requireNonNull(b.capabilities, "capabilities");
        this.stages = AdmissionStages.order(Objects.requireNonNull(b.checks, "checks"));
        this.metrics = Objects.requireNonNull(b.metrics, "metrics");
        this.publisher = b.publisher;
        this.snapshotCapture = b.snapshotCapture;
        this.defaultTimeLimitMillis = b.defaultTimeLimitMillis;
        this.clock = b.clock != null ? b.clock : System::currentTimeMillis;
        log.info("Admission pipeline wired | stages={}", stages);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<AdmissionStages.Stage> getStages() {
        return stages;
    }

    /**
     * Admits or rejects the operation. Never throws for a rejection.
     *
     * @return accepted receipt, or the failing stage's violations
     */
    public AdmissionResult admit(PhysicsOperation op) {
        long start = System.nanoTime();
        String operationId = op != null ? op.getOperationId() : null;

        for (AdmissionStages.Stage stage : stages) {
            if (stage.isLocking()) break;
            AdmissionResult rejected = runStage(stage, op, operationId, start);
            if (rejected != null) return rejected;
        }

        Objects.requireNonNull(op, "operation");
        Deque<Lock> held = acquireLocks(op);
        AdmissionReceipt receipt;
        try {
            for (AdmissionStages.Stage stage : stages) {
                if (!stage.isLocking()) continue;
                AdmissionResult rejected = runStage(stage, op, operationId, start);
                if (rejected != null) return rejected;
            }
            receipt = commit(op);
        } finally {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
        }

        metrics.recordAdmitted(System.nanoTime() - start);
        if (publisher != null && snapshotCapture != null) {
            publisher.publishAsync(snapshotCapture);
        }
        log.debug("Admitted | operationId={} | entity={} | eventId={} | allocation={}",
                operationId, receipt.getEntity(), receipt.getEventId(), receipt.getAllocationRef());
        return AdmissionResult.accepted(receipt);
    }

    /**
     * Like {@link #admit} but throws on rejection.
     *
     * @throws PhysicsViolationException carrying the failure
     */
    public AdmissionReceipt admitOrThrow(PhysicsOperation op) {
        AdmissionResult result = admit(op);
        if (!result.isAccepted()) {
            throw new PhysicsViolationException(result.getFailure());
        }
        return result.getReceipt();
    }

    private AdmissionResult runStage(AdmissionStages.Stage stage, PhysicsOperation op, String operationId, long start) {
        AdmissionCheck check = stage.getCheck();
        // lock-free stages also see a missing operation and report it
        if (op != null && !check.appliesTo(op)) return null;
        ValidationResult result = check.check(op);
        if (result.isValid()) return null;
        metrics.recordRejected(stage.getName(), result, System.nanoTime() - start);
        log.warn("Rejected | operationId={} | stage={} | violation={} | {}",
                operationId, stage.getName(), result.getPrimaryViolation().getType(), result.getPrimaryViolation().getMessage());
        return AdmissionResult.rejected(new ValidationFailure(operationId, stage.getName(), result));
    }

    private Deque<Lock> acquireLocks(PhysicsOperation op) {
        Deque<Lock> held = new ArrayDeque<>(3);
        try {
            if (op.hasEvent()) {
                lock(events.writeLock(), held);
            }
            if (needsAllocation(op)) {
                // unconfigured pair: nothing to lock, the resource stage rejects it
                resources.accountLock(op.getEntity(), op.getResource().kind()).ifPresent(l -> lock(l, held));
            }
            if (op.hasRequiredCapability()) {
                capabilities.readLock(op.getEntity()).ifPresent(l -> lock(l, held));
            }
        } catch (RuntimeException e) {
            while (!held.isEmpty()) {
                held.pop().unlock();
            }
            throw e;
        }
        return held;
    }

    private static void lock(Lock lock, Deque<Lock> held) {
        lock.lock();
        held.push(lock);
    }

    private AdmissionReceipt commit(PhysicsOperation op) {
        String eventId = null;
        Long sequence = null;
        if (op.hasEvent()) {
            EventDescriptor event = op.getEvent();
            EventNode node = events.insert(event.eventId(), event.timestamp(), event.parentIds(),
                    ContentDigests.digest(op.getPayload()));
            eventId = node.id();
            sequence = node.sequence();
        }
        AllocationRef ref = null;
        if (needsAllocation(op)) {
            Resource resource = op.getResource();
            ResourceAllocation allocation = resources.allocate(op.getEntity(), resource.kind(), resource.quantity());
            ref = allocation.ref();
        }
        long timeLimit = op.getTimeLimitMillis() != null ? op.getTimeLimitMillis() : defaultTimeLimitMillis;
        return new AdmissionReceipt(op.getOperationId(), op.getEntity(), eventId, sequence, ref,
                op.getRequiredCapability(), timeLimit, clock.getAsLong(), op.getPayload());
    }

    private static boolean needsAllocation(PhysicsOperation op) {
        return op.hasResource() && op.getResource().quantity() > 0;
    }

    public static final class Builder {
        private EventLedger events;
        private ResourceLedger resources;
        private CapabilityRegistry capabilities;
        private List<? extends AdmissionCheck> checks;
        private AdmissionMetrics metrics;
        private SnapshotPublisher publisher;
        private Supplier<LedgerSnapshot> snapshotCapture;
        private long defaultTimeLimitMillis;
        private LongSupplier clock;

        private Builder() {
        }

        public Builder ledgers(EventLedger events, ResourceLedger resources, CapabilityRegistry capabilities) {
            this.events = events;
            this.resources = resources;
            this.capabilities = capabilities;
            return this;
        }

        /** Checks to run; ordered by their {@code @AdmissionStage} metadata. */
        public Builder checks(List<? extends AdmissionCheck> checks) {
            this.checks = checks;
            return this;
        }

        public Builder metrics(AdmissionMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Publisher and capture for the snapshot written after each commit; both optional. */
        public Builder snapshots(SnapshotPublisher publisher, Supplier<LedgerSnapshot> capture) {
            this.publisher = publisher;
            this.snapshotCapture = capture;
            return this;
        }

        /** Time limit put on receipts of operations that do not request one. */
        public Builder defaultTimeLimitMillis(long millis) {
            this.defaultTimeLimitMillis = millis;
            return this;
        }

        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        public AdmissionPipeline build() {
            return new AdmissionPipeline(this);
        }
    }
}
