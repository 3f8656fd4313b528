package com.emergence.physics.engine;

import com.emergence.annotations.ResourceCleanup;
import com.emergence.physics.config.EntityConfig;
import com.emergence.physics.config.PhysicsConfiguration;
import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.ledger.snapshot.LedgerSnapshot;
import com.emergence.physics.ledger.snapshot.NoOpSnapshotSink;
import com.emergence.physics.ledger.snapshot.SnapshotPublisher;
import com.emergence.physics.ledger.snapshot.SnapshotSink;
import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.ResourceAllocation;
import com.emergence.physics.model.ResourceKind;
import com.emergence.physics.validation.CausalityValidator;
import com.emergence.physics.validation.ResourceValidator;
import com.emergence.physics.validation.SchemaValidator;
import com.emergence.physics.validation.SecurityValidator;
import com.emergence.physics.validation.ValidationResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Entry point of the physics layer: owns the ledgers, the admission pipeline, the metrics and the
 * snapshot publisher of one engine instance.
 * <p>
 * Operations go through {@link #admit}; administrators change grants and allocations through
 * {@link #grant}, {@link #revoke}, {@link #release} and {@link #teardownEntity}. After
 * {@link #shutdown()} every mutating call throws {@link IllegalStateException}; read-only views
 * keep working. Mutating calls run under the read side of a lifecycle lock and shutdown takes the
 * write side, so every call that got past the running check has finished before the final
 * snapshot is taken.
 */
public final class PhysicsEngine implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(PhysicsEngine.class);

    private final String instanceId;
    private final long startedAtMillis;
    private final LongSupplier clock;
    private final EventLedger events;
    private final ResourceLedger resources;
    private final CapabilityRegistry capabilities;
    private final ResourceValidator resourceValidator;
    private final AdmissionMetrics metrics;
    private final SnapshotPublisher publisher;
    private final AdmissionPipeline pipeline;
    private final boolean strictOrdering;
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final ReentrantReadWriteLock lifecycle = new ReentrantReadWriteLock();

    private PhysicsEngine(Builder b) {
        PhysicsConfiguration configuration = b.configuration;
        new SchemaValidator().validateSchemaOrThrow(configuration);

        this.instanceId = b.instanceId != null ? b.instanceId : UUID.randomUUID().toString();
        this.clock = b.clock != null ? b.clock : System::currentTimeMillis;
        this.startedAtMillis = clock.getAsLong();
        this.strictOrdering = configuration.strictOrderingEnabled();
        this.events = new EventLedger();
        this.resources = new ResourceLedger(clock);
        this.capabilities = new CapabilityRegistry();
        seed(configuration);

        this.resourceValidator = new ResourceValidator(resources);
        this.metrics = new AdmissionMetrics(b.meterRegistry, instanceId);
        this.publisher = new SnapshotPublisher(b.snapshotSink != null ? b.snapshotSink : new NoOpSnapshotSink());
        long maxTime = configuration.effectiveMaxOperationTimeMillis();
        this.pipeline = AdmissionPipeline.builder()
                .ledgers(events, resources, capabilities)
                .checks(List.of(
                        new SchemaValidator(maxTime),
                        new CausalityValidator(events, strictOrdering),
                        resourceValidator,
                        new SecurityValidator(capabilities)))
                .metrics(metrics)
                .snapshots(publisher, () -> snapshot("admission"))
                .defaultTimeLimitMillis(maxTime)
                .clock(clock)
                .build();
        log.info("Physics engine started | instanceId={} | version={} | strictOrdering={} | entities={} | maxOperationTimeMillis={} | snapshotSink={}",
                instanceId, configuration.getVersion(), strictOrdering, configuration.entitiesOrEmpty().size(), maxTime,
                publisher.getSink().describe());
    }

    /**
     * @param configuration document to seed budgets and grants from; rejected documents throw
     *                      {@link com.emergence.physics.config.InvalidConfigurationException} at {@link Builder#build()}
     */
    public static Builder builder(PhysicsConfiguration configuration) {
        return new Builder(configuration);
    }

    private void seed(PhysicsConfiguration configuration) {
        for (Map.Entry<String, EntityConfig> e : configuration.entitiesOrEmpty().entrySet()) {
            EntityId entity = EntityId.of(e.getKey());
            for (Map.Entry<ResourceKind, Double> budget : e.getValue().resolvedBudgets().entrySet()) {
                resources.setBudget(entity, budget.getKey(), budget.getValue());
            }
            for (String capability : e.getValue().getCapabilities()) {
                capabilities.grant(entity, capability);
            }
        }
    }

    /**
     * Admits or rejects one operation.
     *
     * @throws IllegalStateException after shutdown
     */
    public AdmissionResult admit(PhysicsOperation operation) {
        return whileRunning(() -> pipeline.admit(operation));
    }

    /**
     * @throws PhysicsViolationException when the operation is rejected
     * @throws IllegalStateException     after shutdown
     */
    public AdmissionReceipt admitOrThrow(PhysicsOperation operation) {
        return whileRunning(() -> pipeline.admitOrThrow(operation));
    }

    /** @return true if the entity did not hold the capability before */
    public boolean grant(EntityId entity, String capability) {
        return whileRunning(() -> capabilities.grant(entity, capability));
    }

    /** @return true if the entity held the capability */
    public boolean revoke(EntityId entity, String capability) {
        return whileRunning(() -> capabilities.revoke(entity, capability));
    }

    /**
     * Releases a live allocation.
     *
     * @return success, or {@code UNKNOWN_ALLOCATION} when the ref is not live (never allocated or already released)
     */
    public ValidationResult release(AllocationRef ref) {
        return whileRunning(() -> {
            ValidationResult result = resourceValidator.validateRelease(ref);
            if (result.isValid()) {
                // a concurrent release of the same ref may win between check and release
                result = resources.release(ref)
                        .map(a -> ValidationResult.success())
                        .orElseGet(() -> resourceValidator.validateRelease(ref));
            }
            if (!result.isValid()) {
                metrics.recordViolations(result);
                log.warn("Release rejected | allocation={} | {}", ref, result.getPrimaryViolation().getMessage());
            }
            return result;
        });
    }

    /**
     * Releases every live allocation of the entity and removes all its grants. Its events stay in
     * the ledger; its budgets stay configured.
     *
     * @return the released allocations
     */
    public List<ResourceAllocation> teardownEntity(EntityId entity) {
        Objects.requireNonNull(entity, "entity");
        return whileRunning(() -> {
            List<ResourceAllocation> released = resources.releaseAll(entity);
            int revoked = capabilities.clear(entity);
            log.info("Entity torn down | entity={} | releasedAllocations={} | revokedCapabilities={}", entity, released.size(), revoked);
            return released;
        });
    }

    public EngineStatistics statistics() {
        Map<String, Map<ResourceKind, Double>> usage = new LinkedHashMap<>();
        resources.usageByEntity().forEach((entity, byKind) -> usage.put(entity.value(), byKind));
        long now = clock.getAsLong();
        return new EngineStatistics(instanceId, startedAtMillis, Math.max(0, now - startedAtMillis),
                events.size(), resources.liveAllocationCount(), usage,
                metrics.admittedCount(), metrics.rejectedCount(), metrics.violationCounts());
    }

    public LedgerSnapshot snapshot() {
        return snapshot("on-demand");
    }

    private LedgerSnapshot snapshot(String reason) {
        return LedgerSnapshot.capture(instanceId, reason, events, resources, capabilities);
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getUptimeMillis() {
        return Math.max(0, clock.getAsLong() - startedAtMillis);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStrictOrdering() {
        return strictOrdering;
    }

    public EventLedger getEventLedger() {
        return events;
    }

    public ResourceLedger getResourceLedger() {
        return resources;
    }

    public CapabilityRegistry getCapabilityRegistry() {
        return capabilities;
    }

    public AdmissionMetrics getMetrics() {
        return metrics;
    }

    public SnapshotPublisher getSnapshotPublisher() {
        return publisher;
    }

    /**
     * Stops admissions, drains pending snapshot writes, writes a final snapshot and logs the final
     * state. Idempotent.
     */
    public void shutdown() {
        lifecycle.writeLock().lock();
        try {
            if (!running.compareAndSet(true, false)) {
                return;
            }
        } finally {
            lifecycle.writeLock().unlock();
        }
        log.info("Physics engine shutting down | instanceId={}", instanceId);
        publisher.onExit();
        publisher.publishNow(snapshot("shutdown"));
        EngineStatistics stats = statistics();
        log.info("Physics engine stopped | instanceId={} | uptimeMillis={} | events={} | liveAllocations={} | admitted={} | rejected={} | violations={}",
                instanceId, stats.getUptimeMillis(), stats.getEventCount(), stats.getLiveAllocations(),
                stats.getAdmitted(), stats.getRejected(), stats.getViolations());
    }

    @Override
    public void onExit() {
        shutdown();
    }

    private <T> T whileRunning(Supplier<T> action) {
        lifecycle.readLock().lock();
        try {
            if (!running.get()) {
                throw new IllegalStateException("Physics engine " + instanceId + " is shut down");
            }
            return action.get();
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    public static final class Builder {
        private final PhysicsConfiguration configuration;
        private String instanceId;
        private MeterRegistry meterRegistry;
        private SnapshotSink snapshotSink;
        private LongSupplier clock;

        private Builder(PhysicsConfiguration configuration) {
            this.configuration = configuration;
        }

        /** Engine instance id; random UUID when unset. */
        public Builder instanceId(String instanceId) {
            this.instanceId = instanceId;
            return this;
        }

        /** Registry for admission metrics; a private {@code SimpleMeterRegistry} when unset. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /** Destination of ledger snapshots; no-op when unset. */
        public Builder snapshotSink(SnapshotSink snapshotSink) {
            this.snapshotSink = snapshotSink;
            return this;
        }

        /** Wall clock (epoch millis) for uptime, receipts and allocation timestamps. */
        public Builder clock(LongSupplier clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws com.emergence.physics.config.InvalidConfigurationException when the document is rejected
         */
        public PhysicsEngine build() {
            return new PhysicsEngine(this);
        }
    }
}
