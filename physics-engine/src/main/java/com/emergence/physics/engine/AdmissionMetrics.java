package com.emergence.physics.engine;

import com.emergence.physics.validation.ValidationResult;
import com.emergence.physics.validation.Violation;
import com.emergence.physics.validation.ViolationType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Admission counters and timer. Every meter is tagged with the engine instance, so several engines
 * may share one registry; the engine's statistics read its own counters back from the registry.
 * <ul>
 *   <li>{@code physics.admissions} (outcome, stage): one per admission</li>
 *   <li>{@code physics.violations} (type): one per reported violation, admissions and releases alike</li>
 *   <li>{@code physics.admission.time} (outcome): time spent in the pipeline</li>
 * </ul>
 */
public final class AdmissionMetrics {

    public static final String ADMISSIONS = "physics.admissions";
    public static final String VIOLATIONS = "physics.violations";
    public static final String ADMISSION_TIME = "physics.admission.time";

    static final String OUTCOME_ADMITTED = "admitted";
    static final String OUTCOME_REJECTED = "rejected";
    static final String STAGE_COMMIT = "commit";

    private static final AtomicReference<MeterRegistry> SHARED = new AtomicReference<>();

    private final MeterRegistry registry;
    private final String instanceId;

    public AdmissionMetrics(MeterRegistry registry, String instanceId) {
        this.registry = registry != null ? registry : new SimpleMeterRegistry();
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
    }

    /**
     * Process-wide registry, created on first call (lock-free CAS) and reused forever.
     */
    public static MeterRegistry sharedRegistry() {
        MeterRegistry existing = SHARED.get();
        if (existing != null) {
            return existing;
        }
        MeterRegistry created = new SimpleMeterRegistry();
        if (SHARED.compareAndSet(null, created)) {
            return created;
        }
        return SHARED.get();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    void recordAdmitted(long durationNanos) {
        registry.counter(ADMISSIONS, "instance", instanceId, "outcome", OUTCOME_ADMITTED, "stage", STAGE_COMMIT).increment();
        timer(OUTCOME_ADMITTED).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    void recordRejected(String stage, ValidationResult result, long durationNanos) {
        registry.counter(ADMISSIONS, "instance", instanceId, "outcome", OUTCOME_REJECTED, "stage", stage).increment();
        recordViolations(result);
        timer(OUTCOME_REJECTED).record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /** Counts the violations of a rejected request that is not an admission, e.g. a release. */
    void recordViolations(ValidationResult result) {
        for (Violation v : result.getViolations()) {
            registry.counter(VIOLATIONS, "instance", instanceId, "type", v.getType().name()).increment();
        }
    }

    public long admittedCount() {
        return (long) sumAdmissions(OUTCOME_ADMITTED);
    }

    public long rejectedCount() {
        return (long) sumAdmissions(OUTCOME_REJECTED);
    }

    /** Rejections of one stage. */
    public long rejectedCount(String stage) {
        return (long) registry.find(ADMISSIONS)
                .tag("instance", instanceId)
                .tag("outcome", OUTCOME_REJECTED)
                .tag("stage", stage)
                .counters().stream().mapToDouble(Counter::count).sum();
    }

    /** Reported violations per type; types never reported are absent. */
    public Map<ViolationType, Long> violationCounts() {
        Map<ViolationType, Long> out = new EnumMap<>(ViolationType.class);
        for (Counter c : registry.find(VIOLATIONS).tag("instance", instanceId).counters()) {
            String type = c.getId().getTag("type");
            if (type == null) continue;
            out.merge(ViolationType.valueOf(type), (long) c.count(), Long::sum);
        }
        return out;
    }

    private double sumAdmissions(String outcome) {
        return registry.find(ADMISSIONS)
                .tag("instance", instanceId)
                .tag("outcome", outcome)
                .counters().stream().mapToDouble(Counter::count).sum();
    }

    private Timer timer(String outcome) {
        return Timer.builder(ADMISSION_TIME)
                .tag("instance", instanceId)
                .tag("outcome", outcome)
                .register(registry);
    }
}
