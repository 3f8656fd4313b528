package com.emergence.physics.engine;

import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.ledger.snapshot.LedgerSnapshot;
import com.emergence.physics.ledger.snapshot.SnapshotPublisher;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.ResourceKind;
import com.emergence.physics.validation.CausalityValidator;
import com.emergence.physics.validation.ResourceValidator;
import com.emergence.physics.validation.SchemaValidator;
import com.emergence.physics.validation.SecurityValidator;
import com.emergence.physics.validation.ViolationType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionPipelineTest {

    private static final EntityId AGENT = EntityId.of("agent-a");

    private EventLedger events;
    private ResourceLedger resources;
    private CapabilityRegistry capabilities;
    private AdmissionMetrics metrics;
    private SnapshotPublisher publisher;
    private List<LedgerSnapshot> published;
    private AdmissionPipeline pipeline;

    @BeforeEach
    void setUp() {
        events = new EventLedger();
        resources = new ResourceLedger();
        resources.setBudget(AGENT, ResourceKind.MEMORY, 10);
        capabilities = new CapabilityRegistry();
        capabilities.grant(AGENT, "Write");
        metrics = new AdmissionMetrics(new SimpleMeterRegistry(), "test-engine");
        published = new CopyOnWriteArrayList<>();
        publisher = new SnapshotPublisher(published::add);
        pipeline = AdmissionPipeline.builder()
                .ledgers(events, resources, capabilities)
                .checks(List.of(
                        new SchemaValidator(),
                        new CausalityValidator(events, false),
                        new ResourceValidator(resources),
                        new SecurityValidator(capabilities)))
                .metrics(metrics)
                .snapshots(publisher, () -> LedgerSnapshot.capture("test-engine", "admission", events, resources, capabilities))
                .defaultTimeLimitMillis(300_000L)
                .clock(() -> 1_000L)
                .build();
    }

    @AfterEach
    void tearDown() {
        publisher.onExit();
    }

    @Test
    void admit_commitsEventAndAllocationTogether() {
        AdmissionResult result = pipeline.admit(PhysicsOperation.builder()
                .operationId("op-1")
                .entity(AGENT)
                .rootEvent("A", 100)
                .resource(ResourceKind.MEMORY, 3)
                .requiredCapability("Write")
                .payload("task", "index")
                .build());

        assertTrue(result.isAccepted());
        AdmissionReceipt receipt = result.getReceipt();
        assertEquals("op-1", receipt.getOperationId());
        assertEquals("A", receipt.getEventId());
        assertEquals(0L, receipt.getSequence());
        assertNotNull(receipt.getAllocationRef());
        assertEquals(300_000L, receipt.getTimeLimitMillis());
        assertEquals(1_000L, receipt.getAdmittedAtMillis());
        assertEquals("index", receipt.getPayload().get("task"));
        assertEquals(1, events.size());
        assertEquals(3.0, resources.usage(AGENT, ResourceKind.MEMORY));
    }

    @Test
    void rejectionInLaterStage_leavesNoPartialEffects() {
        AdmissionResult resourceFails = pipeline.admit(PhysicsOperation.builder()
                .entity(AGENT)
                .rootEvent("A", 100)
                .resource(ResourceKind.MEMORY, 11)
                .build());
        AdmissionResult securityFails = pipeline.admit(PhysicsOperation.builder()
                .entity(AGENT)
                .rootEvent("B", 100)
                .resource(ResourceKind.MEMORY, 5)
                .requiredCapability("Deploy")
                .build());

        assertEquals("resource", resourceFails.getFailure().getStage());
        assertEquals(ViolationType.INSUFFICIENT_RESOURCE, resourceFails.getPrimaryViolation().getType());
        assertEquals("security", securityFails.getFailure().getStage());
        assertEquals(ViolationType.CAPABILITY_DENIED, securityFails.getPrimaryViolation().getType());
        assertEquals(0, events.size());
        assertEquals(0.0, resources.usage(AGENT, ResourceKind.MEMORY));
        assertEquals(0, resources.liveAllocationCount());
    }

    @Test
    void stagesRunInFixedOrder() {
        // schema problem wins over the missing parent and the missing capability
        AdmissionResult result = pipeline.admit(PhysicsOperation.builder()
                .entity(AGENT)
                .event("B", List.of("missing"), 10)
                .requiredCapability("Deploy")
                .timeLimitMillis(-1)
                .build());

        assertEquals("schema", result.getFailure().getStage());

        AdmissionResult causal = pipeline.admit(PhysicsOperation.builder()
                .entity(AGENT)
                .event("B", List.of("missing"), 10)
                .requiredCapability("Deploy")
                .build());
        assertEquals("causality", causal.getFailure().getStage());
        assertEquals(ViolationType.UNKNOWN_PARENT, causal.getPrimaryViolation().getType());
    }

    @Test
    void zeroAmount_isAcceptedWithoutAllocation() {
        AdmissionResult result = pipeline.admit(PhysicsOperation.builder()
                .entity(EntityId.of("no-budget"))
                .resource(ResourceKind.CPU, 0)
                .build());

        assertTrue(result.isAccepted());
        assertNull(result.getReceipt().getAllocationRef());
        assertEquals(0, resources.liveAllocationCount());
    }

    @Test
    void nullOperation_isSchemaInvalid() {
        AdmissionResult result = pipeline.admit(null);

        assertFalse(result.isAccepted());
        assertEquals(ViolationType.SCHEMA_INVALID, result.getPrimaryViolation().getType());
        assertNull(result.getFailure().getOperationId());
    }

    @Test
    void admitOrThrow_throwsWithFailure() {
        PhysicsViolationException e = assertThrows(PhysicsViolationException.class, () -> pipeline.admitOrThrow(
                PhysicsOperation.builder().operationId("op-x").entity(AGENT).resource(ResourceKind.NETWORK, 1).build()));

        assertEquals("op-x", e.getFailure().getOperationId());
        assertEquals(ViolationType.INSUFFICIENT_RESOURCE, e.getPrimaryViolation().getType());
        assertTrue(e.getMessage().contains("stage=resource"));
    }

    @Test
    void metrics_countOutcomesStagesAndViolations() {
        pipeline.admit(PhysicsOperation.builder().entity(AGENT).rootEvent("A", 100).build());
        pipeline.admit(PhysicsOperation.builder().entity(AGENT).event("B", List.of("A"), 50).build());
        pipeline.admit(PhysicsOperation.builder().entity(AGENT).event("C", List.of("X", "Y"), 200).build());

        assertEquals(1, metrics.admittedCount());
        assertEquals(2, metrics.rejectedCount());
        assertEquals(2, metrics.rejectedCount("causality"));
        assertEquals(1L, metrics.violationCounts().get(ViolationType.CAUSAL_ORDER_VIOLATION));
        assertEquals(2L, metrics.violationCounts().get(ViolationType.UNKNOWN_PARENT));
        assertNotNull(metrics.getRegistry().find(AdmissionMetrics.ADMISSION_TIME).timer());
    }

    @Test
    void acceptedAdmission_publishesSnapshot() {
        pipeline.admit(PhysicsOperation.builder().entity(AGENT).rootEvent("A", 100).build());
        publisher.flush();

        assertEquals(1, published.size());
        assertEquals(1, published.get(0).getEvents().size());
    }

    @Test
    void rejectedAdmission_publishesNothing() {
        pipeline.admit(PhysicsOperation.builder().entity(AGENT).requiredCapability("Deploy").build());
        publisher.flush();

        assertTrue(published.isEmpty());
    }
}
