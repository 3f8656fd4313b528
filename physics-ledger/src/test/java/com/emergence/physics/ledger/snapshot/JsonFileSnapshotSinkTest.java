package com.emergence.physics.ledger.snapshot;

import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.ResourceKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFileSnapshotSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void write_thenRead_restoresLedgerContents() {
        EntityId agent = EntityId.of("agent-a");
        EventLedger events = new EventLedger();
        events.insert("A", 100, List.of(), null);
        events.insert("B", 110, List.of("A"), "d1");
        ResourceLedger resources = new ResourceLedger();
        resources.setBudget(agent, ResourceKind.MEMORY, 10);
        resources.allocate(agent, ResourceKind.MEMORY, 2.5);
        CapabilityRegistry capabilities = new CapabilityRegistry();
        capabilities.grant(agent, "CodeAnalysis");

        JsonFileSnapshotSink sink = new JsonFileSnapshotSink(tempDir.resolve("snapshots"));
        sink.write(LedgerSnapshot.capture("engine-1", "test", events, resources, capabilities));

        assertTrue(Files.isRegularFile(sink.target()));
        LedgerSnapshot back = sink.read().orElseThrow();
        assertEquals("engine-1", back.getInstanceId());
        assertEquals("test", back.getReason());
        assertEquals(events.events(), back.getEvents());
        assertEquals(resources.liveAllocations(), back.getAllocations());
        assertEquals(2.5, back.getUsage().get("agent-a").get(ResourceKind.MEMORY));
        assertEquals(Set.of("CodeAnalysis"), back.getCapabilities().get("agent-a"));
    }

    @Test
    void read_emptyWhenNothingWritten() {
        assertTrue(new JsonFileSnapshotSink(tempDir).read().isEmpty());
    }

    @Test
    void write_replacesPreviousFile() throws Exception {
        JsonFileSnapshotSink sink = new JsonFileSnapshotSink(tempDir);
        EventLedger events = new EventLedger();
        sink.write(LedgerSnapshot.capture("e", "first", events, new ResourceLedger(), new CapabilityRegistry()));
        events.insert("A", 1, List.of(), null);
        sink.write(LedgerSnapshot.capture("e", "second", events, new ResourceLedger(), new CapabilityRegistry()));

        assertEquals("second", sink.read().orElseThrow().getReason());
        try (var files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }
}
