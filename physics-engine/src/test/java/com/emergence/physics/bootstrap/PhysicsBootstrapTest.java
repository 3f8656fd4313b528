package com.emergence.physics.bootstrap;

import com.emergence.physics.config.InvalidConfigurationException;
import com.emergence.physics.config.PhysicsConfig;
import com.emergence.physics.config.PhysicsConfiguration;
import com.emergence.physics.config.PhysicsConfigurationLoader;
import com.emergence.physics.engine.AdmissionMetrics;
import com.emergence.physics.engine.PhysicsEngine;
import com.emergence.physics.ledger.snapshot.JsonFileSnapshotSink;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.ResourceKind;
import com.emergence.physics.validation.ViolationType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhysicsBootstrapTest {

    private static final String DOCUMENT = """
            {
              "version": "1.0",
              "strictOrdering": false,
              "entities": {
                "agent-a": { "budgets": { "memory": 10, "cpu": 4 }, "capabilities": ["CodeAnalysis"] }
              }
            }
            """;

    @TempDir
    Path tempDir;

    @Test
    void initialize_buildsEngineFromLoadedDocument() throws Exception {
        Path configDir = Files.createDirectories(tempDir.resolve("config"));
        Files.writeString(configDir.resolve("physics.json"), DOCUMENT);
        PhysicsConfig config = PhysicsConfig.builder()
                .configDir(configDir.toString())
                .snapshotEnabled(true)
                .snapshotDir(tempDir.resolve("snapshots").toString())
                .build();
        PhysicsConfiguration document = PhysicsConfigurationLoader.from(config).loadConfiguration(config.getConfigName());

        PhysicsEngine engine = PhysicsBootstrap.initialize(document, config);
        try {
            assertTrue(engine.admit(PhysicsOperation.builder()
                    .entity("agent-a")
                    .resource(ResourceKind.MEMORY, 4)
                    .requiredCapability("CodeAnalysis")
                    .build()).isAccepted());
            assertSame(AdmissionMetrics.sharedRegistry(), engine.getMetrics().getRegistry());
            assertTrue(engine.getSnapshotPublisher().getSink() instanceof JsonFileSnapshotSink);
        } finally {
            engine.shutdown();
        }

        JsonFileSnapshotSink sink = new JsonFileSnapshotSink(tempDir.resolve("snapshots"));
        assertEquals(4.0, sink.read().orElseThrow().getUsage().get("agent-a").get(ResourceKind.MEMORY));
        assertEquals(4.0, engine.getResourceLedger().usage(EntityId.of("agent-a"), ResourceKind.MEMORY));
    }

    @Test
    void initialize_documentMissingBudgetsIsFatal() throws Exception {
        Files.writeString(tempDir.resolve("physics.json"),
                "{\"version\":\"1.0\",\"strictOrdering\":false,\"entities\":{\"agent-a\":{\"capabilities\":[\"X\"]}}}");
        PhysicsConfig config = PhysicsConfig.builder().configDir(tempDir.toString()).build();
        PhysicsConfiguration document = PhysicsConfigurationLoader.from(config).loadConfiguration("physics");

        InvalidConfigurationException e = assertThrows(InvalidConfigurationException.class,
                () -> PhysicsBootstrap.initialize(document, config));

        assertEquals(ViolationType.SCHEMA_INVALID, e.getValidationResult().getPrimaryViolation().getType());
    }

    @Test
    void initialize_withoutSettingsUsesNoOpSnapshots() {
        PhysicsConfiguration document = PhysicsConfiguration.builder().build();

        PhysicsEngine engine = PhysicsBootstrap.initialize(document, null);
        try {
            assertEquals("no-op", engine.getSnapshotPublisher().getSink().describe());
        } finally {
            engine.shutdown();
        }
    }
}
