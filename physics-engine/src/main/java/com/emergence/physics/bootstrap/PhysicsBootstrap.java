package com.emergence.physics.bootstrap;

import com.emergence.physics.config.InvalidConfigurationException;
import com.emergence.physics.config.PhysicsConfig;
import com.emergence.physics.config.PhysicsConfiguration;
import com.emergence.physics.config.PhysicsConfigurationLoader;
import com.emergence.physics.engine.AdmissionMetrics;
import com.emergence.physics.engine.PhysicsEngine;
import com.emergence.physics.ledger.snapshot.JsonFileSnapshotSink;
import com.emergence.physics.ledger.snapshot.NoOpSnapshotSink;
import com.emergence.physics.ledger.snapshot.SnapshotSink;
import com.emergence.physics.validation.SchemaValidator;
import com.emergence.physics.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Bootstrap for the physics engine: reads settings from the environment, loads and validates the
 * configuration document, and wires ledgers, validators, metrics and the snapshot sink. A rejected
 * document is fatal: {@link InvalidConfigurationException} is thrown and no engine is created.
 */
public final class PhysicsBootstrap {

    private static final Logger log = LoggerFactory.getLogger(PhysicsBootstrap.class);

    private PhysicsBootstrap() {
    }

    /**
     * Loads {@link PhysicsConfig} from environment and builds the engine from the document it points to.
     *
     * @throws InvalidConfigurationException when the document is malformed or fails schema validation
     * @throws IllegalStateException         when no document is found and retry is disabled
     */
    public static PhysicsEngine initialize() {
        log.info("Bootstrap: loading physics settings from environment");
        PhysicsConfig config = PhysicsConfig.fromEnvironment();
        log.info("Bootstrap: configDir={}, configName={}, retryWaitSeconds={}, snapshotEnabled={}, snapshotDir={}",
                Path.of(config.getConfigDir()).toAbsolutePath(), config.getConfigName(), config.getConfigRetryWaitSeconds(),
                config.isSnapshotEnabled(), config.getSnapshotDir());
        log.info("Bootstrap: loading configuration document (order: <name>.json → <name>.yaml → <name>.yml → default.json)");
        PhysicsConfiguration document = PhysicsConfigurationLoader.from(config).loadConfiguration(config.getConfigName());
        return initialize(document, config);
    }

    /**
     * Validates the document and builds an engine with the snapshot sink selected by {@code config}
     * and the process-wide meter registry.
     *
     * @throws InvalidConfigurationException when the document fails schema validation
     */
    public static PhysicsEngine initialize(PhysicsConfiguration document, PhysicsConfig config) {
        ValidationResult result = new SchemaValidator().validateSchema(document);
        if (!result.isValid()) {
            log.error("Bootstrap: configuration document rejected with {} violation(s): {}",
                    result.getViolations().size(), result.getErrors());
            throw new InvalidConfigurationException(result);
        }
        PhysicsConfig settings = config != null ? config : PhysicsConfig.builder().build();
        PhysicsEngine engine = PhysicsEngine.builder(document)
                .snapshotSink(snapshotSink(settings))
                .meterRegistry(AdmissionMetrics.sharedRegistry())
                .build();
        log.info("Bootstrap: physics engine {} ready", engine.getInstanceId());
        return engine;
    }

    private static SnapshotSink snapshotSink(PhysicsConfig config) {
        if (!config.isSnapshotEnabled()) {
            log.info("Snapshots disabled (PHYSICS_SNAPSHOT_ENABLED=false or unset). Set PHYSICS_SNAPSHOT_ENABLED=true to persist ledger snapshots.");
            return new NoOpSnapshotSink();
        }
        JsonFileSnapshotSink sink = new JsonFileSnapshotSink(Path.of(config.getSnapshotDir()));
        log.info("Snapshots enabled: ledger snapshots will be written to {}", sink.target().toAbsolutePath());
        return sink;
    }
}
