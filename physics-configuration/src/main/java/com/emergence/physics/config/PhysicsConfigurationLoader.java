package com.emergence.physics.config;

import com.emergence.physics.validation.ValidationResult;
import com.emergence.physics.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Loads the configuration document from the config directory in order:
 * {@code <name>.json} → {@code <name>.yaml} → {@code <name>.yml} → {@code default.json}.
 * If none is present, waits for the configured retry seconds and repeats; with a retry wait of 0
 * a missing document fails immediately.
 * <p>
 * A document that is present but cannot be parsed is not skipped: it is reported as
 * {@code SCHEMA_INVALID} through {@link InvalidConfigurationException}.
 */
public final class PhysicsConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(PhysicsConfigurationLoader.class);

    private static final String DEFAULT_CONFIG_FILE = "default.json";

    private final Path configDir;
    private final int retryWaitSeconds;

    /**
     * @param configDir        directory holding the document; must not be null
     * @param retryWaitSeconds seconds to wait before retrying when no document is found
     */
    public PhysicsConfigurationLoader(Path configDir, int retryWaitSeconds) {
        if (configDir == null) {
            throw new NullPointerException("configDir");
        }
        this.configDir = configDir;
        this.retryWaitSeconds = Math.max(0, retryWaitSeconds);
    }

    public static PhysicsConfigurationLoader from(PhysicsConfig config) {
        return new PhysicsConfigurationLoader(Path.of(config.getConfigDir()), config.getConfigRetryWaitSeconds());
    }

    /**
     * Loads the document for the given base name, retrying until one is found.
     *
     * @return parsed document (never null; not yet schema-validated)
     * @throws InvalidConfigurationException when a present document cannot be parsed
     * @throws IllegalStateException         when no document exists and retry is disabled
     */
    public PhysicsConfiguration loadConfiguration(String name) {
        while (true) {
            Optional<PhysicsConfiguration> cfg = tryLoadOnce(name);
            if (cfg.isPresent()) {
                return cfg.get();
            }
            if (retryWaitSeconds > 0) {
                log.warn("No physics configuration found for name={} in {}; retrying in {}s", name, configDir, retryWaitSeconds);
                try {
                    Thread.sleep(retryWaitSeconds * 1000L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Interrupted while waiting for configuration", e);
                }
            } else {
                throw new IllegalStateException(
                        "No physics configuration found for name=" + name + " in " + configDir
                                + " (" + String.join(", ", candidateFiles(name)) + ")");
            }
        }
    }

    /** One attempt over the candidate files. Empty when none exists. */
    public Optional<PhysicsConfiguration> tryLoadOnce(String name) {
        for (String fileName : candidateFiles(name)) {
            Optional<String> content = readLocalFile(fileName);
            if (content.isEmpty()) continue;
            PhysicsConfiguration config = parseConfig(fileName, content.get());
            log.info("Physics configuration loaded from file: {} (version={})", configDir.resolve(fileName), config.getVersion());
            return Optional.of(config);
        }
        return Optional.empty();
    }

    static List<String> candidateFiles(String name) {
        if (name == null || name.isBlank()) {
            return List.of(DEFAULT_CONFIG_FILE);
        }
        String base = name.trim();
        return List.of(base + ".json", base + ".yaml", base + ".yml", DEFAULT_CONFIG_FILE);
    }

    private PhysicsConfiguration parseConfig(String fileName, String content) {
        try {
            PhysicsConfiguration config = PhysicsConfigurationCodec.fromContent(fileName, content);
            if (config == null) {
                throw malformed(fileName, "document is empty", null);
            }
            return config;
        } catch (UncheckedIOException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw malformed(fileName, cause.getMessage(), e);
        }
    }

    private InvalidConfigurationException malformed(String fileName, String detail, Throwable cause) {
        String reason = "malformed configuration file " + fileName + ": " + firstLine(detail);
        log.error("Rejecting physics configuration {}: {}", configDir.resolve(fileName), reason);
        return new InvalidConfigurationException(ValidationResult.failure(Violation.schemaInvalid(reason)), cause);
    }

    private static String firstLine(String s) {
        if (s == null) return "unreadable";
        int nl = s.indexOf('\n');
        return nl >= 0 ? s.substring(0, nl) : s;
    }

    private Optional<String> readLocalFile(String fileName) {
        Path file = configDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read config file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
