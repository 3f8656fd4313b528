package com.emergence.physics.config;

/**
 * Process settings for the physics engine, loaded from environment variables.
 * <p>
 * Configuration document: PHYSICS_CONFIG_DIR (directory), PHYSICS_CONFIG_NAME (file base name; the loader
 * tries {@code <name>.json}, {@code <name>.yaml}, {@code <name>.yml}, then {@code default.json}),
 * PHYSICS_CONFIG_RETRY_WAIT_SECONDS (0 = fail immediately when no document is found).
 * <p>
 * Snapshots: PHYSICS_SNAPSHOT_ENABLED, PHYSICS_SNAPSHOT_DIR.
 */
public final class PhysicsConfig {

    private static final String ENV_CONFIG_DIR = "PHYSICS_CONFIG_DIR";
    private static final String ENV_CONFIG_NAME = "PHYSICS_CONFIG_NAME";
    private static final String ENV_CONFIG_RETRY_WAIT_SECONDS = "PHYSICS_CONFIG_RETRY_WAIT_SECONDS";
    private static final String ENV_SNAPSHOT_ENABLED = "PHYSICS_SNAPSHOT_ENABLED";
    private static final String ENV_SNAPSHOT_DIR = "PHYSICS_SNAPSHOT_DIR";

    private static final String DEFAULT_CONFIG_DIR = "config";
    private static final String DEFAULT_CONFIG_NAME = "physics";
    private static final int DEFAULT_CONFIG_RETRY_WAIT_SECONDS = 0;
    /** Default false: snapshots go to a no-op sink unless enabled. */
    private static final boolean DEFAULT_SNAPSHOT_ENABLED = false;
    private static final String DEFAULT_SNAPSHOT_DIR = "snapshots";

    private final String configDir;
    private final String configName;
    private final int configRetryWaitSeconds;
    private final boolean snapshotEnabled;
    private final String snapshotDir;

    private PhysicsConfig(Builder b) {
        this.configDir = b.configDir != null ? b.configDir : DEFAULT_CONFIG_DIR;
        this.configName = b.configName != null ? b.configName : DEFAULT_CONFIG_NAME;
        this.configRetryWaitSeconds = Math.max(0, b.configRetryWaitSeconds);
        this.snapshotEnabled = b.snapshotEnabled;
        this.snapshotDir = b.snapshotDir != null ? b.snapshotDir : DEFAULT_SNAPSHOT_DIR;
    }

    /** Directory holding the configuration document (PHYSICS_CONFIG_DIR). Default "config". */
    public String getConfigDir() {
        return configDir;
    }

    /** Base name of the configuration document (PHYSICS_CONFIG_NAME). Default "physics". */
    public String getConfigName() {
        return configName;
    }

    /** Seconds to wait before retrying when no document is found; 0 = fail at once. */
    public int getConfigRetryWaitSeconds() {
        return configRetryWaitSeconds;
    }

    /** Whether ledger snapshots are written to {@link #getSnapshotDir()} (PHYSICS_SNAPSHOT_ENABLED). */
    public boolean isSnapshotEnabled() {
        return snapshotEnabled;
    }

    public String getSnapshotDir() {
        return snapshotDir;
    }

    public static PhysicsConfig fromEnvironment() {
        return builder()
                .configDir(getEnv(ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR))
                .configName(getEnv(ENV_CONFIG_NAME, DEFAULT_CONFIG_NAME))
                .configRetryWaitSeconds(parseInt(System.getenv(ENV_CONFIG_RETRY_WAIT_SECONDS), DEFAULT_CONFIG_RETRY_WAIT_SECONDS))
                .snapshotEnabled(parseBoolean(System.getenv(ENV_SNAPSHOT_ENABLED), DEFAULT_SNAPSHOT_ENABLED))
                .snapshotDir(getEnv(ENV_SNAPSHOT_DIR, DEFAULT_SNAPSHOT_DIR))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String getEnv(String name, String defaultValue) {
        String v = System.getenv(name);
        return v != null && !v.isBlank() ? v.trim() : defaultValue;
    }

    static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) return defaultValue;
        String v = value.trim();
        if ("true".equalsIgnoreCase(v) || "1".equals(v) || "yes".equalsIgnoreCase(v)) return true;
        if ("false".equalsIgnoreCase(v) || "0".equals(v) || "no".equalsIgnoreCase(v)) return false;
        return defaultValue;
    }

    public static final class Builder {
        private String configDir;
        private String configName;
        private int configRetryWaitSeconds = DEFAULT_CONFIG_RETRY_WAIT_SECONDS;
        private boolean snapshotEnabled = DEFAULT_SNAPSHOT_ENABLED;
        private String snapshotDir;

        private Builder() {
        }

        public Builder configDir(String configDir) {
            this.configDir = configDir;
            return this;
        }

        public Builder configName(String configName) {
            this.configName = configName;
            return this;
        }

        public Builder configRetryWaitSeconds(int seconds) {
            this.configRetryWaitSeconds = seconds;
            return this;
        }

        public Builder snapshotEnabled(boolean snapshotEnabled) {
            this.snapshotEnabled = snapshotEnabled;
            return this;
        }

        public Builder snapshotDir(String snapshotDir) {
            this.snapshotDir = snapshotDir;
            return this;
        }

        public PhysicsConfig build() {
            return new PhysicsConfig(this);
        }
    }
}
