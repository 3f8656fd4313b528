package com.emergence.physics.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PhysicsConfigTest {

    @Test
    void builder_appliesDefaults() {
        PhysicsConfig config = PhysicsConfig.builder().build();

        assertEquals("config", config.getConfigDir());
        assertEquals("physics", config.getConfigName());
        assertEquals(0, config.getConfigRetryWaitSeconds());
        assertFalse(config.isSnapshotEnabled());
        assertEquals("snapshots", config.getSnapshotDir());
    }

    @Test
    void builder_clampsNegativeRetryWait() {
        assertEquals(0, PhysicsConfig.builder().configRetryWaitSeconds(-5).build().getConfigRetryWaitSeconds());
    }

    @Test
    void parseBoolean_acceptsCommonSpellings() {
        assertTrue(PhysicsConfig.parseBoolean("YES", false));
        assertTrue(PhysicsConfig.parseBoolean("1", false));
        assertFalse(PhysicsConfig.parseBoolean("no", true));
        assertTrue(PhysicsConfig.parseBoolean("maybe", true));
        assertFalse(PhysicsConfig.parseBoolean(null, false));
    }

    @Test
    void parseInt_fallsBackOnGarbage() {
        assertEquals(7, PhysicsConfig.parseInt("7", 0));
        assertEquals(3, PhysicsConfig.parseInt("seven", 3));
        assertEquals(3, PhysicsConfig.parseInt("  ", 3));
    }
}
