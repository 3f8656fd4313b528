package com.emergence.physics.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceKindTest {

    @Test
    void fromValue_ignoresCase() {
        assertEquals(ResourceKind.MEMORY, ResourceKind.fromValue("Memory"));
        assertEquals(ResourceKind.CPU, ResourceKind.fromValue("cpu"));
        assertEquals(ResourceKind.NETWORK, ResourceKind.fromValue(" NETWORK "));
    }

    @Test
    void parse_unknownOrBlankIsEmpty() {
        assertTrue(ResourceKind.parse("disk").isEmpty());
        assertTrue(ResourceKind.parse(" ").isEmpty());
        assertTrue(ResourceKind.parse(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ResourceKind.fromValue("disk"));
    }
}
