package com.emergence.physics.validation;

import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValidationResultTest {

    @Test
    void failure_requiresAtLeastOneViolation() {
        assertThrows(IllegalArgumentException.class, () -> ValidationResult.failure(List.of()));
        assertThrows(IllegalArgumentException.class, () -> ValidationResult.failure((List<Violation>) null));
    }

    @Test
    void of_emptyListIsSuccess() {
        ValidationResult result = ValidationResult.of(List.of());

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertNull(result.getPrimaryViolation());
    }

    @Test
    void failure_exposesPrimaryViolationAndMessages() {
        Violation first = Violation.unknownParent("b", "x");
        Violation second = Violation.unknownParent("b", "y");

        ValidationResult result = ValidationResult.failure(List.of(first, second));

        assertFalse(result.isValid());
        assertEquals(first, result.getPrimaryViolation());
        assertEquals(2, result.getErrors().size());
        assertTrue(result.hasViolation(ViolationType.UNKNOWN_PARENT));
        assertFalse(result.hasViolation(ViolationType.DUPLICATE_EVENT));
    }

    @Test
    void insufficientResource_carriesTypedDetails() {
        Violation v = Violation.insufficientResource(EntityId.of("e"), ResourceKind.MEMORY, 6, 4);

        assertEquals(ViolationType.INSUFFICIENT_RESOURCE, v.getType());
        assertEquals(ViolationClass.RESOURCE, v.getViolationClass());
        assertEquals(ResourceKind.MEMORY, v.getResourceKind());
        assertEquals(6.0, v.getRequired());
        assertEquals(4.0, v.getAvailable());
    }

    @Test
    void capabilityDenied_carriesCapability() {
        Violation v = Violation.capabilityDenied(EntityId.of("e"), "CodeAnalysis");

        assertEquals(ViolationClass.SECURITY, v.getViolationClass());
        assertEquals("CodeAnalysis", v.getCapability());
    }
}
