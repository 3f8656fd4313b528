package com.emergence.physics.engine;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.ledger.CapabilityRegistry;
import com.emergence.physics.ledger.EventLedger;
import com.emergence.physics.ledger.ResourceLedger;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.validation.AdmissionCheck;
import com.emergence.physics.validation.CausalityValidator;
import com.emergence.physics.validation.ResourceValidator;
import com.emergence.physics.validation.SchemaValidator;
import com.emergence.physics.validation.SecurityValidator;
import com.emergence.physics.validation.ValidationResult;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionStagesTest {

    @AdmissionStage(name = "late-lock-free", order = 9, locking = false)
    static final class LateLockFreeCheck implements AdmissionCheck {
        @Override
        public boolean appliesTo(PhysicsOperation operation) {
            return true;
        }

        @Override
        public ValidationResult check(PhysicsOperation operation) {
            return ValidationResult.success();
        }
    }

    @AdmissionStage(name = "schema", order = 7)
    static final class DuplicateNameCheck implements AdmissionCheck {
        @Override
        public boolean appliesTo(PhysicsOperation operation) {
            return true;
        }

        @Override
        public ValidationResult check(PhysicsOperation operation) {
            return ValidationResult.success();
        }
    }

    private static List<AdmissionCheck> standardChecks() {
        return List.of(
                new SecurityValidator(new CapabilityRegistry()),
                new ResourceValidator(new ResourceLedger()),
                new SchemaValidator(),
                new CausalityValidator(new EventLedger(), false));
    }

    @Test
    void order_sortsByAnnotatedOrder() {
        List<AdmissionStages.Stage> stages = AdmissionStages.order(standardChecks());

        assertEquals(List.of("schema", "causality", "resource", "security"),
                stages.stream().map(AdmissionStages.Stage::getName).collect(Collectors.toList()));
        assertFalse(stages.get(0).isLocking());
        assertTrue(stages.get(1).isLocking());
    }

    @Test
    void order_rejectsUnannotatedCheck() {
        AdmissionCheck anonymous = new AdmissionCheck() {
            @Override
            public boolean appliesTo(PhysicsOperation operation) {
                return true;
            }

            @Override
            public ValidationResult check(PhysicsOperation operation) {
                return ValidationResult.success();
            }
        };

        assertThrows(IllegalArgumentException.class, () -> AdmissionStages.order(List.of(anonymous)));
    }

    @Test
    void order_rejectsLockFreeStageAfterLockingStage() {
        List<AdmissionCheck> checks = List.of(new CausalityValidator(new EventLedger(), false), new LateLockFreeCheck());

        assertThrows(IllegalArgumentException.class, () -> AdmissionStages.order(checks));
    }

    @Test
    void order_rejectsDuplicateName() {
        List<AdmissionCheck> checks = List.of(new SchemaValidator(), new DuplicateNameCheck());

        assertThrows(IllegalArgumentException.class, () -> AdmissionStages.order(checks));
    }
}
