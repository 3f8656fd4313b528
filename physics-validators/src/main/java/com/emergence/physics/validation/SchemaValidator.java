package com.emergence.physics.validation;

import com.emergence.annotations.AdmissionStage;
import com.emergence.physics.config.EntityConfig;
import com.emergence.physics.config.InvalidConfigurationException;
import com.emergence.physics.config.PhysicsConfiguration;
import com.emergence.physics.model.EventDescriptor;
import com.emergence.physics.model.PhysicsOperation;
import com.emergence.physics.model.Resource;
import com.emergence.physics.model.ResourceKind;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Structural checks for the configuration document and for submitted operations. Stateless and
 * lock-free: runs before any ledger lock is taken. Every problem found is reported, not only the first.
 */
@AdmissionStage(name = "schema", order = 1, locking = false)
public final class SchemaValidator implements AdmissionCheck {

    private final long maxOperationTimeMillis;

    public SchemaValidator() {
        this(PhysicsConfiguration.DEFAULT_MAX_OPERATION_TIME_MILLIS);
    }

    /** @param maxOperationTimeMillis largest execution time limit an operation may request */
    public SchemaValidator(long maxOperationTimeMillis) {
        if (maxOperationTimeMillis <= 0) {
            throw new IllegalArgumentException("maxOperationTimeMillis must be positive: " + maxOperationTimeMillis);
        }
        this.maxOperationTimeMillis = maxOperationTimeMillis;
    }

    public long getMaxOperationTimeMillis() {
        return maxOperationTimeMillis;
    }

    /**
     * Validates the configuration document: version, ordering mode, entity budgets and capabilities.
     */
    public ValidationResult validateSchema(PhysicsConfiguration config) {
        List<Violation> violations = new ArrayList<>();
        if (config == null) {
            return ValidationResult.failure(Violation.schemaInvalid("configuration document is missing"));
        }
        if (config.getVersion() == null || config.getVersion().isBlank()) {
            violations.add(Violation.schemaInvalid("missing required field: version"));
        }
        if (config.getStrictOrdering() == null) {
            violations.add(Violation.schemaInvalid("missing required field: strictOrdering"));
        }
        Long maxTime = config.getMaxOperationTimeMillis();
        if (maxTime != null && maxTime <= 0) {
            violations.add(Violation.schemaInvalid("maxOperationTimeMillis must be positive, was " + maxTime));
        }
        Map<String, EntityConfig> entities = config.getEntities();
        if (entities == null) {
            violations.add(Violation.schemaInvalid("missing required field: entities"));
            return ValidationResult.of(violations);
        }
        Set<String> entityIds = new HashSet<>();
        for (Map.Entry<String, EntityConfig> e : entities.entrySet()) {
            String entityId = e.getKey();
            EntityConfig entity = e.getValue();
            String where = "entities." + entityId;
            if (entityId == null || entityId.isBlank()) {
                violations.add(Violation.schemaInvalid("entity id must be non-blank"));
            } else if (!entityIds.add(entityId.trim())) {
                violations.add(Violation.schemaInvalid("entity id '" + entityId.trim() + "' is declared more than once"));
            }
            if (entity == null) {
                violations.add(Violation.schemaInvalid(where + " is null"));
                continue;
            }
            Map<String, Double> budgets = entity.getBudgets();
            if (budgets == null) {
                violations.add(Violation.schemaInvalid("missing required field: " + where + ".budgets"));
            } else {
                Set<ResourceKind> kinds = EnumSet.noneOf(ResourceKind.class);
                for (Map.Entry<String, Double> b : budgets.entrySet()) {
                    String kindName = b.getKey();
                    Double value = b.getValue();
                    Optional<ResourceKind> kind = ResourceKind.parse(kindName);
                    if (kind.isEmpty()) {
                        violations.add(Violation.schemaInvalid(where + ".budgets: unknown resource kind '" + kindName + "'"));
                    } else if (!kinds.add(kind.get())) {
                        violations.add(Violation.schemaInvalid(where + ".budgets: resource kind " + kind.get() + " is declared more than once"));
                    }
                    if (value == null) {
                        violations.add(Violation.schemaInvalid(where + ".budgets." + kindName + " is missing a value"));
                    } else if (!Double.isFinite(value) || value < 0) {
                        violations.add(Violation.schemaInvalid(where + ".budgets." + kindName
                                + " must be a finite non-negative number, was " + value));
                    }
                }
            }
            for (String capability : entity.getCapabilities()) {
                if (capability == null || capability.isBlank()) {
                    violations.add(Violation.schemaInvalid(where + ".capabilities contains a blank entry"));
                }
            }
        }
        return ValidationResult.of(violations);
    }

    /**
     * Validates the configuration document and throws if it is not acceptable.
     *
     * @throws InvalidConfigurationException with the full violation list
     */
    public void validateSchemaOrThrow(PhysicsConfiguration config) {
        ValidationResult result = validateSchema(config);
        if (!result.isValid()) {
            throw new InvalidConfigurationException(result);
        }
    }

    /**
     * Validates an operation's shape: identity, event descriptor, resource request, capability
     * name and requested time limit.
     */
    public ValidationResult validateOperationShape(PhysicsOperation op) {
        if (op == null) {
            return ValidationResult.failure(Violation.schemaInvalid("operation is missing"));
        }
        List<Violation> violations = new ArrayList<>();
        if (op.getOperationId() == null || op.getOperationId().isBlank()) {
            violations.add(Violation.schemaInvalid("missing required field: operationId"));
        }
        if (op.getEntity() == null) {
            violations.add(Violation.schemaInvalid("missing required field: entity"));
        }
        if (op.hasEvent()) {
            checkEvent(op.getEvent(), violations);
        }
        if (op.hasResource()) {
            checkResource(op.getResource(), violations);
        }
        if (op.hasRequiredCapability() && op.getRequiredCapability().isBlank()) {
            violations.add(Violation.schemaInvalid("requiredCapability must be non-blank"));
        }
        Long timeLimit = op.getTimeLimitMillis();
        if (timeLimit != null) {
            if (timeLimit < 0) {
                violations.add(Violation.schemaInvalid("timeLimitMillis must be non-negative, was " + timeLimit));
            } else if (timeLimit > maxOperationTimeMillis) {
                violations.add(Violation.timeLimitExceeded(timeLimit, maxOperationTimeMillis));
            }
        }
        return ValidationResult.of(violations);
    }

    @Override
    public boolean appliesTo(PhysicsOperation operation) {
        return true;
    }

    @Override
    public ValidationResult check(PhysicsOperation operation) {
        return validateOperationShape(operation);
    }

    private static void checkEvent(EventDescriptor event, List<Violation> violations) {
        String eventId = event.eventId();
        if (eventId == null || eventId.isBlank()) {
            violations.add(Violation.schemaInvalid("event.eventId must be non-blank"));
        }
        if (event.timestamp() == null) {
            violations.add(Violation.schemaInvalid("missing required field: event.timestamp"));
        } else if (event.timestamp() < 0) {
            violations.add(Violation.schemaInvalid("event.timestamp must be non-negative, was " + event.timestamp()));
        }
        Set<String> seen = new HashSet<>();
        for (String parentId : event.parentIds()) {
            if (parentId == null || parentId.isBlank()) {
                violations.add(Violation.schemaInvalid("event.parentIds contains a blank entry"));
                continue;
            }
            if (!seen.add(parentId)) {
                violations.add(Violation.schemaInvalid("event.parentIds lists " + parentId + " more than once"));
            }
            if (parentId.equals(eventId)) {
                violations.add(Violation.schemaInvalid("event " + eventId + " lists itself as parent"));
            }
        }
    }

    private static void checkResource(Resource resource, List<Violation> violations) {
        if (resource.kind() == null) {
            violations.add(Violation.schemaInvalid("missing required field: resource.kind"));
        }
        double quantity = resource.quantity();
        if (!Double.isFinite(quantity) || quantity < 0) {
            violations.add(Violation.schemaInvalid("resource.quantity must be a finite non-negative number, was " + quantity));
        }
    }
}
