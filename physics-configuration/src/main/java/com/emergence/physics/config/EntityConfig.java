package com.emergence.physics.config;

import com.emergence.physics.model.ResourceKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-entity section of the configuration document: budget per resource kind and initial
 * capability grants. Values are kept as written (kind names as strings, nullable budgets) so that
 * schema validation can report every problem; use {@link #resolvedBudgets()} after validation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EntityConfig {

    private final Map<String, Double> budgets;
    private final List<String> capabilities;

    @JsonCreator
    public EntityConfig(
            @JsonProperty("budgets") Map<String, Double> budgets,
            @JsonProperty("capabilities") List<String> capabilities) {
        this.budgets = budgets != null ? Collections.unmodifiableMap(new LinkedHashMap<>(budgets)) : null;
        this.capabilities = capabilities != null ? Collections.unmodifiableList(new ArrayList<>(capabilities)) : List.of();
    }

    public static EntityConfig of(Map<String, Double> budgets, List<String> capabilities) {
        return new EntityConfig(budgets, capabilities);
    }

    /** Budget per kind name as written; null when the document omits {@code budgets}. */
    public Map<String, Double> getBudgets() {
        return budgets;
    }

    /** Initial capability grants; never null. */
    public List<String> getCapabilities() {
        return capabilities;
    }

    /**
     * Budgets keyed by parsed kind. Unknown kinds and null values are skipped (schema validation rejects them first).
     */
    public Map<ResourceKind, Double> resolvedBudgets() {
        Map<ResourceKind, Double> out = new EnumMap<>(ResourceKind.class);
        if (budgets == null) return out;
        budgets.forEach((name, value) -> {
            Optional<ResourceKind> kind = ResourceKind.parse(name);
            if (kind.isPresent() && value != null) out.put(kind.get(), value);
        });
        return out;
    }
}
