package com.emergence.physics.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the configuration document, loaded once at startup: document version, causal ordering
 * mode, maximum operation time limit and the per-entity budgets and capability grants.
 * <p>
 * Required fields are kept nullable here; the schema validator decides whether the document is
 * acceptable before any engine component is configured from it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PhysicsConfiguration {

    /** Maximum execution time limit an operation may request when the document does not set one (5 minutes). */
    public static final long DEFAULT_MAX_OPERATION_TIME_MILLIS = 300_000L;

    private final String version;
    private final Boolean strictOrdering;
    private final Long maxOperationTimeMillis;
    private final Map<String, EntityConfig> entities;

    @JsonCreator
    public PhysicsConfiguration(
            @JsonProperty("version") String version,
            @JsonProperty("strictOrdering") Boolean strictOrdering,
            @JsonProperty("maxOperationTimeMillis") Long maxOperationTimeMillis,
            @JsonProperty("entities") Map<String, EntityConfig> entities) {
        this.version = version;
        this.strictOrdering = strictOrdering;
        this.maxOperationTimeMillis = maxOperationTimeMillis;
        this.entities = entities != null ? Collections.unmodifiableMap(new LinkedHashMap<>(entities)) : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getVersion() {
        return version;
    }

    /** Causal ordering mode as written; null when missing. */
    public Boolean getStrictOrdering() {
        return strictOrdering;
    }

    public Long getMaxOperationTimeMillis() {
        return maxOperationTimeMillis;
    }

    /** Entity id → entity section as written; null when missing. */
    public Map<String, EntityConfig> getEntities() {
        return entities;
    }

    /** Strict ordering flag; false when unset. */
    public boolean strictOrderingEnabled() {
        return Boolean.TRUE.equals(strictOrdering);
    }

    /** Configured maximum time limit, or {@link #DEFAULT_MAX_OPERATION_TIME_MILLIS}. */
    public long effectiveMaxOperationTimeMillis() {
        return maxOperationTimeMillis != null ? maxOperationTimeMillis : DEFAULT_MAX_OPERATION_TIME_MILLIS;
    }

    /** Entity sections; empty map when missing. */
    public Map<String, EntityConfig> entitiesOrEmpty() {
        return entities != null ? entities : Map.of();
    }

    public static final class Builder {
        private String version = "1.0";
        private Boolean strictOrdering = false;
        private Long maxOperationTimeMillis;
        private final Map<String, EntityConfig> entities = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder strictOrdering(Boolean strictOrdering) {
            this.strictOrdering = strictOrdering;
            return this;
        }

        public Builder maxOperationTimeMillis(Long maxOperationTimeMillis) {
            this.maxOperationTimeMillis = maxOperationTimeMillis;
            return this;
        }

        public Builder entity(String entityId, EntityConfig config) {
            this.entities.put(entityId, config);
            return this;
        }

        public PhysicsConfiguration build() {
            return new PhysicsConfiguration(version, strictOrdering, maxOperationTimeMillis, entities);
        }
    }
}
