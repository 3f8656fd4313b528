package com.emergence.physics.ledger;

import com.emergence.physics.model.EntityId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Capability grants per entity. Each entity's set has its own {@link ReentrantReadWriteLock}:
 * lookups share the read lock; {@link #grant}, {@link #revoke} and {@link #clear} take the write
 * lock. Returned sets are immutable copies.
 */
public final class CapabilityRegistry {

    private static final Logger log = LoggerFactory.getLogger(CapabilityRegistry.class);

    private final Map<EntityId, Grants> byEntity = new ConcurrentHashMap<>();

    /**
     * Read lock of the entity's grant set; the admission pipeline holds it across the security check.
     *
     * @return empty when the entity was never granted anything
     */
    public Optional<Lock> readLock(EntityId entity) {
        Grants g = entity != null ? byEntity.get(entity) : null;
        return g != null ? Optional.of(g.lock.readLock()) : Optional.empty();
    }

    /**
     * Grants a capability. Idempotent.
     *
     * @return true if the entity did not hold it before
     */
    public boolean grant(EntityId entity, String capability) {
        String name = requireName(capability);
        Grants g = grants(entity);
        g.lock.writeLock().lock();
        try {
            boolean changed = g.names.add(name);
            if (changed) log.info("Capability granted | entity={} | capability={}", entity, name);
            return changed;
        } finally {
            g.lock.writeLock().unlock();
        }
    }

    /**
     * Revokes a capability. Idempotent.
     *
     * @return true if the entity held it
     */
    public boolean revoke(EntityId entity, String capability) {
        String name = requireName(capability);
        Grants g = byEntity.get(Objects.requireNonNull(entity, "entity"));
        if (g == null) return false;
        g.lock.writeLock().lock();
        try {
            boolean changed = g.names.remove(name);
            if (changed) log.info("Capability revoked | entity={} | capability={}", entity, name);
            return changed;
        } finally {
            g.lock.writeLock().unlock();
        }
    }

    public boolean holds(EntityId entity, String capability) {
        if (entity == null || capability == null) return false;
        Grants g = byEntity.get(entity);
        if (g == null) return false;
        g.lock.readLock().lock();
        try {
            return g.names.contains(capability.trim());
        } finally {
            g.lock.readLock().unlock();
        }
    }

    /** Sorted immutable copy of the entity's grants (empty if none). */
    public Set<String> capabilitiesOf(EntityId entity) {
        Grants g = entity != null ? byEntity.get(entity) : null;
        if (g == null) return Set.of();
        g.lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(g.names));
        } finally {
            g.lock.readLock().unlock();
        }
    }

    /**
     * Removes every grant of the entity.
     *
     * @return number of grants removed
     */
    public int clear(EntityId entity) {
        Grants g = entity != null ? byEntity.get(entity) : null;
        if (g == null) return 0;
        g.lock.writeLock().lock();
        try {
            int n = g.names.size();
            g.names.clear();
            return n;
        } finally {
            g.lock.writeLock().unlock();
        }
    }

    /** Grants of every entity with at least one capability, sorted by entity. */
    public Map<EntityId, Set<String>> snapshot() {
        Map<EntityId, Set<String>> out = new TreeMap<>();
        for (EntityId entity : byEntity.keySet()) {
            Set<String> names = capabilitiesOf(entity);
            if (!names.isEmpty()) out.put(entity, names);
        }
        return out;
    }

    private Grants grants(EntityId entity) {
        return byEntity.computeIfAbsent(Objects.requireNonNull(entity, "entity"), e -> new Grants());
    }

    private static String requireName(String capability) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability must be non-blank");
        }
        return capability.trim();
    }

    private static final class Grants {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final Set<String> names = new HashSet<>();
    }
}
