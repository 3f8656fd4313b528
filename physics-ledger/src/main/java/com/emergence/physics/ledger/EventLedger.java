package com.emergence.physics.ledger;

import com.emergence.physics.model.EventNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only causal DAG of admitted events. Nodes live in an arena list addressed by insertion
 * sequence; an id index maps event ids to arena positions. Parents are referenced by id and must
 * already be present when a node is inserted, so the graph is acyclic by construction.
 * <p>
 * One {@link ReentrantReadWriteLock} guards the arena and the index. Lookups take the read lock.
 * The admission pipeline takes {@link #writeLock()} before the causality check and keeps it until
 * the node is inserted, so no other event can be checked against a stale view in between.
 * The lock is reentrant: the write-lock holder may call any lookup or {@link #insert}.
 */
public final class EventLedger {

    private static final Logger log = LoggerFactory.getLogger(EventLedger.class);

    private final List<EventNode> arena = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public Lock readLock() {
        return lock.readLock();
    }

    public Lock writeLock() {
        return lock.writeLock();
    }

    /** True if the current thread holds the write lock. */
    public boolean isWriteLockedByCurrentThread() {
        return lock.isWriteLockedByCurrentThread();
    }

    /**
     * Appends a node. Callers validate first; this method re-checks the structural invariants and
     * throws instead of corrupting the graph.
     *
     * @param id            event id, not yet in the ledger
     * @param timestamp     event timestamp
     * @param parentIds     parents, all present in the ledger
     * @param contentDigest payload digest; may be null
     * @return the inserted node
     * @throws IllegalStateException when the id is taken or a parent is missing
     */
    public EventNode insert(String id, long timestamp, List<String> parentIds, String contentDigest) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("event id must be non-blank");
        }
        lock.writeLock().lock();
        try {
            if (index.containsKey(id)) {
                throw new IllegalStateException("Event " + id + " already in ledger");
            }
            List<String> parents = parentIds != null ? parentIds : List.of();
            for (String parentId : parents) {
                if (!index.containsKey(parentId)) {
                    throw new IllegalStateException("Parent event " + parentId + " not found in ledger");
                }
            }
            EventNode node = new EventNode(id, timestamp, parents, contentDigest, arena.size());
            arena.add(node);
            index.put(id, arena.size() - 1);
            log.debug("Event inserted | id={} | seq={} | parents={}", id, node.sequence(), parents.size());
            return node;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<EventNode> get(String id) {
        if (id == null) return Optional.empty();
        lock.readLock().lock();
        try {
            Integer pos = index.get(id);
            return pos != null ? Optional.of(arena.get(pos)) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String id) {
        if (id == null) return false;
        lock.readLock().lock();
        try {
            return index.containsKey(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return arena.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Copy of all nodes in insertion order. */
    public List<EventNode> events() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(arena));
        } finally {
            lock.readLock().unlock();
        }
    }
}
