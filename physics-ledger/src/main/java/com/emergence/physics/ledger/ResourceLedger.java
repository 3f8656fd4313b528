package com.emergence.physics.ledger;

import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.ResourceAllocation;
import com.emergence.physics.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Budgets, current usage and live allocations per (entity, resource kind).
 * <p>
 * Each (entity, kind) pair has its own account with a {@link ReentrantLock}; checking that an
 * amount fits and incrementing usage happen in one critical section on that lock, so concurrent
 * requests against the same pair never overshoot the budget and requests against different pairs
 * never contend. Amounts are accumulated as {@link BigDecimal} so fractional allocations and
 * releases cancel exactly.
 * <p>
 * Pairs that were never configured have a zero budget and no account: only {@link #setBudget} opens
 * one, so lookups and rejected requests for unknown pairs leave the ledger unchanged.
 */
public final class ResourceLedger {

    private static final Logger log = LoggerFactory.getLogger(ResourceLedger.class);

    private final Map<AccountKey, Account> accounts = new ConcurrentHashMap<>();
    private final Map<AllocationRef, ResourceAllocation> live = new ConcurrentHashMap<>();
    private final AtomicLong nextRef = new AtomicLong(1);
    private final LongSupplier clock;

    public ResourceLedger() {
        this(System::currentTimeMillis);
    }

    /** @param clock wall clock for allocation timestamps (epoch millis) */
    public ResourceLedger(LongSupplier clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Sets the budget of a pair. Budgets may be lowered below current usage; new allocations then fail until releases catch up. */
    public void setBudget(EntityId entity, ResourceKind kind, double budget) {
        if (!Double.isFinite(budget) || budget < 0) {
            throw new IllegalArgumentException("budget must be finite and non-negative: " + budget);
        }
        Account account = open(entity, kind);
        account.lock.lock();
        try {
            account.budget = BigDecimal.valueOf(budget);
        } finally {
            account.lock.unlock();
        }
        log.debug("Budget set | entity={} | kind={} | budget={}", entity, kind, budget);
    }

    /**
     * Lock of the (entity, kind) account. Holding it makes {@link #fits} and {@link #allocate} one atomic step.
     *
     * @return empty when the pair was never configured
     */
    public Optional<Lock> accountLock(EntityId entity, ResourceKind kind) {
        Account account = existing(entity, kind);
        return account != null ? Optional.of(account.lock) : Optional.empty();
    }

    public double budget(EntityId entity, ResourceKind kind) {
        Account account = existing(entity, kind);
        if (account == null) return 0.0;
        account.lock.lock();
        try {
            return account.budget.doubleValue();
        } finally {
            account.lock.unlock();
        }
    }

    public double usage(EntityId entity, ResourceKind kind) {
        Account account = existing(entity, kind);
        if (account == null) return 0.0;
        account.lock.lock();
        try {
            return account.usage.doubleValue();
        } finally {
            account.lock.unlock();
        }
    }

    /** Budget minus usage; negative only after a budget was lowered below usage. */
    public double available(EntityId entity, ResourceKind kind) {
        Account account = existing(entity, kind);
        if (account == null) return 0.0;
        account.lock.lock();
        try {
            return account.budget.subtract(account.usage).doubleValue();
        } finally {
            account.lock.unlock();
        }
    }

    /** True if {@code usage + amount <= budget}. */
    public boolean fits(EntityId entity, ResourceKind kind, double amount) {
        if (!Double.isFinite(amount)) return false;
        Account account = existing(entity, kind);
        if (account == null) return amount <= 0;
        account.lock.lock();
        try {
            return account.usage.add(BigDecimal.valueOf(amount)).compareTo(account.budget) <= 0;
        } finally {
            account.lock.unlock();
        }
    }

    /**
     * Records a live allocation and increments usage.
     *
     * @param amount positive amount
     * @return the new allocation
     * @throws IllegalStateException when the amount does not fit the remaining budget
     */
    public ResourceAllocation allocate(EntityId entity, ResourceKind kind, double amount) {
        if (!Double.isFinite(amount) || amount <= 0) {
            throw new IllegalArgumentException("allocation amount must be finite and positive: " + amount);
        }
        Account account = existing(entity, kind);
        if (account == null) {
            throw new IllegalStateException("Allocation of " + amount + " " + kind + " exceeds budget of " + entity);
        }
        BigDecimal delta = BigDecimal.valueOf(amount);
        account.lock.lock();
        try {
            BigDecimal next = account.usage.add(delta);
            if (next.compareTo(account.budget) > 0) {
                throw new IllegalStateException("Allocation of " + amount + " " + kind + " exceeds budget of " + entity);
            }
            account.usage = next;
            ResourceAllocation allocation = new ResourceAllocation(
                    AllocationRef.of(nextRef.getAndIncrement()), entity, kind, amount, clock.getAsLong());
            live.put(allocation.ref(), allocation);
            log.debug("Allocated | ref={} | entity={} | kind={} | amount={} | usage={}", allocation.ref(), entity, kind, amount, next);
            return allocation;
        } finally {
            account.lock.unlock();
        }
    }

    /**
     * Releases a live allocation and decrements usage.
     *
     * @return the released allocation, or empty if the ref is unknown (never allocated or already released)
     */
    public Optional<ResourceAllocation> release(AllocationRef ref) {
        if (ref == null) return Optional.empty();
        ResourceAllocation allocation = live.get(ref);
        if (allocation == null) return Optional.empty();
        Account account = existing(allocation.entity(), allocation.kind());
        account.lock.lock();
        try {
            if (live.remove(ref) == null) {
                return Optional.empty();
            }
            account.usage = account.usage.subtract(BigDecimal.valueOf(allocation.amount()));
            log.debug("Released | ref={} | entity={} | kind={} | amount={} | usage={}",
                    ref, allocation.entity(), allocation.kind(), allocation.amount(), account.usage);
            return Optional.of(allocation);
        } finally {
            account.lock.unlock();
        }
    }

    /** Releases every live allocation of the entity. */
    public List<ResourceAllocation> releaseAll(EntityId entity) {
        List<ResourceAllocation> released = new ArrayList<>();
        for (ResourceAllocation allocation : allocationsOf(entity)) {
            release(allocation.ref()).ifPresent(released::add);
        }
        return released;
    }

    public Optional<ResourceAllocation> allocation(AllocationRef ref) {
        return ref != null ? Optional.ofNullable(live.get(ref)) : Optional.empty();
    }

    public boolean isLive(AllocationRef ref) {
        return ref != null && live.containsKey(ref);
    }

    /** Live allocations ordered by ref. */
    public List<ResourceAllocation> liveAllocations() {
        List<ResourceAllocation> out = new ArrayList<>(live.values());
        out.sort(Comparator.comparingLong(a -> a.ref().id()));
        return out;
    }

    public List<ResourceAllocation> allocationsOf(EntityId entity) {
        List<ResourceAllocation> out = new ArrayList<>();
        for (ResourceAllocation allocation : liveAllocations()) {
            if (allocation.entity().equals(entity)) out.add(allocation);
        }
        return out;
    }

    public int liveAllocationCount() {
        return live.size();
    }

    /** Usage per entity (sorted) and kind, for every pair with a budget or usage on record. */
    public Map<EntityId, Map<ResourceKind, Double>> usageByEntity() {
        Map<EntityId, Map<ResourceKind, Double>> out = new TreeMap<>();
        accounts.forEach((key, account) -> {
            double usage;
            account.lock.lock();
            try {
                usage = account.usage.doubleValue();
            } finally {
                account.lock.unlock();
            }
            out.computeIfAbsent(key.entity(), e -> new EnumMap<>(ResourceKind.class)).put(key.kind(), usage);
        });
        return out;
    }

    private Account open(EntityId entity, ResourceKind kind) {
        Objects.requireNonNull(entity, "entity");
        Objects.requireNonNull(kind, "kind");
        return accounts.computeIfAbsent(new AccountKey(entity, kind), k -> new Account());
    }

    private Account existing(EntityId entity, ResourceKind kind) {
        if (entity == null || kind == null) return null;
        return accounts.get(new AccountKey(entity, kind));
    }

    private record AccountKey(EntityId entity, ResourceKind kind) {
    }

    private static final class Account {
        private final ReentrantLock lock = new ReentrantLock();
        private BigDecimal budget = BigDecimal.ZERO;
        private BigDecimal usage = BigDecimal.ZERO;
    }
}
