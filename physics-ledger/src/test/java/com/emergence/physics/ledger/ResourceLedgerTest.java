package com.emergence.physics.ledger;

import com.emergence.physics.model.AllocationRef;
import com.emergence.physics.model.EntityId;
import com.emergence.physics.model.ResourceAllocation;
import com.emergence.physics.model.ResourceKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceLedgerTest {

    private static final EntityId AGENT = EntityId.of("agent-a");

    @Test
    void allocate_incrementsUsageUntilBudget() {
        ResourceLedger ledger = new ResourceLedger(() -> 42L);
        ledger.setBudget(AGENT, ResourceKind.MEMORY, 10);

        ResourceAllocation first = ledger.allocate(AGENT, ResourceKind.MEMORY, 6);

        assertEquals(6.0, ledger.usage(AGENT, ResourceKind.MEMORY));
        assertEquals(4.0, ledger.available(AGENT, ResourceKind.MEMORY));
        assertEquals(42L, first.allocatedAtMillis());
        assertFalse(ledger.fits(AGENT, ResourceKind.MEMORY, 6));
        assertThrows(IllegalStateException.class, () -> ledger.allocate(AGENT, ResourceKind.MEMORY, 6));
        assertEquals(6.0, ledger.usage(AGENT, ResourceKind.MEMORY));
        assertTrue(ledger.fits(AGENT, ResourceKind.MEMORY, 4));
    }

    @Test
    void unconfiguredPairHasZeroBudget() {
        ResourceLedger ledger = new ResourceLedger();

        assertEquals(0.0, ledger.budget(AGENT, ResourceKind.CPU));
        assertFalse(ledger.fits(AGENT, ResourceKind.CPU, 0.5));
        assertTrue(ledger.fits(AGENT, ResourceKind.CPU, 0));
        assertThrows(IllegalStateException.class, () -> ledger.allocate(AGENT, ResourceKind.CPU, 0.5));
        assertTrue(ledger.accountLock(AGENT, ResourceKind.CPU).isEmpty());
        assertTrue(ledger.usageByEntity().isEmpty());
    }

    @Test
    void release_restoresUsageAndForgetsRef() {
        ResourceLedger ledger = new ResourceLedger();
        ledger.setBudget(AGENT, ResourceKind.CPU, 4);
        ResourceAllocation alloc = ledger.allocate(AGENT, ResourceKind.CPU, 3);

        assertTrue(ledger.release(alloc.ref()).isPresent());
        assertEquals(0.0, ledger.usage(AGENT, ResourceKind.CPU));
        assertTrue(ledger.release(alloc.ref()).isEmpty());
        assertTrue(ledger.release(AllocationRef.of(999)).isEmpty());
        assertEquals(0, ledger.liveAllocationCount());
    }

    @Test
    void fractionalAmountsCancelExactly() {
        ResourceLedger ledger = new ResourceLedger();
        ledger.setBudget(AGENT, ResourceKind.NETWORK, 1.0);

        for (int i = 0; i < 10; i++) {
            ledger.allocate(AGENT, ResourceKind.NETWORK, 0.1);
        }
        assertEquals(1.0, ledger.usage(AGENT, ResourceKind.NETWORK));
        assertFalse(ledger.fits(AGENT, ResourceKind.NETWORK, 0.1));

        ledger.releaseAll(AGENT);
        assertEquals(0.0, ledger.usage(AGENT, ResourceKind.NETWORK));
    }

    @Test
    void releaseAll_onlyTouchesTheEntity() {
        EntityId other = EntityId.of("agent-b");
        ResourceLedger ledger = new ResourceLedger();
        ledger.setBudget(AGENT, ResourceKind.MEMORY, 10);
        ledger.setBudget(other, ResourceKind.MEMORY, 10);
        ledger.allocate(AGENT, ResourceKind.MEMORY, 2);
        ledger.allocate(AGENT, ResourceKind.MEMORY, 3);
        ResourceAllocation kept = ledger.allocate(other, ResourceKind.MEMORY, 1);

        List<ResourceAllocation> released = ledger.releaseAll(AGENT);

        assertEquals(2, released.size());
        assertEquals(List.of(kept), ledger.liveAllocations());
        assertEquals(1.0, ledger.usage(other, ResourceKind.MEMORY));
    }

    @Test
    void allocate_rejectsNonPositiveAmount() {
        ResourceLedger ledger = new ResourceLedger();
        assertThrows(IllegalArgumentException.class, () -> ledger.allocate(AGENT, ResourceKind.CPU, 0));
        assertThrows(IllegalArgumentException.class, () -> ledger.allocate(AGENT, ResourceKind.CPU, Double.NaN));
    }

    @Test
    void concurrentAllocations_neverExceedBudget() throws Exception {
        ResourceLedger ledger = new ResourceLedger();
        ledger.setBudget(AGENT, ResourceKind.MEMORY, 50);
        int threads = 8;
        int attemptsPerThread = 100;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        try {
            for (int t = 0; t < threads; t++) {
                pool.execute(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    for (int i = 0; i < attemptsPerThread; i++) {
                        try {
                            ledger.allocate(AGENT, ResourceKind.MEMORY, 1);
                            granted.incrementAndGet();
                        } catch (IllegalStateException expected) {
                            // budget exhausted
                        }
                    }
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        }

        assertEquals(50, granted.get());
        assertEquals(50.0, ledger.usage(AGENT, ResourceKind.MEMORY));
        assertEquals(50, ledger.liveAllocationCount());
    }
}
