package com.emergence.physics.ledger.snapshot;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SnapshotPublisherTest {

    private static LedgerSnapshot snapshot(String reason) {
        return new LedgerSnapshot("engine", 0L, reason, null, null, null, null);
    }

    @Test
    void publishAsync_writesOnBackgroundThread() {
        List<String> threads = new CopyOnWriteArrayList<>();
        SnapshotPublisher publisher = new SnapshotPublisher(s -> threads.add(Thread.currentThread().getName()));
        try {
            publisher.publishAsync(() -> snapshot("admission"));
            publisher.flush();

            assertEquals(List.of("physics-snapshot"), threads);
            assertEquals(1, publisher.getWrittenCount());
        } finally {
            publisher.onExit();
        }
    }

    @Test
    void sinkFailure_isCountedNotThrown() {
        SnapshotPublisher publisher = new SnapshotPublisher(s -> {
            throw new IllegalStateException("disk full");
        });
        try {
            publisher.publishNow(snapshot("x"));
            publisher.publishAsync(() -> snapshot("y"));
            publisher.publishAsync(() -> {
                throw new IllegalStateException("capture broke");
            });
            publisher.flush();

            assertTrue(publisher.getFailedCount() >= 2);
            assertEquals(0, publisher.getWrittenCount());
        } finally {
            publisher.onExit();
        }
    }

    @Test
    void onExit_drainsAndIgnoresLaterRequests() {
        List<String> reasons = new CopyOnWriteArrayList<>();
        SnapshotPublisher publisher = new SnapshotPublisher(s -> reasons.add(s.getReason()));

        publisher.publishAsync(() -> snapshot("before"));
        publisher.onExit();
        publisher.publishAsync(() -> snapshot("after"));
        publisher.onExit();

        assertEquals(List.of("before"), reasons);
    }

    @Test
    void nullSink_fallsBackToNoOp() {
        SnapshotPublisher publisher = new SnapshotPublisher(null);
        try {
            publisher.publishNow(snapshot("x"));
            assertEquals("no-op", publisher.getSink().describe());
            assertEquals(1, publisher.getWrittenCount());
        } finally {
            publisher.onExit();
        }
    }
}
