package com.emergence.physics.ledger.snapshot;

import com.emergence.annotations.ResourceCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Fail-safe, asynchronous facade over a {@link SnapshotSink}. Snapshots are captured and written on
 * a single background thread; any exception from capture or sink is caught, logged and not
 * rethrown, so admissions never fail because of persistence.
 * <p>
 * Requests coalesce: while one write is queued, further requests are dropped because the queued
 * write captures the state when it runs, which already includes their commits.
 */
public final class SnapshotPublisher implements ResourceCleanup {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPublisher.class);

    private static final long DRAIN_TIMEOUT_SECONDS = 10;

    private final SnapshotSink sink;
    private final ExecutorService executor;
    private final AtomicBoolean pending = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong written = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public SnapshotPublisher(SnapshotSink sink) {
        this.sink = sink != null ? sink : new NoOpSnapshotSink();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "physics-snapshot");
            t.setDaemon(true);
            return t;
        });
    }

    public SnapshotSink getSink() {
        return sink;
    }

    /** Schedules a capture-and-write; returns immediately. No-op once closed. */
    public void publishAsync(Supplier<LedgerSnapshot> capture) {
        if (closed.get()) {
            log.debug("Snapshot publisher closed; skipping async snapshot");
            return;
        }
        if (!pending.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> {
                pending.set(false);
                LedgerSnapshot snapshot;
                try {
                    snapshot = capture.get();
                } catch (Throwable t) {
                    failed.incrementAndGet();
                    log.warn("Snapshot capture failed; admissions continue. Error: {}", t.getMessage(), t);
                    return;
                }
                writeSafely(snapshot);
            });
        } catch (RejectedExecutionException e) {
            pending.set(false);
            log.debug("Snapshot executor rejected task (shutting down)");
        }
    }

    /** Writes on the calling thread. Still fail-safe. */
    public void publishNow(LedgerSnapshot snapshot) {
        writeSafely(snapshot);
    }

    /** Waits until every write scheduled so far has finished. */
    public void flush() {
        if (closed.get()) return;
        try {
            executor.submit(() -> { }).get(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            log.warn("Snapshot flush did not complete: {}", e.getMessage());
        }
    }

    public long getWrittenCount() {
        return written.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    /** Stops accepting work and drains queued writes. */
    @Override
    public void onExit() {
        if (!closed.compareAndSet(false, true)) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Snapshot writes did not drain within {}s; {} task(s) dropped",
                        DRAIN_TIMEOUT_SECONDS, executor.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Snapshot publisher stopped | sink={} | written={} | failed={}", sink.describe(), written.get(), failed.get());
    }

    private void writeSafely(LedgerSnapshot snapshot) {
        try {
            sink.write(snapshot);
            written.incrementAndGet();
        } catch (Throwable t) {
            failed.incrementAndGet();
            log.warn("Snapshot write to {} failed; admissions continue. Error: {}", sink.describe(), t.getMessage(), t);
        }
    }
}
