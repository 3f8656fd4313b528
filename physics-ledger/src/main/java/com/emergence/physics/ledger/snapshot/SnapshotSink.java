package com.emergence.physics.ledger.snapshot;

/**
 * Write-only destination for ledger snapshots (file, object store, database).
 * {@link SnapshotPublisher} wraps every call in try/catch so admissions never fail because of a sink.
 */
public interface SnapshotSink {

    void write(LedgerSnapshot snapshot);

    /** Short description for logs (e.g. target path). */
    default String describe() {
        return getClass().getSimpleName();
    }
}
