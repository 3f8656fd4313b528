package com.emergence.physics.ledger.snapshot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** No-op sink when snapshots are disabled. Logs so users see that the snapshot path was hit but nothing is persisted. */
public final class NoOpSnapshotSink implements SnapshotSink {

    private static final Logger log = LoggerFactory.getLogger(NoOpSnapshotSink.class);

    @Override
    public void write(LedgerSnapshot snapshot) {
        log.debug("Snapshot (no-op): reason={} | events={} | allocations={} | persistence skipped (snapshots disabled)",
                snapshot.getReason(), snapshot.getEvents().size(), snapshot.getAllocations().size());
    }

    @Override
    public String describe() {
        return "no-op";
    }
}
