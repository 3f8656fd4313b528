/**
 * Ledger snapshots for external persistence. The engine keeps its ledgers in memory only; a
 * {@link com.emergence.physics.ledger.snapshot.SnapshotSink} receives copies through the fail-safe
 * {@link com.emergence.physics.ledger.snapshot.SnapshotPublisher}.
 */
package com.emergence.physics.ledger.snapshot;
