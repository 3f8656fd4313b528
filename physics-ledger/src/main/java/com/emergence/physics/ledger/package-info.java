/**
 * Shared engine state: the causal event DAG ({@link com.emergence.physics.ledger.EventLedger}),
 * resource budgets and live allocations ({@link com.emergence.physics.ledger.ResourceLedger}) and
 * capability grants ({@link com.emergence.physics.ledger.CapabilityRegistry}).
 * <p>
 * Lock order when more than one is held: event ledger write lock, then the (entity, kind) account
 * lock, then the entity's capability read lock.
 */
package com.emergence.physics.ledger;
