/**
 * The admission engine. {@link com.emergence.physics.engine.PhysicsEngine} owns the ledgers and
 * runs every operation through the {@link com.emergence.physics.engine.AdmissionPipeline}:
 * schema, then causality, resource and security under the ledger locks, then commit.
 */
package com.emergence.physics.engine;
