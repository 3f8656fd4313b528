/**
 * Physics engine configuration: process settings from the environment ({@link com.emergence.physics.config.PhysicsConfig})
 * and the configuration document with per-entity budgets and capability grants
 * ({@link com.emergence.physics.config.PhysicsConfiguration}), loaded by
 * {@link com.emergence.physics.config.PhysicsConfigurationLoader}.
 */
package com.emergence.physics.config;
