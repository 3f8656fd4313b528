/**
 * Process-level wiring: environment settings, configuration document, engine.
 */
package com.emergence.physics.bootstrap;
