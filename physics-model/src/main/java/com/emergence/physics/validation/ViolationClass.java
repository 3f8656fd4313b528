package com.emergence.physics.validation;

/**
 * Family of a violation, matching the admission stage that reports it.
 */
public enum ViolationClass {
    SCHEMA,
    CAUSALITY,
    RESOURCE,
    SECURITY
}
