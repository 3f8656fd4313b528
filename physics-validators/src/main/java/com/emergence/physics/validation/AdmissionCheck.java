package com.emergence.physics.validation;

import com.emergence.physics.model.PhysicsOperation;

/**
 * One stage of admission. Implementations are annotated with
 * {@link com.emergence.annotations.AdmissionStage} so the pipeline can order them and knows whether
 * they must run under the operation's ledger locks.
 * <p>
 * A check never mutates shared state; it only reports.
 */
public interface AdmissionCheck {

    /** True if the operation carries the part this check inspects (event, resource request, capability). */
    boolean appliesTo(PhysicsOperation operation);

    /**
     * Checks the operation against current state.
     *
     * @return success, or a failure with every violation this stage found
     */
    ValidationResult check(PhysicsOperation operation);
}
