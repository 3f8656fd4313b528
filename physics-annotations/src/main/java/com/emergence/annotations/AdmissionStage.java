package com.emergence.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a stage of the admission pipeline. The pipeline reads this annotation when the
 * stages are wired and runs them in ascending {@link #order()}; the first stage that reports a
 * violation ends the admission.
 * <p>
 * {@link #locking()} tells the pipeline whether the stage reads shared ledger state and must
 * therefore run after the ledger locks for the operation are held. Non-locking stages run before
 * any lock is taken.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface AdmissionStage {

    /** Unique stage name (used in logs, metrics tags and rejection reports). */
    String name();

    /** Position in the pipeline; lower runs first. Must be unique across the wired stages. */
    int order();

    /** True if the stage reads ledger state and runs under the operation's ledger locks. */
    boolean locking() default true;
}
