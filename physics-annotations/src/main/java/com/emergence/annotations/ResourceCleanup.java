package com.emergence.annotations;

/**
 * Contract for resource cleanup when the engine or one of its components is shutting down.
 * Components that hold resources (executor threads, open files, pending snapshot writes) implement
 * this and release them in {@link #onExit()}. The engine invokes {@code onExit()} on its components
 * during teardown, after admissions have been stopped.
 */
public interface ResourceCleanup {

    /**
     * Called once when the engine is shutting down. Exceptions should be logged and not rethrown
     * so other components still get a chance to clean up.
     */
    void onExit();
}
