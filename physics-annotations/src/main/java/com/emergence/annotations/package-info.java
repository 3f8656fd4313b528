/**
 * Emergence annotations: stage metadata and lifecycle contracts shared by the physics modules.
 * <ul>
 *   <li>{@link com.emergence.annotations.AdmissionStage} – admission stage (name, order, locking); the pipeline orders its validators by it</li>
 *   <li>{@link com.emergence.annotations.ResourceCleanup} – implement {@link com.emergence.annotations.ResourceCleanup#onExit()} to release resources at engine shutdown</li>
 * </ul>
 */
package com.emergence.annotations;
