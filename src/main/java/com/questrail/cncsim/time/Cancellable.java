package com.questrail.cncsim.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned for every timer registration.
 *
 * <p>The simulation scheduler keeps exactly one of these per running
 * simulation: the handle of the next pending tick. Cancelling it is how
 * {@code stop()} guarantees that no further tick fires.</p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the registered task.
     *
     * @return {@code true} if the task will not run; {@code false} if it already
     *         ran or was cancelled earlier.
     */
    boolean cancel();
}
