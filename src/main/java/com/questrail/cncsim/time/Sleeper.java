package com.questrail.cncsim.time;

import java.time.Duration;

/**
 * Sleeper
 * =============================================================================
 * Blocking pause used between delivery attempts.
 *
 * <p>Retry spacing is the only place the simulator blocks a thread on purpose.
 * Routing it through this seam lets tests record the requested back-off
 * instead of waiting for it.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Block the calling thread for {@code duration}.
     *
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeper backed by {@link Thread#sleep(long)}.
     */
    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
}
