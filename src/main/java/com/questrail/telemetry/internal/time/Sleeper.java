package com.questrail.telemetry.internal.time;

import java.time.Duration;

/**
 * Sleeper
 * =============================================================================
 * Blocking wait used by threads that own their own loop (the link supervisor's
 * reconnect backoff and the emulator's tick pacing).
 *
 * <p>Waits are always relative durations; they must be interruptible so that
 * {@code stop()} can cancel a pending backoff immediately.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Block the calling thread for approximately {@code duration}.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    void sleep(Duration duration) throws InterruptedException;
}
