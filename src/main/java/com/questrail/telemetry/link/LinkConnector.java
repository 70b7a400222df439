package com.questrail.telemetry.link;

import java.time.Duration;

/**
 * Opens a fresh {@link ByteStreamSource} for every connect attempt.
 *
 * <p>A connector may own resources shared by all sources it opens (an event
 * loop, a serial port handle); {@link #close()} releases them.</p>
 */
public interface LinkConnector extends AutoCloseable
{
    /**
     * @param timeout upper bound on how long the attempt may take
     * @throws LinkException if the link could not be opened
     */
    ByteStreamSource open(Duration timeout) throws LinkException, InterruptedException;

    /**
     * Human-readable target, e.g. {@code tcp://car.local:5000}.
     */
    String description();

    /**
     * Releases resources shared across connections. Idempotent.
     */
    @Override
    default void close() {}
}
