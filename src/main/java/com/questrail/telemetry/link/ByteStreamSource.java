package com.questrail.telemetry.link;

import java.time.Duration;

/**
 * ByteStreamSource
 * -----------------------------------------------------------------------------
 * Pull-style port for one open connection carrying the raw telemetry stream.
 *
 * <p>Implementations may be backed by a TCP socket, a serial radio, the
 * emulator, or a test script. The stream has no message boundaries; frames are
 * delimited by {@link StreamFramer}.</p>
 *
 * <p>{@link #close()} may be called from any thread and must unblock a reader
 * waiting in {@link #read(byte[], Duration)}.</p>
 */
public interface ByteStreamSource extends AutoCloseable
{
    /**
     * Reads up to {@code buf.length} bytes, waiting at most {@code timeout}.
     *
     * @return number of bytes read, {@code 0} if the timeout elapsed without
     *         data, or {@code -1} at end of stream
     * @throws LinkException if the connection failed
     */
    int read(byte[] buf, Duration timeout) throws LinkException, InterruptedException;

    /**
     * Releases the underlying resource. Idempotent.
     */
    @Override
    void close();
}
