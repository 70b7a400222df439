package com.questrail.telemetry.link;

/**
 * Lifecycle of the raw telemetry link as driven by {@link LinkSupervisor}.
 *
 * <pre>
 *   IDLE → CONNECTING → STREAMING → RECONNECTING → CONNECTING → ...
 *                 (any state) → STOPPED
 * </pre>
 */
public enum LinkState {
    /** Constructed, not yet started. */
    IDLE,
    /** Opening the byte-stream source; failed attempts stay here with backoff. */
    CONNECTING,
    /** Reading bytes and forwarding frames. */
    STREAMING,
    /** The link dropped; buffered partial data has been discarded. */
    RECONNECTING,
    /** Terminal; the link resource has been released. */
    STOPPED
}
