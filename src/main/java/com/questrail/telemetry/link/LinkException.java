package com.questrail.telemetry.link;

/**
 * Raised when the telemetry link cannot be opened or fails while streaming.
 *
 * <p>Link failures never escape the {@link LinkSupervisor} loop; they drive the
 * transition to {@link LinkState#RECONNECTING} or a retried connect.</p>
 */
public final class LinkException extends Exception
{
    public LinkException(String message) {
        super(message);
    }

    public LinkException(String message, Throwable cause) {
        super(message, cause);
    }
}
