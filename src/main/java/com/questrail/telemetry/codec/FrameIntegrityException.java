package com.questrail.telemetry.codec;

/**
 * Raised when a frame fails wire-level integrity checks and must be dropped as a whole.
 */
public final class FrameIntegrityException extends Exception
{
    public enum Reason {
        /** First byte is not the schema's start marker. */
        BAD_MARKER,
        /** Fewer bytes than a complete header. */
        SHORT_HEADER,
        /** The transmitted CRC does not match the computed one. */
        CRC_MISMATCH
    }

    private final Reason reason;

    public FrameIntegrityException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public FrameIntegrityException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
