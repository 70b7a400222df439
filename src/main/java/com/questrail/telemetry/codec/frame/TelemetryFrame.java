package com.questrail.telemetry.codec.frame;

import java.util.Arrays;

/**
 * TelemetryFrame
 * -----------------------------------------------------------------------------
 * Immutable raw bytes of one telemetry frame as delimited on the link.
 *
 * <p>A frame is opaque until it is decoded against a schema: it has been
 * delimited by the stream framer (start marker, declared length, CRC) but no
 * field has been interpreted. The byte array is copied on the way in and on the
 * way out.</p>
 */
public final class TelemetryFrame
{
    private final byte[] bytes;

    public TelemetryFrame(byte[] bytes) {
        this.bytes = (bytes == null) ? new byte[0] : bytes.clone();
    }

    /**
     * Returns a copy of the frame bytes.
     */
    public byte[] bytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TelemetryFrame other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "TelemetryFrame[length=" + bytes.length
                + (bytes.length > 0 ? ", marker=0x" + Integer.toHexString(bytes[0] & 0xFF) : "")
                + ']';
    }
}
