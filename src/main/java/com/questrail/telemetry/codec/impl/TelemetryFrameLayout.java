package com.questrail.telemetry.codec.impl;

/**
 * TelemetryFrameLayout
 * -----------------------------------------------------------------------------
 * Byte offsets of the telemetry frame and the checks a stream framer needs to
 * delimit frames without decoding them.
 *
 * <pre>
 *   offset  size  field
 *   0       1     start marker
 *   1       1     schema version
 *   2       4     frame sequence (uint32)
 *   6       8     timestamp, epoch milliseconds (int64)
 *   14      2     payload length N (uint16)
 *   16      N     payload: presence bitmap, then present values
 *   16+N    2     CRC-16/ARC over bytes [1, 16+N)
 * </pre>
 *
 * <p>All multi-byte fields are little-endian.</p>
 */
public final class TelemetryFrameLayout
{
    public static final int MARKER_OFFSET = 0;
    public static final int VERSION_OFFSET = 1;
    public static final int SEQUENCE_OFFSET = 2;
    public static final int TIMESTAMP_OFFSET = 6;
    public static final int LENGTH_OFFSET = 14;

    public static final int HEADER_LENGTH = 16;
    public static final int CRC_LENGTH = 2;

    /** Largest payload length the header can declare. */
    public static final int MAX_PAYLOAD_LENGTH = 0xFFFF;

    private TelemetryFrameLayout() {}

    /**
     * Payload length declared by the header starting at {@code offset}.
     * The caller must ensure the header is fully buffered.
     */
    public static int declaredPayloadLength(byte[] buf, int offset)
    {
        return (buf[offset + LENGTH_OFFSET] & 0xFF)
                | ((buf[offset + LENGTH_OFFSET + 1] & 0xFF) << 8);
    }

    /**
     * Total frame length, header and CRC included, for a given payload length.
     */
    public static int frameLength(int payloadLength)
    {
        return HEADER_LENGTH + payloadLength + CRC_LENGTH;
    }

    /**
     * Returns true if the complete frame of {@code frameLength} bytes starting at
     * {@code offset} carries a matching CRC.
     */
    public static boolean crcMatches(byte[] buf, int offset, int frameLength)
    {
        final int bodyEnd = offset + frameLength - CRC_LENGTH;
        if (frameLength < HEADER_LENGTH + CRC_LENGTH || offset + frameLength > buf.length) {
            return false;
        }
        return TelemetryCrc.read(buf, bodyEnd) == TelemetryCrc.compute(buf, offset + 1, bodyEnd - offset - 1);
    }
}
