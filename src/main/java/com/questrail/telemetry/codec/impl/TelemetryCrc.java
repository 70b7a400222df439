package com.questrail.telemetry.codec.impl;

import java.util.Locale;

/**
 * TelemetryCrc
 * -----------------------------------------------------------------------------
 * CRC-16/ARC over the frame body.
 *
 * <p>The CRC covers every byte after the start marker up to the end of the
 * payload and is transmitted as two bytes, little-endian, like every other
 * multi-byte field of the frame.</p>
 */
final class TelemetryCrc
{
    /*
     * CRC-16/ARC (CRC-IBM)
     *   • Polynomial (normal): 0x8005, reflected: 0xA001
     *   • INIT 0x0000, XOROUT 0x0000
     *   • Input and output reflected
     */
    private static final int REFLECTED_POLY = 0xA001;
    private static final int INIT = 0x0000;

    private TelemetryCrc() {}

    /**
     * Validates the CRC that follows {@code bodyEnd} in {@code frame}.
     *
     * @throws CrcException if the buffer does not hold the CRC or it does not match
     */
    static void validate(byte[] frame, int offset, int bodyEnd) throws CrcException
    {
        if (bodyEnd + TelemetryFrameLayout.CRC_LENGTH > frame.length) {
            throw new CrcException("CRC expected but frame too short");
        }

        final int transmitted = read(frame, bodyEnd);
        final int computed = compute(frame, offset + 1, bodyEnd - offset - 1);

        if (transmitted != computed) {
            throw new CrcException(String.format(Locale.ROOT, 
                    "CRC mismatch: transmitted=0x%04X computed=0x%04X",
                    transmitted, computed));
        }
    }

    /**
     * Computes the CRC over bytes {@code [offset + 1, bodyEnd)} and writes it at {@code bodyEnd}.
     */
    static void write(byte[] frame, int offset, int bodyEnd)
    {
        final int crc = compute(frame, offset + 1, bodyEnd - offset - 1);
        frame[bodyEnd] = (byte) (crc & 0xFF);
        frame[bodyEnd + 1] = (byte) ((crc >>> 8) & 0xFF);
    }

    static int read(byte[] frame, int at)
    {
        return (frame[at] & 0xFF) | ((frame[at + 1] & 0xFF) << 8);
    }

    static int compute(byte[] data, int off, int len)
    {
        int crc = INIT & 0xFFFF;

        for (int i = off; i < off + len; i++) {
            crc ^= (data[i] & 0xFF);
            for (int b = 0; b < 8; b++) {
                if ((crc & 0x0001) != 0) {
                    crc = (crc >>> 1) ^ REFLECTED_POLY;
                } else {
                    crc = (crc >>> 1);
                }
            }
            crc &= 0xFFFF;
        }
        return crc & 0xFFFF;
    }
}
