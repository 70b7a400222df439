package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.schema.WireType;

import java.nio.ByteBuffer;

/**
 * Little-endian read and write of single raw values per {@link WireType}.
 *
 * <p>Buffers passed here must already be in little-endian order.</p>
 */
final class WireValues
{
    private WireValues() {}

    static double read(ByteBuffer buf, int at, WireType type)
    {
        switch (type) {
            case INT8:
                return buf.get(at);
            case UINT8:
                return buf.get(at) & 0xFF;
            case INT16:
                return buf.getShort(at);
            case UINT16:
                return buf.getShort(at) & 0xFFFF;
            case INT32:
                return buf.getInt(at);
            case UINT32:
                return buf.getInt(at) & 0xFFFF_FFFFL;
            case FLOAT32:
                return buf.getFloat(at);
            default:
                throw new IllegalArgumentException("Unsupported wire type: " + type);
        }
    }

    /**
     * Writes {@code raw}, which the caller has already range checked against the type.
     */
    static void write(ByteBuffer buf, int at, WireType type, double raw)
    {
        switch (type) {
            case INT8:
            case UINT8:
                buf.put(at, (byte) (long) raw);
                break;
            case INT16:
            case UINT16:
                buf.putShort(at, (short) (long) raw);
                break;
            case INT32:
            case UINT32:
                buf.putInt(at, (int) (long) raw);
                break;
            case FLOAT32:
                buf.putFloat(at, (float) raw);
                break;
            default:
                throw new IllegalArgumentException("Unsupported wire type: " + type);
        }
    }
}
