package com.questrail.telemetry.schema;

import java.util.Locale;

/**
 * On-wire representation of one sensor value.
 *
 * <p>The wire type fixes the number of payload bytes a present sensor occupies
 * and the raw range that scaled values must fit into. Byte order and the actual
 * byte manipulation live in the codec.</p>
 */
public enum WireType {
    INT8("int8", 1, Byte.MIN_VALUE, Byte.MAX_VALUE),
    UINT8("uint8", 1, 0, 0xFF),
    INT16("int16", 2, Short.MIN_VALUE, Short.MAX_VALUE),
    UINT16("uint16", 2, 0, 0xFFFF),
    INT32("int32", 4, Integer.MIN_VALUE, Integer.MAX_VALUE),
    UINT32("uint32", 4, 0, 0xFFFF_FFFFL),
    FLOAT32("float32", 4, -Float.MAX_VALUE, Float.MAX_VALUE);

    private final String schemaName;
    private final int width;
    private final double minRaw;
    private final double maxRaw;

    WireType(String schemaName, int width, double minRaw, double maxRaw) {
        this.schemaName = schemaName;
        this.width = width;
        this.minRaw = minRaw;
        this.maxRaw = maxRaw;
    }

    /** Name used in schema documents ({@code "uint16"}, ...). */
    public String schemaName() {
        return schemaName;
    }

    /** Number of payload bytes occupied by a present value. */
    public int width() {
        return width;
    }

    public double minRaw() {
        return minRaw;
    }

    public double maxRaw() {
        return maxRaw;
    }

    public boolean isInteger() {
        return this != FLOAT32;
    }

    /**
     * Returns true if {@code raw} can be written in this width without overflow.
     */
    public boolean canRepresent(double raw) {
        return Double.isFinite(raw) && raw >= minRaw && raw <= maxRaw;
    }

    /**
     * Resolve a schema document type name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static WireType fromSchemaName(String name) {
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (WireType t : values()) {
            if (t.schemaName.equals(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown wire type: " + name);
    }
}
