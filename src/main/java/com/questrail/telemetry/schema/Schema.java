package com.questrail.telemetry.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema
 * -----------------------------------------------------------------------------
 * Immutable, validated catalog of {@link SensorDefinition}s.
 *
 * <h2>Wire layout contract</h2>
 * Frame payloads are laid out by <strong>declaration order</strong>: sensor
 * {@code i} in {@link #all()} owns bit {@code i} of the presence bitmap and,
 * when present, the {@code i}-th value slot among present sensors. Reordering
 * sensors in a schema document therefore changes the wire format and must be
 * accompanied by a {@link #version()} bump.
 *
 * <p>A schema is never mutated after construction. Reloading builds a new
 * instance which replaces the old one in {@link SchemaRegistry}.</p>
 */
public final class Schema
{
    public static final int DEFAULT_START_BYTE = 0x01;

    private final int version;
    private final int startByte;
    private final List<SensorDefinition> sensors;
    private final Map<String, Integer> indexById;

    private Schema(int version, int startByte, List<SensorDefinition> sensors, Map<String, Integer> indexById) {
        this.version = version;
        this.startByte = startByte;
        this.sensors = sensors;
        this.indexById = indexById;
    }

    /**
     * Validates and builds a schema.
     *
     * @param version   schema version carried in every frame (0-255)
     * @param startByte frame start marker (0-255)
     * @param sensors   definitions in declaration order
     * @throws SchemaException on the first violated invariant; nothing is built
     */
    public static Schema of(int version, int startByte, List<SensorDefinition> sensors)
            throws SchemaException
    {
        Objects.requireNonNull(sensors, "sensors");

        if (version < 0 || version > 0xFF) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, null,
                    "version must be 0-255, was " + version);
        }
        if (startByte < 0 || startByte > 0xFF) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, null,
                    "startByte must be 0-255, was " + startByte);
        }
        if (sensors.isEmpty()) {
            throw new SchemaException(SchemaException.Kind.EMPTY_SCHEMA, null, "schema declares no sensors");
        }

        Map<String, Integer> index = new HashMap<>(sensors.size() * 2);
        for (int i = 0; i < sensors.size(); i++) {
            SensorDefinition d = Objects.requireNonNull(sensors.get(i), "sensor at index " + i);
            validate(d);
            if (index.putIfAbsent(d.id(), i) != null) {
                throw new SchemaException(SchemaException.Kind.DUPLICATE_ID, d.id(), "sensor id declared twice");
            }
        }

        return new Schema(version, startByte,
                Collections.unmodifiableList(new ArrayList<>(sensors)),
                Collections.unmodifiableMap(index));
    }

    private static void validate(SensorDefinition d) throws SchemaException {
        if (d.id().isBlank()) {
            throw new SchemaException(SchemaException.Kind.EMPTY_ID, d.id(), "sensor id must not be empty");
        }
        if (!Double.isFinite(d.min()) || !Double.isFinite(d.max())) {
            throw new SchemaException(SchemaException.Kind.INVALID_RANGE, d.id(), "min and max must be finite");
        }
        if (d.min() > d.max()) {
            throw new SchemaException(SchemaException.Kind.INVALID_RANGE, d.id(),
                    "min " + d.min() + " exceeds max " + d.max());
        }
        if (!Double.isFinite(d.scale()) || d.scale() <= 0) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, d.id(),
                    "scale must be finite and positive, was " + d.scale());
        }
        if (!Double.isFinite(d.offset())) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, d.id(), "offset must be finite");
        }

        WireType type = d.wireType();
        double rawMin = d.toRaw(d.min());
        double rawMax = d.toRaw(d.max());
        if (!type.canRepresent(rawMin) || !type.canRepresent(rawMax)) {
            throw new SchemaException(SchemaException.Kind.UNREPRESENTABLE_RANGE, d.id(),
                    "range [" + d.min() + ", " + d.max() + "] does not fit " + type.schemaName()
                            + " with scale " + d.scale() + " and offset " + d.offset());
        }

        if (d.emulationRule() != null) {
            validateRule(d.id(), d.emulationRule());
        }
    }

    private static void validateRule(String id, EmulationRule rule) throws SchemaException {
        if (rule instanceof EmulationRule.Sine s) {
            requireWave(id, s.amplitude(), s.offset(), s.period());
        }
        else if (rule instanceof EmulationRule.Cosine c) {
            requireWave(id, c.amplitude(), c.offset(), c.period());
        }
        else if (rule instanceof EmulationRule.UniformRandom u) {
            if (!Double.isFinite(u.low()) || !Double.isFinite(u.high()) || u.low() > u.high()) {
                throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                        "uniform_random requires finite low <= high");
            }
        }
        else if (rule instanceof EmulationRule.Constant k) {
            if (!Double.isFinite(k.value())) {
                throw new SchemaException(SchemaException.Kind.INVALID_RULE, id, "constant value must be finite");
            }
        }
        else if (rule instanceof EmulationRule.Linear l) {
            if (!Double.isFinite(l.intercept()) || !Double.isFinite(l.slope()) || l.period() < 0) {
                throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                        "linear requires finite intercept and slope and period >= 0");
            }
        }
    }

    private static void requireWave(String id, double amplitude, double offset, double period)
            throws SchemaException
    {
        if (!Double.isFinite(amplitude) || !Double.isFinite(offset)) {
            throw new SchemaException(SchemaException.Kind.INVALID_RULE, id, "amplitude and offset must be finite");
        }
        if (!Double.isFinite(period) || period <= 0) {
            throw new SchemaException(SchemaException.Kind.INVALID_RULE, id, "period must be positive");
        }
    }

    public int version() {
        return version;
    }

    public int startByte() {
        return startByte;
    }

    /**
     * All definitions in declaration (wire) order.
     */
    public List<SensorDefinition> all() {
        return sensors;
    }

    public Optional<SensorDefinition> lookup(String id) {
        Integer idx = indexById.get(id);
        return idx == null ? Optional.empty() : Optional.of(sensors.get(idx));
    }

    /**
     * Declaration index of {@code id}, or {@code -1} if unknown.
     */
    public int indexOf(String id) {
        return indexById.getOrDefault(id, -1);
    }

    public int size() {
        return sensors.size();
    }

    /** Bytes occupied by the presence bitmap at the start of every payload. */
    public int bitmapLength() {
        return (sensors.size() + 7) / 8;
    }

    /** Payload length when every sensor is present. */
    public int fullPayloadLength() {
        int len = bitmapLength();
        for (SensorDefinition d : sensors) {
            len += d.wireType().width();
        }
        return len;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Schema other)) return false;
        return version == other.version
                && startByte == other.startByte
                && sensors.equals(other.sensors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(version, startByte, sensors);
    }

    @Override
    public String toString() {
        return "Schema[version=" + version + ", startByte=0x" + Integer.toHexString(startByte)
                + ", sensors=" + sensors.size() + ']';
    }
}
