package com.questrail.telemetry.emulation;

import com.questrail.telemetry.codec.FrameEncodeException;
import com.questrail.telemetry.codec.TelemetryFrameEncoder;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SensorDefinition;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Emulator
 * =============================================================================
 * Manufactures schema-valid telemetry frames without a vehicle.
 *
 * <p>Every {@link #tick()} takes the next tick index (starting at 0), evaluates
 * the rule of every enabled sensor at that index and encodes the values through
 * the regular codec, with the tick index as frame sequence. Disabled sensors and
 * sensors without a rule are marked absent in the frame.</p>
 *
 * <p>The schema is read through a supplier on every tick, so a reload applies
 * from the next frame onward.</p>
 */
public final class Emulator {

    private final Supplier<Schema> schemaSupplier;
    private final TelemetryFrameEncoder encoder;
    private final EmulationRuleInterpreter interpreter;
    private final WallClock wallClock;

    private long nextTick;

    public Emulator(Supplier<Schema> schemaSupplier,
                    TelemetryFrameEncoder encoder,
                    EmulationRuleInterpreter interpreter,
                    WallClock wallClock)
    {
        this.schemaSupplier = Objects.requireNonNull(schemaSupplier, "schemaSupplier");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.interpreter = Objects.requireNonNull(interpreter, "interpreter");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Produces the frame for the next tick.
     *
     * <p>The tick counter advances even when encoding fails, so a failing tick
     * is skipped rather than retried.</p>
     *
     * @throws FrameEncodeException if a rule produced a value the wire type cannot carry
     */
    public synchronized TelemetryFrame tick() {
        final long tick = nextTick++;
        final Schema schema = schemaSupplier.get();
        return encoder.encode(sample(schema, tick), schema, tick, Instant.ofEpochMilli(wallClock.nowEpochMillis()));
    }

    /** Number of ticks taken so far. */
    public synchronized long ticks() {
        return nextTick;
    }

    Map<String, Double> sample(Schema schema, long tick) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (SensorDefinition sensor : schema.all()) {
            if (!sensor.enabled() || sensor.emulationRule() == null) {
                continue;
            }
            values.put(sensor.id(), interpreter.evaluate(sensor.emulationRule(), tick));
        }
        return values;
    }
}
