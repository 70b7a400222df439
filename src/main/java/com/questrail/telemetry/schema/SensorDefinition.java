package com.questrail.telemetry.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * SensorDefinition
 * -----------------------------------------------------------------------------
 * Immutable description of one physical or logical sensor.
 *
 * <p>Only {@link #wireType()}, {@link #scale()}, {@link #offset()},
 * {@link #min()}, {@link #max()} and {@link #enabled()} influence decoding and
 * emulation. Name, units, group and the dash flag are display metadata passed
 * through to clients.</p>
 *
 * <p>Values are scaled as {@code value = raw * scale + offset}. Integer wire
 * types round to the nearest raw step when encoding, so the round-trip precision
 * of an integer-typed sensor is {@code scale / 2}; {@code float32} sensors lose
 * single-precision bits of the raw value {@code (value - offset) / scale}.
 * {@link #precision()} bounds both, double arithmetic included.</p>
 *
 * <p>Instances are not validated on construction; {@link Schema#of} validates
 * the complete set atomically.</p>
 */
public record SensorDefinition(
        String id,
        String name,
        String units,
        String group,
        double min,
        double max,
        boolean onDash,
        boolean enabled,
        WireType wireType,
        double scale,
        double offset,
        EmulationRule emulationRule
) {
    public SensorDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(wireType, "wireType");
    }

    public Optional<EmulationRule> rule() {
        return Optional.ofNullable(emulationRule);
    }

    /**
     * Returns true if a decoded raw wire value stands for a value within
     * {@code [min, max]}. The comparison runs against the raw forms of the
     * bounds, so a bound survives the encode/decode round trip as valid even
     * when {@code raw * scale + offset} lands an ulp outside it.
     */
    public boolean rawInRange(double raw) {
        return raw >= toRaw(min) && raw <= toRaw(max);
    }

    /**
     * Converts an engineering value to the raw wire value (not range checked).
     */
    public double toRaw(double value) {
        double raw = (value - offset) / scale;
        return wireType.isInteger() ? Math.round(raw) : (double) (float) raw;
    }

    /**
     * Converts a raw wire value back to the engineering value.
     */
    public double fromRaw(double raw) {
        return raw * scale + offset;
    }

    /**
     * Largest difference between a value and its decoded round trip.
     */
    public double precision() {
        // Double rounding of (v - offset) / scale and raw * scale + offset.
        final double magnitude = Math.max(Math.max(Math.abs(min), Math.abs(max)), Math.abs(offset));
        final double arithmetic = 8 * Math.ulp(magnitude);
        if (wireType.isInteger()) {
            return scale / 2.0 + arithmetic;
        }
        // float32 rounding happens on the raw value, not on the engineering value.
        final double rawMagnitude = Math.max(Math.abs((min - offset) / scale), Math.abs((max - offset) / scale));
        return Math.ulp((float) rawMagnitude) * scale + arithmetic;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String units = "";
        private String group = "Core";
        private double min = 0;
        private double max = 0;
        private boolean onDash;
        private boolean enabled = true;
        private WireType wireType = WireType.INT32;
        private double scale = 1.0;
        private double offset = 0.0;
        private EmulationRule emulationRule;

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id");
            this.name = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder units(String units) {
            this.units = units;
            return this;
        }

        public Builder group(String group) {
            this.group = group;
            return this;
        }

        public Builder range(double min, double max) {
            this.min = min;
            this.max = max;
            return this;
        }

        public Builder onDash(boolean onDash) {
            this.onDash = onDash;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder wireType(WireType wireType) {
            this.wireType = wireType;
            return this;
        }

        public Builder scale(double scale) {
            this.scale = scale;
            return this;
        }

        public Builder offset(double offset) {
            this.offset = offset;
            return this;
        }

        public Builder rule(EmulationRule rule) {
            this.emulationRule = rule;
            return this;
        }

        public SensorDefinition build() {
            return new SensorDefinition(id, name, units, group, min, max, onDash, enabled,
                    wireType, scale, offset, emulationRule);
        }
    }
}
