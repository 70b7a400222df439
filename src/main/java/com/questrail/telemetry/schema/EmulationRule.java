package com.questrail.telemetry.schema;

/**
 * EmulationRule
 * -----------------------------------------------------------------------------
 * Declarative generator used by the emulator to synthesize a sensor value for a
 * given tick.
 *
 * <p>Rules are pure data. The set of variants is closed so that a schema file
 * can never carry executable expressions; the emulator's interpreter is the
 * only place where rules are evaluated.</p>
 *
 * <ul>
 *   <li>{@link Sine}: {@code offset + amplitude * sin(2π · tick / period)}</li>
 *   <li>{@link Cosine}: {@code offset + amplitude * cos(2π · tick / period)}</li>
 *   <li>{@link UniformRandom}: uniform draw in {@code [low, high]}</li>
 *   <li>{@link Constant}: a fixed value</li>
 *   <li>{@link Linear}: {@code intercept + slope · t}, where {@code t} wraps at
 *       {@code period} if {@code period > 0}</li>
 * </ul>
 */
public sealed interface EmulationRule
        permits EmulationRule.Sine,
                EmulationRule.Cosine,
                EmulationRule.UniformRandom,
                EmulationRule.Constant,
                EmulationRule.Linear
{
    /** Tag used for this rule in schema documents. */
    String tag();

    record Sine(double amplitude, double offset, double period) implements EmulationRule {
        @Override
        public String tag() {
            return "sine";
        }
    }

    record Cosine(double amplitude, double offset, double period) implements EmulationRule {
        @Override
        public String tag() {
            return "cosine";
        }
    }

    record UniformRandom(double low, double high) implements EmulationRule {
        @Override
        public String tag() {
            return "uniform_random";
        }
    }

    record Constant(double value) implements EmulationRule {
        @Override
        public String tag() {
            return "constant";
        }
    }

    record Linear(double intercept, double slope, long period) implements EmulationRule {
        @Override
        public String tag() {
            return "linear";
        }
    }
}
