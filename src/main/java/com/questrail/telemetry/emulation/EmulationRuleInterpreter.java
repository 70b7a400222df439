package com.questrail.telemetry.emulation;

import com.questrail.telemetry.schema.EmulationRule;

import java.util.Objects;
import java.util.Random;

/**
 * EmulationRuleInterpreter
 * -----------------------------------------------------------------------------
 * Evaluates an {@link EmulationRule} at a given tick.
 *
 * <p>Waveform, constant and linear rules are pure functions of the tick.
 * {@link EmulationRule.UniformRandom} draws from a single {@link Random} seeded
 * at construction, so two interpreters with the same seed that evaluate the
 * same sequence of rules produce the same values.</p>
 *
 * <p>Not thread-safe; owned by one {@link Emulator}.</p>
 */
public final class EmulationRuleInterpreter {

    private static final double TWO_PI = 2.0 * Math.PI;

    private final Random random;

    public EmulationRuleInterpreter(long seed) {
        this.random = new Random(seed);
    }

    public double evaluate(EmulationRule rule, long tick) {
        Objects.requireNonNull(rule, "rule");

        if (rule instanceof EmulationRule.Sine s) {
            return s.offset() + s.amplitude() * Math.sin(phase(tick, s.period()));
        }
        if (rule instanceof EmulationRule.Cosine c) {
            return c.offset() + c.amplitude() * Math.cos(phase(tick, c.period()));
        }
        if (rule instanceof EmulationRule.UniformRandom u) {
            return u.low() + random.nextDouble() * (u.high() - u.low());
        }
        if (rule instanceof EmulationRule.Constant k) {
            return k.value();
        }
        if (rule instanceof EmulationRule.Linear l) {
            long t = l.period() > 0 ? tick % l.period() : tick;
            return l.intercept() + l.slope() * t;
        }
        throw new IllegalArgumentException("Unsupported emulation rule: " + rule.tag());
    }

    // Reduced modulo the period so that tick k and k + period give identical values.
    private static double phase(long tick, double period) {
        return TWO_PI * (tick % period) / period;
    }
}
