package com.questrail.telemetry.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings of the synthetic telemetry source.
 *
 * @param enabled      replace the vehicle link with the emulator
 * @param tickInterval time between emulated frames
 * @param seed         seed of the emulator's random rules
 */
public record EmulationConfig(
    boolean enabled,
    Duration tickInterval,
    long seed
) {
    public EmulationConfig {
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (tickInterval.isNegative() || tickInterval.isZero()) {
            throw new IllegalArgumentException("tickInterval must be positive");
        }
    }

    /**
     * Emulation off, 500 ms interval, seed 0.
     */
    public static EmulationConfig defaults() {
        return new EmulationConfig(false, Duration.ofMillis(500), 0L);
    }

    public static EmulationConfig enabled(Duration tickInterval, long seed) {
        return new EmulationConfig(true, tickInterval, seed);
    }
}
