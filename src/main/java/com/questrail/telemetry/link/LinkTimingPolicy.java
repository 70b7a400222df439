package com.questrail.telemetry.link;

import java.time.Duration;
import java.util.Objects;

/**
 * LinkTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the {@link LinkSupervisor}.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>connectTimeout</b>: upper bound on a single connect attempt.</li>
 *   <li><b>readTimeout</b>: how long one read waits for bytes before the
 *       supervisor re-checks for stall and stop requests.</li>
 *   <li><b>stallTimeout</b>: a link that delivers no bytes for this long is
 *       treated as dropped.</li>
 *   <li><b>initialBackoff</b>, <b>maxBackoff</b>, <b>backoffMultiplier</b>:
 *       delay after the n-th consecutive failed connect is
 *       {@code min(maxBackoff, initialBackoff * backoffMultiplier^(n-1))}.</li>
 * </ul>
 */
public record LinkTimingPolicy(
        Duration connectTimeout,
        Duration readTimeout,
        Duration stallTimeout,
        Duration initialBackoff,
        Duration maxBackoff,
        double backoffMultiplier
) {
    /**
     * Canonical constructor with validation.
     */
    public LinkTimingPolicy {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(stallTimeout, "stallTimeout");
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");

        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (readTimeout.isNegative() || readTimeout.isZero()) {
            throw new IllegalArgumentException("readTimeout must be positive");
        }
        if (stallTimeout.compareTo(readTimeout) < 0) {
            throw new IllegalArgumentException("stallTimeout must be at least readTimeout");
        }
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be at least initialBackoff");
        }
        if (!(backoffMultiplier >= 1.0) || Double.isInfinite(backoffMultiplier)) {
            throw new IllegalArgumentException("backoffMultiplier must be finite and >= 1");
        }
    }

    /**
     * Creates a policy with defaults suited to a radio link:
     * connect 5s, read 200ms, stall 3s, backoff 250ms doubling up to 10s.
     */
    public static LinkTimingPolicy defaults() {
        return new LinkTimingPolicy(
                Duration.ofSeconds(5),
                Duration.ofMillis(200),
                Duration.ofSeconds(3),
                Duration.ofMillis(250),
                Duration.ofSeconds(10),
                2.0
        );
    }

    /**
     * Delay to wait after {@code consecutiveFailures} failed connect attempts.
     * Non-decreasing in its argument and never above {@link #maxBackoff()}.
     *
     * @param consecutiveFailures 1 for the first failure
     */
    public Duration delayFor(int consecutiveFailures) {
        if (consecutiveFailures < 1) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 1");
        }
        double nanos = initialBackoff.toNanos() * Math.pow(backoffMultiplier, consecutiveFailures - 1);
        long cap = maxBackoff.toNanos();
        if (!(nanos < cap)) {
            return maxBackoff;
        }
        return Duration.ofNanos((long) nanos);
    }
}
