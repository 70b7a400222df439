package com.questrail.telemetry.observability;

import com.questrail.telemetry.link.LinkState;

import java.time.Instant;

/**
 * Record representing a state transition of the link supervisor.
 *
 * @param cause the failure that caused the transition, or {@code null}
 */
public record LinkStateTransitionEvent(
    Instant timestamp,
    LinkState oldState,
    LinkState newState,
    Throwable cause
) {
}
