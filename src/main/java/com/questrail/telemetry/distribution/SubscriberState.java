package com.questrail.telemetry.distribution;

/**
 * Liveness of a subscriber as seen by the {@link DistributionHub}.
 */
public enum SubscriberState {
    /** Keeping up; the last publish found room in its queue. */
    CONNECTED,
    /** The last publish found its queue full and dropped the oldest batch. */
    SLOW,
    /** Removed from the hub, either explicitly or for staying full too long. */
    DISCONNECTED
}
