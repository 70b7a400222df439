package com.questrail.telemetry.config;

/**
 * Backpressure settings of the distribution hub.
 *
 * @param queueCapacity           batches buffered per subscriber before the oldest is dropped
 * @param slowDisconnectThreshold consecutive publishes that find a subscriber's queue
 *                                full before it is disconnected
 * @param maxClients              network clients registered at once; further
 *                                registrations are refused until one leaves
 */
public record DistributionConfig(
    int queueCapacity,
    int slowDisconnectThreshold,
    int maxClients
) {
    public static final int DEFAULT_MAX_CLIENTS = 32;

    public DistributionConfig {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (slowDisconnectThreshold < 1) {
            throw new IllegalArgumentException("slowDisconnectThreshold must be >= 1");
        }
        if (maxClients < 1) {
            throw new IllegalArgumentException("maxClients must be >= 1");
        }
    }

    public DistributionConfig(int queueCapacity, int slowDisconnectThreshold) {
        this(queueCapacity, slowDisconnectThreshold, DEFAULT_MAX_CLIENTS);
    }

    /**
     * 64 batches per subscriber; disconnect after 256 consecutive full publishes;
     * 32 network clients.
     */
    public static DistributionConfig defaults() {
        return new DistributionConfig(64, 256, DEFAULT_MAX_CLIENTS);
    }
}
