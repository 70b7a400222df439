package com.questrail.telemetry.codec;

import java.util.Optional;

/**
 * Raised when a set of values cannot be encoded into a frame under a schema.
 *
 * <p>Typical causes are an unknown sensor id, a non-finite value, or a value
 * whose scaled raw form does not fit the sensor's wire width.</p>
 */
public final class FrameEncodeException extends RuntimeException
{
    private final String sensorId;

    public FrameEncodeException(String sensorId, String message) {
        super(sensorId == null ? message : sensorId + ": " + message);
        this.sensorId = sensorId;
    }

    public Optional<String> sensorId() {
        return Optional.ofNullable(sensorId);
    }
}
