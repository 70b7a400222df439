package com.questrail.telemetry.codec;

import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.schema.Schema;

import java.time.Instant;
import java.util.Map;

/**
 * TelemetryFrameEncoder
 * -----------------------------------------------------------------------------
 * Mechanical inverse of {@link TelemetryFrameDecoder}.
 *
 * <p>Produces the same wire layout the decoder accepts. Sensors missing from
 * {@code values} are marked absent in the presence bitmap and cost no payload
 * bytes.</p>
 */
public interface TelemetryFrameEncoder
{
    /**
     * Encode engineering values into a frame.
     *
     * @param values    engineering values keyed by sensor id
     * @param schema    schema defining order, width and scaling
     * @param sequence  frame sequence number, written modulo 2<sup>32</sup>
     * @param timestamp frame timestamp, written with millisecond resolution
     * @throws FrameEncodeException if a sensor is unknown, a value is not finite,
     *         or a value cannot be represented in its wire width
     */
    TelemetryFrame encode(Map<String, Double> values, Schema schema, long sequence, Instant timestamp);
}
