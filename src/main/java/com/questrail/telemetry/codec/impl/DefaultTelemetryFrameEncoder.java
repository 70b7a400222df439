package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.codec.FrameEncodeException;
import com.questrail.telemetry.codec.TelemetryFrameEncoder;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SensorDefinition;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.HEADER_LENGTH;

/**
 * DefaultTelemetryFrameEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link TelemetryFrameEncoder}.
 *
 * <p>This is the mechanical inverse of {@link DefaultTelemetryFrameDecoder}.
 * Values outside a sensor's declared {@code [min, max]} range are encoded as
 * long as their raw form fits the wire width; classifying them is the
 * decoder's job.</p>
 */
public final class DefaultTelemetryFrameEncoder implements TelemetryFrameEncoder
{
    @Override
    public TelemetryFrame encode(Map<String, Double> values, Schema schema, long sequence, Instant timestamp)
    {
        Objects.requireNonNull(values, "values");
        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(timestamp, "timestamp");

        for (String id : values.keySet()) {
            if (schema.indexOf(id) < 0) {
                throw new FrameEncodeException(id, "not declared by schema version " + schema.version());
            }
        }

        // ---------------------------------------------------------------------
        // 1) Size the payload: bitmap + one slot per present sensor
        // ---------------------------------------------------------------------

        final List<SensorDefinition> sensors = schema.all();
        int payloadLength = schema.bitmapLength();
        for (SensorDefinition sensor : sensors) {
            if (values.containsKey(sensor.id())) {
                payloadLength += sensor.wireType().width();
            }
        }
        if (payloadLength > TelemetryFrameLayout.MAX_PAYLOAD_LENGTH) {
            throw new FrameEncodeException(null, "payload of " + payloadLength + " bytes exceeds frame limit");
        }

        final byte[] out = new byte[TelemetryFrameLayout.frameLength(payloadLength)];
        final ByteBuffer buf = ByteBuffer.wrap(out).order(ByteOrder.LITTLE_ENDIAN);

        // ---------------------------------------------------------------------
        // 2) Header
        // ---------------------------------------------------------------------

        out[TelemetryFrameLayout.MARKER_OFFSET] = (byte) schema.startByte();
        out[TelemetryFrameLayout.VERSION_OFFSET] = (byte) schema.version();
        buf.putInt(TelemetryFrameLayout.SEQUENCE_OFFSET, (int) sequence);
        buf.putLong(TelemetryFrameLayout.TIMESTAMP_OFFSET, timestamp.toEpochMilli());
        buf.putShort(TelemetryFrameLayout.LENGTH_OFFSET, (short) payloadLength);

        // ---------------------------------------------------------------------
        // 3) Bitmap and values in declaration order
        // ---------------------------------------------------------------------

        int cursor = HEADER_LENGTH + schema.bitmapLength();
        for (int i = 0; i < sensors.size(); i++) {
            final SensorDefinition sensor = sensors.get(i);
            if (!values.containsKey(sensor.id())) {
                continue;
            }

            final Double value = values.get(sensor.id());
            if (value == null || !Double.isFinite(value)) {
                throw new FrameEncodeException(sensor.id(), "value " + value + " is not finite");
            }

            final double raw = sensor.toRaw(value);
            if (!sensor.wireType().canRepresent(raw)) {
                throw new FrameEncodeException(sensor.id(),
                        "value " + value + " does not fit " + sensor.wireType().schemaName());
            }

            out[HEADER_LENGTH + (i / 8)] |= (byte) (1 << (i % 8));
            WireValues.write(buf, cursor, sensor.wireType(), raw);
            cursor += sensor.wireType().width();
        }

        // ---------------------------------------------------------------------
        // 4) CRC trailer
        // ---------------------------------------------------------------------

        TelemetryCrc.write(out, 0, HEADER_LENGTH + payloadLength);
        return new TelemetryFrame(out);
    }
}
