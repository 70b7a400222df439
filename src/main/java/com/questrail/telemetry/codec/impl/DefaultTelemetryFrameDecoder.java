package com.questrail.telemetry.codec.impl;

import com.questrail.telemetry.api.Reading;
import com.questrail.telemetry.api.ReadingBatch;
import com.questrail.telemetry.codec.FrameIntegrityException;
import com.questrail.telemetry.codec.TelemetryFrameDecoder;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SensorDefinition;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.CRC_LENGTH;
import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.HEADER_LENGTH;
import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.SEQUENCE_OFFSET;
import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.TIMESTAMP_OFFSET;
import static com.questrail.telemetry.codec.impl.TelemetryFrameLayout.VERSION_OFFSET;

/**
 * DefaultTelemetryFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link TelemetryFrameDecoder}.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Header: start marker and minimum length</li>
 *   <li>CRC validation, when the buffer holds the CRC trailer</li>
 *   <li>Presence bitmap and value extraction in schema declaration order</li>
 *   <li>Scaling and range classification per sensor; the range check compares
 *       raw wire values against the raw forms of {@code min} and {@code max}</li>
 * </ol>
 *
 * <p><strong>CRC presence is inferred structurally:</strong> a buffer shorter
 * than the header-declared frame length is a truncated frame and cannot carry
 * its CRC. Its fields are decoded as far as they fit, the remainder are
 * delivered as missing readings and the batch is marked incomplete.</p>
 *
 * <p><strong>Partial decoding starts after the header.</strong> Below 16 bytes
 * there is no sequence number, timestamp or declared length to attach
 * readings to, so a buffer cut inside the header is rejected with
 * {@link FrameIntegrityException.Reason#SHORT_HEADER} rather than turned
 * into a batch. The stream framer never hands such a buffer over; only
 * direct callers of {@link #decode} can see this.</p>
 */
public final class DefaultTelemetryFrameDecoder implements TelemetryFrameDecoder
{
    @Override
    public ReadingBatch decode(TelemetryFrame frame, Schema schema) throws FrameIntegrityException
    {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(schema, "schema");

        final byte[] bytes = frame.bytes();

        try {
            // 1) Header
            requireHeader(bytes, schema.startByte());

            final ByteBuffer buf = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
            final int version = bytes[VERSION_OFFSET] & 0xFF;
            final long sequence = buf.getInt(SEQUENCE_OFFSET) & 0xFFFF_FFFFL;
            final Instant timestamp = Instant.ofEpochMilli(buf.getLong(TIMESTAMP_OFFSET));
            final int bodyEnd = HEADER_LENGTH + TelemetryFrameLayout.declaredPayloadLength(bytes, 0);

            // 2) CRC, only if the buffer reaches it
            final boolean crcPresent = bytes.length >= bodyEnd + CRC_LENGTH;
            if (crcPresent) {
                TelemetryCrc.validate(bytes, 0, bodyEnd);
            }

            // 3) Payload; bytes past the declared payload are ignored
            final int limit = Math.min(bodyEnd, bytes.length);
            return decodePayload(buf, limit, schema, sequence, version, timestamp, crcPresent);
        }
        catch (FramingException e) {
            throw new FrameIntegrityException(
                    e.shortHeader() ? FrameIntegrityException.Reason.SHORT_HEADER
                                    : FrameIntegrityException.Reason.BAD_MARKER,
                    e.getMessage(), e);
        }
        catch (CrcException e) {
            throw new FrameIntegrityException(FrameIntegrityException.Reason.CRC_MISMATCH, e.getMessage(), e);
        }
    }

    private static void requireHeader(byte[] bytes, int startByte) throws FramingException
    {
        if (bytes.length < HEADER_LENGTH) {
            throw new FramingException("Frame of " + bytes.length + " bytes is shorter than the header", true);
        }
        final int marker = bytes[TelemetryFrameLayout.MARKER_OFFSET] & 0xFF;
        if (marker != startByte) {
            throw new FramingException(String.format(Locale.ROOT,
                    "Start marker mismatch: received=0x%02X expected=0x%02X", marker, startByte), false);
        }
    }

    private static ReadingBatch decodePayload(ByteBuffer buf,
                                              int limit,
                                              Schema schema,
                                              long sequence,
                                              int version,
                                              Instant timestamp,
                                              boolean crcPresent)
    {
        final List<SensorDefinition> sensors = schema.all();
        final List<Reading> readings = new ArrayList<>(sensors.size());
        boolean complete = crcPresent;

        int cursor = HEADER_LENGTH + schema.bitmapLength();

        for (int i = 0; i < sensors.size(); i++) {
            final SensorDefinition sensor = sensors.get(i);
            final int bitmapIndex = HEADER_LENGTH + (i / 8);

            if (bitmapIndex >= limit) {
                readings.add(Reading.missing(sensor.id(), timestamp));
                complete = false;
                continue;
            }

            // Absent sensors are not part of the batch.
            if ((buf.get(bitmapIndex) & (1 << (i % 8))) == 0) {
                continue;
            }

            final int width = sensor.wireType().width();
            if (cursor + width > limit) {
                readings.add(Reading.missing(sensor.id(), timestamp));
                complete = false;
                cursor += width;
                continue;
            }

            final double raw = WireValues.read(buf, cursor, sensor.wireType());
            cursor += width;

            final double value = sensor.fromRaw(raw);
            final boolean valid = Double.isFinite(value) && sensor.rawInRange(raw);
            readings.add(new Reading(sensor.id(), value, timestamp, valid));
        }

        return new ReadingBatch(sequence, version, timestamp, readings, complete);
    }
}
