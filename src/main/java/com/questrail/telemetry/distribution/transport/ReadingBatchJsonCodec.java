package com.questrail.telemetry.distribution.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.telemetry.api.Reading;
import com.questrail.telemetry.api.ReadingBatch;
import com.questrail.telemetry.distribution.DeliveredBatch;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SensorDefinition;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * ReadingBatchJsonCodec
 * -----------------------------------------------------------------------------
 * Serializes delivered batches, one JSON object per message, for presentation
 * clients.
 *
 * <pre>
 * {"type":"batch","sequence":17,"frame_sequence":4211,"schema_version":3,
 *  "timestamp":1718000000123,"complete":true,
 *  "readings":[{"sensor_id":"rpm","value":5000.0,"timestamp":1718000000123,"valid":true}]}
 * </pre>
 *
 * <p>Missing values ({@code NaN}) are written as JSON {@code null}. Timestamps
 * are epoch milliseconds. Clients detect dropped batches by gaps in
 * {@code sequence}.</p>
 *
 * <p>{@link #encodeSchema(Schema)} produces the sensor catalog sent to a client
 * when it registers, so it can label and range its displays.</p>
 */
public final class ReadingBatchJsonCodec {

    private final ObjectMapper mapper;

    public ReadingBatchJsonCodec() {
        this(new ObjectMapper());
    }

    public ReadingBatchJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(DeliveredBatch delivered) {
        return write(toJson(delivered));
    }

    public ObjectNode toJson(DeliveredBatch delivered) {
        Objects.requireNonNull(delivered, "delivered");
        ReadingBatch batch = delivered.batch();

        ObjectNode root = mapper.createObjectNode();
        root.put("type", "batch");
        root.put("sequence", delivered.sequence());
        root.put("frame_sequence", batch.frameSequence());
        root.put("schema_version", batch.schemaVersion());
        root.put("timestamp", batch.timestamp().toEpochMilli());
        root.put("complete", batch.complete());

        ArrayNode readings = root.putArray("readings");
        for (Reading reading : batch.readings()) {
            ObjectNode r = readings.addObject();
            r.put("sensor_id", reading.sensorId());
            if (Double.isFinite(reading.value())) {
                r.put("value", reading.value());
            } else {
                r.putNull("value");
            }
            r.put("timestamp", reading.timestamp().toEpochMilli());
            r.put("valid", reading.valid());
        }
        return root;
    }

    public byte[] encodeSchema(Schema schema) {
        Objects.requireNonNull(schema, "schema");

        ObjectNode root = mapper.createObjectNode();
        root.put("type", "schema");
        root.put("version", schema.version());

        ArrayNode sensors = root.putArray("sensors");
        for (SensorDefinition sensor : schema.all()) {
            ObjectNode s = sensors.addObject();
            s.put("id", sensor.id());
            s.put("name", sensor.name());
            s.put("units", sensor.units());
            s.put("group", sensor.group());
            s.put("min", sensor.min());
            s.put("max", sensor.max());
            s.put("on_dash", sensor.onDash());
            s.put("enabled", sensor.enabled());
        }
        return write(root);
    }

    private byte[] write(ObjectNode node) {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + node.get("type"), e);
        }
    }
}
