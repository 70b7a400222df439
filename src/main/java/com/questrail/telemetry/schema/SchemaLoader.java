package com.questrail.telemetry.schema;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * SchemaLoader
 * -----------------------------------------------------------------------------
 * Parses a JSON sensor catalog into a validated {@link Schema}.
 *
 * <p>Document shape:</p>
 * <pre>
 * {
 *   "version": 3,
 *   "startByte": 1,
 *   "sensors": {
 *     "rpm": {
 *       "name": "RPM", "units": "rpm", "enable": true, "group": "Core",
 *       "min": 0, "max": 10000, "on_dash": true,
 *       "type": "uint16", "scale": 1, "offset": 0,
 *       "emulation": { "rule": "sine", "amplitude": 5000, "offset": 5000, "period": 36 }
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>The order of keys under {@code sensors} is the declaration order and
 * therefore the wire order. {@code enable}, {@code group}, {@code min},
 * {@code max} and {@code on_dash} are mandatory; the remaining attributes
 * default to {@code name = id}, {@code units = ""}, {@code type = int32},
 * {@code scale = 1}, {@code offset = 0} and no emulation rule.</p>
 *
 * <p>Duplicate keys are rejected rather than silently overwritten.</p>
 */
public final class SchemaLoader
{
    private final ObjectMapper mapper;

    public SchemaLoader() {
        this.mapper = new ObjectMapper();
        this.mapper.enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);
    }

    /**
     * Reads and validates the document behind {@code source}.
     *
     * @throws SchemaException if the document cannot be read or violates any invariant
     */
    public Schema load(SchemaSource source) throws SchemaException {
        Objects.requireNonNull(source, "source");

        final JsonNode root;
        try (InputStream in = source.open()) {
            root = mapper.readTree(in);
        }
        catch (JacksonException e) {
            throw new SchemaException(classify(e), null, "unparseable schema " + source.description()
                    + ": " + e.getOriginalMessage(), e);
        }
        catch (IOException e) {
            throw new SchemaException(SchemaException.Kind.IO_FAILURE, null,
                    "cannot read schema " + source.description(), e);
        }

        if (root == null || !root.isObject()) {
            throw new SchemaException(SchemaException.Kind.MALFORMED_SOURCE, null, "schema root must be an object");
        }

        int version = intField(root, "version", 0);
        int startByte = root.has("startByte")
                ? intField(root, "startByte", Schema.DEFAULT_START_BYTE)
                : intField(root, "start_byte", Schema.DEFAULT_START_BYTE);

        JsonNode sensorsNode = root.get("sensors");
        if (sensorsNode == null || !sensorsNode.isObject()) {
            throw new SchemaException(SchemaException.Kind.MISSING_FIELD, null, "'sensors' object is required");
        }

        List<SensorDefinition> sensors = new ArrayList<>(sensorsNode.size());
        Iterator<Map.Entry<String, JsonNode>> it = sensorsNode.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            sensors.add(parseSensor(entry.getKey(), entry.getValue()));
        }

        return Schema.of(version, startByte, sensors);
    }

    private static SchemaException.Kind classify(JacksonException e) {
        String msg = e.getOriginalMessage();
        return msg != null && msg.startsWith("Duplicate field")
                ? SchemaException.Kind.DUPLICATE_ID
                : SchemaException.Kind.MALFORMED_SOURCE;
    }

    private static SensorDefinition parseSensor(String id, JsonNode node) throws SchemaException {
        if (!node.isObject()) {
            throw new SchemaException(SchemaException.Kind.MALFORMED_SOURCE, id, "sensor entry must be an object");
        }

        SensorDefinition.Builder b = SensorDefinition.builder(id)
                .name(textField(id, node, "name", id))
                .units(textField(id, node, "units", ""))
                .group(requiredText(id, node, "group"))
                .enabled(requiredBoolean(id, node, "enable"))
                .onDash(requiredBoolean(id, node, "on_dash"))
                .range(requiredNumber(id, node, "min"), requiredNumber(id, node, "max"))
                .scale(optionalNumber(id, node, "scale", 1.0))
                .offset(optionalNumber(id, node, "offset", 0.0));

        JsonNode type = node.get("type");
        if (type != null) {
            if (!type.isTextual()) {
                throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, id, "'type' must be a string");
            }
            try {
                b.wireType(WireType.fromSchemaName(type.asText()));
            }
            catch (IllegalArgumentException e) {
                throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, id, e.getMessage());
            }
        }

        JsonNode emulation = node.get("emulation");
        if (emulation != null && !emulation.isNull()) {
            b.rule(parseRule(id, emulation));
        }

        return b.build();
    }

    private static EmulationRule parseRule(String id, JsonNode node) throws SchemaException {
        if (!node.isObject()) {
            throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                    "'emulation' must be a rule object, not an expression");
        }
        JsonNode tag = node.get("rule");
        if (tag == null || !tag.isTextual()) {
            throw new SchemaException(SchemaException.Kind.INVALID_RULE, id, "emulation rule requires a 'rule' tag");
        }

        switch (tag.asText()) {
            case "sine":
                return new EmulationRule.Sine(
                        ruleNumber(id, node, "amplitude"),
                        ruleNumber(id, node, "offset"),
                        ruleNumber(id, node, "period"));
            case "cosine":
                return new EmulationRule.Cosine(
                        ruleNumber(id, node, "amplitude"),
                        ruleNumber(id, node, "offset"),
                        ruleNumber(id, node, "period"));
            case "uniform_random":
                return new EmulationRule.UniformRandom(
                        ruleNumber(id, node, "low"),
                        ruleNumber(id, node, "high"));
            case "constant":
                return new EmulationRule.Constant(ruleNumber(id, node, "value"));
            case "linear":
                JsonNode period = node.get("period");
                if (period != null && !period.canConvertToLong()) {
                    throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                            "linear 'period' must be an integer tick count");
                }
                return new EmulationRule.Linear(
                        ruleNumber(id, node, "intercept"),
                        ruleNumber(id, node, "slope"),
                        period == null ? 0L : period.asLong());
            default:
                throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                        "unknown emulation rule '" + tag.asText() + "'");
        }
    }

    private static double ruleNumber(String id, JsonNode node, String field) throws SchemaException {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new SchemaException(SchemaException.Kind.INVALID_RULE, id,
                    "emulation rule '" + node.get("rule").asText() + "' requires numeric '" + field + "'");
        }
        return v.asDouble();
    }

    private static int intField(JsonNode root, String field, int defaultValue) throws SchemaException {
        JsonNode v = root.get(field);
        if (v == null) {
            return defaultValue;
        }
        if (!v.canConvertToInt() || !v.isIntegralNumber()) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, null, "'" + field + "' must be an integer");
        }
        return v.asInt();
    }

    private static String textField(String id, JsonNode node, String field, String defaultValue)
            throws SchemaException
    {
        JsonNode v = node.get(field);
        if (v == null) {
            return defaultValue;
        }
        if (!v.isTextual()) {
            throw new SchemaException(SchemaException.Kind.MISSING_FIELD, id, "'" + field + "' must be a string");
        }
        return v.asText();
    }

    private static String requiredText(String id, JsonNode node, String field) throws SchemaException {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new SchemaException(SchemaException.Kind.MISSING_FIELD, id, "string '" + field + "' is required");
        }
        return v.asText();
    }

    private static boolean requiredBoolean(String id, JsonNode node, String field) throws SchemaException {
        JsonNode v = node.get(field);
        if (v == null || !v.isBoolean()) {
            throw new SchemaException(SchemaException.Kind.MISSING_FIELD, id, "boolean '" + field + "' is required");
        }
        return v.asBoolean();
    }

    private static double requiredNumber(String id, JsonNode node, String field) throws SchemaException {
        JsonNode v = node.get(field);
        if (v == null || !v.isNumber()) {
            throw new SchemaException(SchemaException.Kind.MISSING_FIELD, id, "number '" + field + "' is required");
        }
        return v.asDouble();
    }

    private static double optionalNumber(String id, JsonNode node, String field, double defaultValue)
            throws SchemaException
    {
        JsonNode v = node.get(field);
        if (v == null) {
            return defaultValue;
        }
        if (!v.isNumber()) {
            throw new SchemaException(SchemaException.Kind.INVALID_ENCODING, id, "'" + field + "' must be a number");
        }
        return v.asDouble();
    }
}
