package com.questrail.telemetry.schema;

import java.util.Objects;
import java.util.Optional;

/**
 * Raised when a schema source cannot be turned into a valid {@link Schema}.
 *
 * <p>A schema load is all-or-nothing: when this exception is thrown, no part of
 * the source has been applied and any previously active schema stays active.</p>
 */
public final class SchemaException extends Exception
{
    public enum Kind {
        /** The source could not be read. */
        IO_FAILURE,
        /** The source is not a well-formed schema document. */
        MALFORMED_SOURCE,
        /** A mandatory attribute is absent or has the wrong type. */
        MISSING_FIELD,
        /** A sensor id is empty. */
        EMPTY_ID,
        /** Two sensors share an id. */
        DUPLICATE_ID,
        /** {@code min > max}, or a bound is not finite. */
        INVALID_RANGE,
        /** Unknown wire type, bad scale, or out-of-range header attribute. */
        INVALID_ENCODING,
        /** The declared range cannot be carried by the declared wire type. */
        UNREPRESENTABLE_RANGE,
        /** An emulation rule is unknown or has invalid parameters. */
        INVALID_RULE,
        /** The schema declares no sensors. */
        EMPTY_SCHEMA
    }

    private final Kind kind;
    private final String sensorId;
    private final String detail;

    public SchemaException(Kind kind, String sensorId, String detail) {
        this(kind, sensorId, detail, null);
    }

    public SchemaException(Kind kind, String sensorId, String detail, Throwable cause) {
        super(format(kind, sensorId, detail), cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.sensorId = sensorId;
        this.detail = Objects.requireNonNull(detail, "detail");
    }

    public Kind kind() {
        return kind;
    }

    /** Sensor the violation was found on, if it concerns a single sensor. */
    public Optional<String> sensorId() {
        return Optional.ofNullable(sensorId);
    }

    public String detail() {
        return detail;
    }

    private static String format(Kind kind, String sensorId, String detail) {
        return sensorId == null
                ? kind + ": " + detail
                : kind + " [" + sensorId + "]: " + detail;
    }
}
