/**
 * Concrete telemetry codec.
 *
 * <pre>
 *   TelemetryFrame
 *        → header (marker, version, sequence, timestamp, length)
 *        → TelemetryCrc.validate
 *        → presence bitmap + WireValues.read
 *        → ReadingBatch
 * </pre>
 *
 * <p>Any wire-level failure results in the frame being dropped.</p>
 */
package com.questrail.telemetry.codec.impl;
