package com.questrail.telemetry.codec;

import com.questrail.telemetry.api.ReadingBatch;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.schema.Schema;

/**
 * TelemetryFrameDecoder
 * -----------------------------------------------------------------------------
 * Translates one raw {@link TelemetryFrame} into a {@link ReadingBatch} under a
 * given {@link Schema}.
 *
 * <p>The decoder is responsible for:</p>
 * <ul>
 *   <li>Validating the start marker, header length and CRC</li>
 *   <li>Applying byte order and fixed-point scaling per sensor</li>
 *   <li>Flagging out-of-range values as invalid readings</li>
 *   <li>Decoding as much as fits when the frame is truncated</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for delimiting frames in
 * a byte stream, comparing schema versions, or buffering partial data.</p>
 *
 * <p>Implementations must be stateless and safe for concurrent use.</p>
 */
public interface TelemetryFrameDecoder
{
    /**
     * Decode a single frame.
     *
     * <p>A value outside its sensor's declared range never aborts the batch;
     * it is delivered with {@code valid=false}. Sensors whose bytes lie beyond
     * the end of a truncated frame are delivered as missing readings and the
     * batch is marked incomplete. Bytes after the frame are ignored.</p>
     *
     * @param frame  raw frame bytes starting at the start marker
     * @param schema schema captured by the caller for this frame
     * @return one batch containing a reading per sensor present in the frame
     * @throws FrameIntegrityException if the marker, header or CRC is invalid
     */
    ReadingBatch decode(TelemetryFrame frame, Schema schema) throws FrameIntegrityException;
}
