/**
 * Telemetry Frame Codec
 * =============================================================================
 *
 * <p>The codec layer owns every byte-level rule of the telemetry wire format:
 * start marker, header layout, byte order, presence bitmap, fixed-point scaling
 * and the CRC trailer.</p>
 *
 * <pre>
 *   byte stream
 *        → StreamFramer            (link layer: delimits frames)
 *            → TelemetryFrame      (raw bytes of exactly one frame)
 *                → TelemetryFrameDecoder
 *                    → ReadingBatch
 * </pre>
 *
 * <p>Wire-level failures surface as {@link com.questrail.telemetry.codec.FrameIntegrityException}
 * and result in the frame being dropped and counted; they never reach
 * subscribers.</p>
 */
package com.questrail.telemetry.codec;
