package com.questrail.telemetry.link;

import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.codec.impl.TelemetryFrameLayout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;

/**
 * StreamFramer
 * -----------------------------------------------------------------------------
 * Delimits complete telemetry frames in an unbounded byte stream.
 *
 * <p>Bytes are accumulated across {@link #feed} calls. A candidate frame starts
 * at the start marker; it is accepted once the declared length is sane, all of
 * its bytes are buffered and its CRC matches. A candidate that fails a check is
 * abandoned by skipping a single byte and searching for the next marker, so a
 * marker value occurring inside garbage costs at most one resync.</p>
 *
 * <p>Marker and length limit are read through suppliers on every scan so a
 * schema reload takes effect on the next frame boundary.</p>
 *
 * <p>Not thread-safe: owned by the link supervisor thread.</p>
 */
public final class StreamFramer
{
    /**
     * Receives a notification for every run of bytes the framer gives up on.
     */
    @FunctionalInterface
    public interface DiscardListener
    {
        void onDiscarded(int byteCount, String reason);
    }

    private final IntSupplier startByte;
    private final IntSupplier maxPayloadLength;
    private final DiscardListener discardListener;

    private byte[] buffer = new byte[1024];
    private int size;
    private long discardedBytes;
    private long framesExtracted;

    public StreamFramer(IntSupplier startByte, IntSupplier maxPayloadLength, DiscardListener discardListener)
    {
        this.startByte = Objects.requireNonNull(startByte, "startByte");
        this.maxPayloadLength = Objects.requireNonNull(maxPayloadLength, "maxPayloadLength");
        this.discardListener = Objects.requireNonNull(discardListener, "discardListener");
    }

    /**
     * Appends {@code len} bytes and returns every frame completed by them, in stream order.
     */
    public List<TelemetryFrame> feed(byte[] data, int off, int len)
    {
        Objects.checkFromIndexSize(off, len, data.length);
        append(data, off, len);

        List<TelemetryFrame> frames = new ArrayList<>();
        while (size > 0) {
            final int marker = startByte.getAsInt();

            // 1) Locate start marker; everything before it is garbage
            final int start = indexOf(marker);
            if (start < 0) {
                discard(size, "no start marker");
                break;
            }
            if (start > 0) {
                discard(start, "bytes before start marker");
            }

            // 2) Wait for a complete header
            if (size < TelemetryFrameLayout.HEADER_LENGTH) {
                break;
            }

            // 3) Length sanity
            final int payloadLength = TelemetryFrameLayout.declaredPayloadLength(buffer, 0);
            if (payloadLength > Math.min(maxPayloadLength.getAsInt(), TelemetryFrameLayout.MAX_PAYLOAD_LENGTH)) {
                discard(1, "declared payload length " + payloadLength + " exceeds limit");
                continue;
            }

            // 4) Wait for the complete frame
            final int frameLength = TelemetryFrameLayout.frameLength(payloadLength);
            if (size < frameLength) {
                break;
            }

            // 5) CRC
            if (!TelemetryFrameLayout.crcMatches(buffer, 0, frameLength)) {
                discard(1, "CRC mismatch");
                continue;
            }

            frames.add(new TelemetryFrame(Arrays.copyOf(buffer, frameLength)));
            framesExtracted++;
            remove(frameLength);
        }
        return frames;
    }

    /**
     * Drops any partially buffered frame, e.g. after the link was lost.
     */
    public void reset()
    {
        if (size > 0) {
            discard(size, "partial frame at link loss");
        }
    }

    /** Bytes buffered but not yet part of a complete frame. */
    public int buffered()
    {
        return size;
    }

    public long discardedBytes()
    {
        return discardedBytes;
    }

    public long framesExtracted()
    {
        return framesExtracted;
    }

    private void discard(int count, String reason)
    {
        remove(count);
        discardedBytes += count;
        discardListener.onDiscarded(count, reason);
    }

    private int indexOf(int marker)
    {
        for (int i = 0; i < size; i++) {
            if ((buffer[i] & 0xFF) == marker) {
                return i;
            }
        }
        return -1;
    }

    private void append(byte[] data, int off, int len)
    {
        if (size + len > buffer.length) {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, size + len));
        }
        System.arraycopy(data, off, buffer, size, len);
        size += len;
    }

    private void remove(int count)
    {
        System.arraycopy(buffer, count, buffer, 0, size - count);
        size -= count;
    }
}
