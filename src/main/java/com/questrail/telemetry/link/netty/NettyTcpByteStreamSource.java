package com.questrail.telemetry.link.netty;

import com.questrail.telemetry.link.ByteStreamSource;
import com.questrail.telemetry.link.LinkException;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NettyTcpByteStreamSource
 * -----------------------------------------------------------------------------
 * Adapts Netty's push model to the pull-style {@link ByteStreamSource} port.
 *
 * <p>The channel's event loop copies every inbound {@link ByteBuf} into a
 * {@code byte[]} and queues it; the supervisor thread drains the queue from
 * {@link #read}. End of stream and failures are queued as markers so they are
 * observed in order after the last data chunk.</p>
 *
 * <p>Once {@link #PAUSE_AT} chunks are waiting, the channel stops reading
 * from the socket and TCP flow control pushes back on the sender; reading
 * resumes when the supervisor has drained the backlog to {@link #RESUME_AT}.</p>
 */
final class NettyTcpByteStreamSource implements ByteStreamSource
{
    static final int PAUSE_AT = 64;
    static final int RESUME_AT = 16;

    private static final Object END_OF_STREAM = new Object();

    private final BlockingQueue<Object> inbound = new LinkedBlockingQueue<>();
    private final AtomicInteger bufferedChunks = new AtomicInteger();

    private volatile Channel channel;
    private volatile boolean closed;

    private byte[] pending;
    private int pendingOffset;

    void attach(Channel channel)
    {
        this.channel = channel;
        if (closed) {
            channel.close();
        }
    }

    InboundHandler handler()
    {
        return new InboundHandler();
    }

    @Override
    public int read(byte[] buf, Duration timeout) throws LinkException, InterruptedException
    {
        if (pending == null) {
            Object item = inbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (item == null) {
                return 0;
            }
            if (item == END_OF_STREAM) {
                // Keep the marker so every later read also reports end of stream.
                inbound.offer(END_OF_STREAM);
                return -1;
            }
            if (item instanceof Throwable cause) {
                inbound.offer(END_OF_STREAM);
                throw new LinkException("TCP link failed: " + cause.getMessage(), cause);
            }
            pending = (byte[]) item;
            pendingOffset = 0;
            if (bufferedChunks.decrementAndGet() <= RESUME_AT) {
                resumeReading();
            }
        }

        int n = Math.min(buf.length, pending.length - pendingOffset);
        System.arraycopy(pending, pendingOffset, buf, 0, n);
        pendingOffset += n;
        if (pendingOffset == pending.length) {
            pending = null;
        }
        return n;
    }

    /** Data chunks received but not yet handed to {@link #read}. */
    int bufferedChunks()
    {
        return bufferedChunks.get();
    }

    private void resumeReading()
    {
        Channel ch = channel;
        if (ch != null && !ch.config().isAutoRead()) {
            ch.config().setAutoRead(true);
        }
    }

    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }
        inbound.offer(END_OF_STREAM);
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Copies inbound bytes off the event loop (Netty containment rule).
     */
    final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf msg)
        {
            byte[] bytes = new byte[msg.readableBytes()];
            msg.getBytes(msg.readerIndex(), bytes);
            inbound.offer(bytes);
            if (bufferedChunks.incrementAndGet() >= PAUSE_AT) {
                ctx.channel().config().setAutoRead(false);
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            inbound.offer(END_OF_STREAM);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            inbound.offer(cause);
            ctx.close();
        }
    }
}
