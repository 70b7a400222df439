package com.questrail.telemetry.distribution.transport.netty;

import com.questrail.telemetry.distribution.transport.DatagramEndpoint;
import com.questrail.telemetry.distribution.transport.DatagramEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyUdpDatagramEndpoint
 * =============================================================================
 * Netty UDP socket serving presentation clients.
 *
 * <h2>Scope</h2>
 * Moves bytes only. Client bookkeeping and JSON belong to
 * {@link com.questrail.telemetry.distribution.transport.UdpClientRegistry};
 * nothing Netty-typed leaves this package. Inbound datagrams are copied to
 * {@code byte[]} before the listener sees them.
 *
 * <h2>Outbound pressure</h2>
 * Every client pump writes through the one channel. While the channel is not
 * writable (the socket send buffer is full) further sends are dropped and
 * counted rather than queued in Netty, so one stalled network path cannot
 * grow the relay's heap. Subscriber queues already bound what each client
 * may fall behind by.
 */
public final class NettyUdpDatagramEndpoint implements DatagramEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyUdpDatagramEndpoint.class);

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup group;
    private final Bootstrap bootstrap;
    private final AtomicLong sendsDropped = new AtomicLong();

    private volatile DatagramEndpointListener listener;
    private volatile Channel channel;

    public NettyUdpDatagramEndpoint(InetSocketAddress bindAddress)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.group = new NioEventLoopGroup(1, new DefaultThreadFactory("telemetry-udp-clients", true));
        this.bootstrap = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new ChannelInitializer<NioDatagramChannel>() {
                    @Override
                    protected void initChannel(NioDatagramChannel ch)
                    {
                        ch.pipeline().addLast(new ClientDatagramHandler());
                    }
                });
    }

    @Override
    public void setListener(DatagramEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        final DatagramEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("listener must be set before start()");
        }

        bootstrap.bind(bindAddress).addListener((ChannelFutureListener) bound -> {
            if (!bound.isSuccess()) {
                log.error("Cannot bind client endpoint to {}", bindAddress, bound.cause());
                l.onTransportDown(bound.cause());
                return;
            }
            channel = bound.channel();
            log.info("Serving telemetry clients on {}", bound.channel().localAddress());
            l.onTransportUp();
        });
    }

    @Override
    public void stop()
    {
        final Channel ch = channel;
        channel = null;
        if (ch != null) {
            // channelInactive reports the orderly shutdown to the listener.
            ch.close().syncUninterruptibly();
        }
        group.shutdownGracefully();
    }

    @Override
    public void send(SocketAddress remote, byte[] payload)
    {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        final Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (!ch.isWritable()) {
            if (sendsDropped.incrementAndGet() % 1000 == 1) {
                log.warn("Client socket not writable; {} sends dropped so far", sendsDropped.get());
            }
            return;
        }

        final ByteBuf buf = Unpooled.wrappedBuffer(payload);
        ch.writeAndFlush(new DatagramPacket(buf, (InetSocketAddress) remote))
          .addListener((ChannelFutureListener) written -> {
              if (!written.isSuccess()) {
                  log.debug("Send to {} failed: {}", remote, written.cause().toString());
              }
          });
    }

    @Override
    public Optional<InetSocketAddress> localAddress()
    {
        final Channel ch = channel;
        return ch == null ? Optional.empty() : Optional.of((InetSocketAddress) ch.localAddress());
    }

    /**
     * Datagrams dropped because the socket send buffer was full.
     */
    public long sendsDropped()
    {
        return sendsDropped.get();
    }

    private final class ClientDatagramHandler extends SimpleChannelInboundHandler<DatagramPacket>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet)
        {
            final DatagramEndpointListener l = listener;
            if (l == null) {
                return;
            }
            final ByteBuf content = packet.content();
            final byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);
            l.onDatagram(packet.sender(), bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            final DatagramEndpointListener l = listener;
            if (l != null) {
                l.onTransportDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            // UDP channels survive per-datagram errors such as ICMP port unreachable.
            log.debug("Client endpoint error: {}", cause.toString());
        }
    }
}
