package com.questrail.telemetry.link.netty;

import com.questrail.telemetry.link.ByteStreamSource;
import com.questrail.telemetry.link.LinkConnector;
import com.questrail.telemetry.link.LinkException;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * NettyTcpLinkConnector
 * =============================================================================
 * Netty-backed {@link LinkConnector} that opens a TCP connection to the
 * vehicle's telemetry feed (or a socket-based test feed standing in for it).
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Everything above sees a plain
 * {@link ByteStreamSource}.
 *
 * <h2>Lifecycle</h2>
 * - {@link #open(Duration)} connects a fresh channel per attempt.
 * - {@link #close()} shuts down the event loop group shared by all attempts.
 */
public final class NettyTcpLinkConnector implements LinkConnector
{
    private final InetSocketAddress remoteAddress;
    private final EventLoopGroup group;

    public NettyTcpLinkConnector(InetSocketAddress remoteAddress)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public ByteStreamSource open(Duration timeout) throws LinkException, InterruptedException
    {
        final NettyTcpByteStreamSource source = new NettyTcpByteStreamSource();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ch.pipeline().addLast(source.handler());
                    }
                });

        ChannelFuture f;
        try {
            f = bootstrap.connect(remoteAddress);
        } catch (RuntimeException e) {
            throw new LinkException("Cannot connect to " + description(), e);
        }

        if (!f.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            f.cancel(true);
            f.channel().close();
            throw new LinkException("Connect to " + description() + " timed out");
        }
        if (!f.isSuccess()) {
            throw new LinkException("Connect to " + description() + " failed", f.cause());
        }

        source.attach(f.channel());
        return source;
    }

    @Override
    public String description()
    {
        return "tcp://" + remoteAddress.getHostString() + ":" + remoteAddress.getPort();
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }
}
