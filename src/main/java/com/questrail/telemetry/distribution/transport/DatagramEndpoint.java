package com.questrail.telemetry.distribution.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * The relay's side of the presentation-client channel. Clients announce
 * themselves with a datagram; the relay answers with catalog and batch
 * messages addressed back to them.
 *
 * <p>{@link UdpClientRegistry} is the only intended listener. The Netty
 * implementation lives in the {@code netty} subpackage; tests substitute an
 * in-memory endpoint.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Binds and starts receiving. The listener sees {@code onTransportUp()}
     * once the socket is bound.
     */
    void start();

    /**
     * Unbinds. The listener sees {@code onTransportDown(null)} if the
     * endpoint was up.
     */
    void stop();

    /**
     * Queues one message for {@code remote}. Dropped without error while the
     * endpoint is down, as any datagram may be.
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Must be set before {@link #start()}.
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound address, once bound. Lets callers that asked for port 0
     * learn the actual port.
     */
    Optional<InetSocketAddress> localAddress();
}
