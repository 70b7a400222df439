package com.questrail.telemetry.distribution.transport;

import java.net.SocketAddress;

/**
 * Receives client datagrams and endpoint lifecycle changes from a
 * {@link DatagramEndpoint}.
 *
 * <p>Calls arrive one at a time (the Netty endpoint makes them on its event
 * loop), so implementations must return quickly.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause failure that took the endpoint down, or {@code null} after
     *              {@link DatagramEndpoint#stop()}
     */
    void onTransportDown(Throwable cause);

    /**
     * @param payload a private copy of the datagram body
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
