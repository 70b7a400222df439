package com.questrail.telemetry.distribution.transport;

import com.questrail.telemetry.distribution.DistributionHub;
import com.questrail.telemetry.distribution.SubscriberHandle;
import com.questrail.telemetry.distribution.SubscriberPump;
import com.questrail.telemetry.distribution.SubscriberState;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.TelemetryErrorEvent;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;
import com.questrail.telemetry.schema.Schema;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * UdpClientRegistry
 * =============================================================================
 * Turns presentation clients that talk to the relay's UDP endpoint into hub
 * subscribers.
 *
 * <h2>Client protocol</h2>
 * <ul>
 *   <li>Any datagram from an unknown address registers that address: it
 *       becomes a subscriber, receives the sensor catalog once and then one
 *       JSON batch per datagram.</li>
 *   <li>A datagram from a registered address whose subscription was dropped
 *       for being slow registers it again.</li>
 *   <li>{@code BYE} (case-insensitive) unsubscribes the address.</li>
 *   <li>At most {@link com.questrail.telemetry.config.DistributionConfig#maxClients()}
 *       addresses are registered at once; datagrams from further addresses are
 *       reported and otherwise ignored.</li>
 * </ul>
 *
 * <p>An address leaves the registry as soon as its pump exits, whether by
 * {@code BYE}, a slow-subscriber disconnect or a hub close.</p>
 *
 * <p>Each client is drained by its own {@link SubscriberPump}, so a slow
 * network path only affects that client.</p>
 */
public final class UdpClientRegistry implements DatagramEndpointListener {

    static final String GOODBYE = "BYE";

    private final DistributionHub hub;
    private final DatagramEndpoint endpoint;
    private final ReadingBatchJsonCodec codec;
    private final Supplier<Schema> schemaSupplier;
    private final TelemetryObservabilitySink observabilitySink;
    private final WallClock wallClock;

    private final Map<SocketAddress, SubscriberPump> clients = new ConcurrentHashMap<>();
    private final AtomicLong refusals = new AtomicLong();
    private final int maxClients;
    private volatile boolean up;

    public UdpClientRegistry(DistributionHub hub,
                             DatagramEndpoint endpoint,
                             ReadingBatchJsonCodec codec,
                             Supplier<Schema> schemaSupplier,
                             TelemetryObservabilitySink observabilitySink,
                             WallClock wallClock)
    {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.schemaSupplier = Objects.requireNonNull(schemaSupplier, "schemaSupplier");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.maxClients = hub.config().maxClients();
    }

    @Override
    public void onTransportUp() {
        up = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        up = false;
        if (cause != null) {
            observabilitySink.onError(new TelemetryErrorEvent(
                wallClock.now(),
                "Client UDP endpoint down",
                cause
            ));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        String message = new String(payload, StandardCharsets.US_ASCII).trim();

        if (GOODBYE.equalsIgnoreCase(message)) {
            SubscriberPump pump = clients.remove(remote);
            if (pump != null) {
                // The pump exits by itself once its subscriber is disconnected.
                hub.unsubscribe(pump.handle());
            }
            return;
        }

        final boolean[] refused = {false};
        try {
            clients.compute(remote, (address, existing) -> {
                if (existing != null && existing.handle().state() != SubscriberState.DISCONNECTED) {
                    return existing;
                }
                int others = clients.size() - (existing != null ? 1 : 0);
                if (others >= maxClients) {
                    refused[0] = true;
                    return null;
                }
                return register(address);
            });
        } catch (IllegalStateException e) {
            // Hub closed or no schema loaded yet; the client may retry.
            observabilitySink.onError(new TelemetryErrorEvent(
                wallClock.now(),
                "Cannot register client " + remote,
                e
            ));
            return;
        }

        if (refused[0]) {
            refusals.incrementAndGet();
            observabilitySink.onError(new TelemetryErrorEvent(
                wallClock.now(),
                "Client limit of " + maxClients + " reached, ignoring " + remote,
                null
            ));
        }
    }

    private SubscriberPump register(SocketAddress remote) {
        byte[] catalog = codec.encodeSchema(schemaSupplier.get());
        SubscriberHandle handle = hub.subscribe("udp:" + remote);
        endpoint.send(remote, catalog);

        SubscriberPump pump = new SubscriberPump(
            handle,
            delivered -> endpoint.send(remote, codec.encode(delivered)),
            observabilitySink,
            wallClock
        );
        pump.whenFinished(() -> clients.remove(remote, pump));
        pump.start();
        return pump;
    }

    public boolean isUp() {
        return up;
    }

    public int clientCount() {
        return clients.size();
    }

    /** Registrations refused because the client limit was reached. */
    public long refusedCount() {
        return refusals.get();
    }

    public List<SocketAddress> clients() {
        return new ArrayList<>(clients.keySet());
    }

    /**
     * Waits until every client pump has exited, e.g. after the hub was closed
     * with draining, bounded by {@code timeout} per client.
     */
    public void awaitDrained(Duration timeout) throws InterruptedException {
        for (SubscriberPump pump : new ArrayList<>(clients.values())) {
            pump.awaitTermination(timeout);
        }
    }

    /**
     * Unsubscribes every client and stops its pump.
     */
    public void close() {
        List<SubscriberPump> pumps = new ArrayList<>(clients.values());
        clients.clear();
        for (SubscriberPump pump : pumps) {
            hub.unsubscribe(pump.handle());
            pump.stop();
        }
    }
}
