package com.questrail.telemetry.test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.telemetry.codec.frame.TelemetryFrame;
import com.questrail.telemetry.codec.impl.DefaultTelemetryFrameEncoder;
import com.questrail.telemetry.config.DistributionConfig;
import com.questrail.telemetry.distribution.DistributionHub;
import com.questrail.telemetry.distribution.TestBatches;
import com.questrail.telemetry.distribution.transport.ReadingBatchJsonCodec;
import com.questrail.telemetry.distribution.transport.UdpClientRegistry;
import com.questrail.telemetry.distribution.transport.netty.NettyUdpDatagramEndpoint;
import com.questrail.telemetry.internal.time.SystemMonotonicClock;
import com.questrail.telemetry.internal.time.SystemSleeper;
import com.questrail.telemetry.internal.time.SystemWallClock;
import com.questrail.telemetry.link.LinkException;
import com.questrail.telemetry.link.LinkSupervisor;
import com.questrail.telemetry.link.LinkTimingPolicy;
import com.questrail.telemetry.link.StreamFramer;
import com.questrail.telemetry.link.netty.NettyTcpLinkConnector;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.TestSchemas;
import org.junit.jupiter.api.Test;

import java.io.OutputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTransportIntegrationTest
 * -----------------------------------------------------------------------------
 * Exercises the Netty adapters over loopback sockets: the TCP link connector
 * feeding the supervisor, and the UDP endpoint serving a presentation client.
 */
final class NettyTransportIntegrationTest {

    private static final InetAddress LOOPBACK = InetAddress.getLoopbackAddress();

    private final Schema schema = TestSchemas.engine();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void tcpFramesReachTheSupervisorConsumer() throws Exception {
        DefaultTelemetryFrameEncoder encoder = new DefaultTelemetryFrameEncoder();
        byte[] first = encoder.encode(Map.of("rpm", 1200.0), schema, 1, Instant.EPOCH).bytes();
        byte[] second = encoder.encode(Map.of("rpm", 1300.0), schema, 2, Instant.EPOCH).bytes();

        try (ServerSocket server = new ServerSocket(0, 1, LOOPBACK)) {
            Thread feed = new Thread(() -> {
                try (Socket vehicle = server.accept()) {
                    OutputStream out = vehicle.getOutputStream();
                    out.write(new byte[] {0x00, 0x7F});
                    out.write(first, 0, 9);
                    out.flush();
                    out.write(first, 9, first.length - 9);
                    out.write(second);
                    out.flush();
                    Thread.sleep(200);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }, "test-vehicle-feed");
            feed.setDaemon(true);
            feed.start();

            List<TelemetryFrame> frames = new CopyOnWriteArrayList<>();
            CountDownLatch received = new CountDownLatch(2);
            NettyTcpLinkConnector connector =
                new NettyTcpLinkConnector(new InetSocketAddress(LOOPBACK, server.getLocalPort()));
            StreamFramer framer = new StreamFramer(schema::startByte, schema::fullPayloadLength, (n, reason) -> {});
            LinkSupervisor supervisor = new LinkSupervisor(
                connector, framer,
                frame -> {
                    frames.add(frame);
                    received.countDown();
                },
                LinkTimingPolicy.defaults(),
                SystemMonotonicClock.INSTANCE, SystemSleeper.INSTANCE, SystemWallClock.INSTANCE,
                NullObservabilitySink.INSTANCE);

            try {
                supervisor.start();
                assertTrue(received.await(5, TimeUnit.SECONDS));
                assertEquals(List.of(new TelemetryFrame(first), new TelemetryFrame(second)), frames);
            } finally {
                supervisor.stop();
                connector.close();
            }
        }
    }

    @Test
    void refusedTcpConnectIsALinkException() throws Exception {
        int port;
        try (ServerSocket reserved = new ServerSocket(0, 1, LOOPBACK)) {
            port = reserved.getLocalPort();
        }

        NettyTcpLinkConnector connector = new NettyTcpLinkConnector(new InetSocketAddress(LOOPBACK, port));
        try {
            assertThrows(LinkException.class, () -> connector.open(Duration.ofSeconds(2)));
        } finally {
            connector.close();
        }
    }

    @Test
    void udpClientRegistersAndReceivesBatches() throws Exception {
        DistributionHub hub = new DistributionHub(
            DistributionConfig.defaults(), NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
        NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(new InetSocketAddress(LOOPBACK, 0));
        UdpClientRegistry registry = new UdpClientRegistry(hub, endpoint, new ReadingBatchJsonCodec(mapper),
            () -> schema, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
        endpoint.setListener(registry);

        try (DatagramSocket client = new DatagramSocket(0, LOOPBACK)) {
            client.setSoTimeout(5000);
            endpoint.start();
            InetSocketAddress relay = awaitBound(endpoint);

            send(client, relay, "HELLO");
            JsonNode catalog = receive(client);
            assertEquals("schema", catalog.get("type").asText());
            assertEquals(schema.size(), catalog.get("sensors").size());

            hub.publish(TestBatches.batch(11));
            JsonNode batch = receive(client);
            assertEquals("batch", batch.get("type").asText());
            assertEquals(11, batch.get("frame_sequence").asLong());

            send(client, relay, "BYE");
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (hub.subscriberCount() > 0 && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            assertEquals(0, hub.subscriberCount());
            assertEquals(0, registry.clientCount());
        } finally {
            registry.close();
            endpoint.stop();
        }
    }

    private static InetSocketAddress awaitBound(NettyUdpDatagramEndpoint endpoint) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (System.nanoTime() < deadline) {
            if (endpoint.localAddress().isPresent()) {
                return endpoint.localAddress().get();
            }
            Thread.sleep(10);
        }
        throw new AssertionError("UDP endpoint did not bind");
    }

    private static void send(DatagramSocket client, InetSocketAddress relay, String text) throws Exception {
        byte[] payload = text.getBytes(StandardCharsets.US_ASCII);
        client.send(new DatagramPacket(payload, payload.length, relay));
    }

    private JsonNode receive(DatagramSocket client) throws Exception {
        byte[] buf = new byte[65_507];
        DatagramPacket packet = new DatagramPacket(buf, buf.length);
        client.receive(packet);
        return mapper.readTree(buf, 0, packet.getLength());
    }
}
