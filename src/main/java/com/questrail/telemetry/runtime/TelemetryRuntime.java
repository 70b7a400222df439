package com.questrail.telemetry.runtime;

import com.questrail.telemetry.codec.impl.DefaultTelemetryFrameDecoder;
import com.questrail.telemetry.codec.impl.DefaultTelemetryFrameEncoder;
import com.questrail.telemetry.config.TelemetryRuntimeConfig;
import com.questrail.telemetry.distribution.DistributionHub;
import com.questrail.telemetry.distribution.SubscriberHandle;
import com.questrail.telemetry.distribution.transport.DatagramEndpoint;
import com.questrail.telemetry.distribution.transport.ReadingBatchJsonCodec;
import com.questrail.telemetry.distribution.transport.UdpClientRegistry;
import com.questrail.telemetry.distribution.transport.netty.NettyUdpDatagramEndpoint;
import com.questrail.telemetry.emulation.EmulatedLinkConnector;
import com.questrail.telemetry.emulation.EmulationRuleInterpreter;
import com.questrail.telemetry.emulation.Emulator;
import com.questrail.telemetry.internal.time.MonotonicClock;
import com.questrail.telemetry.internal.time.Sleeper;
import com.questrail.telemetry.internal.time.SystemMonotonicClock;
import com.questrail.telemetry.internal.time.SystemSleeper;
import com.questrail.telemetry.internal.time.SystemWallClock;
import com.questrail.telemetry.internal.time.WallClock;
import com.questrail.telemetry.link.LinkConnector;
import com.questrail.telemetry.link.LinkState;
import com.questrail.telemetry.link.LinkSupervisor;
import com.questrail.telemetry.link.StreamFramer;
import com.questrail.telemetry.link.netty.NettyTcpLinkConnector;
import com.questrail.telemetry.observability.NullObservabilitySink;
import com.questrail.telemetry.observability.TelemetryObservabilitySink;
import com.questrail.telemetry.schema.Schema;
import com.questrail.telemetry.schema.SchemaException;
import com.questrail.telemetry.schema.SchemaLoader;
import com.questrail.telemetry.schema.SchemaRegistry;
import com.questrail.telemetry.schema.SchemaSource;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TelemetryRuntime
 * =============================================================================
 * Unified composition root and lifecycle owner for the telemetry relay.
 *
 * <pre>
 *   LinkConnector (TCP or emulator)
 *        → LinkSupervisor + StreamFramer
 *            → TelemetryPipeline (decode against SchemaRegistry.current())
 *                → DistributionHub
 *                    → SubscriberPump per subscriber (e.g. UDP clients)
 * </pre>
 *
 * <p>{@link #start()} loads the schema first; a schema that fails to load is
 * thrown to the caller and nothing is started. {@link #stop(boolean)} releases
 * the link immediately and then closes the hub.</p>
 */
public final class TelemetryRuntime {

    private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final TelemetryRuntimeConfig config;
    private final SchemaRegistry schemaRegistry;
    private final DistributionHub hub;
    private final TelemetryPipeline pipeline;
    private final LinkConnector connector;
    private final LinkSupervisor supervisor;
    private final DatagramEndpoint clientEndpoint;
    private final UdpClientRegistry clientRegistry;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private TelemetryRuntime(TelemetryRuntimeConfig config,
                             SchemaRegistry schemaRegistry,
                             DistributionHub hub,
                             TelemetryPipeline pipeline,
                             LinkConnector connector,
                             LinkSupervisor supervisor,
                             DatagramEndpoint clientEndpoint,
                             UdpClientRegistry clientRegistry)
    {
        this.config = config;
        this.schemaRegistry = schemaRegistry;
        this.hub = hub;
        this.pipeline = pipeline;
        this.connector = connector;
        this.supervisor = supervisor;
        this.clientEndpoint = clientEndpoint;
        this.clientRegistry = clientRegistry;
    }

    /**
     * Loads the schema, then starts client transport and the link supervisor.
     * Idempotent once it has succeeded.
     *
     * @throws SchemaException if the initial schema cannot be loaded
     */
    public void start() throws SchemaException {
        if (started.get()) {
            return;
        }
        schemaRegistry.reload(config.schemaSource());

        if (started.compareAndSet(false, true)) {
            if (clientEndpoint != null) {
                clientEndpoint.start();
            }
            supervisor.start();
        }
    }

    /**
     * Stops the link, then closes the hub.
     *
     * @param drain if true, subscribers may still consume batches queued before
     *              the stop; otherwise queued batches are discarded
     */
    public void stop(boolean drain) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }

        supervisor.stop();
        connector.close();
        hub.close(drain);

        if (clientRegistry != null) {
            if (drain) {
                try {
                    clientRegistry.awaitDrained(DRAIN_TIMEOUT);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            clientRegistry.close();
            clientEndpoint.stop();
        }
    }

    /**
     * Reloads the schema from the configured source.
     *
     * @throws SchemaException if the new schema is invalid; the previous one stays active
     */
    public Schema reloadSchema() throws SchemaException {
        return schemaRegistry.reload(config.schemaSource());
    }

    public Schema reloadSchema(SchemaSource source) throws SchemaException {
        return schemaRegistry.reload(source);
    }

    public SubscriberHandle subscribe(String name) {
        return hub.subscribe(name);
    }

    public void unsubscribe(SubscriberHandle handle) {
        hub.unsubscribe(handle);
    }

    public Schema schema() {
        return schemaRegistry.current();
    }

    public LinkState linkState() {
        return supervisor.state();
    }

    public PipelineStatistics statistics() {
        return pipeline.statistics();
    }

    public DistributionHub hub() {
        return hub;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TelemetryRuntimeConfig config;
        private TelemetryObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private LinkConnector linkConnector;
        private DatagramEndpoint clientEndpoint;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Sleeper sleeper = SystemSleeper.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withConfig(TelemetryRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(TelemetryObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Overrides the link chosen from configuration (TCP or emulator).
         */
        public Builder withLinkConnector(LinkConnector connector) {
            this.linkConnector = connector;
            return this;
        }

        /**
         * Overrides the UDP client endpoint chosen from configuration.
         */
        public Builder withClientEndpoint(DatagramEndpoint endpoint) {
            this.clientEndpoint = endpoint;
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public TelemetryRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Schema and distribution
            SchemaRegistry registry = new SchemaRegistry(new SchemaLoader(), observabilitySink, wallClock);
            DistributionHub hub = new DistributionHub(config.distribution(), observabilitySink, wallClock);

            // 2. Decode path
            TelemetryPipeline pipeline = new TelemetryPipeline(
                registry::current,
                new DefaultTelemetryFrameDecoder(),
                hub,
                observabilitySink,
                wallClock
            );
            StreamFramer framer = new StreamFramer(
                () -> registry.current().startByte(),
                () -> registry.current().fullPayloadLength(),
                pipeline
            );

            // 3. Link: explicit override, emulator, or TCP
            LinkConnector connector = linkConnector;
            if (connector == null && config.emulation().enabled()) {
                Emulator emulator = new Emulator(
                    registry::current,
                    new DefaultTelemetryFrameEncoder(),
                    new EmulationRuleInterpreter(config.emulation().seed()),
                    wallClock
                );
                connector = new EmulatedLinkConnector(
                    emulator, config.emulation().tickInterval(), clock, sleeper, wallClock, observabilitySink);
            }
            if (connector == null) {
                connector = new NettyTcpLinkConnector(config.link().orElseThrow(
                    () -> new IllegalStateException("linkAddress is required unless emulation is enabled")));
            }

            LinkSupervisor supervisor = new LinkSupervisor(
                connector,
                framer,
                pipeline,
                config.linkTiming(),
                clock,
                sleeper,
                wallClock,
                observabilitySink
            );

            // 4. Optional client transport
            DatagramEndpoint endpoint = clientEndpoint;
            if (endpoint == null && config.clientBind().isPresent()) {
                endpoint = new NettyUdpDatagramEndpoint(config.clientBind().get());
            }
            UdpClientRegistry clients = null;
            if (endpoint != null) {
                clients = new UdpClientRegistry(
                    hub, endpoint, new ReadingBatchJsonCodec(), registry::current, observabilitySink, wallClock);
                endpoint.setListener(clients);
            }

            return new TelemetryRuntime(config, registry, hub, pipeline, connector, supervisor, endpoint, clients);
        }
    }
}
