package com.questrail.telemetry.config;

import com.questrail.telemetry.link.LinkTimingPolicy;
import com.questrail.telemetry.schema.SchemaSource;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the telemetry relay runtime.
 *
 * @param schemaSource      where the sensor schema is loaded (and reloaded) from
 * @param linkTiming        connect, read, stall and backoff timing of the vehicle link
 * @param distribution      per-subscriber backpressure settings
 * @param emulation         synthetic source settings; when enabled, replaces the vehicle link
 * @param linkAddress       TCP address of the vehicle feed; {@code null} when emulating
 * @param clientBindAddress UDP address presentation clients talk to; {@code null} disables it
 */
public record TelemetryRuntimeConfig(
    SchemaSource schemaSource,
    LinkTimingPolicy linkTiming,
    DistributionConfig distribution,
    EmulationConfig emulation,
    InetSocketAddress linkAddress,
    InetSocketAddress clientBindAddress
) {
    public TelemetryRuntimeConfig {
        Objects.requireNonNull(schemaSource, "schemaSource");
        Objects.requireNonNull(linkTiming, "linkTiming");
        Objects.requireNonNull(distribution, "distribution");
        Objects.requireNonNull(emulation, "emulation");
    }

    public Optional<InetSocketAddress> link() {
        return Optional.ofNullable(linkAddress);
    }

    public Optional<InetSocketAddress> clientBind() {
        return Optional.ofNullable(clientBindAddress);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SchemaSource schemaSource;
        private LinkTimingPolicy linkTiming = LinkTimingPolicy.defaults();
        private DistributionConfig distribution = DistributionConfig.defaults();
        private EmulationConfig emulation = EmulationConfig.defaults();
        private InetSocketAddress linkAddress;
        private InetSocketAddress clientBindAddress;

        public Builder withSchemaSource(SchemaSource schemaSource) {
            this.schemaSource = schemaSource;
            return this;
        }

        public Builder withLinkTiming(LinkTimingPolicy linkTiming) {
            this.linkTiming = linkTiming;
            return this;
        }

        public Builder withDistribution(DistributionConfig distribution) {
            this.distribution = distribution;
            return this;
        }

        public Builder withEmulation(EmulationConfig emulation) {
            this.emulation = emulation;
            return this;
        }

        public Builder withLinkAddress(InetSocketAddress linkAddress) {
            this.linkAddress = linkAddress;
            return this;
        }

        public Builder withClientBindAddress(InetSocketAddress clientBindAddress) {
            this.clientBindAddress = clientBindAddress;
            return this;
        }

        public TelemetryRuntimeConfig build() {
            return new TelemetryRuntimeConfig(
                schemaSource, linkTiming, distribution, emulation, linkAddress, clientBindAddress);
        }
    }
}
