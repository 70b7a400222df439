package com.questrail.telemetry.config;

import com.questrail.telemetry.link.LinkTimingPolicy;
import com.questrail.telemetry.schema.SchemaSource;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class TelemetryRuntimeConfigTest {

    @Test
    void builderAppliesDefaults() {
        TelemetryRuntimeConfig config = TelemetryRuntimeConfig.builder()
            .withSchemaSource(SchemaSource.ofClasspath("schema/sensors.json"))
            .build();

        assertEquals(LinkTimingPolicy.defaults(), config.linkTiming());
        assertEquals(DistributionConfig.defaults(), config.distribution());
        assertFalse(config.emulation().enabled());
        assertTrue(config.link().isEmpty());
        assertTrue(config.clientBind().isEmpty());
    }

    @Test
    void builderCarriesAddresses() {
        InetSocketAddress vehicle = new InetSocketAddress("127.0.0.1", 7000);
        InetSocketAddress clients = new InetSocketAddress("127.0.0.1", 7001);

        TelemetryRuntimeConfig config = TelemetryRuntimeConfig.builder()
            .withSchemaSource(SchemaSource.ofClasspath("schema/sensors.json"))
            .withLinkAddress(vehicle)
            .withClientBindAddress(clients)
            .build();

        assertEquals(vehicle, config.link().orElseThrow());
        assertEquals(clients, config.clientBind().orElseThrow());
    }

    @Test
    void schemaSourceIsRequired() {
        assertThrows(NullPointerException.class, () -> TelemetryRuntimeConfig.builder().build());
    }

    @Test
    void distributionRejectsNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new DistributionConfig(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new DistributionConfig(10, 0));
        assertThrows(IllegalArgumentException.class, () -> new DistributionConfig(10, 10, 0));
        assertEquals(DistributionConfig.DEFAULT_MAX_CLIENTS, new DistributionConfig(10, 10).maxClients());
    }

    @Test
    void emulationRejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> EmulationConfig.enabled(Duration.ZERO, 1L));
        assertThrows(IllegalArgumentException.class, () -> EmulationConfig.enabled(Duration.ofMillis(-5), 1L));

        EmulationConfig config = EmulationConfig.enabled(Duration.ofMillis(100), 42L);
        assertTrue(config.enabled());
        assertEquals(42L, config.seed());
    }
}
