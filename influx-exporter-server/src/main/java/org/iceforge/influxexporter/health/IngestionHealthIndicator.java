package org.iceforge.influxexporter.health;

import org.iceforge.influxexporter.sample.SampleStore;
import org.iceforge.influxexporter.udp.UdpLineProtocolListener;
import org.iceforge.influxexporter.udp.UdpListenerLifecycle;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * DOWN when the store writer is not running, since nothing ingested would be kept.
 */
@Component("ingestion")
public class IngestionHealthIndicator implements HealthIndicator {

    private final SampleStore store;
    private final UdpListenerLifecycle udp;

    public IngestionHealthIndicator(SampleStore store, UdpListenerLifecycle udp) {
        this.store = Objects.requireNonNull(store);
        this.udp = Objects.requireNonNull(udp);
    }

    @Override
    public Health health() {
        UdpLineProtocolListener listener = udp.getListener();
        Health.Builder builder = store.isRunning() ? Health.up() : Health.down();
        return builder
                .withDetail("samples", store.size())
                .withDetail("udpListening", listener != null && listener.isRunning())
                .build();
    }
}
