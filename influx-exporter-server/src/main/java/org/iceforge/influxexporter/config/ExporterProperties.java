package org.iceforge.influxexporter.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Exporter settings. The HTTP listen port is Spring Boot's {@code server.port}.
 *
 * @param sampleExpiry  how long a sample is valid for, measured from its own timestamp
 * @param sweepInterval how often the store evicts expired samples
 * @param metricsPath   path under which the scrape endpoint is exposed
 * @param udp           UDP listener settings
 */
@ConfigurationProperties(prefix = "influx-exporter")
public record ExporterProperties(
        @DefaultValue("5m") Duration sampleExpiry,
        @DefaultValue("1m") Duration sweepInterval,
        @DefaultValue("/metrics") String metricsPath,
        @DefaultValue Udp udp
) {

    /**
     * @param enabled     whether to start the listener at all
     * @param bindAddress {@code host:port}; an empty host ({@code :9122}) binds every interface
     */
    public record Udp(
            @DefaultValue("true") boolean enabled,
            @DefaultValue(":9122") String bindAddress
    ) {
    }
}
