package org.iceforge.influxexporter.core;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Process-wide state shared by the listeners, the store and the collector.
 *
 * <p>Built once at startup and handed to every component, so tests can run several
 * independent exporters side by side.
 */
public final class ExporterContext {

    public static final String LAST_PUSH_METRIC = "influxdb_last_push_timestamp_seconds";
    public static final String UDP_PARSE_ERRORS_METRIC = "influxdb_udp_parse_errors";

    private final Clock clock;
    private final Duration sampleExpiry;
    private final CollectorRegistry registry;
    private final Gauge lastPush;
    private final Counter udpParseErrors;

    public ExporterContext(Clock clock, Duration sampleExpiry) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sampleExpiry = Objects.requireNonNull(sampleExpiry, "sampleExpiry");
        if (sampleExpiry.isNegative() || sampleExpiry.isZero()) {
            throw new IllegalArgumentException("sampleExpiry must be positive: " + sampleExpiry);
        }

        this.registry = new CollectorRegistry();
        // Emitted by the sample collector on every scrape, so it is not registered here.
        this.lastPush = Gauge.build()
                .name(LAST_PUSH_METRIC)
                .help("Unix timestamp of the last received influxdb metrics push in seconds.")
                .create();
        this.udpParseErrors = Counter.build()
                .name(UDP_PARSE_ERRORS_METRIC)
                .help("Number of UDP datagrams dropped because they could not be parsed.")
                .register(registry);
    }

    /** Records that an ingestion request was accepted, whether or not it parses. */
    public void markPush() {
        Instant now = clock.instant();
        lastPush.set(now.getEpochSecond() + now.getNano() / 1e9);
    }

    /** Samples whose event time is strictly before this instant are expired. */
    public Instant expiryCutoff() {
        return clock.instant().minus(sampleExpiry);
    }

    public Clock clock() {
        return clock;
    }

    public Duration sampleExpiry() {
        return sampleExpiry;
    }

    public CollectorRegistry registry() {
        return registry;
    }

    public Gauge lastPush() {
        return lastPush;
    }

    public Counter udpParseErrors() {
        return udpParseErrors;
    }
}
