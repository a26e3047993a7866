package org.iceforge.influxexporter.udp;

import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.iceforge.influxexporter.lineprotocol.LineProtocolParser;
import org.iceforge.influxexporter.lineprotocol.Precision;
import org.iceforge.influxexporter.sample.SampleStore;
import org.iceforge.influxexporter.sample.SampleTranslator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.mockito.Mockito;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;

class UdpLineProtocolListenerTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochSecond(60), ZoneOffset.UTC);
    private ExporterContext context;
    private SampleStore store;
    private UdpLineProtocolListener listener;

    @BeforeEach
    void setup() throws Exception {
        context = new ExporterContext(clock, Duration.ofMinutes(5));
        store = new SampleStore(context, Duration.ofMinutes(1));
        store.start();
        SampleIngestor ingestor = new SampleIngestor(new LineProtocolParser(), new SampleTranslator(), store, clock);
        listener = new UdpLineProtocolListener(new InetSocketAddress("127.0.0.1", 0), context, ingestor);
        listener.start();
    }

    @AfterEach
    void tearDown() {
        listener.close();
        store.close();
    }

    private void send(String payload) throws Exception {
        send(payload, listener.getLocalPort());
    }

    private static void send(String payload, int port) throws Exception {
        byte[] bytes = payload.getBytes(StandardCharsets.UTF_8);
        try (DatagramSocket client = new DatagramSocket()) {
            client.send(new DatagramPacket(bytes, bytes.length, InetAddress.getLoopbackAddress(), port));
        }
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void validDatagramIsStored() throws Exception {
        assertThat(listener.getLocalPort()).isGreaterThan(0);
        assertThat(listener.isRunning()).isTrue();

        send("cpu,host=a value=42 1000000000");

        await().atMost(Duration.ofSeconds(10)).until(() -> store.size() == 1);
        assertThat(store.get("[\"cpu\" \"host\" \"a\"]")).isPresent();
        assertThat(context.lastPush().get()).isEqualTo(60.0);
        assertThat(context.udpParseErrors().get()).isZero();
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void malformedDatagramIsCountedAndListenerKeepsGoing() throws Exception {
        send("cpu value=1 1\nnot a valid line");

        await().atMost(Duration.ofSeconds(10)).until(() -> context.udpParseErrors().get() == 1.0);
        assertThat(store.size()).isZero();

        send("mem value=2 2");
        await().atMost(Duration.ofSeconds(10)).until(() -> store.size() == 1);
        assertThat(store.snapshot().get(0).name()).isEqualTo("mem");
        assertThat(context.udpParseErrors().get()).isEqualTo(1.0);
    }

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    void unexpectedFailureDoesNotStopReceiving() throws Exception {
        SampleIngestor failingOnce = Mockito.mock(SampleIngestor.class);
        Mockito.when(failingOnce.ingest(any(byte[].class), eq(Precision.NANOSECONDS)))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(1);

        try (UdpLineProtocolListener other =
                     new UdpLineProtocolListener(new InetSocketAddress("127.0.0.1", 0), context, failingOnce)) {
            other.start();

            send("cpu value=1 1", other.getLocalPort());
            Mockito.verify(failingOnce, Mockito.timeout(10_000)).ingest(any(byte[].class), eq(Precision.NANOSECONDS));

            send("cpu value=2 2", other.getLocalPort());
            Mockito.verify(failingOnce, Mockito.timeout(10_000).times(2))
                    .ingest(any(byte[].class), eq(Precision.NANOSECONDS));
            assertThat(other.isRunning()).isTrue();
            assertThat(context.udpParseErrors().get()).isZero();
        }
    }

    @Test
    void handleDatagram_recordsPushEvenWhenMalformed() {
        listener.handleDatagram("???".getBytes(StandardCharsets.UTF_8));

        assertThat(context.lastPush().get()).isEqualTo(60.0);
        assertThat(context.udpParseErrors().get()).isEqualTo(1.0);
    }

    @Test
    void closeStopsListener() {
        listener.close();
        assertThat(listener.isRunning()).isFalse();
    }
}
