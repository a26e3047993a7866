package org.iceforge.influxexporter.udp;

import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.iceforge.influxexporter.lineprotocol.LineProtocolException;
import org.iceforge.influxexporter.lineprotocol.Precision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Receives line-protocol datagrams and feeds them into the sample store.
 *
 * <ul>
 *   <li>receive errors and unexpected handling failures are logged and the loop keeps going</li>
 *   <li>a datagram with any malformed line is counted and dropped as a whole</li>
 *   <li>timestamps are always nanoseconds</li>
 * </ul>
 */
public class UdpLineProtocolListener implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(UdpLineProtocolListener.class);

    static final int MAX_DATAGRAM_BYTES = 64 * 1024;

    private final InetSocketAddress bindAddress;
    private final ExporterContext context;
    private final SampleIngestor ingestor;
    private final ExecutorService receiver = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "udp-line-protocol");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running;
    private volatile DatagramSocket socket;
    private volatile int localPort;

    public UdpLineProtocolListener(InetSocketAddress bindAddress, ExporterContext context, SampleIngestor ingestor) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.context = Objects.requireNonNull(context, "context");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
    }

    public void start() throws IOException {
        if (running) return;

        DatagramSocket s = new DatagramSocket(bindAddress);
        this.socket = s;
        this.localPort = s.getLocalPort();
        running = true;

        log.info("UDP line protocol listener bound to {}:{}", bindAddress.getHostString(), localPort);
        receiver.submit(() -> receiveLoop(s));
    }

    private void receiveLoop(DatagramSocket s) {
        byte[] buf = new byte[MAX_DATAGRAM_BYTES];
        while (running) {
            DatagramPacket packet = new DatagramPacket(buf, buf.length);
            try {
                s.receive(packet);
            } catch (IOException e) {
                if (!running || s.isClosed()) {
                    break;
                }
                log.warn("UDP receive failed", e);
                continue;
            }
            // The buffer is reused by the next receive.
            byte[] payload = Arrays.copyOfRange(packet.getData(), packet.getOffset(),
                    packet.getOffset() + packet.getLength());
            try {
                handleDatagram(payload);
            } catch (RuntimeException e) {
                log.error("Failed to handle UDP datagram of {} bytes", payload.length, e);
            }
        }
    }

    void handleDatagram(byte[] payload) {
        context.markPush();
        try {
            int forwarded = ingestor.ingest(payload, Precision.NANOSECONDS);
            log.debug("UDP datagram of {} bytes forwarded {} samples", payload.length, forwarded);
        } catch (LineProtocolException e) {
            context.udpParseErrors().inc();
            log.debug("Dropping malformed UDP datagram: {}", e.getMessage());
        }
    }

    public int getLocalPort() {
        return localPort;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        running = false;
        DatagramSocket s = this.socket;
        if (s != null) {
            s.close();
        }
        receiver.shutdownNow();
    }
}
