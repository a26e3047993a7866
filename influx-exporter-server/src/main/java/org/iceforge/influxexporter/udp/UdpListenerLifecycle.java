package org.iceforge.influxexporter.udp;

import org.iceforge.influxexporter.config.ExporterProperties;
import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Objects;

@Component
public class UdpListenerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(UdpListenerLifecycle.class);

    // After the sample store writer.
    static final int PHASE = 10;

    private final ExporterProperties props;
    private final ExporterContext context;
    private final SampleIngestor ingestor;
    private volatile UdpLineProtocolListener listener;
    private volatile boolean running;

    public UdpListenerLifecycle(ExporterProperties props, ExporterContext context, SampleIngestor ingestor) {
        this.props = Objects.requireNonNull(props, "props");
        this.context = Objects.requireNonNull(context, "context");
        this.ingestor = Objects.requireNonNull(ingestor, "ingestor");
    }

    @Override
    public void start() {
        ExporterProperties.Udp udp = props.udp();
        if (udp == null || !udp.enabled()) {
            log.info("UDP listener disabled");
            return;
        }

        UdpLineProtocolListener l = new UdpLineProtocolListener(BindAddress.parse(udp.bindAddress()), context, ingestor);
        try {
            l.start();
        } catch (IOException e) {
            l.close();
            throw new IllegalStateException("Failed to bind UDP listener on " + udp.bindAddress(), e);
        }
        this.listener = l;
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
        UdpLineProtocolListener l = this.listener;
        if (l != null) {
            l.close();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    public UdpLineProtocolListener getListener() {
        return listener;
    }
}
