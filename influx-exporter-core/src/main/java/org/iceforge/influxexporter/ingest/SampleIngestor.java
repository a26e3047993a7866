package org.iceforge.influxexporter.ingest;

import org.iceforge.influxexporter.lineprotocol.LineProtocolException;
import org.iceforge.influxexporter.lineprotocol.LineProtocolParser;
import org.iceforge.influxexporter.lineprotocol.Point;
import org.iceforge.influxexporter.lineprotocol.Precision;
import org.iceforge.influxexporter.sample.Sample;
import org.iceforge.influxexporter.sample.SampleStore;
import org.iceforge.influxexporter.sample.SampleTranslator;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Shared ingestion path for the HTTP and UDP listeners: decode, translate, forward.
 */
public final class SampleIngestor {

    private final LineProtocolParser parser;
    private final SampleTranslator translator;
    private final SampleStore store;
    private final Clock clock;

    public SampleIngestor(LineProtocolParser parser, SampleTranslator translator, SampleStore store, Clock clock) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decodes {@code payload} and forwards every resulting sample to the store.
     * Nothing is forwarded when any line of the payload is malformed.
     *
     * @return number of samples forwarded
     */
    public int ingest(byte[] payload, Precision precision) throws LineProtocolException {
        List<Point> points = parser.parse(payload, clock.instant(), precision);
        int forwarded = 0;
        for (Point point : points) {
            for (Sample sample : translator.translate(point)) {
                store.submit(sample);
                forwarded++;
            }
        }
        return forwarded;
    }
}
