package org.iceforge.influxexporter.config;

import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.exposition.SampleCollector;
import org.iceforge.influxexporter.ingest.SampleIngestor;
import org.iceforge.influxexporter.lineprotocol.LineProtocolParser;
import org.iceforge.influxexporter.sample.SampleStore;
import org.iceforge.influxexporter.sample.SampleTranslator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ExporterConfig {

    @Bean
    public Clock exporterClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExporterContext exporterContext(Clock clock, ExporterProperties props) {
        return new ExporterContext(clock, props.sampleExpiry());
    }

    @Bean
    public SampleStore sampleStore(ExporterContext context, ExporterProperties props) {
        return new SampleStore(context, props.sweepInterval());
    }

    @Bean
    public SampleIngestor sampleIngestor(ExporterContext context, SampleStore store) {
        return new SampleIngestor(new LineProtocolParser(), new SampleTranslator(), store, context.clock());
    }

    @Bean
    public SampleCollector sampleCollector(ExporterContext context, SampleStore store) {
        return new SampleCollector(context, store).register(context.registry());
    }
}
