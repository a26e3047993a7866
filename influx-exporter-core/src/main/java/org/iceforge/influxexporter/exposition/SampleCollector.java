package org.iceforge.influxexporter.exposition;

import io.prometheus.client.Collector;
import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.sample.Sample;
import org.iceforge.influxexporter.sample.SampleStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Exposes the cached samples as untyped metrics, plus the last-push gauge.
 *
 * <p>Samples that expired after the last sweep are skipped here as well. The store is
 * never modified.
 */
public class SampleCollector extends Collector {

    static final String HELP = "InfluxDB Metric";

    private final ExporterContext context;
    private final SampleStore store;

    public SampleCollector(ExporterContext context, SampleStore store) {
        this.context = Objects.requireNonNull(context, "context");
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public List<MetricFamilySamples> collect() {
        List<MetricFamilySamples> out = new ArrayList<>(context.lastPush().collect());

        List<Sample> snapshot = store.snapshot();
        Instant cutoff = context.expiryCutoff();

        // One family per name; the text formats reject repeated HELP/TYPE lines.
        Map<String, List<MetricFamilySamples.Sample>> byName = new TreeMap<>();
        for (Sample sample : snapshot) {
            if (sample.isOlderThan(cutoff)) {
                continue;
            }
            byName.computeIfAbsent(sample.name(), k -> new ArrayList<>())
                    .add(new MetricFamilySamples.Sample(
                            sample.name(),
                            new ArrayList<>(sample.labels().keySet()),
                            new ArrayList<>(sample.labels().values()),
                            sample.value()));
        }
        byName.forEach((name, samples) -> out.add(new MetricFamilySamples(name, Type.UNKNOWN, HELP, samples)));
        return out;
    }
}
