package org.iceforge.influxexporter.store;

import org.iceforge.influxexporter.core.ExporterContext;
import org.iceforge.influxexporter.sample.MetricNames;
import org.iceforge.influxexporter.sample.Sample;
import org.iceforge.influxexporter.sample.SampleStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class SampleStoreLifecycleTest {

    private final ExporterContext context = new ExporterContext(Clock.systemUTC(), Duration.ofMinutes(5));
    private final SampleStore store = new SampleStore(context, Duration.ofMinutes(1));
    private final SampleStoreLifecycle lifecycle = new SampleStoreLifecycle(store);

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void stopThenStartKeepsIngesting() {
        lifecycle.start();
        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();

        lifecycle.start();
        assertThat(lifecycle.isRunning()).isTrue();

        TreeMap<String, String> labels = new TreeMap<>();
        store.submit(new Sample(MetricNames.fingerprint("cpu", labels), "cpu", labels, 1.0, Instant.now()));
        await().atMost(Duration.ofSeconds(5)).until(() -> store.size() == 1);
    }

    @Test
    void startsBeforeListeners() {
        assertThat(lifecycle.getPhase()).isEqualTo(SampleStoreLifecycle.PHASE).isLessThan(10);
    }
}
