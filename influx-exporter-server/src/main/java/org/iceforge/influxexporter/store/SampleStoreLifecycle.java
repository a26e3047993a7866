package org.iceforge.influxexporter.store;

import org.iceforge.influxexporter.sample.SampleStore;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Starts the store writer before any listener can deliver samples.
 */
@Component
public class SampleStoreLifecycle implements SmartLifecycle {

    static final int PHASE = 0;

    private final SampleStore store;

    public SampleStoreLifecycle(SampleStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public void start() {
        store.start();
    }

    @Override
    public void stop() {
        store.close();
    }

    @Override
    public boolean isRunning() {
        return store.isRunning();
    }

    @Override
    public int getPhase() {
        return PHASE;
    }
}
