package org.iceforge.influxexporter.sample;

import org.iceforge.influxexporter.core.ExporterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory cache holding the latest sample per fingerprint.
 *
 * <p>Producers only call {@link #submit(Sample)}. A single writer thread drains the inbox,
 * applies samples (last delivered wins) and sweeps expired entries once per sweep interval.
 * Readers take a {@link #snapshot()} under the read lock.
 */
public final class SampleStore implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SampleStore.class);

    private final ExporterContext context;
    private final long sweepIntervalNanos;

    private final BlockingQueue<Sample> inbox = new LinkedBlockingQueue<>();
    private final Map<String, Sample> samples = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private ExecutorService writer;
    private volatile boolean running;

    public SampleStore(ExporterContext context, Duration sweepInterval) {
        this.context = Objects.requireNonNull(context, "context");
        Objects.requireNonNull(sweepInterval, "sweepInterval");
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive: " + sweepInterval);
        }
        this.sweepIntervalNanos = sweepInterval.toNanos();
    }

    /** Starts a fresh writer thread. May be called again after {@link #close()}. */
    public synchronized void start() {
        if (running) return;
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "sample-store-writer");
            t.setDaemon(true);
            return t;
        });
        running = true;
        try {
            executor.submit(this::drainLoop);
        } catch (RuntimeException e) {
            running = false;
            executor.shutdownNow();
            throw e;
        }
        writer = executor;
        log.info("Sample store writer started (expiry={}, sweepInterval={})",
                context.sampleExpiry(), Duration.ofNanos(sweepIntervalNanos));
    }

    /** Hands a sample to the writer thread. Never blocks. */
    public void submit(Sample sample) {
        inbox.offer(Objects.requireNonNull(sample, "sample"));
    }

    private void drainLoop() {
        long nextSweep = System.nanoTime() + sweepIntervalNanos;
        // A writer from before a restart sees its interrupt here and exits.
        while (running && !Thread.currentThread().isInterrupted()) {
            try {
                long waitNanos = Math.max(0L, nextSweep - System.nanoTime());
                Sample sample = inbox.poll(waitNanos, TimeUnit.NANOSECONDS);
                if (sample != null) {
                    store(sample);
                }
                if (System.nanoTime() - nextSweep >= 0) {
                    int evicted = sweep();
                    if (evicted > 0) {
                        log.debug("Sweep evicted {} expired samples", evicted);
                    }
                    nextSweep = System.nanoTime() + sweepIntervalNanos;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Sample store writer failed to apply an update", e);
            }
        }
        log.debug("Sample store writer stopped");
    }

    void store(Sample sample) {
        lock.writeLock().lock();
        try {
            samples.put(sample.fingerprint(), sample);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Removes every sample whose event time is strictly before the expiry cutoff. */
    int sweep() {
        Instant cutoff = context.expiryCutoff();
        int evicted = 0;
        lock.writeLock().lock();
        try {
            Iterator<Sample> it = samples.values().iterator();
            while (it.hasNext()) {
                if (it.next().isOlderThan(cutoff)) {
                    it.remove();
                    evicted++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return evicted;
    }

    /** Copy of the current entries. May include samples that expired since the last sweep. */
    public List<Sample> snapshot() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(samples.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Sample> get(String fingerprint) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(samples.get(fingerprint));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return samples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        running = false;
        if (writer != null) {
            writer.shutdownNow();
            writer = null;
        }
    }
}
