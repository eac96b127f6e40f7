package com.acme.perf.governor.sim;

import com.acme.perf.governor.api.FrameLatencySource;
import com.acme.perf.governor.api.FrameListener;
import com.acme.perf.governor.api.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.DoubleSupplier;
import java.util.logging.Logger;

/**
 * Frame source driven by a timer at a fixed cadence, with latencies drawn from a swappable profile.
 */
public final class SyntheticFrameSource implements FrameLatencySource, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(SyntheticFrameSource.class.getName());

    private final List<FrameListener> listeners = new CopyOnWriteArrayList<>();
    private final ScheduledExecutorService executor;
    private final long framePeriodMicros;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile DoubleSupplier latencyProfile;

    public SyntheticFrameSource(double framesPerSecond, DoubleSupplier latencyProfile) {
        if (!(framesPerSecond > 0.0d)) {
            throw new IllegalArgumentException("framesPerSecond must be > 0: " + framesPerSecond);
        }
        this.framePeriodMicros = Math.max(1L, (long) (1_000_000.0d / framesPerSecond));
        this.latencyProfile = Objects.requireNonNull(latencyProfile, "latencyProfile");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "synthetic-frame-source");
            t.setDaemon(true);
            return t;
        });
    }

    public static DoubleSupplier jittered(double meanMs, double jitterMs) {
        return () -> Math.max(0.0d, meanMs + ThreadLocalRandom.current().nextDouble(-jitterMs, jitterMs + 1e-9));
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        executor.scheduleAtFixedRate(this::emit, framePeriodMicros, framePeriodMicros, TimeUnit.MICROSECONDS);
    }

    public void useProfile(DoubleSupplier profile) {
        this.latencyProfile = Objects.requireNonNull(profile, "profile");
    }

    @Override
    public Subscription subscribe(FrameListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    private void emit() {
        try {
            double latency = latencyProfile.getAsDouble();
            for (FrameListener listener : listeners) {
                listener.onFrame(latency);
            }
        } catch (Throwable t) {
            LOG.warning("Synthetic frame emission failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        listeners.clear();
    }
}
