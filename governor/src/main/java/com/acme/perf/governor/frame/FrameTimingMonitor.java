package com.acme.perf.governor.frame;

import com.acme.perf.governor.api.FrameLatencySource;
import com.acme.perf.governor.api.Subscription;
import com.acme.perf.governor.util.GovernorDefaults;

import java.util.Objects;
import java.util.function.DoubleConsumer;
import java.util.logging.Logger;

/**
 * Samples frame latencies into a sliding window and recomputes average FPS every
 * {@code recomputeEveryFrames} frames, then hands the new FPS to the health-check callback.
 *
 * <p>{@link #onFrame(double)} must only be called from the governor's execution context.
 */
public final class FrameTimingMonitor {
    private static final Logger LOG = Logger.getLogger(FrameTimingMonitor.class.getName());

    private final FrameLatencySource source;
    private final SlidingFrameWindow window;
    private final int recomputeEveryFrames;
    private final DoubleConsumer healthCheck;

    private volatile boolean started;
    private volatile double currentFps = GovernorDefaults.DEFAULT_FPS;
    private Subscription subscription = Subscription.NOOP;
    private long frameCount;

    public FrameTimingMonitor(FrameLatencySource source, DoubleConsumer healthCheck) {
        this(source,
            GovernorDefaults.FRAME_WINDOW_CAPACITY,
            GovernorDefaults.FPS_RECOMPUTE_EVERY_FRAMES,
            healthCheck);
    }

    public FrameTimingMonitor(FrameLatencySource source,
                              int windowCapacity,
                              int recomputeEveryFrames,
                              DoubleConsumer healthCheck) {
        this.source = Objects.requireNonNull(source, "source");
        this.window = new SlidingFrameWindow(windowCapacity);
        this.recomputeEveryFrames = Math.max(1, recomputeEveryFrames);
        this.healthCheck = healthCheck == null ? fps -> { } : healthCheck;
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        subscription = Objects.requireNonNull(source.subscribe(this::onFrame), "subscription");
        started = true;
    }

    public synchronized void stop() {
        if (!started) {
            return;
        }
        started = false;
        Subscription s = subscription;
        subscription = Subscription.NOOP;
        s.close();
    }

    public void onFrame(double latencyMs) {
        if (!started) {
            return;
        }
        if (!window.push(latencyMs)) {
            LOG.fine(() -> "Rejected frame latency " + latencyMs);
            return;
        }
        frameCount++;
        if (frameCount % recomputeEveryFrames == 0) {
            double fps = computeAverageFps();
            healthCheck.accept(fps);
        }
    }

    /**
     * Recomputes FPS from the current window: {@code clamp(1000 / mean, 0, 120)}, or 60 when empty.
     */
    public double computeAverageFps() {
        double mean = window.mean();
        double fps;
        if (Double.isNaN(mean)) {
            fps = GovernorDefaults.DEFAULT_FPS;
        } else if (mean <= 0.0d) {
            fps = GovernorDefaults.MAX_FPS;
        } else {
            fps = clampFps(1000.0d / mean);
        }
        currentFps = fps;
        return fps;
    }

    public double currentFps() {
        return currentFps;
    }

    public double averageFrameTimeMs() {
        double mean = window.mean();
        return Double.isNaN(mean) ? GovernorDefaults.DEFAULT_FRAME_TIME_MS : mean;
    }

    public int windowSize() {
        return window.size();
    }

    public long frameCount() {
        return frameCount;
    }

    public boolean isStarted() {
        return started;
    }

    public void clear() {
        window.clear();
        frameCount = 0L;
        currentFps = GovernorDefaults.DEFAULT_FPS;
    }

    static double clampFps(double fps) {
        if (Double.isNaN(fps) || fps < 0.0d) return 0.0d;
        return Math.min(fps, GovernorDefaults.MAX_FPS);
    }
}
