package com.acme.perf.governor;

import com.acme.perf.governor.animation.AnimationHandle;
import com.acme.perf.governor.animation.AnimationHandleRegistry;
import com.acme.perf.governor.api.CacheStatistics;
import com.acme.perf.governor.api.FrameLatencySource;
import com.acme.perf.governor.api.FrameListener;
import com.acme.perf.governor.api.Subscription;
import com.acme.perf.governor.frame.FrameTimingMonitor;
import com.acme.perf.governor.health.HealthEvaluator;
import com.acme.perf.governor.health.HealthReport;
import com.acme.perf.governor.mode.CacheMode;
import com.acme.perf.governor.mode.ModeDecision;
import com.acme.perf.governor.mode.RenderMode;
import com.acme.perf.governor.telemetry.AtomicGovernorMetrics;
import com.acme.perf.governor.telemetry.GovernorMetrics;
import com.acme.perf.governor.telemetry.NoopGovernorMetrics;
import com.acme.perf.governor.util.GovernorDefaults;
import io.netty.util.concurrent.DefaultEventExecutor;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.FutureListener;
import io.netty.util.concurrent.ScheduledFuture;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Adaptive performance governor.
 *
 * <p>Samples frame latency, combines it with memory and cache health, and toggles the
 * render axis (NORMAL / LOW_POWER) and the cache axis (NORMAL / AGGRESSIVE) through
 * hysteresis bands. Entering LOW_POWER shortens animations; entering AGGRESSIVE asks the
 * cache to reclaim memory.
 *
 * <p>All governor state is mutated on one single-threaded executor. Frames and collaborator
 * completions arriving on other threads are re-dispatched onto it, and every resumption
 * checks that the session it started in is still live.
 *
 * <p>Construct one instance and pass it to consumers; {@link #initialize(GovernorConfig)} and
 * {@link #dispose()} are the only lifecycle entry points.
 */
public final class AdaptiveGovernor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AdaptiveGovernor.class.getName());

    private final GovernorCollaborators collaborators;
    private final EventExecutor suppliedExecutor;
    private volatile Session session;

    public AdaptiveGovernor(GovernorCollaborators collaborators) {
        this(collaborators, null);
    }

    /**
     * @param executor execution context to run on; when null the governor creates its own at
     *                 {@link #initialize(GovernorConfig)} and shuts it down at {@link #dispose()}.
     *                 A supplied executor is never shut down by the governor.
     */
    public AdaptiveGovernor(GovernorCollaborators collaborators, EventExecutor executor) {
        this.collaborators = Objects.requireNonNull(collaborators, "collaborators");
        this.suppliedExecutor = executor;
    }

    /**
     * Starts frame monitoring, the periodic adaptive-check and reporting tasks, and the
     * backgrounded-signal subscription. No-op if already initialized.
     *
     * @throws GovernorInitializationException if the config is invalid or any part fails to
     *                                         start; everything started so far is torn down
     */
    public synchronized void initialize(GovernorConfig config) throws GovernorInitializationException {
        if (session != null) {
            LOG.fine("Governor already initialized, ignoring initialize()");
            return;
        }
        if (config == null) {
            throw new GovernorInitializationException("config must not be null");
        }
        try {
            config.validate();
        } catch (IllegalArgumentException e) {
            throw new GovernorInitializationException("Invalid governor config: " + e.getMessage(), e);
        }

        boolean ownsExecutor = suppliedExecutor == null;
        EventExecutor executor = ownsExecutor
            ? new DefaultEventExecutor(new DefaultThreadFactory("adaptive-governor", true))
            : suppliedExecutor;
        if (executor.isShuttingDown()) {
            throw new GovernorInitializationException("Supplied executor is shutting down");
        }

        Session started = new Session(config, executor, ownsExecutor);
        try {
            started.start();
        } catch (RuntimeException e) {
            started.close();
            LOG.severe("Failed to initialize governor: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            throw new GovernorInitializationException("Failed to initialize governor: " + e.getMessage(), e);
        }
        session = started;
        LOG.info(() -> "Governor initialized"
            + " adaptive=" + config.adaptiveOptimizationEnabled()
            + " adaptiveIntervalMs=" + config.adaptiveCheckInterval().toMillis()
            + " reporting=" + config.reportingEnabled()
            + " reportingIntervalMs=" + config.reportingInterval().toMillis()
            + " collaboratorTimeoutMs=" + config.collaboratorTimeout().toMillis());
    }

    /**
     * Collects memory and cache statistics, the last computed FPS and the health evaluation.
     * Completes exceptionally only when the governor is not initialized or is disposed
     * before the snapshot is assembled; collaborator failures degrade to last-known values.
     */
    public CompletableFuture<PerformanceSnapshot> getSnapshot() {
        Session s = session;
        if (s == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Governor is not initialized"));
        }
        return s.submit(s::collectSnapshot);
    }

    /**
     * Asks the cache to reclaim memory and issues the host reclaim hint.
     *
     * @return future completing with true when every step succeeded; never completes exceptionally
     */
    public CompletableFuture<Boolean> forceMemoryOptimization() {
        Session s = session;
        if (s == null) {
            LOG.warning("Memory optimization requested while governor is not initialized");
            return CompletableFuture.completedFuture(false);
        }
        return s.submit(s::forceOptimization).exceptionally(t -> {
            LOG.warning("Memory optimization failed: " + describe(t));
            return false;
        });
    }

    /**
     * Runs one adaptive-check cycle now, outside the periodic schedule.
     *
     * @return future completing with false when skipped because a cycle is already in flight,
     *         or exceptionally with {@link CancellationException} if disposed before it finished
     */
    public CompletableFuture<Boolean> runAdaptiveCheck() {
        Session s = session;
        if (s == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Governor is not initialized"));
        }
        return s.submit(s::adaptiveCheck);
    }

    /**
     * Registers an animation. In LOW_POWER the returned handle's effective duration is shortened.
     *
     * @throws IllegalStateException    if the governor is not initialized
     * @throws IllegalArgumentException if {@code nominalDurationMs} is negative
     */
    public AnimationHandle registerAnimation(long nominalDurationMs, String label) {
        Session s = requireSession();
        return s.callOnLoop(() -> s.registry.register(nominalDurationMs, label));
    }

    /**
     * Owner's completion or dismissal signal. Idempotent.
     *
     * @return true if the handle was live
     */
    public boolean completeAnimation(AnimationHandle handle) {
        Session s = session;
        if (s == null || handle == null) {
            return false;
        }
        try {
            return s.callOnLoop(() -> s.registry.remove(handle));
        } catch (IllegalStateException e) {
            // disposed meanwhile; dispose already dropped every handle
            return false;
        }
    }

    /**
     * Stops periodic tasks and subscriptions and clears the animation table and the frame
     * window. Safe to call repeatedly; later calls do nothing.
     */
    public void dispose() {
        Session s;
        synchronized (this) {
            s = session;
            session = null;
        }
        if (s == null) {
            return;
        }
        s.close();
        LOG.info("Governor disposed");
    }

    @Override
    public void close() {
        dispose();
    }

    public boolean isInitialized() {
        return session != null;
    }

    public RenderMode renderMode() {
        Session s = session;
        return s == null ? RenderMode.NORMAL : s.state.renderMode();
    }

    public CacheMode cacheMode() {
        Session s = session;
        return s == null ? CacheMode.NORMAL : s.state.cacheMode();
    }

    public double lastHealthScore() {
        Session s = session;
        return s == null ? Double.NaN : s.state.lastHealthScore();
    }

    public double currentFps() {
        Session s = session;
        return s == null ? GovernorDefaults.DEFAULT_FPS : s.monitor.currentFps();
    }

    public int activeAnimationCount() {
        Session s = session;
        return s == null ? 0 : s.registry.count();
    }

    public Map<String, Long> counters() {
        Session s = session;
        return s == null ? Map.of() : s.counters();
    }

    private Session requireSession() {
        Session s = session;
        if (s == null) {
            throw new IllegalStateException("Governor is not initialized");
        }
        return s;
    }

    static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        Throwable cause = unwrap(t);
        return cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
    }

    private static CancellationException disposed() {
        return new CancellationException("governor disposed");
    }

    private final class Session {
        private final GovernorConfig config;
        private final EventExecutor executor;
        private final boolean ownsExecutor;
        private final GovernorState state;
        private final GovernorMetrics metrics;
        private final AnimationHandleRegistry registry;
        private final FrameTimingMonitor monitor;
        private final long timeoutMillis;

        private volatile boolean live = true;
        private Subscription lifecycleSubscription = Subscription.NOOP;
        private ScheduledFuture<?> adaptiveTask;
        private ScheduledFuture<?> reportingTask;
        // loop-confined
        private boolean adaptiveCheckInFlight;
        private long lastAdaptiveTickNanos;
        private long lastReportTickNanos;

        Session(GovernorConfig config, EventExecutor executor, boolean ownsExecutor) {
            this.config = config;
            this.executor = executor;
            this.ownsExecutor = ownsExecutor;
            this.state = new GovernorState(config.thresholds());
            this.metrics = config.metricsEnabled() ? new AtomicGovernorMetrics() : NoopGovernorMetrics.INSTANCE;
            this.registry = new AnimationHandleRegistry(state::renderMode);
            this.monitor = new FrameTimingMonitor(dispatchingSource(collaborators.frameSource()), this::onFpsRecomputed);
            this.timeoutMillis = config.collaboratorTimeout().toMillis();
        }

        void start() {
            monitor.start();
            lifecycleSubscription = Objects.requireNonNull(
                collaborators.hostLifecycle().subscribeBackgrounded(this::onBackgrounded),
                "lifecycle subscription");
            if (config.adaptiveOptimizationEnabled()) {
                long periodMs = config.adaptiveCheckInterval().toMillis();
                adaptiveTask = executor.scheduleAtFixedRate(this::adaptiveTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
                watch(adaptiveTask, "adaptive-check");
            }
            if (config.reportingEnabled()) {
                long periodMs = config.reportingInterval().toMillis();
                reportingTask = executor.scheduleAtFixedRate(this::reportTick, periodMs, periodMs, TimeUnit.MILLISECONDS);
                watch(reportingTask, "reporting");
            }
        }

        // Frames may arrive on any thread; the monitor only ever sees them on the executor.
        private FrameLatencySource dispatchingSource(FrameLatencySource source) {
            return listener -> source.subscribe(dispatching(listener));
        }

        private FrameListener dispatching(FrameListener listener) {
            return latencyMs -> {
                if (!live) {
                    return;
                }
                if (executor.inEventLoop()) {
                    listener.onFrame(latencyMs);
                    return;
                }
                try {
                    executor.execute(() -> listener.onFrame(latencyMs));
                } catch (RejectedExecutionException e) {
                    LOG.fine("Frame dropped, executor is shutting down");
                }
            };
        }

        // A periodic task ending on its own while the session is live is a scheduling failure.
        // It is reported, never restarted.
        private void watch(ScheduledFuture<?> task, String name) {
            task.addListener((FutureListener<Object>) f -> {
                if (!live) {
                    return;
                }
                metrics.incSchedulingFailures();
                String cause = f.cause() == null ? "cancelled" : f.cause().getClass().getSimpleName();
                LOG.severe("Periodic task '" + name + "' stopped unexpectedly (" + cause + "); it will not be restarted");
            });
        }

        private void onFpsRecomputed(double fps) {
            metrics.incFpsRecomputations();
            ModeDecision<RenderMode> decision = state.modes().onFps(fps);
            if (!(decision instanceof ModeDecision.Switch<RenderMode> change)) {
                return;
            }
            metrics.incRenderTransitions();
            if (change.to() == RenderMode.LOW_POWER) {
                int scaled = registry.applyLowPowerScaling();
                metrics.observeHandlesScaled(scaled);
                LOG.warning(() -> String.format(Locale.ROOT,
                    "Low power mode activated (fps=%.1f, reason=%s, handlesScaled=%d)", fps, change.reason(), scaled));
            } else {
                LOG.info(() -> String.format(Locale.ROOT,
                    "Low power mode deactivated (fps=%.1f, reason=%s)", fps, change.reason()));
            }
        }

        private void onBackgrounded() {
            if (!live) {
                return;
            }
            LOG.warning("Host backgrounded, forcing memory optimization");
            forceMemoryOptimization();
        }

        private void adaptiveTick() {
            long now = System.nanoTime();
            checkLateness(now, lastAdaptiveTickNanos, config.adaptiveCheckInterval().toNanos(), "adaptive-check");
            lastAdaptiveTickNanos = now;
            try {
                adaptiveCheck();
            } catch (RuntimeException e) {
                LOG.warning("Adaptive check failed to start: " + describe(e));
            }
        }

        private void reportTick() {
            long now = System.nanoTime();
            checkLateness(now, lastReportTickNanos, config.reportingInterval().toNanos(), "reporting");
            lastReportTickNanos = now;
            try {
                collectSnapshot().whenComplete((snapshot, error) -> {
                    if (error != null) {
                        if (live) {
                            LOG.warning("Failed to generate performance report: " + describe(error));
                        }
                        return;
                    }
                    if (!live) {
                        return;
                    }
                    try {
                        collaborators.reportSink().report(snapshot, counters());
                    } catch (RuntimeException e) {
                        LOG.warning("Report sink failure: " + describe(e));
                    }
                });
            } catch (RuntimeException e) {
                LOG.warning("Failed to generate performance report: " + describe(e));
            }
        }

        private void checkLateness(long now, long last, long periodNanos, String task) {
            if (last != 0L && now - last > 2 * periodNanos) {
                metrics.incLateTicks();
                long lateMs = TimeUnit.NANOSECONDS.toMillis(now - last);
                LOG.warning(() -> "Periodic task '" + task + "' fired late: " + lateMs + " ms since previous run");
            }
        }

        /**
         * Runs on the executor. Skips, rather than queues, when a previous cycle is still awaiting collaborators.
         */
        CompletableFuture<Boolean> adaptiveCheck() {
            if (!live) {
                return CompletableFuture.failedFuture(disposed());
            }
            if (adaptiveCheckInFlight) {
                metrics.incSkippedChecks();
                LOG.fine("Adaptive check skipped, previous run still in flight");
                return CompletableFuture.completedFuture(false);
            }
            adaptiveCheckInFlight = true;
            metrics.incAdaptiveChecks();
            CompletableFuture<Boolean> run;
            try {
                run = collectSnapshot().thenCompose(this::applyCacheAxis);
            } catch (RuntimeException e) {
                run = CompletableFuture.failedFuture(e);
            }
            return run.whenComplete((ok, error) -> {
                adaptiveCheckInFlight = false;
                if (error != null && live) {
                    LOG.warning("Adaptive optimization failed: " + describe(error));
                }
            });
        }

        private CompletableFuture<Boolean> applyCacheAxis(PerformanceSnapshot snapshot) {
            ensureLive();
            double memoryMb = snapshot.memoryUsageMb();
            ModeDecision<CacheMode> decision = state.modes().onMemoryMb(memoryMb);
            if (!(decision instanceof ModeDecision.Switch<CacheMode> change)) {
                return CompletableFuture.completedFuture(true);
            }
            metrics.incCacheTransitions();
            if (change.to() == CacheMode.NORMAL) {
                LOG.info(() -> String.format(Locale.ROOT,
                    "Deactivating aggressive memory optimization (memoryMb=%.1f)", memoryMb));
                return CompletableFuture.completedFuture(true);
            }
            LOG.warning(() -> String.format(Locale.ROOT,
                "Activating aggressive memory optimization (memoryMb=%.1f, reason=%s)", memoryMb, change.reason()));
            return optimizeCache().thenApply(ignored -> true);
        }

        CompletableFuture<Boolean> forceOptimization() {
            ensureLive();
            metrics.incForcedOptimizations();
            LOG.info("Force memory optimization triggered");
            CompletableFuture<Long> before = memoryUsageBytes();
            return before.thenCompose(beforeBytes -> optimizeCache().thenApply(cacheOk -> {
                ensureLive();
                boolean hostOk = requestHostReclaim();
                return cacheOk && hostOk;
            })).thenCompose(ok -> memoryUsageBytes().thenApply(afterBytes -> {
                long beforeBytes = before.join();
                LOG.info(() -> String.format(Locale.ROOT,
                    "Memory optimization %s (before=%.1f MB, after=%.1f MB)",
                    ok ? "completed" : "completed with failures",
                    beforeBytes / (double) GovernorDefaults.BYTES_PER_MB,
                    afterBytes / (double) GovernorDefaults.BYTES_PER_MB));
                return ok;
            }));
        }

        private CompletableFuture<Boolean> optimizeCache() {
            return callCollaborator("cacheOptimizer", collaborators.cacheProvider()::optimizeMemoryUsage)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return true;
                    }
                    rethrowIfDisposed(error);
                    collaboratorUnavailable("cacheOptimizer", error);
                    return false;
                });
        }

        private boolean requestHostReclaim() {
            try {
                collaborators.memoryReclaimer().requestReclaim();
                return true;
            } catch (RuntimeException e) {
                LOG.warning("Host memory reclaim hint failed: " + describe(e));
                return false;
            }
        }

        CompletableFuture<PerformanceSnapshot> collectSnapshot() {
            ensureLive();
            CompletableFuture<Long> memory = memoryUsageBytes();
            CompletableFuture<CacheStatistics> cache = cacheStatistics();
            return memory.thenCombine(cache, this::buildSnapshot);
        }

        private PerformanceSnapshot buildSnapshot(long memoryBytes, CacheStatistics cacheStatistics) {
            ensureLive();
            double fps = monitor.currentFps();
            int handles = registry.count();
            double memoryMb = memoryBytes / (double) GovernorDefaults.BYTES_PER_MB;
            HealthReport health = HealthEvaluator.evaluate(fps, memoryMb, cacheStatistics.hitRate(), handles);
            state.recordHealthScore(health.score());
            return new PerformanceSnapshot(
                fps,
                monitor.averageFrameTimeMs(),
                state.renderMode(),
                state.cacheMode(),
                handles,
                memoryBytes,
                cacheStatistics,
                health.score(),
                health.status(),
                health.recommendations(),
                config.adaptiveOptimizationEnabled()
            );
        }

        private CompletableFuture<Long> memoryUsageBytes() {
            return callCollaborator("memoryProbe", collaborators.memoryProbe()::currentUsageBytes)
                .handle((bytes, error) -> {
                    if (error == null && bytes != null) {
                        state.recordMemoryUsage(bytes);
                        return Math.max(0L, bytes);
                    }
                    rethrowIfDisposed(error);
                    collaboratorUnavailable("memoryProbe", error);
                    return state.lastMemoryUsageBytes();
                });
        }

        private CompletableFuture<CacheStatistics> cacheStatistics() {
            return callCollaborator("cacheStatistics", collaborators.cacheProvider()::getStatistics)
                .handle((stats, error) -> {
                    if (error == null && stats != null) {
                        state.recordCacheStatistics(stats);
                        return stats;
                    }
                    rethrowIfDisposed(error);
                    collaboratorUnavailable("cacheStatistics", error);
                    return state.lastCacheStatistics();
                });
        }

        /**
         * Invokes a collaborator on the executor, bounds it with the collaborator timeout, and
         * completes the returned future back on the executor.
         */
        private <T> CompletableFuture<T> callCollaborator(String name, Supplier<CompletableFuture<T>> call) {
            CompletableFuture<T> raw;
            try {
                raw = Objects.requireNonNull(call.get(), name + " returned null");
            } catch (RuntimeException e) {
                raw = CompletableFuture.failedFuture(e);
            }
            CompletableFuture<T> bounded = new CompletableFuture<>();
            ScheduledFuture<?> timeout = executor.schedule(() -> {
                bounded.completeExceptionally(new TimeoutException(name + " did not answer within " + timeoutMillis + " ms"));
            }, timeoutMillis, TimeUnit.MILLISECONDS);
            raw.whenComplete((value, error) -> {
                timeout.cancel(false);
                if (error != null) {
                    bounded.completeExceptionally(new CollaboratorUnavailableException(name, unwrap(error)));
                } else {
                    bounded.complete(value);
                }
            });
            return resumeOnExecutor(bounded);
        }

        private <T> CompletableFuture<T> resumeOnExecutor(CompletableFuture<T> source) {
            CompletableFuture<T> out = new CompletableFuture<>();
            source.whenComplete((value, error) -> {
                Runnable relay = () -> {
                    if (!live) {
                        out.completeExceptionally(disposed());
                    } else if (error != null) {
                        out.completeExceptionally(unwrap(error));
                    } else {
                        out.complete(value);
                    }
                };
                if (executor.inEventLoop()) {
                    relay.run();
                    return;
                }
                try {
                    executor.execute(relay);
                } catch (RejectedExecutionException e) {
                    out.completeExceptionally(disposed());
                }
            });
            return out;
        }

        <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> task) {
            CompletableFuture<T> out = new CompletableFuture<>();
            Runnable run = () -> {
                CompletableFuture<T> result;
                try {
                    result = task.get();
                } catch (RuntimeException e) {
                    result = CompletableFuture.failedFuture(e);
                }
                result.whenComplete((value, error) -> {
                    if (error != null) {
                        out.completeExceptionally(unwrap(error));
                    } else {
                        out.complete(value);
                    }
                });
            };
            if (executor.inEventLoop()) {
                run.run();
                return out;
            }
            try {
                executor.execute(run);
            } catch (RejectedExecutionException e) {
                out.completeExceptionally(disposed());
            }
            return out;
        }

        /**
         * Runs {@code call} on the executor and waits for it, or inline when already there.
         * Handle-table changes go through here so they serialize with the LowPower scaling pass.
         *
         * @throws IllegalStateException if the session is disposed before the call runs
         */
        <T> T callOnLoop(Callable<T> call) {
            if (executor.inEventLoop()) {
                ensureOpen();
                try {
                    return call.call();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }
            Future<T> result;
            try {
                result = executor.submit(() -> {
                    ensureOpen();
                    return call.call();
                });
            } catch (RejectedExecutionException e) {
                throw new IllegalStateException("Governor is disposed");
            }
            return result.syncUninterruptibly().getNow();
        }

        private void ensureOpen() {
            if (!live) {
                throw new IllegalStateException("Governor is disposed");
            }
        }

        private void collaboratorUnavailable(String name, Throwable error) {
            metrics.incCollaboratorFailures(name);
            Throwable cause = unwrap(error);
            if (cause instanceof CollaboratorUnavailableException unavailable && unavailable.getCause() != null) {
                cause = unavailable.getCause();
            }
            String detail = cause == null ? "no value" : cause.getClass().getSimpleName();
            LOG.warning("Collaborator " + name + " unavailable (" + detail + "), using last known value");
        }

        private void rethrowIfDisposed(Throwable error) {
            if (!live || unwrap(error) instanceof CancellationException) {
                throw disposed();
            }
        }

        private void ensureLive() {
            if (!live) {
                throw disposed();
            }
        }

        Map<String, Long> counters() {
            return metrics instanceof AtomicGovernorMetrics atomic ? atomic.snapshot().toCounters() : Map.of();
        }

        void close() {
            live = false;
            cancel(adaptiveTask);
            cancel(reportingTask);
            try {
                monitor.stop();
            } catch (RuntimeException e) {
                LOG.fine("Dispose: frame unsubscribe failed: " + e.getClass().getSimpleName());
            }
            try {
                lifecycleSubscription.close();
            } catch (RuntimeException e) {
                LOG.fine("Dispose: lifecycle unsubscribe failed: " + e.getClass().getSimpleName());
            }
            clearOwnedState();
            if (ownsExecutor) {
                executor.shutdownGracefully(
                    GovernorDefaults.EXECUTOR_QUIET_PERIOD_MS,
                    GovernorDefaults.EXECUTOR_SHUTDOWN_TIMEOUT_MS,
                    TimeUnit.MILLISECONDS);
            }
        }

        private void clearOwnedState() {
            Runnable clear = () -> {
                monitor.clear();
                registry.clear();
                state.reset();
            };
            if (executor.inEventLoop() || executor.isShuttingDown()) {
                clear.run();
                return;
            }
            try {
                boolean done = executor.submit(clear)
                    .awaitUninterruptibly(GovernorDefaults.EXECUTOR_SHUTDOWN_TIMEOUT_MS);
                if (!done) {
                    LOG.warning("Dispose: executor did not clear state in time");
                }
            } catch (RejectedExecutionException e) {
                clear.run();
            }
        }

        private void cancel(ScheduledFuture<?> task) {
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
