package com.acme.perf.governor.util;

/**
 * Default cadence, threshold, and scaling constants for the governor.
 * <p>
 * These values are used when the corresponding environment variable is not set.
 */
public final class GovernorDefaults {

    // ---- Frame sampling ----
    public static final int FRAME_WINDOW_CAPACITY = 60;
    public static final int FPS_RECOMPUTE_EVERY_FRAMES = 60;
    public static final double DEFAULT_FPS = 60.0d;
    public static final double MAX_FPS = 120.0d;
    public static final double DEFAULT_FRAME_TIME_MS = 16.67d;

    // ---- Render axis ----
    public static final double TARGET_FPS = 60.0d;
    public static final double MIN_ACCEPTABLE_FPS = 45.0d;
    public static final double LOW_POWER_EXIT_RATIO = 0.9d;

    // ---- Cache axis (MB) ----
    public static final double CRITICAL_MEMORY_MB = 150.0d;
    public static final double WARNING_MEMORY_MB = 100.0d;

    // ---- Animation scaling ----
    public static final double LOW_POWER_CREATION_SCALE = 0.8d;
    public static final double LOW_POWER_LIVE_SCALE = 0.7d;
    public static final long LOW_POWER_LIVE_SCALE_MIN_NOMINAL_MS = 500L;

    // ---- Periodic tasks ----
    public static final long DEFAULT_ADAPTIVE_CHECK_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_REPORTING_INTERVAL_MS = 5 * 60_000L;
    public static final long DEFAULT_COLLABORATOR_TIMEOUT_MS = 5_000L;

    // ---- Shutdown ----
    public static final long EXECUTOR_QUIET_PERIOD_MS = 0L;
    public static final long EXECUTOR_SHUTDOWN_TIMEOUT_MS = 2_000L;

    public static final long BYTES_PER_MB = 1024L * 1024L;

    private GovernorDefaults() {
    }
}
