package com.acme.perf.governor.mode;

import com.acme.perf.governor.util.GovernorDefaults;

/**
 * Enter/exit thresholds for both axes. Each axis leaves its reduced-cost state at a
 * threshold strictly on the healthy side of the one that entered it.
 *
 * @param minFps           render axis enters LOW_POWER below this
 * @param targetFps        nominal frame rate
 * @param exitRatio        render axis returns to NORMAL above {@code targetFps * exitRatio}
 * @param criticalMemoryMb cache axis enters AGGRESSIVE above this
 * @param warningMemoryMb  cache axis returns to NORMAL below this
 */
public record ModeThresholds(
    double minFps,
    double targetFps,
    double exitRatio,
    double criticalMemoryMb,
    double warningMemoryMb
) {
    public static final ModeThresholds DEFAULT = new ModeThresholds(
        GovernorDefaults.MIN_ACCEPTABLE_FPS,
        GovernorDefaults.TARGET_FPS,
        GovernorDefaults.LOW_POWER_EXIT_RATIO,
        GovernorDefaults.CRITICAL_MEMORY_MB,
        GovernorDefaults.WARNING_MEMORY_MB
    );

    public ModeThresholds {
        requirePositive("minFps", minFps);
        requirePositive("targetFps", targetFps);
        requirePositive("exitRatio", exitRatio);
        requirePositive("criticalMemoryMb", criticalMemoryMb);
        requirePositive("warningMemoryMb", warningMemoryMb);
        if (targetFps * exitRatio < minFps) {
            throw new IllegalArgumentException("low-power exit fps " + (targetFps * exitRatio)
                + " must not be below minFps " + minFps);
        }
        if (warningMemoryMb >= criticalMemoryMb) {
            throw new IllegalArgumentException("warningMemoryMb " + warningMemoryMb
                + " must be below criticalMemoryMb " + criticalMemoryMb);
        }
    }

    public double lowPowerExitFps() {
        return targetFps * exitRatio;
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0.0d) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite number: " + value);
        }
    }
}
