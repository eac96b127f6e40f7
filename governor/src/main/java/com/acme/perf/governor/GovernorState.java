package com.acme.perf.governor;

import com.acme.perf.governor.api.CacheStatistics;
import com.acme.perf.governor.mode.CacheMode;
import com.acme.perf.governor.mode.HysteresisModeController;
import com.acme.perf.governor.mode.ModeThresholds;
import com.acme.perf.governor.mode.RenderMode;

final class GovernorState {
    private final HysteresisModeController modes;
    private volatile double lastHealthScore = Double.NaN;
    private volatile long lastMemoryUsageBytes;
    private volatile CacheStatistics lastCacheStatistics = CacheStatistics.HEALTHY;

    GovernorState(ModeThresholds thresholds) {
        this.modes = new HysteresisModeController(thresholds);
    }

    HysteresisModeController modes() {
        return modes;
    }

    RenderMode renderMode() {
        return modes.renderMode();
    }

    CacheMode cacheMode() {
        return modes.cacheMode();
    }

    double lastHealthScore() {
        return lastHealthScore;
    }

    void recordHealthScore(double score) {
        this.lastHealthScore = score;
    }

    long lastMemoryUsageBytes() {
        return lastMemoryUsageBytes;
    }

    void recordMemoryUsage(long bytes) {
        this.lastMemoryUsageBytes = Math.max(0L, bytes);
    }

    CacheStatistics lastCacheStatistics() {
        return lastCacheStatistics;
    }

    void recordCacheStatistics(CacheStatistics statistics) {
        this.lastCacheStatistics = statistics;
    }

    void reset() {
        modes.reset();
        lastHealthScore = Double.NaN;
        lastMemoryUsageBytes = 0L;
        lastCacheStatistics = CacheStatistics.HEALTHY;
    }
}
