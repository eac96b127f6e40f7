package com.acme.perf.governor;

import com.acme.perf.governor.api.CacheStatistics;
import com.acme.perf.governor.health.HealthEvaluator;
import com.acme.perf.governor.health.HealthStatus;
import com.acme.perf.governor.mode.CacheMode;
import com.acme.perf.governor.mode.RenderMode;
import com.acme.perf.governor.util.GovernorDefaults;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record PerformanceSnapshot(
    double currentFps,
    double averageFrameTimeMs,
    RenderMode renderMode,
    CacheMode cacheMode,
    int activeHandleCount,
    long memoryUsageBytes,
    CacheStatistics cacheStatistics,
    double healthScore,
    HealthStatus healthStatus,
    List<String> recommendations,
    boolean adaptiveOptimizationEnabled
) {
    public PerformanceSnapshot {
        recommendations = List.copyOf(recommendations);
    }

    public double memoryUsageMb() {
        return memoryUsageBytes / (double) GovernorDefaults.BYTES_PER_MB;
    }

    public boolean hasPerformanceIssues() {
        return currentFps < GovernorDefaults.MIN_ACCEPTABLE_FPS
            || memoryUsageMb() > GovernorDefaults.WARNING_MEMORY_MB
            || cacheStatistics.hitRate() < HealthEvaluator.MIN_HEALTHY_HIT_RATE;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("current_fps", currentFps);
        out.put("average_frame_time_ms", averageFrameTimeMs);
        out.put("render_mode", renderMode.name());
        out.put("cache_mode", cacheMode.name());
        out.put("active_animations", activeHandleCount);
        out.put("memory_usage_mb", memoryUsageMb());
        out.put("cache_stats", cacheStatistics.toMap());
        out.put("health_score", healthScore);
        out.put("health_status", healthStatus.name());
        out.put("has_performance_issues", hasPerformanceIssues());
        out.put("adaptive_optimization_active", adaptiveOptimizationEnabled);
        out.put("recommendations", recommendations);
        return out;
    }
}
