package com.acme.perf.governor.health;

import com.acme.perf.governor.util.GovernorDefaults;

import java.util.ArrayList;
import java.util.List;

/**
 * Weighted 0..100 health score over frame rate (40), memory headroom (30) and cache
 * hit rate (30), plus the recommendations that apply to the inputs.
 *
 * <p>Stateless.
 */
public final class HealthEvaluator {
    public static final String REDUCE_ANIMATION_COMPLEXITY = "Consider reducing animation complexity or duration";
    public static final String CLEAR_CACHES = "Memory usage is high, consider clearing caches";
    public static final String REVIEW_CACHING_STRATEGY = "Cache hit rate is low, review caching strategy";
    public static final String STAGGER_ANIMATIONS = "Multiple animations active, consider staggering them";

    static final double FPS_WEIGHT = 40.0d;
    static final double MEMORY_WEIGHT = 30.0d;
    static final double CACHE_WEIGHT = 30.0d;
    static final double MEMORY_CEILING_MB = 200.0d;

    static final double LOW_FPS_ADVICE = 45.0d;
    static final double HIGH_MEMORY_ADVICE_MB = 100.0d;
    public static final double MIN_HEALTHY_HIT_RATE = 0.7d;
    static final int BUSY_ANIMATION_ADVICE = 5;

    private HealthEvaluator() {
    }

    public static HealthReport evaluate(double fps, double memoryMb, double cacheHitRate, int activeHandleCount) {
        double score = score(fps, memoryMb, cacheHitRate);
        return new HealthReport(score, HealthStatus.fromScore(score),
            recommendations(fps, memoryMb, cacheHitRate, activeHandleCount));
    }

    public static double score(double fps, double memoryMb, double cacheHitRate) {
        double fpsScore = unit(fps / GovernorDefaults.TARGET_FPS) * FPS_WEIGHT;
        double memoryScore = (1.0d - unit(memoryMb / MEMORY_CEILING_MB)) * MEMORY_WEIGHT;
        double cacheScore = unit(cacheHitRate) * CACHE_WEIGHT;
        return Math.max(0.0d, Math.min(100.0d, fpsScore + memoryScore + cacheScore));
    }

    public static List<String> recommendations(double fps,
                                               double memoryMb,
                                               double cacheHitRate,
                                               int activeHandleCount) {
        List<String> out = new ArrayList<>(4);
        if (fps < LOW_FPS_ADVICE) {
            out.add(REDUCE_ANIMATION_COMPLEXITY);
        }
        if (memoryMb > HIGH_MEMORY_ADVICE_MB) {
            out.add(CLEAR_CACHES);
        }
        if (cacheHitRate < MIN_HEALTHY_HIT_RATE) {
            out.add(REVIEW_CACHING_STRATEGY);
        }
        if (activeHandleCount > BUSY_ANIMATION_ADVICE) {
            out.add(STAGGER_ANIMATIONS);
        }
        return out;
    }

    // NaN maps to 0
    private static double unit(double v) {
        if (Double.isNaN(v) || v < 0.0d) return 0.0d;
        return Math.min(v, 1.0d);
    }
}
