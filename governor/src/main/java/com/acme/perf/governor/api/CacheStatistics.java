package com.acme.perf.governor.api;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cache health as reported by a {@link CacheStatisticsProvider}. Never mutated by the governor.
 *
 * @param hitRate           overall hit rate in {@code [0, 1]}
 * @param entryCount        total cached entries across segments, or 0 when unknown
 * @param segmentHitRates   per-segment hit rates keyed by segment name, possibly empty
 */
public record CacheStatistics(double hitRate, long entryCount, Map<String, Double> segmentHitRates) {
    /** Assumed when no provider answers: a cache that never misses. */
    public static final CacheStatistics HEALTHY = new CacheStatistics(1.0d, 0L, Map.of());

    public CacheStatistics {
        if (Double.isNaN(hitRate)) {
            hitRate = 0.0d;
        }
        hitRate = Math.max(0.0d, Math.min(1.0d, hitRate));
        entryCount = Math.max(0L, entryCount);
        segmentHitRates = segmentHitRates == null ? Map.of() : Map.copyOf(segmentHitRates);
    }

    public static CacheStatistics of(double hitRate) {
        return new CacheStatistics(hitRate, 0L, Map.of());
    }

    /**
     * Overall hit rate is the unweighted mean of the segment rates; an empty map yields {@link #HEALTHY}.
     */
    public static CacheStatistics ofSegments(Map<String, Double> segmentHitRates, long entryCount) {
        if (segmentHitRates == null || segmentHitRates.isEmpty()) {
            return HEALTHY;
        }
        double sum = 0.0d;
        for (double rate : segmentHitRates.values()) {
            sum += rate;
        }
        return new CacheStatistics(sum / segmentHitRates.size(), entryCount, segmentHitRates);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("overall_hit_rate", hitRate);
        out.put("entry_count", entryCount);
        if (!segmentHitRates.isEmpty()) {
            out.put("segment_hit_rates", new LinkedHashMap<>(segmentHitRates));
        }
        return out;
    }
}
