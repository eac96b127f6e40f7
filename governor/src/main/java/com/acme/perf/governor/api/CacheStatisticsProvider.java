package com.acme.perf.governor.api;

import java.util.concurrent.CompletableFuture;

/**
 * Cache subsystem the governor observes and commands but does not own.
 */
public interface CacheStatisticsProvider {
    CompletableFuture<CacheStatistics> getStatistics();

    /**
     * Asks the cache to reclaim memory (expire stale entries, compact). The governor only
     * decides when this runs; eviction itself is up to the provider.
     */
    CompletableFuture<Void> optimizeMemoryUsage();
}
