package com.acme.perf.governor.api;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface MemoryProbe {
    CompletableFuture<Long> currentUsageBytes();
}
