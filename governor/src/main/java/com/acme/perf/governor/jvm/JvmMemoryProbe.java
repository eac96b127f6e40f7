package com.acme.perf.governor.jvm;

import com.acme.perf.governor.api.MemoryProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

public final class JvmMemoryProbe implements MemoryProbe {
    private final MemoryMXBean memoryBean;
    private final boolean includeNonHeap;

    public JvmMemoryProbe() {
        this(ManagementFactory.getMemoryMXBean(), false);
    }

    public JvmMemoryProbe(MemoryMXBean memoryBean, boolean includeNonHeap) {
        this.memoryBean = Objects.requireNonNull(memoryBean, "memoryBean");
        this.includeNonHeap = includeNonHeap;
    }

    @Override
    public CompletableFuture<Long> currentUsageBytes() {
        try {
            long used = memoryBean.getHeapMemoryUsage().getUsed();
            if (includeNonHeap) {
                used += memoryBean.getNonHeapMemoryUsage().getUsed();
            }
            return CompletableFuture.completedFuture(Math.max(0L, used));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
