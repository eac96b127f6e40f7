package com.acme.perf.governor.jvm;

import com.acme.perf.governor.api.HostMemoryReclaimer;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

public final class SystemGcReclaimer implements HostMemoryReclaimer {
    public static final SystemGcReclaimer INSTANCE = new SystemGcReclaimer();

    private final MemoryMXBean memoryBean = ManagementFactory.getMemoryMXBean();

    private SystemGcReclaimer() {
    }

    @Override
    public void requestReclaim() {
        memoryBean.gc();
    }
}
