package com.acme.perf.governor.api;

@FunctionalInterface
public interface HostMemoryReclaimer {
    HostMemoryReclaimer NONE = () -> { };

    void requestReclaim();
}
