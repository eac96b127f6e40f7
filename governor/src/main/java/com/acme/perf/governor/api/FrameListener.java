package com.acme.perf.governor.api;

@FunctionalInterface
public interface FrameListener {
    void onFrame(double latencyMs);
}
