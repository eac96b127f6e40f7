package com.acme.perf.governor.api;

/**
 * Push source of per-frame render latencies (a choreographer, a vsync callback, a render loop).
 *
 * <p>Frames may be delivered from any thread.
 */
public interface FrameLatencySource {
    Subscription subscribe(FrameListener listener);
}
