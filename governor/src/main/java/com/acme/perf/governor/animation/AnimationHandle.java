package com.acme.perf.governor.animation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One externally owned animated value tracked by {@link AnimationHandleRegistry}.
 *
 * <p>The nominal duration is fixed at registration. The effective duration is always
 * derived as {@code nominal * scale}, so rescaling never compounds.
 */
public final class AnimationHandle {
    private final long id;
    private final String label;
    private final long nominalDurationMs;
    private final AtomicLong ticks = new AtomicLong();
    private volatile double scale;
    private volatile boolean live = true;

    AnimationHandle(long id, String label, long nominalDurationMs, double scale) {
        this.id = id;
        this.label = label;
        this.nominalDurationMs = nominalDurationMs;
        this.scale = scale;
    }

    public long id() {
        return id;
    }

    public String label() {
        return label;
    }

    public long nominalDurationMs() {
        return nominalDurationMs;
    }

    public double scale() {
        return scale;
    }

    public long effectiveDurationMs() {
        return Math.round(nominalDurationMs * scale);
    }

    public boolean isLive() {
        return live;
    }

    public long ticks() {
        return ticks.get();
    }

    void rescale(double newScale) {
        this.scale = newScale;
    }

    void markRemoved() {
        this.live = false;
    }

    void tick() {
        ticks.incrementAndGet();
    }

    @Override
    public String toString() {
        return "AnimationHandle{id=" + id
            + ", label=" + label
            + ", nominalMs=" + nominalDurationMs
            + ", effectiveMs=" + effectiveDurationMs()
            + ", live=" + live + '}';
    }
}
