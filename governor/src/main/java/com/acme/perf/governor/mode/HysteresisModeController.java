package com.acme.perf.governor.mode;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Two independent two-state machines with separate enter and exit thresholds.
 *
 * <p>Render axis: NORMAL to LOW_POWER below {@code minFps}, back above
 * {@code targetFps * exitRatio}. Cache axis: NORMAL to AGGRESSIVE above
 * {@code criticalMemoryMb}, back below {@code warningMemoryMb}. Inputs inside a band
 * never change the mode.
 */
public final class HysteresisModeController {
    private final ModeThresholds thresholds;
    private final AtomicReference<RenderMode> renderMode = new AtomicReference<>(RenderMode.NORMAL);
    private final AtomicReference<CacheMode> cacheMode = new AtomicReference<>(CacheMode.NORMAL);

    public HysteresisModeController() {
        this(ModeThresholds.DEFAULT);
    }

    public HysteresisModeController(ModeThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds");
    }

    public ModeDecision<RenderMode> onFps(double fps) {
        while (true) {
            RenderMode prev = renderMode.get();
            ModeDecision<RenderMode> decision = decideRender(prev, fps);
            if (decision instanceof ModeDecision.Hold) {
                return decision;
            }
            if (renderMode.compareAndSet(prev, decision.mode())) {
                return decision;
            }
            // lost the race to a concurrent evaluation; decide again against the new mode
        }
    }

    public ModeDecision<CacheMode> onMemoryMb(double memoryMb) {
        while (true) {
            CacheMode prev = cacheMode.get();
            ModeDecision<CacheMode> decision = decideCache(prev, memoryMb);
            if (decision instanceof ModeDecision.Hold) {
                return decision;
            }
            if (cacheMode.compareAndSet(prev, decision.mode())) {
                return decision;
            }
        }
    }

    private ModeDecision<RenderMode> decideRender(RenderMode prev, double fps) {
        if (Double.isNaN(fps)) {
            return new ModeDecision.Hold<>(prev, "fps_unknown");
        }
        if (prev == RenderMode.NORMAL) {
            return fps < thresholds.minFps()
                ? new ModeDecision.Switch<>(RenderMode.NORMAL, RenderMode.LOW_POWER, "fps_below_minimum")
                : new ModeDecision.Hold<>(RenderMode.NORMAL, "fps_acceptable");
        }
        if (fps > thresholds.lowPowerExitFps()) {
            return new ModeDecision.Switch<>(RenderMode.LOW_POWER, RenderMode.NORMAL, "fps_recovered");
        }
        return new ModeDecision.Hold<>(RenderMode.LOW_POWER,
            fps >= thresholds.minFps() ? "fps_in_dead_band" : "fps_below_minimum");
    }

    private ModeDecision<CacheMode> decideCache(CacheMode prev, double memoryMb) {
        if (Double.isNaN(memoryMb)) {
            return new ModeDecision.Hold<>(prev, "memory_unknown");
        }
        if (prev == CacheMode.NORMAL) {
            return memoryMb > thresholds.criticalMemoryMb()
                ? new ModeDecision.Switch<>(CacheMode.NORMAL, CacheMode.AGGRESSIVE, "memory_above_critical")
                : new ModeDecision.Hold<>(CacheMode.NORMAL, "memory_below_critical");
        }
        if (memoryMb < thresholds.warningMemoryMb()) {
            return new ModeDecision.Switch<>(CacheMode.AGGRESSIVE, CacheMode.NORMAL, "memory_below_warning");
        }
        return new ModeDecision.Hold<>(CacheMode.AGGRESSIVE,
            memoryMb <= thresholds.criticalMemoryMb() ? "memory_in_dead_band" : "memory_above_critical");
    }

    public RenderMode renderMode() {
        return renderMode.get();
    }

    public CacheMode cacheMode() {
        return cacheMode.get();
    }

    public ModeThresholds thresholds() {
        return thresholds;
    }

    public void reset() {
        renderMode.set(RenderMode.NORMAL);
        cacheMode.set(CacheMode.NORMAL);
    }
}
