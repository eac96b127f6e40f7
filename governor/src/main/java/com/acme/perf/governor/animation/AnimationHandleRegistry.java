package com.acme.perf.governor.animation;

import com.acme.perf.governor.mode.RenderMode;
import com.acme.perf.governor.util.GovernorDefaults;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Id-keyed table of live animation handles.
 *
 * <p>Handles enter on {@link #register(long, String)} and leave only when their owner calls
 * {@link #remove(AnimationHandle)} or the registry is cleared.
 */
public final class AnimationHandleRegistry {
    private static final Logger LOG = Logger.getLogger(AnimationHandleRegistry.class.getName());

    private final Map<Long, AnimationHandle> live = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1L);
    private final Supplier<RenderMode> renderMode;
    private final double creationScale;
    private final double liveScale;
    private final long liveScaleMinNominalMs;

    public AnimationHandleRegistry(Supplier<RenderMode> renderMode) {
        this(renderMode,
            GovernorDefaults.LOW_POWER_CREATION_SCALE,
            GovernorDefaults.LOW_POWER_LIVE_SCALE,
            GovernorDefaults.LOW_POWER_LIVE_SCALE_MIN_NOMINAL_MS);
    }

    public AnimationHandleRegistry(Supplier<RenderMode> renderMode,
                                   double creationScale,
                                   double liveScale,
                                   long liveScaleMinNominalMs) {
        this.renderMode = Objects.requireNonNull(renderMode, "renderMode");
        this.creationScale = clampScale(creationScale);
        this.liveScale = clampScale(liveScale);
        this.liveScaleMinNominalMs = Math.max(0L, liveScaleMinNominalMs);
    }

    /**
     * Registers a handle. In LOW_POWER the effective duration is scaled down at creation.
     *
     * @throws IllegalArgumentException if {@code nominalDurationMs} is negative
     */
    public AnimationHandle register(long nominalDurationMs, String label) {
        if (nominalDurationMs < 0L) {
            throw new IllegalArgumentException("nominalDurationMs must be >= 0: " + nominalDurationMs);
        }
        long id = nextId.getAndIncrement();
        String name = label == null || label.isBlank() ? "handle-" + id : label;
        double scale = renderMode.get() == RenderMode.LOW_POWER ? creationScale : 1.0d;
        AnimationHandle handle = new AnimationHandle(id, name, nominalDurationMs, scale);
        live.put(id, handle);
        return handle;
    }

    /**
     * Sets the live scale on every live handle longer than the threshold. Called once per
     * entry into LOW_POWER.
     *
     * @return number of handles rescaled
     */
    public int applyLowPowerScaling() {
        int rescaled = 0;
        for (AnimationHandle handle : live.values()) {
            if (handle.nominalDurationMs() > liveScaleMinNominalMs) {
                handle.rescale(liveScale);
                rescaled++;
            }
        }
        int total = rescaled;
        LOG.fine(() -> "Low-power scaling applied to " + total + " of " + live.size() + " handles");
        return rescaled;
    }

    /**
     * Removes exactly this handle. A handle issued by another registry never matches,
     * even when its id is in use here.
     *
     * @return true if the handle was live and is now removed; false on repeat calls
     */
    public boolean remove(AnimationHandle handle) {
        if (handle == null || !live.remove(handle.id(), handle)) {
            return false;
        }
        handle.markRemoved();
        return true;
    }

    public boolean remove(long id) {
        AnimationHandle removed = live.remove(id);
        if (removed == null) {
            return false;
        }
        removed.markRemoved();
        return true;
    }

    public AnimationHandle find(long id) {
        return live.get(id);
    }

    public boolean recordTick(AnimationHandle handle) {
        if (handle == null || live.get(handle.id()) != handle) {
            return false;
        }
        handle.tick();
        return true;
    }

    public int count() {
        return live.size();
    }

    public void clear() {
        for (AnimationHandle handle : live.values()) {
            handle.markRemoved();
        }
        live.clear();
    }

    private static double clampScale(double scale) {
        if (Double.isNaN(scale) || scale <= 0.0d) {
            throw new IllegalArgumentException("scale must be > 0: " + scale);
        }
        return Math.min(scale, 1.0d);
    }
}
