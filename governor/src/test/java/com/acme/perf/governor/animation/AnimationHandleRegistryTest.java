package com.acme.perf.governor.animation;

import com.acme.perf.governor.mode.RenderMode;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnimationHandleRegistryTest {

    @Test
    void shouldShortenHandlesCreatedInLowPower() {
        AtomicReference<RenderMode> mode = new AtomicReference<>(RenderMode.NORMAL);
        AnimationHandleRegistry registry = new AnimationHandleRegistry(mode::get);

        AnimationHandle normal = registry.register(1_000L, "fade");
        assertEquals(1_000L, normal.effectiveDurationMs());

        mode.set(RenderMode.LOW_POWER);
        AnimationHandle reduced = registry.register(1_000L, "slide");
        assertEquals(800L, reduced.effectiveDurationMs());
        assertEquals(1_000L, reduced.nominalDurationMs());
        assertEquals(2, registry.count());
    }

    @Test
    void shouldScaleOnlyLongLiveHandles() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle shortOne = registry.register(300L, "short");
        AnimationHandle boundary = registry.register(500L, "boundary");
        AnimationHandle longOne = registry.register(1_000L, "long");

        assertEquals(1, registry.applyLowPowerScaling());
        assertEquals(300L, shortOne.effectiveDurationMs());
        assertEquals(500L, boundary.effectiveDurationMs());
        assertEquals(700L, longOne.effectiveDurationMs());
    }

    @Test
    void shouldNotCompoundRepeatedScaling() {
        AtomicReference<RenderMode> mode = new AtomicReference<>(RenderMode.LOW_POWER);
        AnimationHandleRegistry registry = new AnimationHandleRegistry(mode::get);
        AnimationHandle handle = registry.register(1_000L, "pulse");
        assertEquals(800L, handle.effectiveDurationMs());

        registry.applyLowPowerScaling();
        registry.applyLowPowerScaling();
        registry.applyLowPowerScaling();
        assertEquals(700L, handle.effectiveDurationMs());
        assertEquals(0.7d, handle.scale(), 1e-9);
    }

    @Test
    void shouldRemoveIdempotently() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle handle = registry.register(200L, "blink");

        assertTrue(registry.remove(handle));
        assertFalse(handle.isLive());
        assertFalse(registry.remove(handle));
        assertFalse(registry.remove(handle.id()));
        assertFalse(registry.remove(null));
        assertNull(registry.find(handle.id()));
        assertEquals(0, registry.count());
    }

    @Test
    void shouldNotRemoveHandleIssuedByAnotherRegistry() {
        AnimationHandleRegistry previous = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandleRegistry current = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle stale = previous.register(300L, "old");
        AnimationHandle fresh = current.register(300L, "new");
        assertEquals(stale.id(), fresh.id());

        assertFalse(current.remove(stale));
        assertTrue(fresh.isLive());
        assertTrue(stale.isLive());
        assertSame(fresh, current.find(fresh.id()));
        assertEquals(1, current.count());
    }

    @Test
    void shouldAssignUniqueIdsAndDefaultLabels() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle a = registry.register(0L, null);
        AnimationHandle b = registry.register(0L, "  ");
        assertNotEquals(a.id(), b.id());
        assertEquals("handle-" + a.id(), a.label());
        assertEquals("handle-" + b.id(), b.label());
        assertSame(a, registry.find(a.id()));
    }

    @Test
    void shouldCountTicksOnlyForLiveHandles() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle handle = registry.register(100L, "spin");
        assertTrue(registry.recordTick(handle));
        assertTrue(registry.recordTick(handle));
        registry.remove(handle);
        assertFalse(registry.recordTick(handle));
        assertEquals(2L, handle.ticks());
    }

    @Test
    void shouldClearAndMarkHandlesRemoved() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        AnimationHandle a = registry.register(100L, "a");
        AnimationHandle b = registry.register(900L, "b");
        registry.clear();
        assertEquals(0, registry.count());
        assertFalse(a.isLive());
        assertFalse(b.isLive());
        assertEquals(0, registry.applyLowPowerScaling());
    }

    @Test
    void shouldRejectInvalidInputs() {
        AnimationHandleRegistry registry = new AnimationHandleRegistry(() -> RenderMode.NORMAL);
        assertThrows(IllegalArgumentException.class, () -> registry.register(-1L, "bad"));
        assertThrows(IllegalArgumentException.class,
            () -> new AnimationHandleRegistry(() -> RenderMode.NORMAL, 0.0d, 0.7d, 500L));
    }
}
