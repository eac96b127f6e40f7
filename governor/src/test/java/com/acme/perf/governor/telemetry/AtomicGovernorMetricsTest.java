package com.acme.perf.governor.telemetry;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class AtomicGovernorMetricsTest {

    @Test
    void shouldAccumulateCounters() {
        AtomicGovernorMetrics metrics = new AtomicGovernorMetrics();
        metrics.incFpsRecomputations();
        metrics.incFpsRecomputations();
        metrics.incRenderTransitions();
        metrics.incCacheTransitions();
        metrics.incAdaptiveChecks();
        metrics.incSkippedChecks();
        metrics.incSchedulingFailures();
        metrics.incLateTicks();
        metrics.incForcedOptimizations();
        metrics.observeHandlesScaled(3);
        metrics.observeHandlesScaled(0);
        metrics.observeHandlesScaled(-4);

        AtomicGovernorMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(2L, snapshot.fpsRecomputations());
        assertEquals(1L, snapshot.renderTransitions());
        assertEquals(1L, snapshot.cacheTransitions());
        assertEquals(1L, snapshot.adaptiveChecks());
        assertEquals(1L, snapshot.skippedChecks());
        assertEquals(1L, snapshot.schedulingFailures());
        assertEquals(1L, snapshot.lateTicks());
        assertEquals(1L, snapshot.forcedOptimizations());
        assertEquals(3L, snapshot.handlesScaled());
    }

    @Test
    void shouldTrackCollaboratorFailuresByName() {
        AtomicGovernorMetrics metrics = new AtomicGovernorMetrics();
        metrics.incCollaboratorFailures("memoryProbe");
        metrics.incCollaboratorFailures("memoryProbe");
        metrics.incCollaboratorFailures("cacheStatistics");
        metrics.incCollaboratorFailures(" ");

        AtomicGovernorMetrics.Snapshot snapshot = metrics.snapshot();
        assertEquals(4L, snapshot.collaboratorFailures());
        assertEquals(2L, snapshot.collaboratorFailuresByName().get("memoryProbe"));
        assertEquals(1L, snapshot.collaboratorFailuresByName().get("unknown"));

        Map<String, Long> counters = snapshot.toCounters();
        assertEquals(2L, counters.get("collaboratorFailures.memoryProbe"));
        assertEquals(1L, counters.get("collaboratorFailures.cacheStatistics"));
        assertEquals(0L, counters.get("skippedChecks"));
    }

    @Test
    void shouldExposeStableCounterKeysWhenIdle() {
        Map<String, Long> counters = new AtomicGovernorMetrics().snapshot().toCounters();
        assertEquals(9, counters.size());
        assertFalse(counters.containsKey("collaboratorFailures"));
        counters.values().forEach(v -> assertEquals(0L, v));
    }
}
