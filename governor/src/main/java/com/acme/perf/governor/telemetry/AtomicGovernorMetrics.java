package com.acme.perf.governor.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicGovernorMetrics implements GovernorMetrics {
    private final LongAdder fpsRecomputations = new LongAdder();
    private final LongAdder renderTransitions = new LongAdder();
    private final LongAdder cacheTransitions = new LongAdder();
    private final LongAdder adaptiveChecks = new LongAdder();
    private final LongAdder skippedChecks = new LongAdder();
    private final LongAdder schedulingFailures = new LongAdder();
    private final LongAdder lateTicks = new LongAdder();
    private final LongAdder forcedOptimizations = new LongAdder();
    private final LongAdder handlesScaled = new LongAdder();
    private final ConcurrentHashMap<String, LongAdder> collaboratorFailures = new ConcurrentHashMap<>();

    @Override
    public void incFpsRecomputations() {
        fpsRecomputations.increment();
    }

    @Override
    public void incRenderTransitions() {
        renderTransitions.increment();
    }

    @Override
    public void incCacheTransitions() {
        cacheTransitions.increment();
    }

    @Override
    public void incAdaptiveChecks() {
        adaptiveChecks.increment();
    }

    @Override
    public void incSkippedChecks() {
        skippedChecks.increment();
    }

    @Override
    public void incCollaboratorFailures(String collaborator) {
        String key = collaborator == null || collaborator.isBlank() ? "unknown" : collaborator;
        collaboratorFailures.computeIfAbsent(key, ignored -> new LongAdder()).increment();
    }

    @Override
    public void incSchedulingFailures() {
        schedulingFailures.increment();
    }

    @Override
    public void incLateTicks() {
        lateTicks.increment();
    }

    @Override
    public void incForcedOptimizations() {
        forcedOptimizations.increment();
    }

    @Override
    public void observeHandlesScaled(int n) {
        if (n <= 0) return;
        handlesScaled.add(n);
    }

    public Snapshot snapshot() {
        Map<String, Long> failures = new TreeMap<>();
        collaboratorFailures.forEach((k, v) -> failures.put(k, v.sum()));
        return new Snapshot(
            fpsRecomputations.sum(),
            renderTransitions.sum(),
            cacheTransitions.sum(),
            adaptiveChecks.sum(),
            skippedChecks.sum(),
            schedulingFailures.sum(),
            lateTicks.sum(),
            forcedOptimizations.sum(),
            handlesScaled.sum(),
            Collections.unmodifiableMap(failures)
        );
    }

    public record Snapshot(long fpsRecomputations,
                           long renderTransitions,
                           long cacheTransitions,
                           long adaptiveChecks,
                           long skippedChecks,
                           long schedulingFailures,
                           long lateTicks,
                           long forcedOptimizations,
                           long handlesScaled,
                           Map<String, Long> collaboratorFailuresByName) {

        public long collaboratorFailures() {
            long total = 0L;
            for (long v : collaboratorFailuresByName.values()) {
                total += v;
            }
            return total;
        }

        public Map<String, Long> toCounters() {
            Map<String, Long> out = new LinkedHashMap<>();
            out.put("fpsRecomputations", fpsRecomputations);
            out.put("renderTransitions", renderTransitions);
            out.put("cacheTransitions", cacheTransitions);
            out.put("adaptiveChecks", adaptiveChecks);
            out.put("skippedChecks", skippedChecks);
            out.put("schedulingFailures", schedulingFailures);
            out.put("lateTicks", lateTicks);
            out.put("forcedOptimizations", forcedOptimizations);
            out.put("handlesScaled", handlesScaled);
            collaboratorFailuresByName.forEach((k, v) -> out.put("collaboratorFailures." + k, v));
            return out;
        }
    }
}
