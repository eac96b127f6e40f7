package com.acme.perf.governor.telemetry;

public interface GovernorMetrics {
    void incFpsRecomputations();
    void incRenderTransitions();
    void incCacheTransitions();
    void incAdaptiveChecks();
    void incSkippedChecks();
    void incCollaboratorFailures(String collaborator);
    void incSchedulingFailures();
    void incLateTicks();
    void incForcedOptimizations();
    void observeHandlesScaled(int n);
}
