package com.acme.perf.governor.telemetry;

public final class NoopGovernorMetrics implements GovernorMetrics {
    public static final NoopGovernorMetrics INSTANCE = new NoopGovernorMetrics();

    private NoopGovernorMetrics() {
    }

    @Override
    public void incFpsRecomputations() {
    }

    @Override
    public void incRenderTransitions() {
    }

    @Override
    public void incCacheTransitions() {
    }

    @Override
    public void incAdaptiveChecks() {
    }

    @Override
    public void incSkippedChecks() {
    }

    @Override
    public void incCollaboratorFailures(String collaborator) {
    }

    @Override
    public void incSchedulingFailures() {
    }

    @Override
    public void incLateTicks() {
    }

    @Override
    public void incForcedOptimizations() {
    }

    @Override
    public void observeHandlesScaled(int n) {
    }
}
