package com.acme.perf.governor.util;

public final class GovernorEnvKeys {
    public static final String GOVERNOR_ADAPTIVE_ENABLED = "GOVERNOR_ADAPTIVE_ENABLED";
    public static final String GOVERNOR_ADAPTIVE_INTERVAL_MS = "GOVERNOR_ADAPTIVE_INTERVAL_MS";
    public static final String GOVERNOR_REPORTING_ENABLED = "GOVERNOR_REPORTING_ENABLED";
    public static final String GOVERNOR_REPORTING_INTERVAL_MS = "GOVERNOR_REPORTING_INTERVAL_MS";
    public static final String GOVERNOR_COLLABORATOR_TIMEOUT_MS = "GOVERNOR_COLLABORATOR_TIMEOUT_MS";
    public static final String GOVERNOR_METRICS_ENABLED = "GOVERNOR_METRICS_ENABLED";

    public static final String GOVERNOR_MIN_FPS = "GOVERNOR_MIN_FPS";
    public static final String GOVERNOR_TARGET_FPS = "GOVERNOR_TARGET_FPS";
    public static final String GOVERNOR_LOW_POWER_EXIT_RATIO = "GOVERNOR_LOW_POWER_EXIT_RATIO";
    public static final String GOVERNOR_MEMORY_CRITICAL_MB = "GOVERNOR_MEMORY_CRITICAL_MB";
    public static final String GOVERNOR_MEMORY_WARNING_MB = "GOVERNOR_MEMORY_WARNING_MB";

    private GovernorEnvKeys() {
    }
}
