package com.acme.perf.governor;

import com.acme.perf.governor.mode.ModeThresholds;
import com.acme.perf.governor.util.EnvVars;
import com.acme.perf.governor.util.GovernorDefaults;
import com.acme.perf.governor.util.GovernorEnvKeys;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Governor settings. Validated by {@link AdaptiveGovernor#initialize(GovernorConfig)}, not at construction.
 */
public record GovernorConfig(
    boolean adaptiveOptimizationEnabled,
    Duration adaptiveCheckInterval,
    boolean reportingEnabled,
    Duration reportingInterval,
    Duration collaboratorTimeout,
    boolean metricsEnabled,
    ModeThresholds thresholds
) {
    public GovernorConfig {
        Objects.requireNonNull(adaptiveCheckInterval, "adaptiveCheckInterval");
        Objects.requireNonNull(reportingInterval, "reportingInterval");
        Objects.requireNonNull(collaboratorTimeout, "collaboratorTimeout");
        Objects.requireNonNull(thresholds, "thresholds");
    }

    public static GovernorConfig defaults() {
        return builder().build();
    }

    public static GovernorConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads {@link GovernorEnvKeys}; missing or malformed values keep their defaults, out-of-range values are clamped.
     *
     * @throws IllegalArgumentException if the resulting thresholds do not form a valid band
     */
    public static GovernorConfig fromEnv(Map<String, String> env) {
        ModeThresholds thresholds = new ModeThresholds(
            EnvVars.getDoubleClamped(env, GovernorEnvKeys.GOVERNOR_MIN_FPS,
                GovernorDefaults.MIN_ACCEPTABLE_FPS, 1.0d, GovernorDefaults.MAX_FPS),
            EnvVars.getDoubleClamped(env, GovernorEnvKeys.GOVERNOR_TARGET_FPS,
                GovernorDefaults.TARGET_FPS, 1.0d, GovernorDefaults.MAX_FPS),
            EnvVars.getDoubleClamped(env, GovernorEnvKeys.GOVERNOR_LOW_POWER_EXIT_RATIO,
                GovernorDefaults.LOW_POWER_EXIT_RATIO, 0.1d, 1.0d),
            EnvVars.getDoubleClamped(env, GovernorEnvKeys.GOVERNOR_MEMORY_CRITICAL_MB,
                GovernorDefaults.CRITICAL_MEMORY_MB, 1.0d, 1_048_576.0d),
            EnvVars.getDoubleClamped(env, GovernorEnvKeys.GOVERNOR_MEMORY_WARNING_MB,
                GovernorDefaults.WARNING_MEMORY_MB, 1.0d, 1_048_576.0d)
        );
        return builder()
            .adaptiveOptimizationEnabled(EnvVars.getBoolean(env, GovernorEnvKeys.GOVERNOR_ADAPTIVE_ENABLED, true))
            .adaptiveCheckInterval(EnvVars.getMillisClamped(env, GovernorEnvKeys.GOVERNOR_ADAPTIVE_INTERVAL_MS,
                GovernorDefaults.DEFAULT_ADAPTIVE_CHECK_INTERVAL_MS, 100L, 3_600_000L))
            .reportingEnabled(EnvVars.getBoolean(env, GovernorEnvKeys.GOVERNOR_REPORTING_ENABLED, true))
            .reportingInterval(EnvVars.getMillisClamped(env, GovernorEnvKeys.GOVERNOR_REPORTING_INTERVAL_MS,
                GovernorDefaults.DEFAULT_REPORTING_INTERVAL_MS, 1_000L, 86_400_000L))
            .collaboratorTimeout(EnvVars.getMillisClamped(env, GovernorEnvKeys.GOVERNOR_COLLABORATOR_TIMEOUT_MS,
                GovernorDefaults.DEFAULT_COLLABORATOR_TIMEOUT_MS, 10L, 600_000L))
            .metricsEnabled(EnvVars.getBoolean(env, GovernorEnvKeys.GOVERNOR_METRICS_ENABLED, true))
            .thresholds(thresholds)
            .build();
    }

    public void validate() {
        requirePositive("adaptiveCheckInterval", adaptiveCheckInterval);
        requirePositive("reportingInterval", reportingInterval);
        requirePositive("collaboratorTimeout", collaboratorTimeout);
    }

    private static void requirePositive(String name, Duration d) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive: " + d);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .adaptiveOptimizationEnabled(adaptiveOptimizationEnabled)
            .adaptiveCheckInterval(adaptiveCheckInterval)
            .reportingEnabled(reportingEnabled)
            .reportingInterval(reportingInterval)
            .collaboratorTimeout(collaboratorTimeout)
            .metricsEnabled(metricsEnabled)
            .thresholds(thresholds);
    }

    public static final class Builder {
        private boolean adaptiveOptimizationEnabled = true;
        private Duration adaptiveCheckInterval = Duration.ofMillis(GovernorDefaults.DEFAULT_ADAPTIVE_CHECK_INTERVAL_MS);
        private boolean reportingEnabled = true;
        private Duration reportingInterval = Duration.ofMillis(GovernorDefaults.DEFAULT_REPORTING_INTERVAL_MS);
        private Duration collaboratorTimeout = Duration.ofMillis(GovernorDefaults.DEFAULT_COLLABORATOR_TIMEOUT_MS);
        private boolean metricsEnabled = true;
        private ModeThresholds thresholds = ModeThresholds.DEFAULT;

        private Builder() {
        }

        public Builder adaptiveOptimizationEnabled(boolean enabled) {
            this.adaptiveOptimizationEnabled = enabled;
            return this;
        }

        public Builder adaptiveCheckInterval(Duration interval) {
            this.adaptiveCheckInterval = interval;
            return this;
        }

        public Builder reportingEnabled(boolean enabled) {
            this.reportingEnabled = enabled;
            return this;
        }

        public Builder reportingInterval(Duration interval) {
            this.reportingInterval = interval;
            return this;
        }

        public Builder collaboratorTimeout(Duration timeout) {
            this.collaboratorTimeout = timeout;
            return this;
        }

        public Builder metricsEnabled(boolean enabled) {
            this.metricsEnabled = enabled;
            return this;
        }

        public Builder thresholds(ModeThresholds thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public GovernorConfig build() {
            return new GovernorConfig(
                adaptiveOptimizationEnabled,
                adaptiveCheckInterval,
                reportingEnabled,
                reportingInterval,
                collaboratorTimeout,
                metricsEnabled,
                thresholds
            );
        }
    }
}
