package com.acme.perf.governor;

import com.acme.perf.governor.mode.ModeThresholds;
import com.acme.perf.governor.util.GovernorEnvKeys;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GovernorConfigTest {

    @Test
    void shouldUseDefaultsForEmptyEnvironment() {
        GovernorConfig config = GovernorConfig.fromEnv(Map.of());
        assertEquals(GovernorConfig.defaults(), config);
        assertTrue(config.adaptiveOptimizationEnabled());
        assertTrue(config.reportingEnabled());
        assertEquals(Duration.ofSeconds(30), config.adaptiveCheckInterval());
        assertEquals(Duration.ofMinutes(5), config.reportingInterval());
        assertEquals(Duration.ofSeconds(5), config.collaboratorTimeout());
        assertEquals(ModeThresholds.DEFAULT, config.thresholds());
    }

    @Test
    void shouldReadAndClampEnvironment() {
        GovernorConfig config = GovernorConfig.fromEnv(Map.of(
            GovernorEnvKeys.GOVERNOR_ADAPTIVE_ENABLED, "false",
            GovernorEnvKeys.GOVERNOR_ADAPTIVE_INTERVAL_MS, "5",
            GovernorEnvKeys.GOVERNOR_REPORTING_INTERVAL_MS, "60000",
            GovernorEnvKeys.GOVERNOR_COLLABORATOR_TIMEOUT_MS, "bogus",
            GovernorEnvKeys.GOVERNOR_METRICS_ENABLED, "false",
            GovernorEnvKeys.GOVERNOR_MIN_FPS, "30",
            GovernorEnvKeys.GOVERNOR_MEMORY_CRITICAL_MB, "512",
            GovernorEnvKeys.GOVERNOR_MEMORY_WARNING_MB, "256"
        ));
        assertFalse(config.adaptiveOptimizationEnabled());
        assertEquals(Duration.ofMillis(100), config.adaptiveCheckInterval());
        assertEquals(Duration.ofMinutes(1), config.reportingInterval());
        assertEquals(Duration.ofSeconds(5), config.collaboratorTimeout());
        assertFalse(config.metricsEnabled());
        assertEquals(30.0d, config.thresholds().minFps());
        assertEquals(512.0d, config.thresholds().criticalMemoryMb());
        assertEquals(256.0d, config.thresholds().warningMemoryMb());
    }

    @Test
    void shouldRejectInvertedMemoryBandFromEnvironment() {
        assertThrows(IllegalArgumentException.class, () -> GovernorConfig.fromEnv(Map.of(
            GovernorEnvKeys.GOVERNOR_MEMORY_CRITICAL_MB, "80",
            GovernorEnvKeys.GOVERNOR_MEMORY_WARNING_MB, "100"
        )));
    }

    @Test
    void shouldValidateDurations() {
        assertDoesNotThrow(() -> GovernorConfig.defaults().validate());
        assertThrows(IllegalArgumentException.class,
            () -> GovernorConfig.builder().adaptiveCheckInterval(Duration.ZERO).build().validate());
        assertThrows(IllegalArgumentException.class,
            () -> GovernorConfig.builder().collaboratorTimeout(Duration.ofMillis(-1)).build().validate());
        assertThrows(NullPointerException.class,
            () -> GovernorConfig.builder().reportingInterval(null).build());
    }
}
