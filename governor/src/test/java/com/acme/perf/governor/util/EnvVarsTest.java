package com.acme.perf.governor.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvVarsTest {

    @Test
    void shouldParseBooleanWithDefault() {
        Map<String, String> env = Map.of("ENABLED", "true", "DISABLED", " false ", "EMPTY", "  ");
        assertTrue(EnvVars.getBoolean(env, "ENABLED", false));
        assertFalse(EnvVars.getBoolean(env, "DISABLED", true));
        assertTrue(EnvVars.getBoolean(env, "EMPTY", true));
        assertTrue(EnvVars.getBoolean(env, "MISSING", true));
    }

    @Test
    void shouldClampLongAndFallbackOnMalformed() {
        Map<String, String> env = Map.of(
            "LOW", "-10",
            "HIGH", "90000",
            "OK", " 30000 ",
            "BAD", "30s"
        );
        assertEquals(100L, EnvVars.getLongClamped(env, "LOW", 5_000L, 100L, 60_000L));
        assertEquals(60_000L, EnvVars.getLongClamped(env, "HIGH", 5_000L, 100L, 60_000L));
        assertEquals(30_000L, EnvVars.getLongClamped(env, "OK", 5_000L, 100L, 60_000L));
        assertEquals(5_000L, EnvVars.getLongClamped(env, "BAD", 5_000L, 100L, 60_000L));
        assertEquals(5_000L, EnvVars.getLongClamped(env, "MISSING", 5_000L, 100L, 60_000L));
    }

    @Test
    void shouldClampDoubleAndRejectNaN() {
        Map<String, String> env = Map.of(
            "LOW", "  -0.5 ",
            "HIGH", "  9.5 ",
            "OK", "  0.25 ",
            "BAD", "oops",
            "NAN", "NaN"
        );
        assertEquals(0.1d, EnvVars.getDoubleClamped(env, "LOW", 0.9d, 0.1d, 1.0d));
        assertEquals(1.0d, EnvVars.getDoubleClamped(env, "HIGH", 0.9d, 0.1d, 1.0d));
        assertEquals(0.25d, EnvVars.getDoubleClamped(env, "OK", 0.9d, 0.1d, 1.0d));
        assertEquals(0.9d, EnvVars.getDoubleClamped(env, "BAD", 0.9d, 0.1d, 1.0d));
        assertEquals(0.9d, EnvVars.getDoubleClamped(env, "NAN", 0.9d, 0.1d, 1.0d));
        assertEquals(0.9d, EnvVars.getDoubleClamped(env, "MISSING", 0.9d, 0.1d, 1.0d));
    }

    @Test
    void shouldReadMillisAsClampedDuration() {
        Map<String, String> env = Map.of("INTERVAL", "250", "TINY", "1");
        assertEquals(Duration.ofMillis(250), EnvVars.getMillisClamped(env, "INTERVAL", 30_000L, 100L, 60_000L));
        assertEquals(Duration.ofMillis(100), EnvVars.getMillisClamped(env, "TINY", 30_000L, 100L, 60_000L));
        assertEquals(Duration.ofSeconds(30), EnvVars.getMillisClamped(env, "MISSING", 30_000L, 100L, 60_000L));
    }
}
