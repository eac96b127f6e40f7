package com.acme.perf.governor.util;

import java.time.Duration;
import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Startup-path only. Malformed values fall back to the default.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    public static Duration getMillisClamped(Map<String, String> env,
                                            String name,
                                            long defaultMs,
                                            long minMs,
                                            long maxMs) {
        return Duration.ofMillis(getLongClamped(env, name, defaultMs, minMs, maxMs));
    }

    public static double getDoubleClamped(Map<String, String> env,
                                          String name,
                                          double defaultValue,
                                          double min,
                                          double max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            double parsed = Double.parseDouble(raw.trim());
            if (Double.isNaN(parsed)) {
                return defaultValue;
            }
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }
}
