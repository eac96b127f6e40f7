package com.acme.perf.governor.telemetry;

import com.acme.perf.governor.PerformanceSnapshot;
import com.acme.perf.governor.api.CacheStatistics;
import com.acme.perf.governor.health.HealthEvaluator;
import com.acme.perf.governor.health.HealthStatus;
import com.acme.perf.governor.mode.CacheMode;
import com.acme.perf.governor.mode.RenderMode;
import com.acme.perf.governor.util.GovernorDefaults;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonLogReportSinkTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void shouldRenderSnapshotAsJsonLine() throws Exception {
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
            30.0d,
            33.3d,
            RenderMode.LOW_POWER,
            CacheMode.AGGRESSIVE,
            2,
            160L * GovernorDefaults.BYTES_PER_MB,
            CacheStatistics.ofSegments(Map.of("images", 0.5d, "data", 0.7d), 42L),
            35.0d,
            HealthStatus.POOR,
            List.of(HealthEvaluator.REDUCE_ANIMATION_COMPLEXITY, HealthEvaluator.CLEAR_CACHES),
            true
        );
        String line = new JsonLogReportSink("checkout-app").render(snapshot, Map.of("adaptiveChecks", 3L));

        assertFalse(line.contains("\n"));
        JsonNode root = MAPPER.readTree(line);
        assertEquals("checkout-app", root.get("component").asText());
        assertEquals("performance_report", root.get("type").asText());
        assertEquals("LOW_POWER", root.get("render_mode").asText());
        assertEquals("AGGRESSIVE", root.get("cache_mode").asText());
        assertEquals(160.0d, root.get("memory_usage_mb").asDouble(), 1e-9);
        assertEquals(0.6d, root.get("cache_stats").get("overall_hit_rate").asDouble(), 1e-9);
        assertEquals(42L, root.get("cache_stats").get("entry_count").asLong());
        assertEquals("POOR", root.get("health_status").asText());
        assertTrue(root.get("has_performance_issues").asBoolean());
        assertEquals(2, root.get("recommendations").size());
        assertEquals(3L, root.get("counters").get("adaptiveChecks").asLong());
    }

    @Test
    void shouldKeepLineParseableWithNonFiniteSegmentRate() throws Exception {
        Map<String, Double> segments = new HashMap<>();
        segments.put("images", Double.NaN);
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
            60.0d, 16.6d, RenderMode.NORMAL, CacheMode.NORMAL, 0, 0L,
            new CacheStatistics(0.5d, 1L, segments), 85.0d, HealthStatus.EXCELLENT, List.of(), true);

        JsonNode root = MAPPER.readTree(new JsonLogReportSink().render(snapshot, Map.of()));
        assertEquals("NaN", root.get("cache_stats").get("segment_hit_rates").get("images").asText());
    }

    @Test
    void shouldOmitCountersWhenEmptyAndDefaultComponent() throws Exception {
        PerformanceSnapshot snapshot = new PerformanceSnapshot(
            60.0d, 16.6d, RenderMode.NORMAL, CacheMode.NORMAL, 0, 0L,
            CacheStatistics.HEALTHY, 100.0d, HealthStatus.EXCELLENT, List.of(), true);
        JsonNode root = MAPPER.readTree(new JsonLogReportSink(" ").render(snapshot, Map.of()));
        assertEquals("governor", root.get("component").asText());
        assertFalse(root.has("counters"));
        assertFalse(root.get("has_performance_issues").asBoolean());
    }
}
