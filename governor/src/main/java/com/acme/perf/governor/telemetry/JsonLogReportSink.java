package com.acme.perf.governor.telemetry;

import com.acme.perf.governor.PerformanceSnapshot;
import com.acme.perf.governor.api.ReportSink;
import com.acme.perf.governor.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Logs each report as one JSON line, and recommendations as warnings.
 */
public final class JsonLogReportSink implements ReportSink {
    private static final Logger LOG = Logger.getLogger(JsonLogReportSink.class.getName());

    private final String component;

    public JsonLogReportSink() {
        this("governor");
    }

    public JsonLogReportSink(String component) {
        this.component = component == null || component.isBlank() ? "governor" : component;
    }

    @Override
    public void report(PerformanceSnapshot snapshot, Map<String, Long> counters) {
        LOG.info(render(snapshot, counters));
        if (LOG.isLoggable(Level.WARNING)) {
            for (String recommendation : snapshot.recommendations()) {
                LOG.warning("Performance recommendation: " + recommendation);
            }
        }
    }

    String render(PerformanceSnapshot snapshot, Map<String, Long> counters) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", component);
        payload.put("type", "performance_report");
        payload.putAll(snapshot.toMap());
        if (counters != null && !counters.isEmpty()) {
            payload.put("counters", counters);
        }
        try {
            return JsonCodec.writeLine(payload);
        } catch (JsonProcessingException e) {
            LOG.fine(() -> "Report JSON encoding failed: " + e.getClass().getSimpleName());
            return payload.toString();
        }
    }
}
