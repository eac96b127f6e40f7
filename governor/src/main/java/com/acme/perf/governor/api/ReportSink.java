package com.acme.perf.governor.api;

import com.acme.perf.governor.PerformanceSnapshot;

import java.util.Map;

/**
 * Receives the periodic performance report. For logging and metrics only; the governor
 * ignores anything the sink does with it.
 */
@FunctionalInterface
public interface ReportSink {
    void report(PerformanceSnapshot snapshot, Map<String, Long> counters);
}
