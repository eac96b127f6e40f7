package com.acme.perf.governor.health;

import java.util.List;

public record HealthReport(
    double score,
    HealthStatus status,
    List<String> recommendations
) {
    public HealthReport {
        recommendations = List.copyOf(recommendations);
    }
}
