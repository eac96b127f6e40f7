package com.acme.perf.governor.health;

public enum HealthStatus {
    EXCELLENT, GOOD, FAIR, POOR;

    public static HealthStatus fromScore(double score) {
        if (score >= 85.0d) return EXCELLENT;
        if (score >= 70.0d) return GOOD;
        if (score >= 50.0d) return FAIR;
        return POOR;
    }
}
