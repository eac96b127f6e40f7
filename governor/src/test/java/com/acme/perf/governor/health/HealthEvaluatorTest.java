package com.acme.perf.governor.health;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HealthEvaluatorTest {

    @Test
    void shouldScoreIdealInputsAtOneHundred() {
        HealthReport report = HealthEvaluator.evaluate(60.0d, 0.0d, 1.0d, 0);
        assertEquals(100.0d, report.score(), 1e-9);
        assertEquals(HealthStatus.EXCELLENT, report.status());
        assertTrue(report.recommendations().isEmpty());
    }

    @Test
    void shouldScoreWorstInputsAtZero() {
        assertEquals(0.0d, HealthEvaluator.score(0.0d, 200.0d, 0.0d), 1e-9);
        assertEquals(0.0d, HealthEvaluator.score(0.0d, 4_096.0d, 0.0d), 1e-9);
    }

    @Test
    void shouldWeightComponents() {
        // 30 fps -> 20, 100 MB -> 15, 0.5 hit rate -> 15
        assertEquals(50.0d, HealthEvaluator.score(30.0d, 100.0d, 0.5d), 1e-9);
        // fps above target does not push the score past its weight
        assertEquals(100.0d, HealthEvaluator.score(120.0d, 0.0d, 1.0d), 1e-9);
    }

    @Test
    void shouldTreatNaNComponentsAsZeroContribution() {
        assertEquals(60.0d, HealthEvaluator.score(Double.NaN, 0.0d, 1.0d), 1e-9);
        assertEquals(70.0d, HealthEvaluator.score(60.0d, 0.0d, Double.NaN), 1e-9);
    }

    @Test
    void shouldEmitAllRecommendationsInOrder() {
        List<String> out = HealthEvaluator.recommendations(30.0d, 120.0d, 0.5d, 6);
        assertEquals(List.of(
            HealthEvaluator.REDUCE_ANIMATION_COMPLEXITY,
            HealthEvaluator.CLEAR_CACHES,
            HealthEvaluator.REVIEW_CACHING_STRATEGY,
            HealthEvaluator.STAGGER_ANIMATIONS
        ), out);
    }

    @Test
    void shouldNotRecommendAtExactThresholds() {
        assertTrue(HealthEvaluator.recommendations(45.0d, 100.0d, 0.7d, 5).isEmpty());
    }

    @Test
    void shouldMapScoresToStatus() {
        assertEquals(HealthStatus.EXCELLENT, HealthStatus.fromScore(85.0d));
        assertEquals(HealthStatus.GOOD, HealthStatus.fromScore(84.9d));
        assertEquals(HealthStatus.GOOD, HealthStatus.fromScore(70.0d));
        assertEquals(HealthStatus.FAIR, HealthStatus.fromScore(50.0d));
        assertEquals(HealthStatus.POOR, HealthStatus.fromScore(49.9d));
        assertEquals(HealthStatus.POOR, HealthStatus.fromScore(Double.NaN));
    }
}
