package com.neurasense.jitai.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EngineMetricsTest {

    @Test
    void testCountersStartAtZero() {
        Map<String, Long> snapshot = new EngineMetrics().snapshot();

        assertThat(snapshot).isNotEmpty();
        assertThat(snapshot.values()).allMatch(value -> value == 0L);
    }

    @Test
    void testIncrementsAreReflectedInSnapshot() {
        EngineMetrics metrics = new EngineMetrics();
        metrics.incrementDecisions();
        metrics.incrementDecisions();
        metrics.incrementRecommendationsRecorded(3);
        metrics.incrementMalformedRulesSkipped(2);
        metrics.recordDecisionLatency(14);

        Map<String, Long> snapshot = metrics.snapshot();

        assertThat(snapshot)
                .containsEntry("decisions_total", 2L)
                .containsEntry("recommendations_recorded_total", 3L)
                .containsEntry("malformed_rules_skipped_total", 2L)
                .containsEntry("decision_latency_ms_last", 14L)
                .containsEntry("tracking_failure_total", 0L);
    }
}
