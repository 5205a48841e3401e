package com.neurasense.jitai.util;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Lightweight in-process counters for engine observability.
 * <p>
 * Exposed via {@code /v1/manage/metrics}. No external dependency required.
 */
@ApplicationScoped
public class EngineMetrics {

    private final AtomicLong decisionsTotal = new AtomicLong();
    private final AtomicLong previewsTotal = new AtomicLong();
    private final AtomicLong defaultFallbackTotal = new AtomicLong();
    private final AtomicLong degradedNamespaceTotal = new AtomicLong();
    private final AtomicLong trackingFailureTotal = new AtomicLong();
    private final AtomicLong recommendationsRecordedTotal = new AtomicLong();
    private final AtomicLong outcomeAppliedTotal = new AtomicLong();
    private final AtomicLong outcomeIgnoredTotal = new AtomicLong();
    private final AtomicLong ruleReloadSuccessTotal = new AtomicLong();
    private final AtomicLong ruleReloadFailureTotal = new AtomicLong();
    private final AtomicLong malformedRulesSkippedTotal = new AtomicLong();
    private final AtomicLong decisionLatencyMsLast = new AtomicLong();

    public void incrementDecisions() {
        decisionsTotal.incrementAndGet();
    }

    public void incrementPreviews() {
        previewsTotal.incrementAndGet();
    }

    public void incrementDefaultFallback() {
        defaultFallbackTotal.incrementAndGet();
    }

    public void incrementDegradedNamespace() {
        degradedNamespaceTotal.incrementAndGet();
    }

    public void incrementTrackingFailure() {
        trackingFailureTotal.incrementAndGet();
    }

    public void incrementRecommendationsRecorded(long count) {
        recommendationsRecordedTotal.addAndGet(count);
    }

    public void incrementOutcomeApplied() {
        outcomeAppliedTotal.incrementAndGet();
    }

    public void incrementOutcomeIgnored() {
        outcomeIgnoredTotal.incrementAndGet();
    }

    public void incrementRuleReloadSuccess() {
        ruleReloadSuccessTotal.incrementAndGet();
    }

    public void incrementRuleReloadFailure() {
        ruleReloadFailureTotal.incrementAndGet();
    }

    public void incrementMalformedRulesSkipped(long count) {
        malformedRulesSkippedTotal.addAndGet(count);
    }

    public void recordDecisionLatency(long ms) {
        decisionLatencyMsLast.set(ms);
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> m = new LinkedHashMap<>();
        m.put("decisions_total", decisionsTotal.get());
        m.put("previews_total", previewsTotal.get());
        m.put("default_fallback_total", defaultFallbackTotal.get());
        m.put("degraded_namespace_total", degradedNamespaceTotal.get());
        m.put("tracking_failure_total", trackingFailureTotal.get());
        m.put("recommendations_recorded_total", recommendationsRecordedTotal.get());
        m.put("outcome_applied_total", outcomeAppliedTotal.get());
        m.put("outcome_ignored_total", outcomeIgnoredTotal.get());
        m.put("rule_reload_success_total", ruleReloadSuccessTotal.get());
        m.put("rule_reload_failure_total", ruleReloadFailureTotal.get());
        m.put("malformed_rules_skipped_total", malformedRulesSkippedTotal.get());
        m.put("decision_latency_ms_last", decisionLatencyMsLast.get());
        return m;
    }
}
