package com.neurasense.jitai.util;

import org.jboss.logging.Logger;

import java.util.HashMap;
import java.util.Map;

/**
 * Utility for sending structured alerts to monitoring systems.
 * <p>
 * Provides consistent alert logging with structured metadata that can be
 * detected by log aggregators (Datadog, Splunk, Loki, etc.).
 */
public final class AlertLogger {

    private AlertLogger() {}

    private static final Logger LOG = Logger.getLogger(AlertLogger.class);

    public static void ruleReloadFailed(String source, int currentVersion, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "RULE_RELOAD_FAILURE");
        alertData.put("severity", "WARNING");
        alertData.put("source", source);
        alertData.put("current_version", currentVersion);
        alertData.put("error", error);

        LOG.warnf("ALERT: Rule reload failed for %s. Keeping v%d. Error: %s",
                source, currentVersion, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void malformedRuleSkipped(String source, String ruleId, String reason) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "MALFORMED_RULE_SKIPPED");
        alertData.put("severity", "WARNING");
        alertData.put("source", source);
        alertData.put("rule_id", ruleId);
        alertData.put("reason", reason);

        LOG.warnf("ALERT: Skipping malformed rule %s in %s: %s", ruleId, source, reason);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void featureSourceDegraded(String namespace, String userId, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "FEATURE_SOURCE_DEGRADED");
        alertData.put("severity", "WARNING");
        alertData.put("namespace", namespace);
        alertData.put("user_id", userId);
        alertData.put("error", error);

        LOG.warnf("ALERT: Feature source for '%s' unavailable, using defaults. Error: %s",
                namespace, error);
        LOG.debugf("Alert details: %s", alertData);
    }

    public static void trackingWriteFailed(String userId, int actionCount, String error) {
        Map<String, Object> alertData = new HashMap<>();
        alertData.put("alert_type", "TRACKING_WRITE_FAILURE");
        alertData.put("severity", "CRITICAL");
        alertData.put("user_id", userId);
        alertData.put("action_count", actionCount);
        alertData.put("error", error);

        LOG.errorf("ALERT: Recommendation tracking failed for %d actions. Decision returned untracked. Error: %s",
                actionCount, error);
        LOG.debugf("Alert details: %s", alertData);
    }
}
