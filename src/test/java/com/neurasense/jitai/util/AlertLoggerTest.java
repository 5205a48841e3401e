package com.neurasense.jitai.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;

class AlertLoggerTest {

    @Test
    void ruleReloadFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.ruleReloadFailed("/etc/jitai/rules.json", 3, "boom"));
    }

    @Test
    void malformedRuleSkippedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.malformedRuleSkipped("builtin", "rule[4]", "unknown tier"));
    }

    @Test
    void featureSourceDegradedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.featureSourceDegraded("trend", "u1", "timeout"));
    }

    @Test
    void trackingWriteFailedDoesNotThrow() {
        assertDoesNotThrow(() ->
                AlertLogger.trackingWriteFailed("u1", 2, null));
    }
}
