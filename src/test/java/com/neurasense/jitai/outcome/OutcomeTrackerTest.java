package com.neurasense.jitai.outcome;

import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;
import com.neurasense.jitai.domain.SelectedAction;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.domain.Tier;
import com.neurasense.jitai.util.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OutcomeTrackerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T22:00:00Z");

    @Mock
    RecommendationStore failingStore;

    private InMemoryRecommendationStore store;
    private EngineMetrics metrics;
    private OutcomeTracker tracker;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecommendationStore();
        metrics = new EngineMetrics();
        tracker = new OutcomeTracker();
        tracker.store = store;
        tracker.clock = Clock.fixed(NOW, ZoneOffset.UTC);
        tracker.engineMetrics = metrics;
    }

    @Test
    void testRecordCreatesOneDeliveredRecordPerAction() {
        Decision decision = decision("breathing-478", "sleep-countdown");

        List<String> ids = tracker.record("u1", decision);

        assertThat(ids).hasSize(2).doesNotHaveDuplicates();
        RecommendationRecord first = store.find(ids.get(0)).orElseThrow();
        assertThat(first.getStatus()).isEqualTo(RecommendationStatus.DELIVERED);
        assertThat(first.getUserId()).isEqualTo("u1");
        assertThat(first.getActionId()).isEqualTo("breathing-478");
        assertThat(first.getCreatedAt()).isEqualTo(NOW);
        assertThat(first.getContextSnapshot()).isEqualTo(decision.getContext());
        assertThat(store.find(ids.get(1)).orElseThrow().getActionId()).isEqualTo("sleep-countdown");
    }

    @Test
    void testRecordPropagatesStoreFailure() {
        tracker.store = failingStore;
        doThrow(new RecommendationStoreException("disk full")).when(failingStore).saveAll(anyList());

        assertThatThrownBy(() -> tracker.record("u1", decision("pmr")))
                .isInstanceOf(RecommendationStoreException.class);
    }

    @Test
    void testCompletedThenDismissedIsNoOp() {
        String id = tracker.record("u1", decision("pmr")).get(0);

        assertThat(tracker.updateStatus(id, "u1", RecommendationStatus.COMPLETED, Map.of())).isTrue();
        assertThat(tracker.updateStatus(id, "u1", RecommendationStatus.DISMISSED, Map.of())).isFalse();

        RecommendationRecord record = store.find(id).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(RecommendationStatus.COMPLETED);
        assertThat(record.getCompletedAt()).isEqualTo(NOW);
        assertThat(record.getDismissedAt()).isNull();
    }

    @Test
    void testForeignUserCannotUpdate() {
        String id = tracker.record("u1", decision("pmr")).get(0);

        assertThat(tracker.updateStatus(id, "intruder", RecommendationStatus.DISMISSED, Map.of())).isFalse();

        assertThat(store.find(id).orElseThrow().getStatus()).isEqualTo(RecommendationStatus.DELIVERED);
        assertThat(tracker.updateStatus(id, "u1", RecommendationStatus.OPENED, Map.of())).isTrue();
    }

    @Test
    void testUnknownIdIsNoOp() {
        assertThat(tracker.updateStatus("no-such-id", "u1", RecommendationStatus.COMPLETED, Map.of())).isFalse();
        assertThat(metrics.snapshot().get("outcome_ignored_total")).isEqualTo(1L);
    }

    @Test
    void testOnlyAllowListedExtrasAreStored() {
        String id = tracker.record("u1", decision("pmr")).get(0);
        Map<String, Object> extra = new HashMap<>();
        extra.put("duration_sec", 300);
        extra.put("helpfulness", 4);
        extra.put("post_mood", 6.0);
        extra.put("free_text", "secret");
        extra.put("mood", 3);

        tracker.updateStatus(id, "u1", RecommendationStatus.COMPLETED, extra);

        RecommendationRecord record = store.find(id).orElseThrow();
        assertThat(record.getDurationSec()).isEqualTo(300);
        assertThat(record.getHelpfulness()).isEqualTo(4);
        assertThat(record.getPostMood()).isEqualTo(6);
    }

    @Test
    void testFilterExtrasDropsNonIntegralValues() {
        Map<String, Object> extra = new HashMap<>();
        extra.put("duration_sec", "120");
        extra.put("helpfulness", 3.5);
        extra.put("post_mood", 7L);

        assertThat(OutcomeTracker.filterExtras(extra)).containsOnly(Map.entry("post_mood", 7));
        assertThat(OutcomeTracker.filterExtras(null)).isEmpty();
    }

    @Test
    void testFilterExtrasDropsOutOfRangeValues() {
        Map<String, Object> extra = new HashMap<>();
        extra.put("duration_sec", 3_000_000_000L);
        extra.put("helpfulness", Double.POSITIVE_INFINITY);
        extra.put("post_mood", Double.NaN);

        assertThat(OutcomeTracker.filterExtras(extra)).isEmpty();

        extra.put("duration_sec", (long) Integer.MAX_VALUE);
        extra.put("helpfulness", 1e12);
        assertThat(OutcomeTracker.filterExtras(extra)).containsOnly(Map.entry("duration_sec", Integer.MAX_VALUE));
    }

    @Test
    void testReportedStatusMustBeTerminal() {
        assertThatThrownBy(() -> tracker.updateStatus("x", "u1", RecommendationStatus.DELIVERED, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testUpdatePropagatesStoreFailure() {
        tracker.store = failingStore;
        when(failingStore.find("r1")).thenThrow(new RecommendationStoreException("unavailable"));

        assertThatThrownBy(() -> tracker.updateStatus("r1", "u1", RecommendationStatus.OPENED, Map.of()))
                .isInstanceOf(RecommendationStoreException.class);
    }

    @Test
    void testConcurrentCompareAndSetLoses() {
        tracker.store = failingStore;
        RecommendationRecord delivered = InMemoryRecommendationStoreTest.record("r1", "u1", 0);
        when(failingStore.find("r1")).thenReturn(Optional.of(delivered));
        when(failingStore.replaceIfStatus(eq("r1"),
                eq(RecommendationStatus.DELIVERED),
                any())).thenReturn(false);

        assertThat(tracker.updateStatus("r1", "u1", RecommendationStatus.COMPLETED, Map.of())).isFalse();
    }

    @Test
    void testStatsAndHistory() {
        List<String> ids = tracker.record("u1", decision("pmr", "dbt-stop", "breathing-box"));
        tracker.record("u2", decision("pmr"));
        tracker.updateStatus(ids.get(0), "u1", RecommendationStatus.COMPLETED, Map.of("helpfulness", 5, "post_mood", 7));
        tracker.updateStatus(ids.get(1), "u1", RecommendationStatus.OPENED, Map.of("helpfulness", 2));

        OutcomeStats stats = tracker.stats("u1");

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.count(RecommendationStatus.COMPLETED)).isEqualTo(1);
        assertThat(stats.count(RecommendationStatus.DELIVERED)).isEqualTo(1);
        assertThat(stats.getCompletionRate()).isEqualTo(0.333);
        assertThat(stats.getEngagementRate()).isEqualTo(0.667);
        assertThat(stats.getAvgHelpfulness()).isEqualTo(3.5);
        assertThat(stats.getAvgPostMood()).isEqualTo(7.0);

        assertThat(tracker.stats(null).getTotal()).isEqualTo(4);
        assertThat(tracker.history("u1", 2)).hasSize(2);
    }

    @Test
    void testStatsByRuleGroupsOnRuleId() {
        tracker.record("u1", decision("pmr", "dbt-stop"));

        Map<String, OutcomeStats> byRule = tracker.statsByRule();

        assertThat(byRule).containsOnlyKeys("rule-pmr", "rule-dbt-stop");
        assertThat(byRule.get("rule-pmr").getTotal()).isEqualTo(1);
    }

    @Test
    void testEmptyStats() {
        OutcomeStats stats = tracker.stats("nobody");

        assertThat(stats.getTotal()).isZero();
        assertThat(stats.getCompletionRate()).isZero();
        assertThat(stats.getAvgHelpfulness()).isNull();
    }

    private static Decision decision(String... actionIds) {
        Decision decision = new Decision("u1");
        decision.setContext(TailoringContext.builder().put(TailoringContext.CHECKIN, "mood", 2).build());
        for (String actionId : actionIds) {
            decision.addAction(new SelectedAction("rule-" + actionId, Tier.ACUTE, 10, actionId, "because"));
        }
        return decision;
    }
}
