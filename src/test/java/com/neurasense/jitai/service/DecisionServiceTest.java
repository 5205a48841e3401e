package com.neurasense.jitai.service;

import com.neurasense.jitai.catalog.CatalogService;
import com.neurasense.jitai.config.DecisionConfig;
import com.neurasense.jitai.domain.CatalogEntry;
import com.neurasense.jitai.domain.CheckinObservation;
import com.neurasense.jitai.domain.CompanionTask;
import com.neurasense.jitai.domain.ConditionNode;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.Rule;
import com.neurasense.jitai.domain.RuleAction;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.domain.Tier;
import com.neurasense.jitai.engine.ContextBuilder;
import com.neurasense.jitai.engine.DecisionResolver;
import com.neurasense.jitai.engine.EngineTestSupport;
import com.neurasense.jitai.outcome.InMemoryRecommendationStore;
import com.neurasense.jitai.outcome.OutcomeTestSupport;
import com.neurasense.jitai.outcome.OutcomeTracker;
import com.neurasense.jitai.outcome.RecommendationStoreException;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import com.neurasense.jitai.source.InMemoryCheckinSource;
import com.neurasense.jitai.source.InMemoryCompletionSource;
import com.neurasense.jitai.util.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DecisionServiceTest {

    // Monday 2026-03-02, 23:30 UTC
    private static final Instant NOW = Instant.parse("2026-03-02T23:30:00Z");

    @Mock
    RulesetRegistry rulesetRegistry;

    @Mock
    OutcomeTracker failingTracker;

    private InMemoryCheckinSource checkins;
    private InMemoryRecommendationStore store;
    private OutcomeTracker tracker;
    private EngineMetrics metrics;
    private DecisionService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        metrics = new EngineMetrics();
        checkins = new InMemoryCheckinSource();

        ContextBuilder contextBuilder = EngineTestSupport.contextBuilder(
                clock, checkins, new InMemoryCompletionSource(), DecisionConfig.defaults(), metrics);
        DecisionResolver resolver = EngineTestSupport.decisionResolver(CatalogService.of(List.of(
                new CatalogEntry("dbt-tipp", "TIPP Skills", "dbt", "🧊"),
                new CatalogEntry("breathing-478", "4-7-8 Breathing", "breathing", "🌬️"))));

        store = new InMemoryRecommendationStore();
        tracker = OutcomeTestSupport.tracker(store, clock, metrics);

        service = new DecisionService();
        service.contextBuilder = contextBuilder;
        service.decisionResolver = resolver;
        service.rulesetRegistry = rulesetRegistry;
        service.outcomeTracker = tracker;
        service.config = DecisionConfig.defaults();
        service.clock = clock;
        service.engineMetrics = metrics;

        when(rulesetRegistry.current()).thenReturn(ruleset());
    }

    @Test
    void testDecideRecordsOneRecommendationPerAction() {
        CheckinObservation checkin = new CheckinObservation("u1", 1, 9, 3, 3, NOW);

        Decision decision = service.decide("u1", checkin, 3);

        assertThat(decision.getActions()).extracting("actionId").containsExactly("dbt-tipp", "breathing-478");
        assertThat(decision.getRecommendationIds()).hasSize(2);
        assertThat(decision.isTrackingAvailable()).isTrue();
        assertThat(decision.getEngineMode()).isEqualTo(Decision.MODE_NORMAL);
        assertThat(decision.isHasCheckin()).isTrue();
        assertThat(decision.getDecidedAt()).isEqualTo(NOW);
        assertThat(store.size()).isEqualTo(2);
        assertThat(metrics.snapshot().get("decisions_total")).isEqualTo(1L);
    }

    @Test
    void testTrackingFailureStillReturnsActions() {
        service.outcomeTracker = failingTracker;
        when(failingTracker.record(eq("u1"), any(Decision.class)))
                .thenThrow(new RecommendationStoreException("store offline"));

        Decision decision = service.decide("u1", new CheckinObservation("u1", 1, 9, 3, 3, NOW), null);

        assertThat(decision.getActions()).isNotEmpty();
        assertThat(decision.getRecommendationIds()).isEmpty();
        assertThat(decision.isTrackingAvailable()).isFalse();
        assertThat(decision.getEngineMode()).isEqualTo(Decision.MODE_DEGRADED);
        assertThat(metrics.snapshot().get("tracking_failure_total")).isEqualTo(1L);
    }

    @Test
    void testMissingCheckinFallsBackToTodaysObservation() {
        checkins.record(new CheckinObservation("u1", 1, 9, 5, 5, NOW.minusSeconds(3600)));

        Decision decision = service.decide("u1", null, null);

        assertThat(decision.isHasCheckin()).isTrue();
        assertThat(decision.getMatchedRules()).contains("crisis");
    }

    @Test
    void testNoCheckinUsesDefaults() {
        Decision decision = service.decide("u1", null, null);

        assertThat(decision.isHasCheckin()).isFalse();
        assertThat(decision.isUsedDefault()).isTrue();
        assertThat(decision.getActions()).extracting("actionId").containsExactly("breathing-478");
        assertThat(decision.getTask().getText()).isEqualTo("Take a breath");
        assertThat(metrics.snapshot().get("default_fallback_total")).isEqualTo(1L);
    }

    @Test
    void testPreviewRecordsNothing() {
        service.outcomeTracker = failingTracker;

        Decision decision = service.preview("u1", new CheckinObservation("u1", 1, 9, 3, 3, NOW), null);

        assertThat(decision.getEngineMode()).isEqualTo(Decision.MODE_PREVIEW);
        assertThat(decision.getActions()).isNotEmpty();
        assertThat(decision.getRecommendationIds()).isEmpty();
        assertThat(decision.getContext().resolve("checkin.mood")).isEqualTo(1);
        verify(failingTracker, never()).record(any(), any());
        assertThat(metrics.snapshot().get("previews_total")).isEqualTo(1L);
    }

    private static Ruleset ruleset() {
        Rule crisis = Rule.builder("crisis", Tier.CRISIS, 100, ConditionNode.allOf(
                ConditionNode.leaf("checkin.mood", "<=", 2),
                ConditionNode.leaf("checkin.stress", ">=", 8)))
                .action(new RuleAction("dbt-tipp", "bring intensity down"))
                .action(new RuleAction("breathing-478", "slow breathing"))
                .build();
        return Ruleset.of(List.of(crisis),
                List.of(new RuleAction("breathing-478", "a short reset")),
                new CompanionTask("Take a breath", "One minute is enough"));
    }
}
