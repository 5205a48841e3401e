package com.neurasense.jitai.engine;

import com.neurasense.jitai.catalog.CatalogService;
import com.neurasense.jitai.domain.CatalogEntry;
import com.neurasense.jitai.domain.CompanionTask;
import com.neurasense.jitai.domain.ConditionNode;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.Rule;
import com.neurasense.jitai.domain.RuleAction;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.domain.SelectedAction;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.domain.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionResolverTest {

    private static final CompanionTask DEFAULT_TASK = new CompanionTask("Notice one good thing", "Small wins add up");
    private static final List<RuleAction> DEFAULT_ACTIONS = List.of(
            new RuleAction("cbt-three-good", "gratitude"),
            new RuleAction("mindfulness-1min", "pause"),
            new RuleAction("pmr", "relax"));

    private DecisionResolver resolver;
    private TailoringContext lowMoodAtNight;

    @BeforeEach
    void setUp() {
        resolver = new DecisionResolver();
        resolver.conditionEvaluator = new ConditionEvaluator();
        resolver.catalogService = CatalogService.of(List.of(
                new CatalogEntry("breathing-478", "4-7-8 Breathing", "breathing", "🌬️"),
                new CatalogEntry("cbt-three-good", "Three Good Things", "cbt", "✨")));

        lowMoodAtNight = TailoringContext.builder()
                .put(TailoringContext.CHECKIN, "mood", 2)
                .put(TailoringContext.CHECKIN, "stress", 6)
                .put(TailoringContext.TIME, "period", "late_night")
                .build();
    }

    @Test
    void testAcuteMatchOutranksDefaultTierGratitude() {
        Rule acute = Rule.builder("low_mood_night", Tier.ACUTE, 10, ConditionNode.allOf(
                ConditionNode.leaf("checkin.mood", "<", 3),
                ConditionNode.leaf("time.period", "==", "late_night")))
                .action(new RuleAction("breathing-478", "slow breathing"))
                .build();
        Rule gratitude = Rule.builder("gratitude", Tier.DEFAULT, 100, ConditionNode.always())
                .action(new RuleAction("cbt-three-good", "gratitude"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(gratitude, acute), 1);

        assertThat(actionIds(decision)).containsExactly("breathing-478");
        assertThat(decision.getActions().get(0).getTier()).isEqualTo(Tier.ACUTE);
        assertThat(decision.getMatchedRules()).containsExactly("low_mood_night", "gratitude");
        assertThat(decision.isUsedDefault()).isFalse();
    }

    @Test
    void testTierOrderingIsAbsolute() {
        Rule crisis = Rule.builder("crisis", Tier.CRISIS, 0, ConditionNode.always())
                .action(new RuleAction("dbt-tipp", "reset"))
                .build();
        Rule acute = Rule.builder("acute", Tier.ACUTE, 1000, ConditionNode.always())
                .action(new RuleAction("breathing-box", "breathe"))
                .build();
        Rule maintenance = Rule.builder("maintenance", Tier.MAINTENANCE, 5000, ConditionNode.always())
                .action(new RuleAction("focus-pomodoro", "focus"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(maintenance, acute, crisis), 3);

        assertThat(actionIds(decision)).containsExactly("dbt-tipp", "breathing-box", "focus-pomodoro");
    }

    @Test
    void testPriorityBreaksTiesWithinTier() {
        Rule low = Rule.builder("low", Tier.PREVENTIVE, 10, ConditionNode.always())
                .action(new RuleAction("cbt-worry-time", "worry"))
                .build();
        Rule high = Rule.builder("high", Tier.PREVENTIVE, 60, ConditionNode.always())
                .action(new RuleAction("cbt-thought-record", "thoughts"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(low, high), 2);

        assertThat(actionIds(decision)).containsExactly("cbt-thought-record", "cbt-worry-time");
    }

    @Test
    void testDisabledRuleIsNeverConsidered() {
        Rule disabled = Rule.builder("disabled", Tier.CRISIS, 100, ConditionNode.always())
                .action(new RuleAction("dbt-tipp", "reset"))
                .enabled(false)
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(disabled), 2);

        assertThat(decision.getMatchedRules()).isEmpty();
        assertThat(actionIds(decision)).doesNotContain("dbt-tipp");
        assertThat(decision.isUsedDefault()).isTrue();
    }

    @Test
    void testSameActionFromTwoRulesAppearsOnce() {
        Rule first = Rule.builder("first", Tier.ACUTE, 50, ConditionNode.always())
                .action(new RuleAction("breathing-478", "first reason"))
                .build();
        Rule second = Rule.builder("second", Tier.ACUTE, 40, ConditionNode.always())
                .action(new RuleAction("breathing-478", "second reason"))
                .action(new RuleAction("pmr", "relax"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(first, second), 5);

        assertThat(actionIds(decision)).containsExactly("breathing-478", "pmr");
        assertThat(decision.getActions().get(0).getReason()).isEqualTo("first reason");
        assertThat(decision.getActions().get(0).getRuleId()).isEqualTo("first");
    }

    @Test
    void testEmptyRulesetYieldsDefaultsExactly() {
        Decision decision = resolver.resolve(lowMoodAtNight, Ruleset.of(List.of(), DEFAULT_ACTIONS, DEFAULT_TASK), 5);

        assertThat(actionIds(decision)).containsExactly("cbt-three-good", "mindfulness-1min", "pmr");
        assertThat(decision.getTask()).isEqualTo(DEFAULT_TASK);
        assertThat(decision.isUsedDefault()).isTrue();
        assertThat(decision.getActions()).allSatisfy(action -> {
            assertThat(action.getRuleId()).isEqualTo(SelectedAction.DEFAULT_RULE_ID);
            assertThat(action.getTier()).isEqualTo(Tier.DEFAULT);
            assertThat(action.getPriority()).isZero();
        });
    }

    @Test
    void testDefaultsAreCappedAtMaxResults() {
        Decision decision = resolver.resolve(lowMoodAtNight, Ruleset.of(List.of(), DEFAULT_ACTIONS, DEFAULT_TASK), 2);

        assertThat(actionIds(decision)).containsExactly("cbt-three-good", "mindfulness-1min");
    }

    @Test
    void testMatchedRuleWithoutRecommendationsFallsBackToDefaults() {
        Rule taskOnly = Rule.builder("task_only", Tier.ACUTE, 10, ConditionNode.always())
                .task(new CompanionTask("Drink a glass of water", "Hydration"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(taskOnly), 2);

        assertThat(decision.getMatchedRules()).containsExactly("task_only");
        assertThat(decision.isUsedDefault()).isTrue();
        assertThat(decision.getTask()).isEqualTo(DEFAULT_TASK);
    }

    @Test
    void testTaskFromFirstMatchedRuleThatHasOne() {
        Rule noTask = Rule.builder("no_task", Tier.CRISIS, 10, ConditionNode.always())
                .action(new RuleAction("dbt-tipp", "reset"))
                .build();
        CompanionTask task = new CompanionTask("Put the phone away", "Screens keep you alert");
        Rule withTask = Rule.builder("with_task", Tier.ACUTE, 10, ConditionNode.always())
                .action(new RuleAction("breathing-478", "breathe"))
                .task(task)
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(withTask, noTask), 1);

        assertThat(actionIds(decision)).containsExactly("dbt-tipp");
        assertThat(decision.getTask()).isEqualTo(task);
    }

    @Test
    void testNonRecommendationActionsAreIgnored() {
        Rule rule = Rule.builder("notify", Tier.ACUTE, 10, ConditionNode.always())
                .action(new RuleAction("send_notification", "push-1", "ping"))
                .action(new RuleAction(RuleAction.TYPE_RECOMMEND_TOOL, " ", "blank id"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(rule), 2);

        assertThat(decision.isUsedDefault()).isTrue();
    }

    @Test
    void testCatalogMetadataAndMissingEntryFallback() {
        Rule rule = Rule.builder("r", Tier.ACUTE, 10, ConditionNode.always())
                .action(new RuleAction("breathing-478", "known"))
                .action(new RuleAction("not-in-catalog", "unknown"))
                .build();

        Decision decision = resolver.resolve(lowMoodAtNight, ruleset(rule), 2);

        SelectedAction known = decision.getActions().get(0);
        assertThat(known.getTitle()).isEqualTo("4-7-8 Breathing");
        assertThat(known.getCategory()).isEqualTo("breathing");

        SelectedAction unknown = decision.getActions().get(1);
        assertThat(unknown.getActionId()).isEqualTo("not-in-catalog");
        assertThat(unknown.getTitle()).isEqualTo("not-in-catalog");
        assertThat(unknown.getIcon()).isEmpty();
        assertThat(unknown.getCategory()).isEmpty();
    }

    @Test
    void testResolutionIsDeterministic() {
        Rule a = Rule.builder("a", Tier.ACUTE, 10, ConditionNode.always()).action(new RuleAction("pmr", "x")).build();
        Rule b = Rule.builder("b", Tier.PREVENTIVE, 90, ConditionNode.always()).action(new RuleAction("dbt-stop", "y")).build();
        Ruleset rules = ruleset(b, a);

        List<String> first = actionIds(resolver.resolve(lowMoodAtNight, rules, 2));
        List<String> second = actionIds(resolver.resolve(lowMoodAtNight, rules, 2));

        assertThat(first).isEqualTo(second).containsExactly("pmr", "dbt-stop");
    }

    @Test
    void testMaxResultsMustBePositive() {
        assertThatThrownBy(() -> resolver.resolve(lowMoodAtNight, ruleset(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static Ruleset ruleset(Rule... rules) {
        return Ruleset.of(List.of(rules), DEFAULT_ACTIONS, DEFAULT_TASK);
    }

    private static List<String> actionIds(Decision decision) {
        return decision.getActions().stream().map(SelectedAction::getActionId).collect(Collectors.toList());
    }
}
