package com.neurasense.jitai.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RuleTest {

    @Test
    void testBuilderDefaults() {
        Rule rule = Rule.builder("r1", null, 0, null).build();

        assertThat(rule.isEnabled()).isTrue();
        assertThat(rule.getTier()).isEqualTo(Tier.DEFAULT);
        assertThat(rule.getCondition()).isEqualTo(ConditionNode.always());
        assertThat(rule.getActions()).isEmpty();
        assertThat(rule.getTask()).isNull();
    }

    @Test
    void testActionsAreCopiedAndUnmodifiable() {
        List<RuleAction> actions = new ArrayList<>(List.of(new RuleAction("pmr", "relax")));
        Rule rule = Rule.builder("r1", Tier.ACUTE, 10, ConditionNode.always())
                .actions(actions)
                .build();

        actions.add(new RuleAction("dbt-stop", "pause"));

        assertThat(rule.getActions()).extracting(RuleAction::getActionId).containsExactly("pmr");
        assertThatThrownBy(() -> rule.getActions().add(new RuleAction("dbt-tipp", "reset")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testBuilderChangesDoNotReachBuiltRule() {
        Rule.Builder builder = Rule.builder("r1", Tier.CRISIS, 100, ConditionNode.always())
                .action(new RuleAction("dbt-tipp", "reset"));
        Rule first = builder.build();

        builder.action(new RuleAction("dbt-stop", "pause")).enabled(false);

        assertThat(first.getActions()).hasSize(1);
        assertThat(first.isEnabled()).isTrue();
    }

    @Test
    void testRuleActionDefaultsToRecommendation() {
        RuleAction action = new RuleAction(null, "pmr", "relax");

        assertThat(action.getType()).isEqualTo(RuleAction.TYPE_RECOMMEND_TOOL);
        assertThat(action.isRecommendation()).isTrue();
    }

    @Test
    void testConditionTreeDescribesItself() {
        ConditionNode tree = ConditionNode.anyOf(
                ConditionNode.leaf("checkin.mood", "<", 3),
                ConditionNode.not(ConditionNode.leaf("checkin.stress", ">=", 8)));

        assertThat(tree.toString())
                .startsWith("OR[")
                .contains("checkin.mood < 3")
                .contains("NOT(checkin.stress >= 8)");
    }
}
