package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Represents a tailoring rule.
 *
 * A rule consists of:
 * - A rule_id that uniquely identifies the rule within a rule document
 * - A name and optional description for display purposes
 * - A condition tree evaluated against the tailoring context
 * - A tier (primary urgency class) and priority (higher = more urgent within the tier)
 * - One or more candidate actions, each naming a catalog entry
 * - An optional companion task
 *
 * Rules are immutable once built; a {@link Ruleset} snapshot shares them across threads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Rule {

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("name")
    private final String name;

    @JsonProperty("description")
    private final String description;

    @JsonProperty("enabled")
    private final boolean enabled;

    @JsonProperty("tier")
    private final Tier tier;

    @JsonProperty("priority")
    private final int priority;

    @JsonProperty("condition")
    private final ConditionNode condition;

    @JsonProperty("actions")
    private final List<RuleAction> actions;

    @JsonProperty("task")
    private final CompanionTask task;

    private Rule(Builder b) {
        this.ruleId = b.ruleId;
        this.name = b.name;
        this.description = b.description;
        this.enabled = b.enabled;
        this.tier = b.tier != null ? b.tier : Tier.DEFAULT;
        this.priority = b.priority;
        this.condition = b.condition != null ? b.condition : ConditionNode.always();
        this.actions = List.copyOf(b.actions);
        this.task = b.task;
    }

    public static Builder builder(String ruleId, Tier tier, int priority, ConditionNode condition) {
        return new Builder(ruleId, tier, priority, condition);
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Tier getTier() {
        return tier;
    }

    public int getPriority() {
        return priority;
    }

    public ConditionNode getCondition() {
        return condition;
    }

    public List<RuleAction> getActions() {
        return actions;
    }

    public CompanionTask getTask() {
        return task;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rule rule = (Rule) o;
        return Objects.equals(ruleId, rule.ruleId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId);
    }

    @Override
    public String toString() {
        return "Rule{" +
                "ruleId='" + ruleId + '\'' +
                ", tier=" + tier +
                ", priority=" + priority +
                ", enabled=" + enabled +
                '}';
    }

    // ========== Builder ==========

    public static final class Builder {
        private final String ruleId;
        private final Tier tier;
        private final int priority;
        private final ConditionNode condition;
        private String name;
        private String description;
        private boolean enabled = true;
        private final List<RuleAction> actions = new ArrayList<>();
        private CompanionTask task;

        private Builder(String ruleId, Tier tier, int priority, ConditionNode condition) {
            this.ruleId = ruleId;
            this.tier = tier;
            this.priority = priority;
            this.condition = condition;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder action(RuleAction action) {
            this.actions.add(Objects.requireNonNull(action, "action"));
            return this;
        }

        public Builder actions(List<RuleAction> actions) {
            actions.forEach(this::action);
            return this;
        }

        public Builder task(CompanionTask task) {
            this.task = task;
            return this;
        }

        public Rule build() {
            return new Rule(this);
        }
    }
}
