package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An action that survived resolution, with the rule that selected it and its display fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SelectedAction {

    public static final String DEFAULT_RULE_ID = "default";

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("tier")
    private Tier tier;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("action_id")
    private String actionId;

    @JsonProperty("action_type")
    private String actionType = RuleAction.TYPE_RECOMMEND_TOOL;

    @JsonProperty("reason")
    private String reason;

    @JsonProperty("title")
    private String title;

    @JsonProperty("icon")
    private String icon;

    @JsonProperty("category")
    private String category;

    public SelectedAction() {
    }

    public SelectedAction(String ruleId, Tier tier, int priority, String actionId, String reason) {
        this.ruleId = ruleId;
        this.tier = tier;
        this.priority = priority;
        this.actionId = actionId;
        this.reason = reason;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public Tier getTier() {
        return tier;
    }

    public void setTier(Tier tier) {
        this.tier = tier;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getActionId() {
        return actionId;
    }

    public void setActionId(String actionId) {
        this.actionId = actionId;
    }

    public String getActionType() {
        return actionType;
    }

    public void setActionType(String actionType) {
        this.actionType = actionType;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getIcon() {
        return icon;
    }

    public void setIcon(String icon) {
        this.icon = icon;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    @Override
    public String toString() {
        return "SelectedAction{" + actionId + " <- " + ruleId + " " + tier + "/" + priority + "}";
    }
}
