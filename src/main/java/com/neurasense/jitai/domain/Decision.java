package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Result of one decision point.
 *
 * Holds the ordered selected actions, at most one companion task, the audit list of matched
 * rule ids and, once the outcome tracker has run, one recommendation id per selected action.
 * The decision itself is never persisted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Decision {

    public static final String MODE_NORMAL = "NORMAL";
    public static final String MODE_DEGRADED = "DEGRADED";
    public static final String MODE_PREVIEW = "PREVIEW";

    @JsonProperty("decision_id")
    private String decisionId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("actions")
    private List<SelectedAction> actions = new ArrayList<>();

    @JsonProperty("task")
    private CompanionTask task;

    @JsonProperty("matched_rules")
    private List<String> matchedRules = new ArrayList<>();

    @JsonProperty("used_default")
    private boolean usedDefault;

    @JsonProperty("recommendation_ids")
    private List<String> recommendationIds = new ArrayList<>();

    @JsonProperty("tracking_available")
    private boolean trackingAvailable = true;

    @JsonProperty("engine_mode")
    private String engineMode = MODE_NORMAL;

    @JsonProperty("degraded_sources")
    private List<String> degradedSources = new ArrayList<>();

    @JsonProperty("has_checkin")
    private boolean hasCheckin;

    @JsonProperty("ruleset_version")
    private int rulesetVersion;

    @JsonProperty("context")
    private TailoringContext context;

    @JsonProperty("decided_at")
    private Instant decidedAt;

    public Decision() {
        this.decisionId = UUID.randomUUID().toString();
    }

    public Decision(String userId) {
        this();
        this.userId = userId;
    }

    public void addAction(SelectedAction action) {
        this.actions.add(action);
    }

    public void addMatchedRule(String ruleId) {
        this.matchedRules.add(ruleId);
    }

    public boolean isDegraded() {
        return MODE_DEGRADED.equals(engineMode);
    }

    public String getDecisionId() {
        return decisionId;
    }

    public void setDecisionId(String decisionId) {
        this.decisionId = decisionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public List<SelectedAction> getActions() {
        return actions;
    }

    public void setActions(List<SelectedAction> actions) {
        this.actions = actions;
    }

    public CompanionTask getTask() {
        return task;
    }

    public void setTask(CompanionTask task) {
        this.task = task;
    }

    public List<String> getMatchedRules() {
        return matchedRules;
    }

    public void setMatchedRules(List<String> matchedRules) {
        this.matchedRules = matchedRules;
    }

    public boolean isUsedDefault() {
        return usedDefault;
    }

    public void setUsedDefault(boolean usedDefault) {
        this.usedDefault = usedDefault;
    }

    public List<String> getRecommendationIds() {
        return recommendationIds;
    }

    public void setRecommendationIds(List<String> recommendationIds) {
        this.recommendationIds = recommendationIds;
    }

    public boolean isTrackingAvailable() {
        return trackingAvailable;
    }

    public void setTrackingAvailable(boolean trackingAvailable) {
        this.trackingAvailable = trackingAvailable;
    }

    public String getEngineMode() {
        return engineMode;
    }

    public void setEngineMode(String engineMode) {
        this.engineMode = engineMode;
    }

    public List<String> getDegradedSources() {
        return degradedSources;
    }

    public void setDegradedSources(List<String> degradedSources) {
        this.degradedSources = degradedSources;
    }

    public boolean isHasCheckin() {
        return hasCheckin;
    }

    public void setHasCheckin(boolean hasCheckin) {
        this.hasCheckin = hasCheckin;
    }

    public int getRulesetVersion() {
        return rulesetVersion;
    }

    public void setRulesetVersion(int rulesetVersion) {
        this.rulesetVersion = rulesetVersion;
    }

    public TailoringContext getContext() {
        return context;
    }

    public void setContext(TailoringContext context) {
        this.context = context;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public void setDecidedAt(Instant decidedAt) {
        this.decidedAt = decidedAt;
    }

    @Override
    public String toString() {
        return "Decision{" +
                "decisionId='" + decisionId + '\'' +
                ", userId='" + userId + '\'' +
                ", actions=" + actions +
                ", matchedRules=" + matchedRules +
                ", usedDefault=" + usedDefault +
                ", engineMode='" + engineMode + '\'' +
                '}';
    }
}
