package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.CompanionTask;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.SelectedAction;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Decision API response. The tailoring context stays server side; the preview endpoint
 * returns it.
 */
@Schema(description = "Decision response")
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DecisionResponse {

    @JsonProperty("decision_id")
    public String decisionId;

    @JsonProperty("user_id")
    public String userId;

    @JsonProperty("actions")
    public List<SelectedAction> actions;

    @JsonProperty("task")
    public CompanionTask task;

    @JsonProperty("matched_rules")
    public List<String> matchedRules;

    @JsonProperty("used_default")
    public boolean usedDefault;

    @JsonProperty("recommendation_ids")
    public List<String> recommendationIds;

    @JsonProperty("tracking_available")
    public boolean trackingAvailable;

    @JsonProperty("engine_mode")
    @Schema(example = "NORMAL")
    public String engineMode;

    @JsonProperty("degraded_sources")
    public List<String> degradedSources;

    @JsonProperty("has_checkin")
    public boolean hasCheckin;

    @JsonProperty("ruleset_version")
    public int rulesetVersion;

    @JsonProperty("decided_at")
    public Instant decidedAt;

    public static DecisionResponse from(Decision decision) {
        DecisionResponse response = new DecisionResponse();
        response.decisionId = decision.getDecisionId();
        response.userId = decision.getUserId();
        response.actions = decision.getActions();
        response.task = decision.getTask();
        response.matchedRules = decision.getMatchedRules();
        response.usedDefault = decision.isUsedDefault();
        response.recommendationIds = decision.getRecommendationIds();
        response.trackingAvailable = decision.isTrackingAvailable();
        response.engineMode = decision.getEngineMode();
        response.degradedSources = decision.getDegradedSources();
        response.hasCheckin = decision.isHasCheckin();
        response.rulesetVersion = decision.getRulesetVersion();
        response.decidedAt = decision.getDecidedAt();
        return response;
    }
}
