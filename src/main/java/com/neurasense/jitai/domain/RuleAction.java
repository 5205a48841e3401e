package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One candidate action of a rule: a catalog identifier plus the rationale shown to the user.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RuleAction {

    public static final String TYPE_RECOMMEND_TOOL = "recommend_tool";

    @JsonProperty("type")
    private final String type;

    @JsonProperty("tool_id")
    private final String actionId;

    @JsonProperty("reason")
    private final String reason;

    public RuleAction(String actionId, String reason) {
        this(TYPE_RECOMMEND_TOOL, actionId, reason);
    }

    public RuleAction(String type, String actionId, String reason) {
        this.type = type != null ? type : TYPE_RECOMMEND_TOOL;
        this.actionId = actionId;
        this.reason = reason;
    }

    /**
     * Only recommend actions that name a catalog entry take part in resolution.
     */
    public boolean isRecommendation() {
        return TYPE_RECOMMEND_TOOL.equals(type) && actionId != null && !actionId.isBlank();
    }

    public String getType() {
        return type;
    }

    public String getActionId() {
        return actionId;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuleAction that = (RuleAction) o;
        return Objects.equals(type, that.type) &&
               Objects.equals(actionId, that.actionId) &&
               Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, actionId, reason);
    }

    @Override
    public String toString() {
        return "RuleAction{" + type + ":" + actionId + "}";
    }
}
