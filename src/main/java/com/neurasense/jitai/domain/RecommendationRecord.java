package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Persistent trace of one delivered action.
 * <p>
 * Records are immutable values; a status change produces a new record which the store swaps
 * in with a compare-and-set on the previous status. Records are never deleted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RecommendationRecord {

    public static final String EXTRA_DURATION_SEC = "duration_sec";
    public static final String EXTRA_POST_MOOD = "post_mood";
    public static final String EXTRA_HELPFULNESS = "helpfulness";

    /**
     * Extra fields a client may attach to an outcome report. Anything else is dropped.
     */
    public static final Set<String> ALLOWED_EXTRAS = Set.of(EXTRA_DURATION_SEC, EXTRA_POST_MOOD, EXTRA_HELPFULNESS);

    @JsonProperty("id")
    private final String id;

    @JsonProperty("user_id")
    private final String userId;

    @JsonProperty("rule_id")
    private final String ruleId;

    @JsonProperty("action_id")
    private final String actionId;

    @JsonProperty("action_type")
    private final String actionType;

    @JsonProperty("reason")
    private final String reason;

    @JsonProperty("tier")
    private final Tier tier;

    @JsonProperty("priority")
    private final int priority;

    @JsonProperty("context_snapshot")
    private final TailoringContext contextSnapshot;

    @JsonProperty("status")
    private final RecommendationStatus status;

    @JsonProperty("created_at")
    private final Instant createdAt;

    @JsonProperty("opened_at")
    private final Instant openedAt;

    @JsonProperty("completed_at")
    private final Instant completedAt;

    @JsonProperty("dismissed_at")
    private final Instant dismissedAt;

    @JsonProperty("abandoned_at")
    private final Instant abandonedAt;

    @JsonProperty("duration_sec")
    private final Integer durationSec;

    @JsonProperty("post_mood")
    private final Integer postMood;

    @JsonProperty("helpfulness")
    private final Integer helpfulness;

    private RecommendationRecord(Builder b) {
        this.id = b.id;
        this.userId = b.userId;
        this.ruleId = b.ruleId;
        this.actionId = b.actionId;
        this.actionType = b.actionType;
        this.reason = b.reason;
        this.tier = b.tier;
        this.priority = b.priority;
        this.contextSnapshot = b.contextSnapshot;
        this.status = b.status;
        this.createdAt = b.createdAt;
        this.openedAt = b.openedAt;
        this.completedAt = b.completedAt;
        this.dismissedAt = b.dismissedAt;
        this.abandonedAt = b.abandonedAt;
        this.durationSec = b.durationSec;
        this.postMood = b.postMood;
        this.helpfulness = b.helpfulness;
    }

    /**
     * Seeds a delivered record from a selected action.
     */
    public static RecommendationRecord delivered(String id, String userId, SelectedAction action,
                                                 TailoringContext context, Instant createdAt) {
        Builder b = new Builder();
        b.id = id;
        b.userId = userId;
        b.ruleId = action.getRuleId();
        b.actionId = action.getActionId();
        b.actionType = action.getActionType();
        b.reason = action.getReason();
        b.tier = action.getTier();
        b.priority = action.getPriority();
        b.contextSnapshot = context;
        b.status = RecommendationStatus.DELIVERED;
        b.createdAt = createdAt;
        return new RecommendationRecord(b);
    }

    /**
     * Returns a copy moved to {@code target}, stamped with the event time and carrying the
     * allow-listed extras. Callers must check {@link #canTransitionTo} first.
     *
     * @param target the terminal status
     * @param at the event time
     * @param extras already filtered extras, keyed by the {@code EXTRA_*} names
     */
    public RecommendationRecord transitionTo(RecommendationStatus target, Instant at, Map<String, Integer> extras) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("Cannot move " + id + " from " + status + " to " + target);
        }
        Builder b = toBuilder();
        b.status = target;
        switch (target) {
            case OPENED -> b.openedAt = at;
            case COMPLETED -> b.completedAt = at;
            case DISMISSED -> b.dismissedAt = at;
            case ABANDONED -> b.abandonedAt = at;
            default -> throw new IllegalArgumentException("Not a reportable status: " + target);
        }
        if (extras.containsKey(EXTRA_DURATION_SEC)) {
            b.durationSec = extras.get(EXTRA_DURATION_SEC);
        }
        if (extras.containsKey(EXTRA_POST_MOOD)) {
            b.postMood = extras.get(EXTRA_POST_MOOD);
        }
        if (extras.containsKey(EXTRA_HELPFULNESS)) {
            b.helpfulness = extras.get(EXTRA_HELPFULNESS);
        }
        return new RecommendationRecord(b);
    }

    public boolean canTransitionTo(RecommendationStatus target) {
        return status == RecommendationStatus.DELIVERED && target != null && target.isTerminal();
    }

    private Builder toBuilder() {
        Builder b = new Builder();
        b.id = id;
        b.userId = userId;
        b.ruleId = ruleId;
        b.actionId = actionId;
        b.actionType = actionType;
        b.reason = reason;
        b.tier = tier;
        b.priority = priority;
        b.contextSnapshot = contextSnapshot;
        b.status = status;
        b.createdAt = createdAt;
        b.openedAt = openedAt;
        b.completedAt = completedAt;
        b.dismissedAt = dismissedAt;
        b.abandonedAt = abandonedAt;
        b.durationSec = durationSec;
        b.postMood = postMood;
        b.helpfulness = helpfulness;
        return b;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getActionId() {
        return actionId;
    }

    public String getActionType() {
        return actionType;
    }

    public String getReason() {
        return reason;
    }

    public Tier getTier() {
        return tier;
    }

    public int getPriority() {
        return priority;
    }

    public TailoringContext getContextSnapshot() {
        return contextSnapshot;
    }

    public RecommendationStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getDismissedAt() {
        return dismissedAt;
    }

    public Instant getAbandonedAt() {
        return abandonedAt;
    }

    public Integer getDurationSec() {
        return durationSec;
    }

    public Integer getPostMood() {
        return postMood;
    }

    public Integer getHelpfulness() {
        return helpfulness;
    }

    @Override
    public String toString() {
        return "RecommendationRecord{" +
                "id='" + id + '\'' +
                ", userId='" + userId + '\'' +
                ", actionId='" + actionId + '\'' +
                ", status=" + status +
                '}';
    }

    private static final class Builder {
        private String id;
        private String userId;
        private String ruleId;
        private String actionId;
        private String actionType;
        private String reason;
        private Tier tier;
        private int priority;
        private TailoringContext contextSnapshot;
        private RecommendationStatus status;
        private Instant createdAt;
        private Instant openedAt;
        private Instant completedAt;
        private Instant dismissedAt;
        private Instant abandonedAt;
        private Integer durationSec;
        private Integer postMood;
        private Integer helpfulness;
    }
}
