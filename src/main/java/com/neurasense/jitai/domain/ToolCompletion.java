package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A completed tool session reported by the client.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolCompletion {

    public static final String STATUS_COMPLETED = "completed";

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("tool_id")
    private String toolId;

    @JsonProperty("duration_sec")
    private Integer durationSec;

    @JsonProperty("rating")
    private Integer rating;

    @JsonProperty("created_at")
    private Instant createdAt;

    public ToolCompletion() {
    }

    public ToolCompletion(String userId, String toolId, Instant createdAt) {
        this.userId = userId;
        this.toolId = toolId;
        this.createdAt = createdAt;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getToolId() {
        return toolId;
    }

    public void setToolId(String toolId) {
        this.toolId = toolId;
    }

    public Integer getDurationSec() {
        return durationSec;
    }

    public void setDurationSec(Integer durationSec) {
        this.durationSec = durationSec;
    }

    public Integer getRating() {
        return rating;
    }

    public void setRating(Integer rating) {
        this.rating = rating;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
