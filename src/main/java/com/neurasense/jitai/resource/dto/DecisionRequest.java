package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Decision request. Also used by the preview endpoint.
 */
@Schema(description = "Decision request")
public class DecisionRequest {

    @NotBlank(message = "user_id is required")
    @JsonProperty("user_id")
    @Schema(description = "User at the decision point", example = "user-42", required = true)
    public String userId;

    @Valid
    @JsonProperty("checkin")
    @Schema(description = "Current observation; when absent today's latest check-in is used")
    public CheckinPayload checkin;

    @Min(value = 1, message = "max_results must be at least 1")
    @JsonProperty("max_results")
    @Schema(description = "Number of actions to return, capped by configuration", example = "2")
    public Integer maxResults;

    public DecisionRequest() {
    }

    public DecisionRequest(String userId, CheckinPayload checkin, Integer maxResults) {
        this.userId = userId;
        this.checkin = checkin;
        this.maxResults = maxResults;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public CheckinPayload getCheckin() {
        return checkin;
    }

    public void setCheckin(CheckinPayload checkin) {
        this.checkin = checkin;
    }

    public Integer getMaxResults() {
        return maxResults;
    }

    public void setMaxResults(Integer maxResults) {
        this.maxResults = maxResults;
    }
}
