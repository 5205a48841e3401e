package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.RecommendationRecord;
import jakarta.validation.constraints.NotBlank;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome report for a delivered recommendation.
 */
@Schema(description = "Outcome report")
public class OutcomeRequest {

    @NotBlank(message = "recommendation_id is required")
    @JsonProperty("recommendation_id")
    public String recommendationId;

    @NotBlank(message = "user_id is required")
    @JsonProperty("user_id")
    public String userId;

    @NotBlank(message = "status is required")
    @JsonProperty("status")
    @Schema(description = "opened, completed, dismissed or abandoned", example = "completed")
    public String status;

    @JsonProperty("duration_sec")
    public Integer durationSec;

    @JsonProperty("post_mood")
    public Integer postMood;

    @JsonProperty("helpfulness")
    public Integer helpfulness;

    public OutcomeRequest() {
    }

    public OutcomeRequest(String recommendationId, String userId, String status) {
        this.recommendationId = recommendationId;
        this.userId = userId;
        this.status = status;
    }

    /**
     * The optional extra fields that were supplied.
     */
    public Map<String, Object> extras() {
        Map<String, Object> extras = new LinkedHashMap<>();
        if (durationSec != null) {
            extras.put(RecommendationRecord.EXTRA_DURATION_SEC, durationSec);
        }
        if (postMood != null) {
            extras.put(RecommendationRecord.EXTRA_POST_MOOD, postMood);
        }
        if (helpfulness != null) {
            extras.put(RecommendationRecord.EXTRA_HELPFULNESS, helpfulness);
        }
        return extras;
    }
}
