package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.RecommendationRecord;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

@Schema(description = "Recommendation history, newest first")
public class HistoryResponse {

    @JsonProperty("user_id")
    public String userId;

    @JsonProperty("count")
    public int count;

    @JsonProperty("records")
    public List<RecommendationRecord> records;

    public HistoryResponse(String userId, List<RecommendationRecord> records) {
        this.userId = userId;
        this.records = records;
        this.count = records.size();
    }
}
