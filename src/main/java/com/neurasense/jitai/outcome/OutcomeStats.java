package com.neurasense.jitai.outcome;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate proximal outcomes over a set of recommendation records.
 * <p>
 * Rates are over all records in the set; averages only over records that carry the value
 * and are null when none do.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutcomeStats {

    @JsonProperty("total")
    private final int total;

    @JsonProperty("by_status")
    private final Map<String, Integer> byStatus;

    @JsonProperty("completion_rate")
    private final double completionRate;

    @JsonProperty("engagement_rate")
    private final double engagementRate;

    @JsonProperty("avg_helpfulness")
    private final Double avgHelpfulness;

    @JsonProperty("avg_post_mood")
    private final Double avgPostMood;

    private OutcomeStats(int total, Map<String, Integer> byStatus, double completionRate,
                         double engagementRate, Double avgHelpfulness, Double avgPostMood) {
        this.total = total;
        this.byStatus = byStatus;
        this.completionRate = completionRate;
        this.engagementRate = engagementRate;
        this.avgHelpfulness = avgHelpfulness;
        this.avgPostMood = avgPostMood;
    }

    public static OutcomeStats of(Collection<RecommendationRecord> records) {
        Map<RecommendationStatus, Integer> counts = new EnumMap<>(RecommendationStatus.class);
        for (RecommendationStatus status : RecommendationStatus.values()) {
            counts.put(status, 0);
        }
        long helpfulnessSum = 0;
        int helpfulnessCount = 0;
        long postMoodSum = 0;
        int postMoodCount = 0;

        for (RecommendationRecord record : records) {
            counts.merge(record.getStatus(), 1, Integer::sum);
            if (record.getHelpfulness() != null) {
                helpfulnessSum += record.getHelpfulness();
                helpfulnessCount++;
            }
            if (record.getPostMood() != null) {
                postMoodSum += record.getPostMood();
                postMoodCount++;
            }
        }

        int total = records.size();
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        counts.forEach((status, count) -> byStatus.put(status.wireValue(), count));

        int completed = counts.get(RecommendationStatus.COMPLETED);
        int engaged = completed + counts.get(RecommendationStatus.OPENED);
        return new OutcomeStats(
                total,
                byStatus,
                ratio(completed, total),
                ratio(engaged, total),
                helpfulnessCount > 0 ? round((double) helpfulnessSum / helpfulnessCount) : null,
                postMoodCount > 0 ? round((double) postMoodSum / postMoodCount) : null);
    }

    private static double ratio(int part, int total) {
        return total == 0 ? 0.0 : round((double) part / total);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    public int getTotal() {
        return total;
    }

    public Map<String, Integer> getByStatus() {
        return byStatus;
    }

    public int count(RecommendationStatus status) {
        return byStatus.getOrDefault(status.wireValue(), 0);
    }

    public double getCompletionRate() {
        return completionRate;
    }

    public double getEngagementRate() {
        return engagementRate;
    }

    public Double getAvgHelpfulness() {
        return avgHelpfulness;
    }

    public Double getAvgPostMood() {
        return avgPostMood;
    }
}
