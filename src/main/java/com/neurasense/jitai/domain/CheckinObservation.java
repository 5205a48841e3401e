package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A self-reported check-in: mood, stress, energy and sleep quality on a 0-10 scale.
 * Any indicator may be missing.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckinObservation {

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("mood")
    private Integer mood;

    @JsonProperty("stress")
    private Integer stress;

    @JsonProperty("energy")
    private Integer energy;

    @JsonProperty("sleep_quality")
    private Integer sleepQuality;

    @JsonProperty("note")
    private String note;

    @JsonProperty("created_at")
    private Instant createdAt;

    public CheckinObservation() {
    }

    public CheckinObservation(String userId, Integer mood, Integer stress, Integer energy,
                              Integer sleepQuality, Instant createdAt) {
        this.userId = userId;
        this.mood = mood;
        this.stress = stress;
        this.energy = energy;
        this.sleepQuality = sleepQuality;
        this.createdAt = createdAt;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public Integer getMood() {
        return mood;
    }

    public void setMood(Integer mood) {
        this.mood = mood;
    }

    public Integer getStress() {
        return stress;
    }

    public void setStress(Integer stress) {
        this.stress = stress;
    }

    public Integer getEnergy() {
        return energy;
    }

    public void setEnergy(Integer energy) {
        this.energy = energy;
    }

    public Integer getSleepQuality() {
        return sleepQuality;
    }

    public void setSleepQuality(Integer sleepQuality) {
        this.sleepQuality = sleepQuality;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @Override
    public String toString() {
        return "CheckinObservation{" +
                "userId='" + userId + '\'' +
                ", mood=" + mood +
                ", stress=" + stress +
                ", createdAt=" + createdAt +
                '}';
    }
}
