package com.neurasense.jitai.resource.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.neurasense.jitai.domain.CheckinObservation;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

/**
 * Current observation supplied with a decision request. Every indicator is optional.
 */
@Schema(description = "Current check-in observation")
public class CheckinPayload {

    @Min(0) @Max(10)
    @JsonProperty("mood")
    @Schema(example = "3")
    public Integer mood;

    @Min(0) @Max(10)
    @JsonProperty("stress")
    @Schema(example = "8")
    public Integer stress;

    @Min(0) @Max(10)
    @JsonProperty("energy")
    public Integer energy;

    @Min(0) @Max(10)
    @JsonProperty("sleep_quality")
    public Integer sleepQuality;

    @JsonProperty("note")
    public String note;

    public CheckinPayload() {
    }

    public CheckinPayload(Integer mood, Integer stress, Integer energy, Integer sleepQuality) {
        this.mood = mood;
        this.stress = stress;
        this.energy = energy;
        this.sleepQuality = sleepQuality;
    }

    public CheckinObservation toObservation(String userId, Instant at) {
        CheckinObservation observation = new CheckinObservation(userId, mood, stress, energy, sleepQuality, at);
        observation.setNote(note);
        return observation;
    }
}
