package com.neurasense.jitai.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle of a delivered recommendation.
 * <p>
 * Every record starts {@link #DELIVERED}; each of the other four statuses is an end state
 * reachable only from DELIVERED.
 */
public enum RecommendationStatus {
    DELIVERED,
    OPENED,
    COMPLETED,
    DISMISSED,
    ABANDONED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this != DELIVERED;
    }

    /**
     * Parses a status a client may report. DELIVERED is not reportable.
     *
     * @param value the reported status, case-insensitive
     * @return the terminal status, or empty when unrecognized
     */
    public static Optional<RecommendationStatus> fromReported(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RecommendationStatus status : values()) {
            if (status.isTerminal() && status.wireValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
