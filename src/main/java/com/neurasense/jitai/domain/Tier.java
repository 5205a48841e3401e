package com.neurasense.jitai.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Urgency class of a rule, ordered most to least urgent.
 * <p>
 * Tier is the primary sort key of the decision resolver; numeric priority only breaks ties
 * within a tier, so a CRISIS match always outranks any lower tier.
 */
public enum Tier {
    CRISIS(0),
    ACUTE(1),
    PREVENTIVE(2),
    MAINTENANCE(3),
    DEFAULT(4);

    private final int rank;

    Tier(int rank) {
        this.rank = rank;
    }

    /**
     * @return sort rank, 0 for the most urgent tier
     */
    public int rank() {
        return rank;
    }

    /**
     * Parses a tier name case-insensitively.
     *
     * @param value the tier as written in the rule document
     * @return the tier, or empty if the name is not one of the fixed tiers
     */
    public static Optional<Tier> fromString(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Tier.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
