package com.neurasense.jitai.config;

import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Configuration for decision and context construction.
 * <p>
 * Groups the knobs the decision path reads on every request so beans inject one object
 * instead of repeating the keys.
 */
@Singleton
public class DecisionConfig {

    /**
     * Number of actions returned when the caller does not ask for a specific count.
     * Default: 2
     */
    @ConfigProperty(name = "app.decision.default-max-results", defaultValue = "2")
    public int defaultMaxResults;

    /**
     * Upper bound for a caller-supplied result count.
     * Default: 5
     */
    @ConfigProperty(name = "app.decision.max-results-limit", defaultValue = "5")
    public int maxResultsLimit;

    /**
     * Zone used for time-of-day variables and the start of "today".
     */
    @ConfigProperty(name = "app.context.time-zone", defaultValue = "UTC")
    public String timeZone;

    @ConfigProperty(name = "app.context.trend-window-days", defaultValue = "7")
    public int trendWindowDays;

    @ConfigProperty(name = "app.context.engagement-window-days", defaultValue = "7")
    public int engagementWindowDays;

    @ConfigProperty(name = "app.outcome.history-limit", defaultValue = "20")
    public int historyLimit;

    /**
     * Clamps a requested result count into [1, limit], using the default when absent.
     *
     * @param requested the caller's count, may be null
     * @return the effective count
     */
    public int effectiveMaxResults(Integer requested) {
        int value = requested != null ? requested : defaultMaxResults;
        return Math.max(1, Math.min(value, maxResultsLimit));
    }

    /**
     * Settings with the documented defaults, for use outside the container.
     */
    public static DecisionConfig defaults() {
        DecisionConfig config = new DecisionConfig();
        config.defaultMaxResults = 2;
        config.maxResultsLimit = 5;
        config.timeZone = "UTC";
        config.trendWindowDays = 7;
        config.engagementWindowDays = 7;
        config.historyLimit = 20;
        return config;
    }
}
