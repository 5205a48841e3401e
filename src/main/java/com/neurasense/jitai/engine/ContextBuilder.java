package com.neurasense.jitai.engine;

import com.neurasense.jitai.config.DecisionConfig;
import com.neurasense.jitai.domain.CheckinObservation;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.domain.ToolCompletion;
import com.neurasense.jitai.source.CheckinSource;
import com.neurasense.jitai.source.CompletionSource;
import com.neurasense.jitai.util.AlertLogger;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Builds the tailoring context for one decision point.
 *
 * <p>Namespaces:
 * <ul>
 *   <li>{@code checkin}: mood, stress, energy, sleep_quality of the current observation, 5 when missing</li>
 *   <li>{@code time}: hour, period, day_of_week (0 = Monday), is_weekend from the injected clock</li>
 *   <li>{@code trend}: rolling averages and slope over the trend window</li>
 *   <li>{@code engagement}: days since last completion (999 when none), completions in window,
 *       identity of the last completed tool</li>
 * </ul>
 *
 * <p>A failing feature source degrades only its own namespace to defaults; the namespace
 * name is added to the caller's degraded set.
 */
@ApplicationScoped
public class ContextBuilder {

    private static final Logger LOG = Logger.getLogger(ContextBuilder.class);

    public static final int NEUTRAL_CHECKIN_VALUE = 5;
    public static final int NO_COMPLETION_DAYS = 999;

    public static final String PERIOD_MORNING = "morning";
    public static final String PERIOD_AFTERNOON = "afternoon";
    public static final String PERIOD_EVENING = "evening";
    public static final String PERIOD_LATE_NIGHT = "late_night";

    @Inject
    Clock clock;

    @Inject
    CheckinSource checkinSource;

    @Inject
    CompletionSource completionSource;

    @Inject
    DecisionConfig config;

    @Inject
    EngineMetrics engineMetrics;

    public TailoringContext build(String userId, CheckinObservation current) {
        return build(userId, current, new LinkedHashSet<>());
    }

    /**
     * Builds the context, collecting the names of namespaces that fell back to defaults.
     *
     * @param userId the user at the decision point
     * @param current the current observation, or null to use neutral check-in values
     * @param degraded receives the names of degraded namespaces
     * @return the unmodifiable context
     */
    public TailoringContext build(String userId, CheckinObservation current, Set<String> degraded) {
        ZonedDateTime now = ZonedDateTime.now(clock);

        TailoringContext context = TailoringContext.builder()
                .putAll(TailoringContext.CHECKIN, checkinVariables(current))
                .putAll(TailoringContext.TIME, timeVariables(now))
                .putAll(TailoringContext.TREND, guarded(TailoringContext.TREND, userId, degraded,
                        () -> trendVariables(userId, now.toInstant()), TrendCalculator::neutral))
                .putAll(TailoringContext.ENGAGEMENT, guarded(TailoringContext.ENGAGEMENT, userId, degraded,
                        () -> engagementVariables(userId, now.toInstant()), ContextBuilder::engagementDefaults))
                .build();

        if (LOG.isDebugEnabled()) {
            LOG.debugf("Context for user=%s: %s (degraded=%s)", userId, context, degraded);
        }
        return context;
    }

    /**
     * Looks up the user's latest check-in since the start of today in the clock's zone.
     * A failing source counts as the {@code checkin} namespace being degraded.
     */
    public Optional<CheckinObservation> todaysObservation(String userId, Set<String> degraded) {
        Instant startOfDay = ZonedDateTime.now(clock).toLocalDate().atStartOfDay(clock.getZone()).toInstant();
        try {
            return checkinSource.latest(userId, startOfDay);
        } catch (RuntimeException e) {
            markDegraded(TailoringContext.CHECKIN, userId, degraded, e);
            return Optional.empty();
        }
    }

    static Map<String, Object> checkinVariables(CheckinObservation current) {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("mood", valueOrNeutral(current != null ? current.getMood() : null));
        vars.put("stress", valueOrNeutral(current != null ? current.getStress() : null));
        vars.put("energy", valueOrNeutral(current != null ? current.getEnergy() : null));
        vars.put("sleep_quality", valueOrNeutral(current != null ? current.getSleepQuality() : null));
        return vars;
    }

    static Map<String, Object> timeVariables(ZonedDateTime now) {
        int hour = now.getHour();
        int dayOfWeek = now.getDayOfWeek().getValue() - 1;
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("hour", hour);
        vars.put("period", period(hour));
        vars.put("day_of_week", dayOfWeek);
        vars.put("is_weekend", dayOfWeek >= 5);
        return vars;
    }

    static String period(int hour) {
        if (hour >= 5 && hour < 12) {
            return PERIOD_MORNING;
        }
        if (hour >= 12 && hour < 18) {
            return PERIOD_AFTERNOON;
        }
        if (hour >= 18 && hour < 23) {
            return PERIOD_EVENING;
        }
        return PERIOD_LATE_NIGHT;
    }

    private Map<String, Object> trendVariables(String userId, Instant now) {
        Instant since = now.minus(Duration.ofDays(config.trendWindowDays));
        List<CheckinObservation> window = checkinSource.history(userId, since);
        return TrendCalculator.compute(window);
    }

    private Map<String, Object> engagementVariables(String userId, Instant now) {
        Optional<ToolCompletion> last = completionSource.latest(userId);
        if (last.isEmpty()) {
            return engagementDefaults();
        }
        Instant since = now.minus(Duration.ofDays(config.engagementWindowDays));
        int recent = completionSource.completions(userId, since).size();
        long daysSince = Math.max(0, Duration.between(last.get().getCreatedAt(), now).toDays());

        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("days_since_last_completion", (int) daysSince);
        vars.put("tools_completed_7d", recent);
        vars.put("last_tool_id", last.get().getToolId());
        vars.put("last_tool_status", ToolCompletion.STATUS_COMPLETED);
        return vars;
    }

    static Map<String, Object> engagementDefaults() {
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("days_since_last_completion", NO_COMPLETION_DAYS);
        vars.put("tools_completed_7d", 0);
        return vars;
    }

    private Map<String, Object> guarded(String namespace, String userId, Set<String> degraded,
                                        Supplier<Map<String, Object>> compute,
                                        Supplier<Map<String, Object>> defaults) {
        try {
            return compute.get();
        } catch (RuntimeException e) {
            markDegraded(namespace, userId, degraded, e);
            return defaults.get();
        }
    }

    private void markDegraded(String namespace, String userId, Set<String> degraded, RuntimeException e) {
        degraded.add(namespace);
        engineMetrics.incrementDegradedNamespace();
        AlertLogger.featureSourceDegraded(namespace, userId, e.getMessage());
    }

    private static int valueOrNeutral(Integer value) {
        return value != null ? value : NEUTRAL_CHECKIN_VALUE;
    }
}
