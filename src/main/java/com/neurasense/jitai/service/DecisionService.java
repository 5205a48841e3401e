package com.neurasense.jitai.service;

import com.neurasense.jitai.config.DecisionConfig;
import com.neurasense.jitai.domain.CheckinObservation;
import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.Ruleset;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.engine.ContextBuilder;
import com.neurasense.jitai.engine.DecisionResolver;
import com.neurasense.jitai.outcome.OutcomeTracker;
import com.neurasense.jitai.outcome.RecommendationStoreException;
import com.neurasense.jitai.ruleset.RulesetRegistry;
import com.neurasense.jitai.util.AlertLogger;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Runs one decision point end to end: context, rule snapshot, resolution, delivery logging.
 * <p>
 * Delivery logging is best effort. When the recommendation store fails, the decision is still
 * returned, marked {@code DEGRADED} with {@code tracking_available=false} and no recommendation ids.
 */
@ApplicationScoped
public class DecisionService {

    private static final Logger LOG = Logger.getLogger(DecisionService.class);

    @Inject
    ContextBuilder contextBuilder;

    @Inject
    DecisionResolver decisionResolver;

    @Inject
    RulesetRegistry rulesetRegistry;

    @Inject
    OutcomeTracker outcomeTracker;

    @Inject
    DecisionConfig config;

    @Inject
    Clock clock;

    @Inject
    EngineMetrics engineMetrics;

    /**
     * Decides which interventions to deliver and records them.
     *
     * @param userId the user at the decision point
     * @param checkin the current observation, or null to look up today's latest check-in
     * @param maxResults requested number of actions, or null for the configured default
     * @return the decision, with one recommendation id per action when tracking succeeded
     */
    public Decision decide(String userId, CheckinObservation checkin, Integer maxResults) {
        long start = System.nanoTime();
        Decision decision = evaluate(userId, checkin, maxResults);

        try {
            decision.setRecommendationIds(outcomeTracker.record(userId, decision));
        } catch (RecommendationStoreException e) {
            decision.setRecommendationIds(new ArrayList<>());
            decision.setTrackingAvailable(false);
            decision.setEngineMode(Decision.MODE_DEGRADED);
            engineMetrics.incrementTrackingFailure();
            AlertLogger.trackingWriteFailed(userId, decision.getActions().size(), e.getMessage());
        }

        engineMetrics.incrementDecisions();
        if (decision.isUsedDefault()) {
            engineMetrics.incrementDefaultFallback();
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        engineMetrics.recordDecisionLatency(elapsedMs);

        LOG.infof("Decision %s: user=%s, actions=%d, matched=%d, default=%s, mode=%s, %dms",
                decision.getDecisionId(), userId, decision.getActions().size(),
                decision.getMatchedRules().size(), decision.isUsedDefault(), decision.getEngineMode(), elapsedMs);
        return decision;
    }

    /**
     * Evaluates like {@link #decide} but writes no recommendation records.
     */
    public Decision preview(String userId, CheckinObservation checkin, Integer maxResults) {
        Decision decision = evaluate(userId, checkin, maxResults);
        decision.setEngineMode(Decision.MODE_PREVIEW);
        engineMetrics.incrementPreviews();
        LOG.debugf("Preview for user=%s: matched=%s", userId, decision.getMatchedRules());
        return decision;
    }

    private Decision evaluate(String userId, CheckinObservation checkin, Integer maxResults) {
        Set<String> degraded = new LinkedHashSet<>();

        CheckinObservation current = checkin;
        if (current == null) {
            Optional<CheckinObservation> today = contextBuilder.todaysObservation(userId, degraded);
            current = today.orElse(null);
        }

        TailoringContext context = contextBuilder.build(userId, current, degraded);
        Ruleset ruleset = rulesetRegistry.current();
        Decision decision = decisionResolver.resolve(context, ruleset, config.effectiveMaxResults(maxResults));

        decision.setUserId(userId);
        decision.setHasCheckin(current != null);
        decision.setDegradedSources(new ArrayList<>(degraded));
        decision.setDecidedAt(clock.instant());
        return decision;
    }
}
