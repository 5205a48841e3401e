package com.neurasense.jitai.outcome;

import com.neurasense.jitai.domain.Decision;
import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;
import com.neurasense.jitai.domain.SelectedAction;
import com.neurasense.jitai.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Records delivered recommendations and applies the outcomes clients report for them.
 *
 * <p>State machine: {@code delivered -> opened | completed | dismissed | abandoned}. Each
 * end state is reachable only from delivered, so a second report on the same record is a
 * no-op. Reports for unknown ids or another user's record are no-ops too, indistinguishable
 * to the caller from a successful one.
 */
@ApplicationScoped
public class OutcomeTracker {

    private static final Logger LOG = Logger.getLogger(OutcomeTracker.class);

    @Inject
    RecommendationStore store;

    @Inject
    Clock clock;

    @Inject
    EngineMetrics engineMetrics;

    /**
     * Creates one delivered record per selected action.
     *
     * @return the new record ids, in action order
     * @throws RecommendationStoreException if the records could not be stored
     */
    public List<String> record(String userId, Decision decision) {
        Instant now = clock.instant();
        List<RecommendationRecord> records = new ArrayList<>(decision.getActions().size());
        for (SelectedAction action : decision.getActions()) {
            records.add(RecommendationRecord.delivered(
                    UUID.randomUUID().toString(), userId, action, decision.getContext(), now));
        }
        if (records.isEmpty()) {
            return List.of();
        }
        store.saveAll(records);
        engineMetrics.incrementRecommendationsRecorded(records.size());

        List<String> ids = records.stream().map(RecommendationRecord::getId).collect(Collectors.toList());
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Recorded %d recommendations for user=%s: %s", ids.size(), userId, ids);
        }
        return ids;
    }

    /**
     * Applies a reported outcome.
     *
     * @param id the recommendation id
     * @param userId the reporting user; must own the record
     * @param status the reported end state
     * @param extra optional extra fields; only {@link RecommendationRecord#ALLOWED_EXTRAS} are kept
     * @return true if the record changed, false for any no-op
     * @throws RecommendationStoreException if the store is unavailable
     */
    public boolean updateStatus(String id, String userId, RecommendationStatus status, Map<String, ?> extra) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("Not a reportable status: " + status);
        }
        Optional<RecommendationRecord> existing = store.find(id);
        if (existing.isEmpty() || !existing.get().getUserId().equals(userId)) {
            engineMetrics.incrementOutcomeIgnored();
            LOG.debugf("Outcome ignored: id=%s not found for reporting user", id);
            return false;
        }
        RecommendationRecord record = existing.get();
        if (!record.canTransitionTo(status)) {
            engineMetrics.incrementOutcomeIgnored();
            LOG.debugf("Outcome ignored: id=%s already %s, reported %s", id, record.getStatus(), status);
            return false;
        }

        RecommendationRecord updated = record.transitionTo(status, clock.instant(), filterExtras(extra));
        boolean applied = store.replaceIfStatus(id, RecommendationStatus.DELIVERED, updated);
        if (applied) {
            engineMetrics.incrementOutcomeApplied();
            LOG.debugf("Outcome applied: id=%s -> %s", id, status);
        } else {
            engineMetrics.incrementOutcomeIgnored();
            LOG.debugf("Outcome ignored: id=%s changed concurrently", id);
        }
        return applied;
    }

    public List<RecommendationRecord> history(String userId, int limit) {
        return store.findByUser(userId, Math.max(0, limit));
    }

    /**
     * @param userId a single user's stats, or everyone's when null
     */
    public OutcomeStats stats(String userId) {
        return OutcomeStats.of(store.findAll(userId));
    }

    /**
     * Outcome stats grouped by the rule that produced each recommendation, ordered by rule id.
     */
    public Map<String, OutcomeStats> statsByRule() {
        Map<String, List<RecommendationRecord>> grouped = store.findAll(null).stream()
                .collect(Collectors.groupingBy(RecommendationRecord::getRuleId, TreeMap::new, Collectors.toList()));
        Map<String, OutcomeStats> result = new LinkedHashMap<>();
        grouped.forEach((ruleId, records) -> result.put(ruleId, OutcomeStats.of(records)));
        return result;
    }

    /**
     * Keeps allow-listed keys with integral values that fit in an int; everything else is dropped.
     */
    static Map<String, Integer> filterExtras(Map<String, ?> extra) {
        Map<String, Integer> kept = new LinkedHashMap<>();
        if (extra == null) {
            return kept;
        }
        for (Map.Entry<String, ?> entry : extra.entrySet()) {
            if (!RecommendationRecord.ALLOWED_EXTRAS.contains(entry.getKey())) {
                continue;
            }
            if (entry.getValue() instanceof Number number && isIntegral(number)) {
                kept.put(entry.getKey(), number.intValue());
            }
        }
        return kept;
    }

    private static boolean isIntegral(Number number) {
        if (number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return true;
        }
        if (number instanceof Long value) {
            return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
        }
        double value = number.doubleValue();
        return Double.isFinite(value)
                && value == Math.rint(value)
                && value >= Integer.MIN_VALUE
                && value <= Integer.MAX_VALUE;
    }
}
