package com.neurasense.jitai.outcome;

import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;

import java.util.List;
import java.util.Optional;

/**
 * Storage for recommendation records. Implementations throw
 * {@link RecommendationStoreException} when the backing store is unavailable.
 */
public interface RecommendationStore {

    /**
     * Appends freshly delivered records.
     */
    void saveAll(List<RecommendationRecord> records);

    Optional<RecommendationRecord> find(String id);

    /**
     * Replaces a record only if its status is still {@code expected}.
     * @return true if the replacement was stored
     */
    boolean replaceIfStatus(String id, RecommendationStatus expected, RecommendationRecord replacement);

    /**
     * A user's records, newest first.
     */
    List<RecommendationRecord> findByUser(String userId, int limit);

    /**
     * All records, or a single user's when {@code userId} is not null.
     */
    List<RecommendationRecord> findAll(String userId);
}
