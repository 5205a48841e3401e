package com.neurasense.jitai.source;

import com.neurasense.jitai.domain.CheckinObservation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Read access to a user's check-in observations.
 * <p>
 * Implementations return empty results, not errors, when the user has no data.
 * A {@link FeatureSourceException} signals that the backing store itself is unavailable.
 */
public interface CheckinSource {

    /**
     * Latest observation created at or after {@code since}.
     */
    Optional<CheckinObservation> latest(String userId, Instant since);

    /**
     * Observations created at or after {@code since}, oldest first.
     */
    List<CheckinObservation> history(String userId, Instant since);
}
