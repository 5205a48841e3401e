package com.neurasense.jitai.source;

import com.neurasense.jitai.domain.ToolCompletion;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Read access to a user's completed tool sessions.
 * <p>
 * Implementations return empty results, not errors, when the user has no data.
 */
public interface CompletionSource {

    /**
     * Completions created at or after {@code since}, oldest first.
     */
    List<ToolCompletion> completions(String userId, Instant since);

    /**
     * Most recent completion regardless of age.
     */
    default Optional<ToolCompletion> latest(String userId) {
        return completions(userId, Instant.EPOCH).stream()
                .max(Comparator.comparing(ToolCompletion::getCreatedAt));
    }
}
