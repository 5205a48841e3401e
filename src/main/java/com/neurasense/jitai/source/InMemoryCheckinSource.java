package com.neurasense.jitai.source;

import com.neurasense.jitai.domain.CheckinObservation;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local check-in source. Fed through {@link #record}.
 */
@ApplicationScoped
public class InMemoryCheckinSource implements CheckinSource {

    private static final Logger LOG = Logger.getLogger(InMemoryCheckinSource.class);

    private final Map<String, List<CheckinObservation>> byUser = new ConcurrentHashMap<>();

    public void record(CheckinObservation observation) {
        Objects.requireNonNull(observation.getUserId(), "user_id");
        Objects.requireNonNull(observation.getCreatedAt(), "created_at");
        byUser.computeIfAbsent(observation.getUserId(), k -> new CopyOnWriteArrayList<>()).add(observation);
        if (LOG.isDebugEnabled()) {
            LOG.debugf("Recorded check-in for user=%s at %s", observation.getUserId(), observation.getCreatedAt());
        }
    }

    @Override
    public Optional<CheckinObservation> latest(String userId, Instant since) {
        return window(userId, since).stream()
                .max(Comparator.comparing(CheckinObservation::getCreatedAt));
    }

    @Override
    public List<CheckinObservation> history(String userId, Instant since) {
        List<CheckinObservation> result = window(userId, since);
        result.sort(Comparator.comparing(CheckinObservation::getCreatedAt));
        return result;
    }

    public void clear() {
        byUser.clear();
    }

    private List<CheckinObservation> window(String userId, Instant since) {
        List<CheckinObservation> result = new ArrayList<>();
        for (CheckinObservation observation : byUser.getOrDefault(userId, List.of())) {
            if (!observation.getCreatedAt().isBefore(since)) {
                result.add(observation);
            }
        }
        return result;
    }
}
