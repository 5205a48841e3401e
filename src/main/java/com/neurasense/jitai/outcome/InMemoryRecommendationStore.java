package com.neurasense.jitai.outcome;

import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local record store. Status changes are compare-and-set on the record map entry.
 */
@ApplicationScoped
public class InMemoryRecommendationStore implements RecommendationStore {

    private final Map<String, RecommendationRecord> byId = new ConcurrentHashMap<>();
    private final Map<String, List<String>> idsByUser = new ConcurrentHashMap<>();

    @Override
    public void saveAll(List<RecommendationRecord> records) {
        for (RecommendationRecord record : records) {
            if (byId.putIfAbsent(record.getId(), record) != null) {
                throw new RecommendationStoreException("Duplicate recommendation id " + record.getId());
            }
            idsByUser.computeIfAbsent(record.getUserId(), k -> new CopyOnWriteArrayList<>()).add(record.getId());
        }
    }

    @Override
    public Optional<RecommendationRecord> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public boolean replaceIfStatus(String id, RecommendationStatus expected, RecommendationRecord replacement) {
        AtomicBoolean replaced = new AtomicBoolean(false);
        byId.computeIfPresent(id, (key, existing) -> {
            if (existing.getStatus() != expected) {
                return existing;
            }
            replaced.set(true);
            return replacement;
        });
        return replaced.get();
    }

    @Override
    public List<RecommendationRecord> findByUser(String userId, int limit) {
        List<String> ids = idsByUser.getOrDefault(userId, List.of());
        List<RecommendationRecord> result = new ArrayList<>();
        for (int i = ids.size() - 1; i >= 0 && result.size() < limit; i--) {
            RecommendationRecord record = byId.get(ids.get(i));
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public List<RecommendationRecord> findAll(String userId) {
        if (userId != null) {
            return findByUser(userId, Integer.MAX_VALUE);
        }
        return new ArrayList<>(byId.values());
    }

    public int size() {
        return byId.size();
    }

    public void clear() {
        byId.clear();
        idsByUser.clear();
    }
}
