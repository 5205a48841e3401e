package com.neurasense.jitai.source;

import com.neurasense.jitai.domain.ToolCompletion;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local completion source. Fed through {@link #record}.
 */
@ApplicationScoped
public class InMemoryCompletionSource implements CompletionSource {

    private final Map<String, List<ToolCompletion>> byUser = new ConcurrentHashMap<>();

    public void record(ToolCompletion completion) {
        Objects.requireNonNull(completion.getUserId(), "user_id");
        Objects.requireNonNull(completion.getToolId(), "tool_id");
        Objects.requireNonNull(completion.getCreatedAt(), "created_at");
        byUser.computeIfAbsent(completion.getUserId(), k -> new CopyOnWriteArrayList<>()).add(completion);
    }

    @Override
    public List<ToolCompletion> completions(String userId, Instant since) {
        List<ToolCompletion> result = new ArrayList<>();
        for (ToolCompletion completion : byUser.getOrDefault(userId, List.of())) {
            if (!completion.getCreatedAt().isBefore(since)) {
                result.add(completion);
            }
        }
        result.sort(Comparator.comparing(ToolCompletion::getCreatedAt));
        return result;
    }

    public void clear() {
        byUser.clear();
    }
}
