package com.neurasense.jitai.outcome;

import com.neurasense.jitai.domain.RecommendationRecord;
import com.neurasense.jitai.domain.RecommendationStatus;
import com.neurasense.jitai.domain.SelectedAction;
import com.neurasense.jitai.domain.TailoringContext;
import com.neurasense.jitai.domain.Tier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryRecommendationStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-02T08:00:00Z");

    private InMemoryRecommendationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRecommendationStore();
    }

    @Test
    void testSaveAndFind() {
        store.saveAll(List.of(record("r1", "u1", 0), record("r2", "u1", 1)));

        assertThat(store.find("r1")).isPresent();
        assertThat(store.find("missing")).isEmpty();
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void testDuplicateIdRejected() {
        store.saveAll(List.of(record("r1", "u1", 0)));

        assertThatThrownBy(() -> store.saveAll(List.of(record("r1", "u2", 1))))
                .isInstanceOf(RecommendationStoreException.class);
        assertThat(store.find("r1").orElseThrow().getUserId()).isEqualTo("u1");
    }

    @Test
    void testFindByUserNewestFirstWithLimit() {
        store.saveAll(List.of(record("r1", "u1", 0), record("r2", "u2", 1), record("r3", "u1", 2), record("r4", "u1", 3)));

        assertThat(store.findByUser("u1", 2)).extracting(RecommendationRecord::getId).containsExactly("r4", "r3");
        assertThat(store.findByUser("u1", 10)).hasSize(3);
        assertThat(store.findByUser("nobody", 10)).isEmpty();
    }

    @Test
    void testFindAllFiltersByUser() {
        store.saveAll(List.of(record("r1", "u1", 0), record("r2", "u2", 1)));

        assertThat(store.findAll("u2")).extracting(RecommendationRecord::getId).containsExactly("r2");
        assertThat(store.findAll(null)).hasSize(2);
    }

    @Test
    void testReplaceIfStatusIsCompareAndSet() {
        RecommendationRecord delivered = record("r1", "u1", 0);
        store.saveAll(List.of(delivered));

        RecommendationRecord completed = delivered.transitionTo(RecommendationStatus.COMPLETED, T0.plusSeconds(60), Map.of());
        RecommendationRecord dismissed = delivered.transitionTo(RecommendationStatus.DISMISSED, T0.plusSeconds(90), Map.of());

        assertThat(store.replaceIfStatus("r1", RecommendationStatus.DELIVERED, completed)).isTrue();
        assertThat(store.replaceIfStatus("r1", RecommendationStatus.DELIVERED, dismissed)).isFalse();
        assertThat(store.find("r1").orElseThrow().getStatus()).isEqualTo(RecommendationStatus.COMPLETED);
        assertThat(store.replaceIfStatus("missing", RecommendationStatus.DELIVERED, completed)).isFalse();
    }

    static RecommendationRecord record(String id, String userId, int minutes) {
        SelectedAction action = new SelectedAction("rule-" + id, Tier.ACUTE, 10, "pmr", "relax");
        return RecommendationRecord.delivered(id, userId, action, TailoringContext.builder().build(),
                T0.plusSeconds(minutes * 60L));
    }
}
