package com.fleetrank.core.pipeline;

import com.fleetrank.core.aggregation.AggregationStrategy;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.EntityKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Ranking}.
 */
class RankingTest {

    @Test
    @DisplayName("Should rank by score descending and break ties by entity id")
    void shouldRankWithTieBreak() {
        List<AggregatedScore> scores = List.of(node("c1", "b", 0.7), node("c1", "a", 0.7), node("c1", "c", 0.9));

        List<AggregatedScore> top = Ranking.topN(scores, 2);

        assertThat(top).extracting(AggregatedScore::getEntityId).containsExactly("c", "a");
    }

    @Test
    @DisplayName("Should return everything when n exceeds the number of scores")
    void shouldReturnAllWhenNIsLarge() {
        List<AggregatedScore> scores = List.of(node("c1", "a", 0.1), node("c1", "b", 0.2));

        assertThat(Ranking.topN(scores, 10)).extracting(AggregatedScore::getEntityId).containsExactly("b", "a");
        assertThat(Ranking.topN(List.of(), 3)).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to the full key when entity ids tie across clusters")
    void shouldUseFullKeyAsFinalTieBreak() {
        List<AggregatedScore> scores = List.of(node("c2", "n1", 0.5), node("c1", "n1", 0.5));

        assertThat(Ranking.topN(scores, 2)).extracting(s -> s.getKey().toString())
                .containsExactly("t1/c1/n1", "t1/c2/n1");
    }

    @Test
    @DisplayName("Should accept a custom tie-break key")
    void shouldUseCustomTieBreak() {
        List<AggregatedScore> scores = List.of(node("c1", "a", 0.7), node("c2", "b", 0.7));

        List<AggregatedScore> top = Ranking.topN(scores, 1, s -> s.getClusterId().equals("c2") ? "0" : "1");

        assertThat(top).extracting(AggregatedScore::getEntityId).containsExactly("b");
    }

    @Test
    @DisplayName("Should reject n <= 0")
    void shouldRejectNonPositiveN() {
        assertThatThrownBy(() -> Ranking.topN(List.of(), 0))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("n must be > 0");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static AggregatedScore node(String cluster, String node, double score) {
        return AggregatedScore.of(EntityKey.node("t1", cluster, node), AggregationStrategy.MAX, score, 1, 0);
    }
}
