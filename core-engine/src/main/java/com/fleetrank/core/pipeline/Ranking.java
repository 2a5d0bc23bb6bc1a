package com.fleetrank.core.pipeline;

import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.AggregatedScore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Top-N selection over same-level scores.
 *
 * <p>
 * Scores sort descending by {@link AggregatedScore#getAggregateScore()}.
 * Ties sort ascending by a tie-break key, by default the entity id (node id
 * for node scores, cluster id for cluster scores), and then by the full
 * entity key. The order is total, so identical input always ranks
 * identically.
 * </p>
 *
 * @since 1.0.0
 */
public final class Ranking {

    private Ranking() {
        // utility class, not instantiable
    }

    /**
     * Rank by score, breaking ties on the entity id.
     *
     * @param scores scores to rank; not modified
     * @param n      maximum number of entries to return; must be {@code > 0}
     * @return up to {@code n} scores, highest first
     * @throws ConfigException if {@code n <= 0}
     */
    public static List<AggregatedScore> topN(List<AggregatedScore> scores, int n) {
        return topN(scores, n, AggregatedScore::getEntityId);
    }

    /**
     * Rank by score, breaking ties on a caller-chosen key.
     *
     * @param scores      scores to rank; not modified
     * @param n           maximum number of entries to return; must be {@code > 0}
     * @param tieBreakKey key compared lexically, ascending, between equal scores
     * @return up to {@code n} scores, highest first; fewer when fewer are given
     * @throws ConfigException if {@code n <= 0}
     */
    public static List<AggregatedScore> topN(List<AggregatedScore> scores, int n,
            Function<AggregatedScore, String> tieBreakKey) {
        Objects.requireNonNull(scores, "scores must not be null");
        Objects.requireNonNull(tieBreakKey, "tieBreakKey must not be null");
        if (n <= 0) {
            throw new ConfigException("n must be > 0, got: " + n);
        }
        Comparator<AggregatedScore> order = Comparator
                .comparingDouble(AggregatedScore::getAggregateScore).reversed()
                .thenComparing(tieBreakKey, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(AggregatedScore::getKey);
        return scores.stream()
                .sorted(order)
                .limit(n)
                .toList();
    }
}
