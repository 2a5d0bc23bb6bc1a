package com.fleetrank.core.aggregation;

import com.fleetrank.core.error.AggregationException;
import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.AnomalyResult;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Entry points for one-off aggregation without holding an
 * {@link Aggregator}.
 *
 * @since 1.0.0
 */
public final class Aggregators {

    private Aggregators() {
        // utility class, not instantiable
    }

    /**
     * Create an aggregator from a configured strategy name.
     *
     * @param strategyName strategy name, e.g. {@code "p95"}
     * @param weights      weights for the weighted strategy; may be {@code null}
     * @return the aggregator
     * @throws AggregationException if the strategy name is unknown
     */
    public static Aggregator create(String strategyName, Map<String, Double> weights) {
        return new Aggregator(AggregationStrategy.fromName(strategyName),
                weights != null ? weights : Collections.emptyMap());
    }

    /**
     * Aggregate the per-metric results of one node.
     *
     * @param results  results for a single node
     * @param strategy the reduction to apply
     * @param weights  metric weights for the weighted strategy; may be
     *                 {@code null}
     * @return the node score
     */
    public static AggregatedScore aggregate(List<AnomalyResult> results, AggregationStrategy strategy,
            Map<String, Double> weights) {
        return new Aggregator(strategy, weights != null ? weights : Collections.emptyMap())
                .aggregateResults(results);
    }

    /**
     * Aggregate the per-metric results of one node with a strategy given by
     * name.
     *
     * @throws AggregationException if the strategy name is unknown
     */
    public static AggregatedScore aggregate(List<AnomalyResult> results, String strategyName,
            Map<String, Double> weights) {
        return create(strategyName, weights).aggregateResults(results);
    }
}
