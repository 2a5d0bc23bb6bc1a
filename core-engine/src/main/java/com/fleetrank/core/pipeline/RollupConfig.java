package com.fleetrank.core.pipeline;

import com.fleetrank.core.aggregation.AggregationStrategy;
import com.fleetrank.core.aggregation.Aggregator;
import com.fleetrank.core.model.RollupLevel;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Strategy and weights for each of the three roll-up passes.
 *
 * <p>
 * Every level is configured on its own; nothing assumes the same strategy
 * throughout. Unset levels default to {@link AggregationStrategy#MAX} with
 * no weights. Weights are keyed by child identity: metric names at node
 * level, node ids at cluster level, cluster ids at tenant level.
 * </p>
 *
 * @since 1.0.0
 */
public final class RollupConfig {

    private final Map<RollupLevel, Aggregator> aggregators;

    private RollupConfig(Map<RollupLevel, Aggregator> aggregators) {
        this.aggregators = Collections.unmodifiableMap(aggregators);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return MAX at every level
     */
    public static RollupConfig defaults() {
        return builder().build();
    }

    public Aggregator aggregatorFor(RollupLevel level) {
        return aggregators.get(level);
    }

    public AggregationStrategy strategyFor(RollupLevel level) {
        return aggregators.get(level).getStrategy();
    }

    @Override
    public String toString() {
        return "RollupConfig" + aggregators;
    }

    /**
     * Builder for {@link RollupConfig}.
     */
    public static class Builder {
        private final Map<RollupLevel, AggregationStrategy> strategies = new EnumMap<>(RollupLevel.class);
        private final Map<RollupLevel, Map<String, Double>> weights = new EnumMap<>(RollupLevel.class);

        public Builder strategy(RollupLevel level, AggregationStrategy strategy) {
            strategies.put(Objects.requireNonNull(level, "level"), Objects.requireNonNull(strategy, "strategy"));
            return this;
        }

        public Builder weights(RollupLevel level, Map<String, Double> levelWeights) {
            weights.put(Objects.requireNonNull(level, "level"), new LinkedHashMap<>(levelWeights));
            return this;
        }

        public Builder nodeStrategy(AggregationStrategy strategy) {
            return strategy(RollupLevel.NODE, strategy);
        }

        public Builder clusterStrategy(AggregationStrategy strategy) {
            return strategy(RollupLevel.CLUSTER, strategy);
        }

        public Builder tenantStrategy(AggregationStrategy strategy) {
            return strategy(RollupLevel.TENANT, strategy);
        }

        /**
         * Metric weights used by the node-level pass.
         */
        public Builder metricWeights(Map<String, Double> metricWeights) {
            return weights(RollupLevel.NODE, metricWeights);
        }

        /**
         * Build the configuration.
         *
         * @return the configuration
         * @throws com.fleetrank.core.error.ConfigException if a weight is invalid
         */
        public RollupConfig build() {
            Map<RollupLevel, Aggregator> aggregators = new EnumMap<>(RollupLevel.class);
            for (RollupLevel level : RollupLevel.values()) {
                aggregators.put(level, new Aggregator(
                        strategies.getOrDefault(level, AggregationStrategy.MAX),
                        weights.getOrDefault(level, Collections.emptyMap())));
            }
            return new RollupConfig(aggregators);
        }
    }
}
