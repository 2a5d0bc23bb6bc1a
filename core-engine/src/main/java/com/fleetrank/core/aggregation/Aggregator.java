package com.fleetrank.core.aggregation;

import com.fleetrank.core.error.AggregationException;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.error.ValidationException;
import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.EntityKey;
import com.fleetrank.core.model.RollupLevel;
import com.fleetrank.core.model.ScoredInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Reduces a group of child scores that share one parent into a single
 * {@link AggregatedScore}.
 *
 * <h3>Failure policy</h3>
 * <ul>
 * <li>An empty group fails with {@link AggregationException}; a roll-up over
 * nothing is a caller bug, not a zero score.</li>
 * <li>Under {@link AggregationStrategy#WEIGHTED} every input key must have a
 * configured weight. There is no implicit default weight.</li>
 * <li>Inputs whose parent differs from the requested parent fail with
 * {@link ValidationException}.</li>
 * </ul>
 *
 * <p>
 * Instances are immutable and safe to share between threads.
 * </p>
 *
 * @since 1.0.0
 */
public class Aggregator {

    private static final Logger LOG = LoggerFactory.getLogger(Aggregator.class);

    /** Percentile used by {@link AggregationStrategy#P95}. */
    static final double P95_PERCENTILE = 95.0;

    private final AggregationStrategy strategy;
    private final Map<String, Double> weights;

    /**
     * Create an aggregator without weights.
     *
     * @param strategy the reduction to apply
     */
    public Aggregator(AggregationStrategy strategy) {
        this(strategy, Collections.emptyMap());
    }

    /**
     * @param strategy the reduction to apply; must not be {@code null}
     * @param weights  input key to weight; consulted only by
     *                 {@link AggregationStrategy#WEIGHTED}
     * @throws ConfigException if a weight is not a positive finite number
     */
    public Aggregator(AggregationStrategy strategy, Map<String, Double> weights) {
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        Objects.requireNonNull(weights, "weights must not be null");

        List<String> errors = new ArrayList<>();
        weights.forEach((key, weight) -> {
            if (weight == null || !Double.isFinite(weight) || weight <= 0) {
                errors.add("weight for '" + key + "' must be a positive finite number, got " + weight);
            }
        });
        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid weights: " + String.join("; ", errors));
        }
        this.weights = Collections.unmodifiableMap(new LinkedHashMap<>(weights));
    }

    public AggregationStrategy getStrategy() {
        return strategy;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    // ---------------------------------------------------------------
    // Aggregation
    // ---------------------------------------------------------------

    /**
     * Roll per-metric results of one node up into a node score.
     *
     * @param results results for a single node
     * @return the node score
     * @throws AggregationException if {@code results} is empty, or a weight is
     *                              missing under the weighted strategy
     * @throws ValidationException  if the results span more than one node
     */
    public AggregatedScore aggregateResults(List<AnomalyResult> results) {
        if (results == null || results.isEmpty()) {
            throw new AggregationException("empty input: no anomaly results to aggregate");
        }
        return aggregate(results.get(0).getNodeKey(), results);
    }

    /**
     * Roll node scores up into a cluster score, or cluster scores up into a
     * tenant score.
     *
     * @param scores scores sharing one parent
     * @return the parent score
     * @throws AggregationException if {@code scores} is empty, or a weight is
     *                              missing under the weighted strategy
     * @throws ValidationException  if the scores do not share one parent, or
     *                              are tenant scores
     */
    public AggregatedScore aggregateScores(List<AggregatedScore> scores) {
        if (scores == null || scores.isEmpty()) {
            throw new AggregationException("empty input: no scores to aggregate");
        }
        AggregatedScore first = scores.get(0);
        if (first.getLevel() == RollupLevel.TENANT) {
            throw new ValidationException("Tenant score " + first.getKey() + " cannot be rolled up further");
        }
        return aggregate(first.getParentKey(), scores);
    }

    /**
     * Combine {@code inputs} into a score for {@code parent}.
     *
     * @param parent the entity being scored
     * @param inputs child scores whose parent is {@code parent}
     * @return the parent score
     * @throws AggregationException if {@code inputs} is empty, or a weight is
     *                              missing under the weighted strategy
     * @throws ValidationException  if an input belongs to another parent
     */
    public AggregatedScore aggregate(EntityKey parent, List<? extends ScoredInput> inputs) {
        Objects.requireNonNull(parent, "parent must not be null");
        if (inputs == null || inputs.isEmpty()) {
            throw new AggregationException("empty input: nothing to aggregate for " + parent);
        }

        int anomalous = 0;
        for (ScoredInput input : inputs) {
            if (!parent.equals(input.getParentKey())) {
                throw new ValidationException("Input '" + input.getInputKey() + "' belongs to "
                        + input.getParentKey() + ", not " + parent);
            }
            anomalous += input.getAnomalousCount();
        }

        double score = switch (strategy) {
            case MAX -> max(inputs);
            case MEAN -> mean(inputs);
            case WEIGHTED -> weightedMean(parent, inputs);
            case P95 -> Percentiles.percentile(scores(inputs), P95_PERCENTILE);
        };
        // Guard against rounding drift just outside [0, 1]
        score = Math.min(1.0, Math.max(0.0, score));

        LOG.debug("Aggregated {} {} score(s) for {} with {}: {}",
                inputs.size(), parent.getLevel().getChildKind(), parent, strategy.value(), score);
        return AggregatedScore.of(parent, strategy, score, inputs.size(), anomalous);
    }

    // ---------------------------------------------------------------
    // Strategies
    // ---------------------------------------------------------------

    private static double max(List<? extends ScoredInput> inputs) {
        double max = Double.NEGATIVE_INFINITY;
        for (ScoredInput input : inputs) {
            max = Math.max(max, input.getScore());
        }
        return max;
    }

    private static double mean(List<? extends ScoredInput> inputs) {
        double sum = 0;
        for (ScoredInput input : inputs) {
            sum += input.getScore();
        }
        return sum / inputs.size();
    }

    private double weightedMean(EntityKey parent, List<? extends ScoredInput> inputs) {
        TreeSet<String> missing = new TreeSet<>();
        double weightedSum = 0;
        double totalWeight = 0;
        for (ScoredInput input : inputs) {
            Double weight = weights.get(input.getInputKey());
            if (weight == null) {
                missing.add(input.getInputKey());
                continue;
            }
            weightedSum += input.getScore() * weight;
            totalWeight += weight;
        }
        if (!missing.isEmpty()) {
            throw new AggregationException("missing weight for " + missing + " while aggregating " + parent
                    + "; configured weights: " + weights.keySet());
        }
        return weightedSum / totalWeight;
    }

    private static double[] scores(List<? extends ScoredInput> inputs) {
        double[] scores = new double[inputs.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = inputs.get(i).getScore();
        }
        return scores;
    }

    @Override
    public String toString() {
        return "Aggregator{strategy=" + strategy.value() + ", weights=" + weights + '}';
    }
}
