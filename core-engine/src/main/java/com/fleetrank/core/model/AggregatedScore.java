package com.fleetrank.core.model;

import com.fleetrank.core.aggregation.AggregationStrategy;
import com.fleetrank.core.error.ValidationException;

import java.io.Serializable;
import java.util.Objects;

/**
 * The roll-up score of one node, cluster or tenant.
 *
 * <p>
 * Cluster id and node id are absent at the levels above them: a tenant
 * score carries neither. A fresh instance is created for every aggregation
 * call and never changes afterwards.
 * </p>
 *
 * <p>
 * When fed into the next level up, an aggregated score acts as a
 * {@link ScoredInput} keyed by its own entity id and standing for
 * {@link #getNumAnomalous()} anomalous observations.
 * </p>
 *
 * @since 1.0.0
 */
public final class AggregatedScore implements ScoredInput, Serializable {

    private static final long serialVersionUID = 1L;

    private final EntityKey key;
    private final AggregationStrategy strategy;
    private final double aggregateScore;
    private final int numInputs;
    private final int numAnomalous;

    private AggregatedScore(EntityKey key, AggregationStrategy strategy, double aggregateScore,
            int numInputs, int numAnomalous) {
        this.key = key;
        this.strategy = strategy;
        this.aggregateScore = aggregateScore;
        this.numInputs = numInputs;
        this.numAnomalous = numAnomalous;
    }

    /**
     * Create a score.
     *
     * @param key            the entity being scored
     * @param strategy       strategy that produced the score
     * @param aggregateScore score in {@code [0, 1]}
     * @param numInputs      number of inputs combined; at least one
     * @param numAnomalous   number of anomalous observations behind the inputs
     * @return the score
     * @throws ValidationException if a bound is violated
     */
    public static AggregatedScore of(EntityKey key, AggregationStrategy strategy, double aggregateScore,
            int numInputs, int numAnomalous) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (!(aggregateScore >= 0.0 && aggregateScore <= 1.0)) {
            throw new ValidationException("aggregateScore must be in [0, 1], got " + aggregateScore
                    + " for " + key);
        }
        if (numInputs < 1) {
            throw new ValidationException("numInputs must be >= 1, got " + numInputs + " for " + key);
        }
        if (numAnomalous < 0) {
            throw new ValidationException("numAnomalous must be >= 0, got " + numAnomalous + " for " + key);
        }
        return new AggregatedScore(key, strategy, aggregateScore, numInputs, numAnomalous);
    }

    public EntityKey getKey() {
        return key;
    }

    public String getTenantId() {
        return key.getTenantId();
    }

    /**
     * @return cluster id, or {@code null} for a tenant score
     */
    public String getClusterId() {
        return key.getClusterId();
    }

    /**
     * @return node id, or {@code null} for cluster and tenant scores
     */
    public String getNodeId() {
        return key.getNodeId();
    }

    public String getEntityId() {
        return key.getEntityId();
    }

    public RollupLevel getLevel() {
        return key.getLevel();
    }

    public AggregationStrategy getStrategy() {
        return strategy;
    }

    public double getAggregateScore() {
        return aggregateScore;
    }

    public int getNumInputs() {
        return numInputs;
    }

    public int getNumAnomalous() {
        return numAnomalous;
    }

    @Override
    public String getInputKey() {
        return key.getEntityId();
    }

    @Override
    public double getScore() {
        return aggregateScore;
    }

    @Override
    public int getAnomalousCount() {
        return numAnomalous;
    }

    /**
     * @throws IllegalStateException for a tenant score, which has no parent
     */
    @Override
    public EntityKey getParentKey() {
        return key.parent();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregatedScore that))
            return false;
        return Double.compare(aggregateScore, that.aggregateScore) == 0
                && numInputs == that.numInputs
                && numAnomalous == that.numAnomalous
                && key.equals(that.key)
                && strategy == that.strategy;
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, strategy, aggregateScore, numInputs, numAnomalous);
    }

    @Override
    public String toString() {
        return "AggregatedScore{" +
                "key=" + key +
                ", level=" + getLevel() +
                ", strategy=" + strategy.value() +
                ", score=" + aggregateScore +
                ", inputs=" + numInputs +
                ", anomalous=" + numAnomalous +
                '}';
    }
}
