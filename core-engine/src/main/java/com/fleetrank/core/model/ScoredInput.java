package com.fleetrank.core.model;

/**
 * One input to a roll-up: a child entity's score, keyed by the child's
 * identity within its parent.
 *
 * <p>
 * At node level the key is the metric name; above it, the key is the id of
 * the child node or cluster. Weighted aggregation looks weights up by this
 * key.
 * </p>
 *
 * @since 1.0.0
 */
public interface ScoredInput {

    /**
     * @return identity of this input within its parent
     */
    String getInputKey();

    /**
     * @return score in {@code [0, 1]}
     */
    double getScore();

    /**
     * @return number of anomalous observations this input stands for
     */
    int getAnomalousCount();

    /**
     * @return the key of the entity this input rolls up into
     */
    EntityKey getParentKey();
}
