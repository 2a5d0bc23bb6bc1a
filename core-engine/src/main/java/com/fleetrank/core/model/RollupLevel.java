package com.fleetrank.core.model;

/**
 * The three levels a roll-up can produce, each named after the parent
 * entity it scores.
 *
 * @since 1.0.0
 */
public enum RollupLevel {

    /** Metric results folded into one score per node. */
    NODE("metric"),

    /** Node scores folded into one score per cluster. */
    CLUSTER("node"),

    /** Cluster scores folded into one score per tenant. */
    TENANT("cluster");

    private final String childKind;

    RollupLevel(String childKind) {
        this.childKind = childKind;
    }

    /**
     * @return the kind of entity whose scores are combined at this level
     */
    public String getChildKind() {
        return childKind;
    }
}
