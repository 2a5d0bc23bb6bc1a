package com.fleetrank.core.error;

/**
 * Raised when a roll-up cannot be computed: empty input, unknown strategy
 * name, or a metric without a configured weight under the weighted
 * strategy.
 *
 * @since 1.0.0
 */
public class AggregationException extends FleetRankException {

    private static final long serialVersionUID = 1L;

    public AggregationException(String message) {
        super(message);
    }
}
