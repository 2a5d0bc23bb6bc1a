/**
 * Roll-up of child scores into parent scores.
 *
 * <p>
 * {@link com.fleetrank.core.aggregation.Aggregator} applies one
 * {@link com.fleetrank.core.aggregation.AggregationStrategy} to a group of
 * inputs sharing a parent. The same class serves all three hierarchy levels.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.aggregation;
