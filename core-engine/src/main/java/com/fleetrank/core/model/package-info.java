/**
 * Immutable value types shared by every stage of the engine.
 *
 * <ul>
 * <li>{@link com.fleetrank.core.model.MetricSeries}: samples for one
 * tenant/cluster/node/metric</li>
 * <li>{@link com.fleetrank.core.model.TimeWindow}: index slice over a
 * series</li>
 * <li>{@link com.fleetrank.core.model.AnomalyResult}: detection output for
 * one window</li>
 * <li>{@link com.fleetrank.core.model.AggregatedScore}: roll-up output for a
 * node, cluster or tenant</li>
 * <li>{@link com.fleetrank.core.model.EntityKey}: identity in the ownership
 * hierarchy</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.model;
