/**
 * Orchestration of the metric → node → cluster → tenant roll-up.
 *
 * <ul>
 * <li>{@link com.fleetrank.core.pipeline.AggregationPipeline}: three
 * roll-up passes over anomaly results</li>
 * <li>{@link com.fleetrank.core.pipeline.ScoringRunner}: per-node windowing
 * and detection with failure isolation</li>
 * <li>{@link com.fleetrank.core.pipeline.Ranking}: deterministic Top-N</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.pipeline;
