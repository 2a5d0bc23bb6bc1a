/**
 * YAML-backed pipeline configuration.
 *
 * <p>
 * {@link com.fleetrank.core.config.PipelineConfigLoader} binds
 * {@code pipeline.yml} to {@link com.fleetrank.core.config.PipelineConfig}
 * and validates it before anything runs.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.config;
