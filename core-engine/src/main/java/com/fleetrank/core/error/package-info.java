/**
 * Typed failures raised by the core.
 *
 * <ul>
 * <li>{@link com.fleetrank.core.error.ConfigException} for invalid settings</li>
 * <li>{@link com.fleetrank.core.error.ValidationException} for malformed input</li>
 * <li>{@link com.fleetrank.core.error.InsufficientDataException} for series
 * too short to window</li>
 * <li>{@link com.fleetrank.core.error.AggregationException} for roll-ups that
 * cannot be computed</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.error;
