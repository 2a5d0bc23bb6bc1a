/**
 * Seeded synthetic metric generation for local scoring runs.
 *
 * @since 1.0.0
 */
package com.fleetrank.job.simulator;
