/**
 * Metric storage used by the scoring job.
 *
 * @since 1.0.0
 */
package com.fleetrank.job.store;
