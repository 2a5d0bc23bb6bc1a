/**
 * Batch scoring job: simulated fleet, in-memory storage, the core scoring
 * pipeline and a JSON ranking report.
 *
 * @since 1.0.0
 */
package com.fleetrank.job;
