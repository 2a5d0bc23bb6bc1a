/**
 * Storage port consumed by the scoring run.
 *
 * @since 1.0.0
 */
package com.fleetrank.core.source;
