/**
 * Window extraction policies.
 *
 * <ul>
 * <li>{@link com.fleetrank.core.window.PointWindowExtractor}: fixed sample
 * count, partial tail dropped</li>
 * <li>{@link com.fleetrank.core.window.TimeWindowExtractor}: fixed duration,
 * empty windows allowed</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.window;
