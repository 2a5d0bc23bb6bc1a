/**
 * The detection port and its reference engines.
 *
 * <p>
 * The core consumes detection through
 * {@link com.fleetrank.core.detection.DetectionEngine} only. Engines are
 * looked up by name in a
 * {@link com.fleetrank.core.detection.DetectionEngineRegistry} the caller
 * builds and passes in. Bundled engines:
 * </p>
 * <ul>
 * <li>{@link com.fleetrank.core.detection.ZScoreDetectionEngine}: window
 * mean ± N × σ</li>
 * <li>{@link com.fleetrank.core.detection.ThresholdDetectionEngine}: static
 * numeric threshold</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * Implement {@code DetectionEngine} and register a constructor under a new
 * name with {@code DetectionEngineRegistry.register()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.fleetrank.core.detection;
