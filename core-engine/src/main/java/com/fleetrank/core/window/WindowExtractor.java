package com.fleetrank.core.window;

import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.TimeWindow;

import java.util.List;
import java.util.Map;

/**
 * Slices a series into an ordered sequence of analysis windows.
 *
 * <p>
 * Implementations are deterministic and hold no cursor state: extracting
 * the same series twice returns equal lists, ascending by start time.
 * </p>
 */
public interface WindowExtractor {

    /**
     * Extract every window of {@code series}.
     *
     * @param series the series to slice
     * @return unmodifiable list of windows in ascending start order
     * @throws com.fleetrank.core.error.InsufficientDataException if the series
     *                                                            is too short for
     *                                                            a single window
     */
    List<TimeWindow> extract(MetricSeries series);

    /**
     * @return extraction settings, for logging
     */
    Map<String, Object> describe();
}
