package com.fleetrank.core.detection;

import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.MetricSeries;

import java.util.List;

/**
 * Capability the core consumes to score a series.
 * <p>
 * The core calls {@link #detect(MetricSeries)} once per analysis window,
 * passing the windowed slice of the original series. It does not judge
 * whether the detection is correct; it only checks that every returned
 * result carries the hierarchy keys of the series it was computed from.
 * </p>
 * <p>
 * Implementations may be called concurrently for different series and
 * must not share mutable state between calls.
 * </p>
 */
public interface DetectionEngine {

    /**
     * Score a series.
     *
     * @param series the series (usually one window of a longer series)
     * @return zero or more results, ordered by window start
     */
    List<AnomalyResult> detect(MetricSeries series);

    /**
     * Return the name this engine is registered under.
     *
     * @return engine name
     */
    String getEngineName();
}
