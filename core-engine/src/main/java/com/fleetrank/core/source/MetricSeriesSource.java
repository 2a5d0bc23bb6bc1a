package com.fleetrank.core.source;

import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;

import java.time.Instant;

/**
 * Storage capability the scoring run reads series from.
 *
 * <p>
 * Implementations must return samples sorted ascending by timestamp. A
 * source is passed to {@link com.fleetrank.core.pipeline.ScoringRunner}
 * explicitly; the core never looks one up from global state.
 * </p>
 */
public interface MetricSeriesSource {

    /**
     * Read one series restricted to {@code [from, to]}.
     *
     * @param tenantId   tenant identifier
     * @param clusterId  cluster identifier
     * @param nodeId     node identifier
     * @param metricName metric name
     * @param from       start of the range, inclusive
     * @param to         end of the range, inclusive
     * @return the series
     * @throws java.util.NoSuchElementException if no samples fall in the range
     */
    MetricSeries getMetricSeries(String tenantId, String clusterId, String nodeId, String metricName,
            Instant from, Instant to);

    /**
     * Read one series by key.
     *
     * @see #getMetricSeries(String, String, String, String, Instant, Instant)
     */
    default MetricSeries getMetricSeries(SeriesKey key, Instant from, Instant to) {
        return getMetricSeries(key.getTenantId(), key.getClusterId(), key.getNodeId(), key.getMetricName(),
                from, to);
    }
}
