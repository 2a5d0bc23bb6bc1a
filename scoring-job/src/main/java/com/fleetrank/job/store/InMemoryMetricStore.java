package com.fleetrank.job.store;

import com.fleetrank.core.model.MetricSample;
import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import com.fleetrank.core.source.MetricSeriesSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MetricSeriesSource} backed by a concurrent map. Nothing is
 * persisted.
 *
 * <p>
 * Storing a series replaces any series previously stored under the same
 * {@link SeriesKey}. Reads are safe from concurrent scoring partitions.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryMetricStore implements MetricSeriesSource {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryMetricStore.class);

    private final Map<SeriesKey, MetricSeries> series = new ConcurrentHashMap<>();

    /**
     * Store or replace a series.
     *
     * @param metricSeries series to store; must not be {@code null}
     */
    public void store(MetricSeries metricSeries) {
        Objects.requireNonNull(metricSeries, "series must not be null");
        series.put(metricSeries.getSeriesKey(), metricSeries);
        LOG.debug("Stored {} ({} samples)", metricSeries.getSeriesKey(), metricSeries.size());
    }

    public void storeAll(List<MetricSeries> all) {
        all.forEach(this::store);
    }

    /**
     * @return every stored key, sorted
     */
    public List<SeriesKey> keys() {
        return series.keySet().stream().sorted().toList();
    }

    public int size() {
        return series.size();
    }

    /**
     * Return the samples of one series with {@code from <= timestamp <= to}.
     *
     * @throws NoSuchElementException if nothing is stored under the key or no
     *                                sample falls in the range
     */
    @Override
    public MetricSeries getMetricSeries(String tenantId, String clusterId, String nodeId, String metricName,
            Instant from, Instant to) {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        SeriesKey key = new SeriesKey(tenantId, clusterId, nodeId, metricName);
        MetricSeries stored = series.get(key);
        if (stored == null) {
            throw new NoSuchElementException("No data found for " + key);
        }

        List<MetricSample> inRange = new ArrayList<>();
        for (MetricSample sample : stored.getSamples()) {
            Instant ts = sample.getTimestamp();
            if (!ts.isBefore(from) && !ts.isAfter(to)) {
                inRange.add(sample);
            }
        }
        if (inRange.isEmpty()) {
            throw new NoSuchElementException("No data in time range " + from + " to " + to + " for " + key);
        }

        return MetricSeries.builder()
                .key(key)
                .samples(inRange)
                .metadata(stored.getMetadata())
                .build();
    }
}
