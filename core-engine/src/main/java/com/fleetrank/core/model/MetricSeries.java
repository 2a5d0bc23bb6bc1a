package com.fleetrank.core.model;

import com.fleetrank.core.error.ValidationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered sequence of samples for one metric on one node.
 *
 * <h3>Invariants</h3>
 * <ul>
 * <li>tenant, cluster, node and metric name are present and non-blank</li>
 * <li>at least one sample</li>
 * <li>timestamps strictly ascending</li>
 * <li>every value finite</li>
 * </ul>
 *
 * <p>
 * Instances are immutable. The {@link Builder} checks every invariant at
 * {@link Builder#build()} and reports all violations in a single
 * {@link ValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricSeries implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final String clusterId;
    private final String nodeId;
    private final String metricName;
    private final List<MetricSample> samples;
    private final Map<String, String> metadata;

    private MetricSeries(String tenantId, String clusterId, String nodeId, String metricName,
            List<MetricSample> samples, Map<String, String> metadata) {
        this.tenantId = tenantId;
        this.clusterId = clusterId;
        this.nodeId = nodeId;
        this.metricName = metricName;
        this.samples = samples;
        this.metadata = metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public String getTenantId() {
        return tenantId;
    }

    public String getClusterId() {
        return clusterId;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getMetricName() {
        return metricName;
    }

    /**
     * @return unmodifiable list of samples in ascending timestamp order
     */
    public List<MetricSample> getSamples() {
        return samples;
    }

    /**
     * @return unmodifiable tag map; empty when no tags were supplied
     */
    public Map<String, String> getMetadata() {
        return metadata;
    }

    public int size() {
        return samples.size();
    }

    public Instant getStartTime() {
        return samples.get(0).getTimestamp();
    }

    public Instant getEndTime() {
        return samples.get(samples.size() - 1).getTimestamp();
    }

    public Instant getTimestamp(int index) {
        return samples.get(index).getTimestamp();
    }

    public List<Instant> getTimestamps() {
        List<Instant> timestamps = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            timestamps.add(sample.getTimestamp());
        }
        return Collections.unmodifiableList(timestamps);
    }

    /**
     * @return a fresh array holding the sample values in order
     */
    public double[] getValues() {
        double[] values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = samples.get(i).getValue();
        }
        return values;
    }

    public EntityKey getNodeKey() {
        return EntityKey.node(tenantId, clusterId, nodeId);
    }

    public SeriesKey getSeriesKey() {
        return new SeriesKey(tenantId, clusterId, nodeId, metricName);
    }

    /**
     * Return the part of this series covered by a window.
     *
     * <p>
     * The returned series is a view over this one's samples; no sample data
     * is copied.
     * </p>
     *
     * @param window a window produced for this series
     * @return the windowed series
     * @throws ValidationException if the window is empty or out of bounds
     */
    public MetricSeries slice(TimeWindow window) {
        Objects.requireNonNull(window, "window must not be null");
        if (window.getEndIndex() > samples.size()) {
            throw new ValidationException("Window " + window + " exceeds series of " + samples.size()
                    + " sample(s) for " + getSeriesKey());
        }
        if (window.isEmpty()) {
            throw new ValidationException("Cannot slice empty window " + window + " of " + getSeriesKey());
        }
        return new MetricSeries(tenantId, clusterId, nodeId, metricName,
                samples.subList(window.getStartIndex(), window.getEndIndex()), metadata);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSeries that))
            return false;
        return tenantId.equals(that.tenantId)
                && clusterId.equals(that.clusterId)
                && nodeId.equals(that.nodeId)
                && metricName.equals(that.metricName)
                && samples.equals(that.samples);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, clusterId, nodeId, metricName, samples);
    }

    @Override
    public String toString() {
        return "MetricSeries{" +
                "key=" + getSeriesKey() +
                ", size=" + samples.size() +
                ", range=[" + getStartTime() + ", " + getEndTime() + "]" +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link MetricSeries}.
     *
     * <p>
     * Samples can be added one at a time, as {@link MetricSample} values, or
     * as parallel timestamp and value lists. Parallel lists of different
     * lengths are rejected at build time.
     * </p>
     */
    public static class Builder {
        private String tenantId;
        private String clusterId;
        private String nodeId;
        private String metricName;
        private final List<Instant> timestamps = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
        private final Map<String, String> metadata = new LinkedHashMap<>();

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder clusterId(String clusterId) {
            this.clusterId = clusterId;
            return this;
        }

        public Builder nodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder metricName(String metricName) {
            this.metricName = metricName;
            return this;
        }

        public Builder key(SeriesKey key) {
            return tenantId(key.getTenantId())
                    .clusterId(key.getClusterId())
                    .nodeId(key.getNodeId())
                    .metricName(key.getMetricName());
        }

        public Builder sample(Instant timestamp, double value) {
            timestamps.add(timestamp);
            values.add(value);
            return this;
        }

        public Builder samples(List<MetricSample> samples) {
            for (MetricSample s : samples) {
                sample(s.getTimestamp(), s.getValue());
            }
            return this;
        }

        /**
         * Replace any samples added so far with parallel timestamp and value
         * lists.
         */
        public Builder points(List<Instant> timestamps, List<Double> values) {
            this.timestamps.clear();
            this.values.clear();
            this.timestamps.addAll(timestamps);
            this.values.addAll(values);
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(key, value);
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            this.metadata.putAll(metadata);
            return this;
        }

        /**
         * Build and validate the series.
         *
         * @return a new immutable {@link MetricSeries}
         * @throws ValidationException listing every invariant that does not hold
         */
        public MetricSeries build() {
            List<String> errors = new ArrayList<>();
            requireNonBlank(tenantId, "tenantId", errors);
            requireNonBlank(clusterId, "clusterId", errors);
            requireNonBlank(nodeId, "nodeId", errors);
            requireNonBlank(metricName, "metricName", errors);

            if (timestamps.size() != values.size()) {
                errors.add("Timestamp and value count mismatch: " + timestamps.size()
                        + " timestamps vs " + values.size() + " values");
            } else if (timestamps.isEmpty()) {
                errors.add("Series must contain at least one sample");
            } else {
                checkSamples(errors);
            }

            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid MetricSeries: " + String.join("; ", errors));
            }

            List<MetricSample> samples = new ArrayList<>(timestamps.size());
            for (int i = 0; i < timestamps.size(); i++) {
                samples.add(MetricSample.of(timestamps.get(i), values.get(i)));
            }
            return new MetricSeries(tenantId, clusterId, nodeId, metricName,
                    Collections.unmodifiableList(samples),
                    Collections.unmodifiableMap(new LinkedHashMap<>(metadata)));
        }

        private void checkSamples(List<String> errors) {
            Instant previous = null;
            for (int i = 0; i < timestamps.size(); i++) {
                Instant ts = timestamps.get(i);
                Double v = values.get(i);
                if (ts == null) {
                    errors.add("Timestamp at index " + i + " is null");
                    return;
                }
                if (v == null || !Double.isFinite(v)) {
                    errors.add("Value at index " + i + " is not finite: " + v);
                    return;
                }
                if (previous != null && !ts.isAfter(previous)) {
                    errors.add("Timestamps must be strictly ascending: index " + i + " (" + ts
                            + ") does not follow " + previous);
                    return;
                }
                previous = ts;
            }
        }

        private static void requireNonBlank(String value, String name, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add("'" + name + "' is required");
            }
        }
    }
}
