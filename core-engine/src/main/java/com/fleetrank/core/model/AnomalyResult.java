package com.fleetrank.core.model;

import com.fleetrank.core.error.ValidationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detection output for one metric over one analysis window.
 *
 * <p>
 * Produced by a {@link com.fleetrank.core.detection.DetectionEngine}, never
 * by the core itself. The core only checks that the hierarchy keys are
 * present and the score lies in {@code [0, 1]}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}; {@link Builder#build()} throws
 * {@link ValidationException} naming every missing key or out-of-range value.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyResult implements ScoredInput, Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final String clusterId;
    private final String nodeId;
    private final String metricName;
    private final Instant windowStart;
    private final Instant windowEnd;
    private final double anomalyScore;
    private final AnomalyLabel anomalyLabel;

    /** Severity estimate in {@code [0, 1]}; {@code null} when the engine gives none. */
    private final Double magnitude;

    private final String explanation;
    private final String engineName;

    private AnomalyResult(Builder b) {
        this.tenantId = b.tenantId;
        this.clusterId = b.clusterId;
        this.nodeId = b.nodeId;
        this.metricName = b.metricName;
        this.windowStart = b.windowStart;
        this.windowEnd = b.windowEnd;
        this.anomalyScore = b.anomalyScore;
        this.anomalyLabel = b.anomalyLabel;
        this.magnitude = b.magnitude;
        this.explanation = b.explanation;
        this.engineName = b.engineName;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start a builder with the hierarchy keys and window bounds of a series.
     *
     * @param series the (windowed) series the result is computed from
     * @return a builder with keys and window filled in
     */
    public static Builder forSeries(MetricSeries series) {
        return new Builder()
                .tenantId(series.getTenantId())
                .clusterId(series.getClusterId())
                .nodeId(series.getNodeId())
                .metricName(series.getMetricName())
                .windowStart(series.getStartTime())
                .windowEnd(series.getEndTime());
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

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public AnomalyLabel getAnomalyLabel() {
        return anomalyLabel;
    }

    public Optional<Double> getMagnitude() {
        return Optional.ofNullable(magnitude);
    }

    public Optional<String> getExplanation() {
        return Optional.ofNullable(explanation);
    }

    public Optional<String> getEngineName() {
        return Optional.ofNullable(engineName);
    }

    public boolean isAnomalous() {
        return anomalyLabel != AnomalyLabel.NORMAL;
    }

    public EntityKey getNodeKey() {
        return EntityKey.node(tenantId, clusterId, nodeId);
    }

    public SeriesKey getSeriesKey() {
        return new SeriesKey(tenantId, clusterId, nodeId, metricName);
    }

    /**
     * Check that this result was computed for the given series.
     *
     * @param series the series the result claims to describe
     * @return {@code true} if tenant, cluster, node and metric all match
     */
    public boolean matches(MetricSeries series) {
        return tenantId.equals(series.getTenantId())
                && clusterId.equals(series.getClusterId())
                && nodeId.equals(series.getNodeId())
                && metricName.equals(series.getMetricName());
    }

    // ---------------------------------------------------------------
    // ScoredInput
    // ---------------------------------------------------------------

    @Override
    public String getInputKey() {
        return metricName;
    }

    @Override
    public double getScore() {
        return anomalyScore;
    }

    @Override
    public int getAnomalousCount() {
        return isAnomalous() ? 1 : 0;
    }

    @Override
    public EntityKey getParentKey() {
        return getNodeKey();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AnomalyResult that))
            return false;
        return Double.compare(anomalyScore, that.anomalyScore) == 0
                && tenantId.equals(that.tenantId)
                && clusterId.equals(that.clusterId)
                && nodeId.equals(that.nodeId)
                && metricName.equals(that.metricName)
                && windowStart.equals(that.windowStart)
                && windowEnd.equals(that.windowEnd)
                && anomalyLabel == that.anomalyLabel
                && Objects.equals(magnitude, that.magnitude)
                && Objects.equals(explanation, that.explanation)
                && Objects.equals(engineName, that.engineName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, clusterId, nodeId, metricName, windowStart, windowEnd, anomalyScore,
                anomalyLabel);
    }

    @Override
    public String toString() {
        return "AnomalyResult{" +
                "series=" + tenantId + '/' + clusterId + '/' + nodeId + '/' + metricName +
                ", window=[" + windowStart + ", " + windowEnd + "]" +
                ", score=" + anomalyScore +
                ", label=" + anomalyLabel.value() +
                '}';
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AnomalyResult}.
     */
    public static class Builder {
        private String tenantId;
        private String clusterId;
        private String nodeId;
        private String metricName;
        private Instant windowStart;
        private Instant windowEnd;
        private double anomalyScore = Double.NaN;
        private AnomalyLabel anomalyLabel;
        private Double magnitude;
        private String explanation;
        private String engineName;

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

        public Builder windowStart(Instant windowStart) {
            this.windowStart = windowStart;
            return this;
        }

        public Builder windowEnd(Instant windowEnd) {
            this.windowEnd = windowEnd;
            return this;
        }

        public Builder anomalyScore(double anomalyScore) {
            this.anomalyScore = anomalyScore;
            return this;
        }

        public Builder anomalyLabel(AnomalyLabel anomalyLabel) {
            this.anomalyLabel = anomalyLabel;
            return this;
        }

        public Builder anomalyLabel(String anomalyLabel) {
            this.anomalyLabel = AnomalyLabel.fromValue(anomalyLabel);
            return this;
        }

        public Builder magnitude(Double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder explanation(String explanation) {
            this.explanation = explanation;
            return this;
        }

        public Builder engineName(String engineName) {
            this.engineName = engineName;
            return this;
        }

        /**
         * Build and validate the result.
         *
         * @return a new {@link AnomalyResult}
         * @throws ValidationException if a key is missing or a bound is violated
         */
        public AnomalyResult build() {
            List<String> errors = new ArrayList<>();
            requireNonBlank(tenantId, "tenantId", errors);
            requireNonBlank(clusterId, "clusterId", errors);
            requireNonBlank(nodeId, "nodeId", errors);
            requireNonBlank(metricName, "metricName", errors);

            if (windowStart == null || windowEnd == null) {
                errors.add("'windowStart' and 'windowEnd' are required");
            } else if (windowEnd.isBefore(windowStart)) {
                errors.add("windowEnd " + windowEnd + " precedes windowStart " + windowStart);
            }
            if (!(anomalyScore >= 0.0 && anomalyScore <= 1.0)) {
                errors.add("anomalyScore must be in [0, 1], got " + anomalyScore);
            }
            if (anomalyLabel == null) {
                errors.add("'anomalyLabel' is required");
            }
            if (magnitude != null && !(magnitude >= 0.0 && magnitude <= 1.0)) {
                errors.add("magnitude must be in [0, 1], got " + magnitude);
            }

            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid AnomalyResult: " + String.join("; ", errors));
            }
            return new AnomalyResult(this);
        }

        private static void requireNonBlank(String value, String name, List<String> errors) {
            if (value == null || value.isBlank()) {
                errors.add("'" + name + "' is required");
            }
        }
    }
}
