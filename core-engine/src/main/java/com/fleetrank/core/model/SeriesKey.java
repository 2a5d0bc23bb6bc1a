package com.fleetrank.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identifies one metric series: a node key plus a metric name.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Comparable<SeriesKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private final String tenantId;
    private final String clusterId;
    private final String nodeId;
    private final String metricName;

    /**
     * @throws com.fleetrank.core.error.ValidationException if any id is null or blank
     */
    public SeriesKey(String tenantId, String clusterId, String nodeId, String metricName) {
        this.tenantId = EntityKey.requireId(tenantId, "tenantId");
        this.clusterId = EntityKey.requireId(clusterId, "clusterId");
        this.nodeId = EntityKey.requireId(nodeId, "nodeId");
        this.metricName = EntityKey.requireId(metricName, "metricName");
    }

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

    public EntityKey getNodeKey() {
        return EntityKey.node(tenantId, clusterId, nodeId);
    }

    @Override
    public int compareTo(SeriesKey other) {
        int byNode = getNodeKey().compareTo(other.getNodeKey());
        return byNode != 0 ? byNode : metricName.compareTo(other.metricName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return tenantId.equals(that.tenantId)
                && clusterId.equals(that.clusterId)
                && nodeId.equals(that.nodeId)
                && metricName.equals(that.metricName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, clusterId, nodeId, metricName);
    }

    @Override
    public String toString() {
        return tenantId + "/" + clusterId + "/" + nodeId + "/" + metricName;
    }
}
