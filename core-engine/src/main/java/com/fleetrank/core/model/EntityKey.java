package com.fleetrank.core.model;

import com.fleetrank.core.error.ValidationException;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a node, cluster or tenant in the ownership hierarchy.
 *
 * <p>
 * A tenant key has neither cluster nor node id; a cluster key has no node
 * id. Keys order by tenant, then cluster, then node, with the less specific
 * key first.
 * </p>
 *
 * @since 1.0.0
 */
public final class EntityKey implements Comparable<EntityKey>, Serializable {

    private static final long serialVersionUID = 1L;

    private static final Comparator<EntityKey> ORDER = Comparator
            .comparing(EntityKey::getTenantId)
            .thenComparing(EntityKey::getClusterId, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(EntityKey::getNodeId, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final String tenantId;
    private final String clusterId;
    private final String nodeId;

    private EntityKey(String tenantId, String clusterId, String nodeId) {
        this.tenantId = tenantId;
        this.clusterId = clusterId;
        this.nodeId = nodeId;
    }

    public static EntityKey tenant(String tenantId) {
        return new EntityKey(requireId(tenantId, "tenantId"), null, null);
    }

    public static EntityKey cluster(String tenantId, String clusterId) {
        return new EntityKey(requireId(tenantId, "tenantId"), requireId(clusterId, "clusterId"), null);
    }

    public static EntityKey node(String tenantId, String clusterId, String nodeId) {
        return new EntityKey(requireId(tenantId, "tenantId"),
                requireId(clusterId, "clusterId"),
                requireId(nodeId, "nodeId"));
    }

    public String getTenantId() {
        return tenantId;
    }

    /**
     * @return the cluster id, or {@code null} for a tenant key
     */
    public String getClusterId() {
        return clusterId;
    }

    /**
     * @return the node id, or {@code null} for cluster and tenant keys
     */
    public String getNodeId() {
        return nodeId;
    }

    public RollupLevel getLevel() {
        if (nodeId != null) {
            return RollupLevel.NODE;
        }
        return clusterId != null ? RollupLevel.CLUSTER : RollupLevel.TENANT;
    }

    /**
     * @return the most specific id this key carries
     */
    public String getEntityId() {
        if (nodeId != null) {
            return nodeId;
        }
        return clusterId != null ? clusterId : tenantId;
    }

    /**
     * Return the key one level up: node to cluster, cluster to tenant.
     *
     * @return the parent key
     * @throws IllegalStateException if this is a tenant key
     */
    public EntityKey parent() {
        return switch (getLevel()) {
            case NODE -> new EntityKey(tenantId, clusterId, null);
            case CLUSTER -> new EntityKey(tenantId, null, null);
            case TENANT -> throw new IllegalStateException("Tenant key '" + tenantId + "' has no parent");
        };
    }

    @Override
    public int compareTo(EntityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EntityKey that))
            return false;
        return tenantId.equals(that.tenantId)
                && Objects.equals(clusterId, that.clusterId)
                && Objects.equals(nodeId, that.nodeId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tenantId, clusterId, nodeId);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(tenantId);
        if (clusterId != null) {
            sb.append('/').append(clusterId);
        }
        if (nodeId != null) {
            sb.append('/').append(nodeId);
        }
        return sb.toString();
    }

    static String requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be null or blank");
        }
        return value;
    }
}
