package com.fleetrank.core.pipeline;

import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.EntityKey;

import java.util.Collections;
import java.util.List;

/**
 * Output of one pipeline run: scores at each level, plus, for partitioned
 * runs, a report per node partition and the partitions that failed.
 *
 * <p>
 * Score lists are ordered by {@link EntityKey}. Use the {@code top*}
 * methods for ranked views.
 * </p>
 *
 * @since 1.0.0
 */
public final class PipelineResult {

    private final List<AggregatedScore> nodeScores;
    private final List<AggregatedScore> clusterScores;
    private final List<AggregatedScore> tenantScores;
    private final List<PartitionReport> partitions;
    private final List<PartitionFailure> failures;

    PipelineResult(List<AggregatedScore> nodeScores, List<AggregatedScore> clusterScores,
            List<AggregatedScore> tenantScores, List<PartitionReport> partitions,
            List<PartitionFailure> failures) {
        this.nodeScores = List.copyOf(nodeScores);
        this.clusterScores = List.copyOf(clusterScores);
        this.tenantScores = List.copyOf(tenantScores);
        this.partitions = List.copyOf(partitions);
        this.failures = List.copyOf(failures);
    }

    static PipelineResult empty() {
        return new PipelineResult(Collections.emptyList(), Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList());
    }

    public List<AggregatedScore> getNodeScores() {
        return nodeScores;
    }

    public List<AggregatedScore> getClusterScores() {
        return clusterScores;
    }

    public List<AggregatedScore> getTenantScores() {
        return tenantScores;
    }

    /**
     * @return one report per node partition; empty for runs over
     *         precomputed results
     */
    public List<PartitionReport> getPartitions() {
        return partitions;
    }

    public List<PartitionFailure> getFailures() {
        return failures;
    }

    public List<EntityKey> getFailedKeys() {
        return failures.stream().map(PartitionFailure::getKey).toList();
    }

    /**
     * @return {@code true} if no partition failed
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    public List<AggregatedScore> topNodes(int n) {
        return Ranking.topN(nodeScores, n);
    }

    public List<AggregatedScore> topClusters(int n) {
        return Ranking.topN(clusterScores, n);
    }

    public List<AggregatedScore> topTenants(int n) {
        return Ranking.topN(tenantScores, n);
    }

    @Override
    public String toString() {
        return "PipelineResult{" +
                "nodes=" + nodeScores.size() +
                ", clusters=" + clusterScores.size() +
                ", tenants=" + tenantScores.size() +
                ", failures=" + failures.size() +
                '}';
    }
}
