package com.fleetrank.core.pipeline;

import com.fleetrank.core.aggregation.Aggregator;
import com.fleetrank.core.error.ValidationException;
import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.EntityKey;
import com.fleetrank.core.model.RollupLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Rolls anomaly results up the hierarchy in three passes.
 *
 * <pre>
 *   AnomalyResult   → group by (tenant, cluster, node) → node scores
 *   node scores     → group by (tenant, cluster)       → cluster scores
 *   cluster scores  → group by tenant                  → tenant scores
 * </pre>
 *
 * <p>
 * Each pass uses the aggregator its level is configured with in
 * {@link RollupConfig}. Groups are built only from keys present in the input,
 * so no pass ever aggregates an empty group. Inputs within a group are put in
 * a fixed order before aggregation, which keeps scores bit-for-bit stable
 * regardless of the order results arrive in.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationPipeline.class);

    private static final Comparator<AnomalyResult> RESULT_ORDER = Comparator
            .comparing(AnomalyResult::getSeriesKey)
            .thenComparing(AnomalyResult::getWindowStart)
            .thenComparing(AnomalyResult::getWindowEnd);

    private final RollupConfig config;

    public AggregationPipeline(RollupConfig config) {
        this.config = Objects.requireNonNull(config, "RollupConfig must not be null");
    }

    public RollupConfig getConfig() {
        return config;
    }

    /**
     * Run all three passes over precomputed results.
     *
     * @param results anomaly results for any number of nodes; may be empty
     * @return node, cluster and tenant scores
     * @throws ValidationException if an element is {@code null}
     * @throws com.fleetrank.core.error.AggregationException if a pass cannot
     *                                                       be computed, e.g.
     *                                                       a missing weight
     */
    public PipelineResult run(List<AnomalyResult> results) {
        Objects.requireNonNull(results, "results must not be null");
        if (results.isEmpty()) {
            LOG.info("No anomaly results to aggregate");
            return PipelineResult.empty();
        }

        Map<EntityKey, List<AnomalyResult>> byNode = new TreeMap<>();
        for (int i = 0; i < results.size(); i++) {
            AnomalyResult result = results.get(i);
            if (result == null) {
                throw new ValidationException("Anomaly result at index " + i + " is null");
            }
            byNode.computeIfAbsent(result.getNodeKey(), k -> new ArrayList<>()).add(result);
        }

        List<AggregatedScore> nodeScores = new ArrayList<>(byNode.size());
        for (List<AnomalyResult> nodeResults : byNode.values()) {
            nodeScores.add(aggregateNode(nodeResults));
        }
        return rollUp(nodeScores, Collections.emptyList(), Collections.emptyList());
    }

    /**
     * Metric → node pass for a single node.
     *
     * @param nodeResults results of one node
     * @return the node score
     */
    public AggregatedScore aggregateNode(List<AnomalyResult> nodeResults) {
        List<AnomalyResult> ordered = new ArrayList<>(nodeResults);
        ordered.sort(RESULT_ORDER);
        return config.aggregatorFor(RollupLevel.NODE).aggregateResults(ordered);
    }

    /**
     * Node → cluster and cluster → tenant passes.
     */
    PipelineResult rollUp(List<AggregatedScore> nodeScores, List<PartitionReport> partitions,
            List<PartitionFailure> failures) {
        List<AggregatedScore> sortedNodes = new ArrayList<>(nodeScores);
        sortedNodes.sort(Comparator.comparing(AggregatedScore::getKey));

        List<AggregatedScore> clusterScores = aggregateLevel(RollupLevel.CLUSTER, sortedNodes);
        List<AggregatedScore> tenantScores = aggregateLevel(RollupLevel.TENANT, clusterScores);

        LOG.info("Aggregated {} node(s) into {} cluster(s) and {} tenant(s) [{}]",
                sortedNodes.size(), clusterScores.size(), tenantScores.size(), describeStrategies());
        return new PipelineResult(sortedNodes, clusterScores, tenantScores, partitions, failures);
    }

    private List<AggregatedScore> aggregateLevel(RollupLevel level, List<AggregatedScore> children) {
        Map<EntityKey, List<AggregatedScore>> byParent = new TreeMap<>();
        for (AggregatedScore child : children) {
            byParent.computeIfAbsent(child.getParentKey(), k -> new ArrayList<>()).add(child);
        }
        Aggregator aggregator = config.aggregatorFor(level);
        List<AggregatedScore> scores = new ArrayList<>(byParent.size());
        for (Map.Entry<EntityKey, List<AggregatedScore>> group : byParent.entrySet()) {
            List<AggregatedScore> members = group.getValue();
            members.sort(Comparator.comparing(AggregatedScore::getInputKey));
            scores.add(aggregator.aggregate(group.getKey(), members));
        }
        return scores;
    }

    private String describeStrategies() {
        return "node=" + config.strategyFor(RollupLevel.NODE).value()
                + ", cluster=" + config.strategyFor(RollupLevel.CLUSTER).value()
                + ", tenant=" + config.strategyFor(RollupLevel.TENANT).value();
    }
}
