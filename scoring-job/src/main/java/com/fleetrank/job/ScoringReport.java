package com.fleetrank.job;

import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.pipeline.PartitionFailure;
import com.fleetrank.core.pipeline.PipelineResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * JSON-serialisable summary of one scoring run: Top-N per level plus the
 * partitions that failed.
 *
 * @since 1.0.0
 */
public final class ScoringReport {

    private final Instant generatedAt;
    private final Instant from;
    private final Instant to;
    private final String engine;
    private final int partitions;
    private final boolean complete;
    private final List<RankedEntity> topNodes;
    private final List<RankedEntity> topClusters;
    private final List<RankedEntity> topTenants;
    private final List<FailedPartition> failures;

    private ScoringReport(Instant generatedAt, Instant from, Instant to, String engine, int partitions,
            boolean complete, List<RankedEntity> topNodes, List<RankedEntity> topClusters,
            List<RankedEntity> topTenants, List<FailedPartition> failures) {
        this.generatedAt = generatedAt;
        this.from = from;
        this.to = to;
        this.engine = engine;
        this.partitions = partitions;
        this.complete = complete;
        this.topNodes = topNodes;
        this.topClusters = topClusters;
        this.topTenants = topTenants;
        this.failures = failures;
    }

    /**
     * Summarise a pipeline result.
     *
     * @param result      scores and failures of the run
     * @param topN        entries kept per level
     * @param engine      name of the detection engine used
     * @param from        start of the scored range
     * @param to          end of the scored range
     * @param generatedAt report timestamp
     * @return the report
     */
    public static ScoringReport from(PipelineResult result, int topN, String engine, Instant from, Instant to,
            Instant generatedAt) {
        Objects.requireNonNull(result, "result must not be null");
        List<FailedPartition> failed = new ArrayList<>();
        for (PartitionFailure failure : result.getFailures()) {
            failed.add(new FailedPartition(failure.getKey().toString(), failure.getErrorType(),
                    failure.getReason()));
        }
        return new ScoringReport(generatedAt, from, to, engine,
                result.getPartitions().size() + result.getFailures().size(),
                result.isComplete(),
                ranked(result.topNodes(topN)),
                ranked(result.topClusters(topN)),
                ranked(result.topTenants(topN)),
                List.copyOf(failed));
    }

    private static List<RankedEntity> ranked(List<AggregatedScore> scores) {
        List<RankedEntity> ranked = new ArrayList<>(scores.size());
        for (int i = 0; i < scores.size(); i++) {
            AggregatedScore s = scores.get(i);
            ranked.add(new RankedEntity(i + 1, s.getKey().toString(), s.getEntityId(),
                    s.getLevel().name().toLowerCase(Locale.ROOT), s.getStrategy().value(),
                    s.getAggregateScore(), s.getNumInputs(), s.getNumAnomalous()));
        }
        return List.copyOf(ranked);
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }

    public Instant getFrom() {
        return from;
    }

    public Instant getTo() {
        return to;
    }

    public String getEngine() {
        return engine;
    }

    public int getPartitions() {
        return partitions;
    }

    public boolean isComplete() {
        return complete;
    }

    public List<RankedEntity> getTopNodes() {
        return topNodes;
    }

    public List<RankedEntity> getTopClusters() {
        return topClusters;
    }

    public List<RankedEntity> getTopTenants() {
        return topTenants;
    }

    public List<FailedPartition> getFailures() {
        return failures;
    }

    /**
     * One row of a Top-N table.
     */
    public static final class RankedEntity {
        private final int rank;
        private final String key;
        private final String entityId;
        private final String level;
        private final String strategy;
        private final double score;
        private final int numInputs;
        private final int numAnomalous;

        RankedEntity(int rank, String key, String entityId, String level, String strategy, double score,
                int numInputs, int numAnomalous) {
            this.rank = rank;
            this.key = key;
            this.entityId = entityId;
            this.level = level;
            this.strategy = strategy;
            this.score = score;
            this.numInputs = numInputs;
            this.numAnomalous = numAnomalous;
        }

        public int getRank() {
            return rank;
        }

        public String getKey() {
            return key;
        }

        public String getEntityId() {
            return entityId;
        }

        public String getLevel() {
            return level;
        }

        public String getStrategy() {
            return strategy;
        }

        public double getScore() {
            return score;
        }

        public int getNumInputs() {
            return numInputs;
        }

        public int getNumAnomalous() {
            return numAnomalous;
        }
    }

    /**
     * A node partition that could not be scored.
     */
    public static final class FailedPartition {
        private final String key;
        private final String errorType;
        private final String reason;

        FailedPartition(String key, String errorType, String reason) {
            this.key = key;
            this.errorType = errorType;
            this.reason = reason;
        }

        public String getKey() {
            return key;
        }

        public String getErrorType() {
            return errorType;
        }

        public String getReason() {
            return reason;
        }
    }
}
