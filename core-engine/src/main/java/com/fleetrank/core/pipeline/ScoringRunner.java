package com.fleetrank.core.pipeline;

import com.fleetrank.core.detection.DetectionEngine;
import com.fleetrank.core.error.InsufficientDataException;
import com.fleetrank.core.error.ValidationException;
import com.fleetrank.core.model.AggregatedScore;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.EntityKey;
import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import com.fleetrank.core.model.TimeWindow;
import com.fleetrank.core.source.MetricSeriesSource;
import com.fleetrank.core.window.WindowExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Windows, detects and aggregates series, one node partition at a time.
 *
 * <h3>Partitioning</h3>
 * <p>
 * Series are grouped by {@code (tenant, cluster, node)}. Each group is
 * windowed, passed window by window to the {@link DetectionEngine}, and
 * aggregated to a node score as an independent task on the supplied
 * {@link Executor}. Groups share no mutable data.
 * </p>
 *
 * <h3>Failure isolation</h3>
 * <p>
 * Any failure inside a group (reading the series, detection, results whose
 * keys do not match their series, node aggregation) is caught and recorded as
 * a {@link PartitionFailure}. That includes errors thrown by a detection
 * engine, such as a {@link StackOverflowError}. Other
 * {@link VirtualMachineError}s, for example {@link OutOfMemoryError}, abort
 * the whole run. The remaining groups still roll
 * up to cluster and tenant scores. Series too short for a single point
 * window and empty time windows are not failures; they are counted in the
 * group's {@link PartitionReport}.
 * </p>
 *
 * <p>
 * The cluster and tenant passes start only after every group has finished.
 * The runner applies no timeouts; bounding how long detection may take is the
 * caller's concern, typically through the executor it supplies.
 * </p>
 *
 * @since 1.0.0
 */
public class ScoringRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ScoringRunner.class);

    private final WindowExtractor extractor;
    private final DetectionEngine engine;
    private final AggregationPipeline pipeline;
    private final Executor executor;

    /**
     * Create a runner that processes partitions on the calling thread.
     */
    public ScoringRunner(WindowExtractor extractor, DetectionEngine engine, AggregationPipeline pipeline) {
        this(extractor, engine, pipeline, Runnable::run);
    }

    /**
     * @param extractor window policy applied to every series
     * @param engine    detection capability
     * @param pipeline  roll-up passes
     * @param executor  runs one task per node partition
     */
    public ScoringRunner(WindowExtractor extractor, DetectionEngine engine, AggregationPipeline pipeline,
            Executor executor) {
        this.extractor = Objects.requireNonNull(extractor, "WindowExtractor must not be null");
        this.engine = Objects.requireNonNull(engine, "DetectionEngine must not be null");
        this.pipeline = Objects.requireNonNull(pipeline, "AggregationPipeline must not be null");
        this.executor = Objects.requireNonNull(executor, "Executor must not be null");
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Score series already in memory.
     *
     * @param series series for any number of nodes
     * @return scores at every level, partition reports and failures
     */
    public PipelineResult score(List<MetricSeries> series) {
        Objects.requireNonNull(series, "series must not be null");
        Map<EntityKey, List<Supplier<MetricSeries>>> partitions = new TreeMap<>();
        for (MetricSeries s : series) {
            Objects.requireNonNull(s, "series element must not be null");
            partitions.computeIfAbsent(s.getNodeKey(), k -> new ArrayList<>()).add(() -> s);
        }
        return run(partitions);
    }

    /**
     * Read series from a source and score them. Reads happen inside each
     * partition's task, so a read failure only fails that partition.
     *
     * @param source storage to read from
     * @param keys   series to score
     * @param from   start of the range, inclusive
     * @param to     end of the range, inclusive
     * @return scores at every level, partition reports and failures
     */
    public PipelineResult score(MetricSeriesSource source, List<SeriesKey> keys, Instant from, Instant to) {
        Objects.requireNonNull(source, "MetricSeriesSource must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        Map<EntityKey, List<Supplier<MetricSeries>>> partitions = new TreeMap<>();
        for (SeriesKey key : keys) {
            partitions.computeIfAbsent(key.getNodeKey(), k -> new ArrayList<>())
                    .add(() -> source.getMetricSeries(key, from, to));
        }
        return run(partitions);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private PipelineResult run(Map<EntityKey, List<Supplier<MetricSeries>>> partitions) {
        LOG.info("Scoring {} node partition(s) with engine '{}' and windows {}",
                partitions.size(), engine.getEngineName(), extractor.describe());

        List<CompletableFuture<PartitionOutcome>> futures = new ArrayList<>(partitions.size());
        for (Map.Entry<EntityKey, List<Supplier<MetricSeries>>> partition : partitions.entrySet()) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> runPartition(partition.getKey(), partition.getValue()), executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<AggregatedScore> nodeScores = new ArrayList<>();
        List<PartitionReport> reports = new ArrayList<>();
        List<PartitionFailure> failures = new ArrayList<>();
        for (CompletableFuture<PartitionOutcome> future : futures) {
            PartitionOutcome outcome = future.join();
            if (outcome.failure != null) {
                failures.add(outcome.failure);
                continue;
            }
            reports.add(outcome.report);
            if (outcome.score != null) {
                nodeScores.add(outcome.score);
            }
        }

        if (!failures.isEmpty()) {
            LOG.warn("{} of {} partition(s) failed: {}", failures.size(), partitions.size(),
                    failures.stream().map(PartitionFailure::getKey).toList());
        }
        return pipeline.rollUp(nodeScores, reports, failures);
    }

    private PartitionOutcome runPartition(EntityKey key, List<Supplier<MetricSeries>> loaders) {
        try {
            int seriesCount = 0;
            int windowCount = 0;
            int emptyWindows = 0;
            List<AnomalyResult> results = new ArrayList<>();

            for (Supplier<MetricSeries> loader : loaders) {
                MetricSeries series = loader.get();
                if (!key.equals(series.getNodeKey())) {
                    throw new ValidationException("Series " + series.getSeriesKey()
                            + " does not belong to partition " + key);
                }
                seriesCount++;

                List<TimeWindow> windows;
                try {
                    windows = extractor.extract(series);
                } catch (InsufficientDataException e) {
                    LOG.debug("{} yields no windows: {}", series.getSeriesKey(), e.getMessage());
                    continue;
                }

                for (TimeWindow window : windows) {
                    windowCount++;
                    if (window.isEmpty()) {
                        emptyWindows++;
                        continue;
                    }
                    List<AnomalyResult> detected = engine.detect(series.slice(window));
                    for (AnomalyResult result : detected) {
                        if (!result.matches(series)) {
                            throw new ValidationException("Engine '" + engine.getEngineName()
                                    + "' returned result for " + result.getSeriesKey()
                                    + " while scoring " + series.getSeriesKey());
                        }
                    }
                    results.addAll(detected);
                }
            }

            PartitionReport report = new PartitionReport(key, seriesCount, windowCount, emptyWindows,
                    results.size());
            if (results.isEmpty()) {
                LOG.info("Partition {} produced no anomaly results ({})", key, report);
                return new PartitionOutcome(report, null, null);
            }
            AggregatedScore score = pipeline.aggregateNode(results);
            LOG.debug("Partition {} scored {} from {} result(s)", key, score.getAggregateScore(), results.size());
            return new PartitionOutcome(report, score, null);
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError fatal && !(t instanceof StackOverflowError)) {
                throw fatal;
            }
            LOG.warn("Partition {} failed – continuing with other partitions: {}", key, t.toString());
            return new PartitionOutcome(null, null, new PartitionFailure(key, t));
        }
    }

    /** Result of one partition task: a report and optional score, or a failure. */
    private static final class PartitionOutcome {
        private final PartitionReport report;
        private final AggregatedScore score;
        private final PartitionFailure failure;

        PartitionOutcome(PartitionReport report, AggregatedScore score, PartitionFailure failure) {
            this.report = report;
            this.score = score;
            this.failure = failure;
        }
    }
}
