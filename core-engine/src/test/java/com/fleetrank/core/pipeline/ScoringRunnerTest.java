package com.fleetrank.core.pipeline;

import com.fleetrank.core.detection.DetectionEngine;
import com.fleetrank.core.error.ValidationException;
import com.fleetrank.core.model.AnomalyLabel;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.EntityKey;
import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import com.fleetrank.core.source.MetricSeriesSource;
import com.fleetrank.core.window.PointWindowExtractor;
import com.fleetrank.core.window.TimeWindowExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.fleetrank.core.TestSeries.T0;
import static com.fleetrank.core.TestSeries.series;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ScoringRunner}.
 */
class ScoringRunnerTest {

    private static final MetricSeries N1_CPU = series("t1", "c1", "n1", "cpu",
            0.1, 0.2, 0.3, 0.4, 0.5, 0.1, 0.1, 0.1, 0.1, 0.8);
    private static final MetricSeries N1_MEM = series("t1", "c1", "n1", "mem",
            0.1, 0.1, 0.1, 0.1, 0.1, 0.2, 0.2, 0.2, 0.2, 0.2);
    private static final MetricSeries N2_CPU = series("t1", "c1", "n2", "cpu",
            0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.3, 0.3);
    private static final MetricSeries BAD_CPU = series("t1", "c1", "bad", "cpu",
            0.9, 0.9, 0.9, 0.9, 0.9, 0.9, 0.9, 0.9, 0.9, 0.9);

    private final AggregationPipeline pipeline = new AggregationPipeline(RollupConfig.defaults());

    @Test
    @DisplayName("Should score every node and roll up to cluster and tenant")
    void shouldScoreAllNodes() {
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(List.of(N1_CPU, N1_MEM, N2_CPU));

        assertThat(result.getNodeScores()).extracting(s -> s.getEntityId() + "=" + s.getAggregateScore())
                .containsExactly("n1=0.8", "n2=0.3");
        assertThat(result.getNodeScores().get(0).getNumInputs()).isEqualTo(4);
        assertThat(result.getClusterScores()).singleElement()
                .satisfies(s -> assertThat(s.getAggregateScore()).isEqualTo(0.8));
        assertThat(result.getTenantScores()).hasSize(1);
        assertThat(result.getPartitions()).extracting(PartitionReport::getWindowCount).containsExactly(4, 2);
        assertThat(result.isComplete()).isTrue();
    }

    @Test
    @DisplayName("Should isolate a failing node and keep scoring the others")
    void shouldIsolateFailingPartition() {
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(List.of(N1_CPU, BAD_CPU, N2_CPU));

        assertThat(result.isComplete()).isFalse();
        assertThat(result.getFailedKeys()).containsExactly(EntityKey.node("t1", "c1", "bad"));
        assertThat(result.getFailures().get(0).getErrorType()).isEqualTo("IllegalStateException");
        assertThat(result.getFailures().get(0).getReason()).contains("engine failure");
        assertThat(result.getNodeScores()).extracting(s -> s.getEntityId()).containsExactly("n1", "n2");
        // the failed node's 0.9 must not leak into the cluster score
        assertThat(result.getClusterScores().get(0).getAggregateScore()).isEqualTo(0.8);
        assertThat(result.getClusterScores().get(0).getNumInputs()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should isolate an error thrown by the engine, not only exceptions")
    void shouldIsolateEngineErrors() {
        MetricSeries deep = series("t1", "c1", "deep", "cpu", 0.9, 0.9, 0.9, 0.9, 0.9);
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(List.of(N1_CPU, deep, N2_CPU));

        assertThat(result.getFailedKeys()).containsExactly(EntityKey.node("t1", "c1", "deep"));
        assertThat(result.getFailures().get(0).getErrorType()).isEqualTo("StackOverflowError");
        assertThat(result.getNodeScores()).extracting(s -> s.getEntityId()).containsExactly("n1", "n2");
        assertThat(result.getClusterScores().get(0).getAggregateScore()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("Should report a series shorter than the window without failing")
    void shouldReportShortSeries() {
        MetricSeries shortSeries = series("t1", "c1", "n3", "cpu", 0.9, 0.9);
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(List.of(N2_CPU, shortSeries));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getNodeScores()).extracting(s -> s.getEntityId()).containsExactly("n2");
        assertThat(result.getPartitions())
                .contains(new PartitionReport(EntityKey.node("t1", "c1", "n3"), 1, 0, 0, 0));
    }

    @Test
    @DisplayName("Should skip and count empty time windows")
    void shouldCountEmptyTimeWindows() {
        MetricSeries sparse = MetricSeries.builder()
                .tenantId("t1").clusterId("c1").nodeId("n1").metricName("cpu")
                .sample(T0, 0.2)
                .sample(T0.plus(Duration.ofMinutes(25)), 0.6)
                .build();
        ScoringRunner runner = new ScoringRunner(TimeWindowExtractor.tumbling(Duration.ofMinutes(10)),
                new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(List.of(sparse));

        assertThat(result.getPartitions()).containsExactly(
                new PartitionReport(EntityKey.node("t1", "c1", "n1"), 1, 3, 1, 2));
        assertThat(result.getNodeScores().get(0).getAggregateScore()).isEqualTo(0.6);
    }

    @Test
    @DisplayName("Should fail a partition whose engine returns results for another series")
    void shouldRejectMismatchedResults() {
        DetectionEngine wrongKeys = new DetectionEngine() {
            @Override
            public List<AnomalyResult> detect(MetricSeries series) {
                return List.of(AnomalyResult.forSeries(series)
                        .nodeId("someone-else")
                        .anomalyScore(0.1)
                        .anomalyLabel(AnomalyLabel.NORMAL)
                        .build());
            }

            @Override
            public String getEngineName() {
                return "wrong-keys";
            }
        };
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), wrongKeys, pipeline);

        PipelineResult result = runner.score(List.of(N2_CPU));

        assertThat(result.getFailures()).singleElement()
                .satisfies(f -> assertThat(f.getCause()).isInstanceOf(ValidationException.class));
        assertThat(result.getNodeScores()).isEmpty();
    }

    @Test
    @DisplayName("Should turn a storage miss into a partition failure")
    void shouldIsolateSourceFailures() {
        MetricSeriesSource source = (tenant, cluster, node, metric, from, to) -> {
            if (node.equals("n2")) {
                return N2_CPU;
            }
            throw new NoSuchElementException("No data found for " + node);
        };
        ScoringRunner runner = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline);

        PipelineResult result = runner.score(source,
                List.of(new SeriesKey("t1", "c1", "n2", "cpu"), new SeriesKey("t1", "c1", "gone", "cpu")),
                T0, T0.plus(Duration.ofHours(1)));

        assertThat(result.getFailedKeys()).containsExactly(EntityKey.node("t1", "c1", "gone"));
        assertThat(result.getFailures().get(0).getErrorType()).isEqualTo("NoSuchElementException");
        assertThat(result.getNodeScores()).extracting(s -> s.getEntityId()).containsExactly("n2");
    }

    @Test
    @DisplayName("Should produce the same result on a thread pool as on the calling thread")
    void shouldMatchSequentialResultWhenConcurrent() {
        List<MetricSeries> all = List.of(N1_CPU, N1_MEM, N2_CPU, BAD_CPU,
                series("t2", "c5", "n7", "cpu", 0.4, 0.4, 0.4, 0.4, 0.7));
        PipelineResult sequential = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(),
                pipeline).score(all);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        PipelineResult concurrent;
        try {
            concurrent = new ScoringRunner(PointWindowExtractor.tumbling(5), new MaxValueEngine(), pipeline,
                    executor).score(all);
        } finally {
            executor.shutdownNow();
        }

        assertThat(concurrent.getNodeScores()).isEqualTo(sequential.getNodeScores());
        assertThat(concurrent.getClusterScores()).isEqualTo(sequential.getClusterScores());
        assertThat(concurrent.getTenantScores()).isEqualTo(sequential.getTenantScores());
        assertThat(concurrent.getFailedKeys()).isEqualTo(sequential.getFailedKeys());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Scores a window with its largest value; fails for nodes {@code bad}
     * and {@code deep}.
     */
    private static final class MaxValueEngine implements DetectionEngine {

        @Override
        public List<AnomalyResult> detect(MetricSeries series) {
            if (series.getNodeId().equals("bad")) {
                throw new IllegalStateException("engine failure on " + series.getSeriesKey());
            }
            if (series.getNodeId().equals("deep")) {
                throw new StackOverflowError("recursion in " + series.getSeriesKey());
            }
            double max = Arrays.stream(series.getValues()).max().orElse(0);
            return List.of(AnomalyResult.forSeries(series)
                    .anomalyScore(max)
                    .anomalyLabel(max >= 0.5 ? AnomalyLabel.SPIKE : AnomalyLabel.NORMAL)
                    .engineName(getEngineName())
                    .build());
        }

        @Override
        public String getEngineName() {
            return "max-value";
        }
    }
}
