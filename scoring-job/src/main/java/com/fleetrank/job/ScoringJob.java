package com.fleetrank.job;

import com.fleetrank.core.config.PipelineConfig;
import com.fleetrank.core.config.PipelineConfigLoader;
import com.fleetrank.core.detection.DetectionEngine;
import com.fleetrank.core.detection.DetectionEngineRegistry;
import com.fleetrank.core.pipeline.AggregationPipeline;
import com.fleetrank.core.pipeline.PipelineResult;
import com.fleetrank.core.pipeline.ScoringRunner;
import com.fleetrank.job.simulator.MetricSimulator;
import com.fleetrank.job.store.InMemoryMetricStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the Fleet Rank scoring job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   MetricSimulator
 *     → InMemoryMetricStore
 *     → ScoringRunner (window → detect → node score, one task per node)
 *     → AggregationPipeline (cluster and tenant roll-up)
 *     → Top-N per level
 *     → JSON report (file or stdout)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via
 * {@link JobConfig}; windowing, aggregation, ranking and detection come from
 * {@code pipeline.yml} via {@link PipelineConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class ScoringJob {

        private static final Logger LOG = LoggerFactory.getLogger(ScoringJob.class);

        private ScoringJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Fleet Rank scoring with config: {}", config);

                PipelineConfig pipelineConfig = PipelineConfigLoader.load(config.getPipelineConfigPath());

                // 2. Score and report
                Instant now = Instant.now().truncatedTo(ChronoUnit.MINUTES);
                ScoringReport report = run(config, pipelineConfig, now);
                new ReportWriter().write(report, config.getReportPath(), System.out);

                if (!report.isComplete()) {
                        LOG.warn("Scoring finished with {} failed partition(s)", report.getFailures().size());
                }
        }

        // ---------------------------------------------------------------
        // Run assembly (extracted for testability)
        // ---------------------------------------------------------------

        /**
         * Simulate the configured fleet up to {@code now}, score the lookback
         * range and summarise it.
         */
        static ScoringReport run(JobConfig config, PipelineConfig pipelineConfig, Instant now) {
                InMemoryMetricStore store = populate(config, now);

                DetectionEngine engine = DetectionEngineRegistry.withBuiltIns()
                                .create(pipelineConfig.getDetection());
                AggregationPipeline pipeline = new AggregationPipeline(
                                pipelineConfig.getAggregation().toRollupConfig());

                Instant from = now.minus(config.getLookback());
                ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
                PipelineResult result;
                try {
                        ScoringRunner runner = new ScoringRunner(
                                        pipelineConfig.getWindowing().toExtractor(), engine, pipeline, executor);
                        result = runner.score(store, store.keys(), from, now);
                } finally {
                        shutdown(executor);
                }

                int topN = config.getTopN() > 0 ? config.getTopN() : pipelineConfig.getRanking().getTopN();
                LOG.info("Scored {} node(s), {} cluster(s), {} tenant(s); reporting top {}",
                                result.getNodeScores().size(), result.getClusterScores().size(),
                                result.getTenantScores().size(), topN);
                return ScoringReport.from(result, topN, engine.getEngineName(), from, now, Instant.now());
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static InMemoryMetricStore populate(JobConfig config, Instant now) {
                MetricSimulator simulator = new MetricSimulator(config.getSeed());
                Instant start = now.minus(
                                Duration.ofMinutes(config.getPointsPerSeries() - 1L));
                InMemoryMetricStore store = new InMemoryMetricStore();
                for (int t = 0; t < config.getTenants(); t++) {
                        String tenantId = String.format("tenant-%02d", t);
                        for (int c = 0; c < config.getClustersPerTenant(); c++) {
                                String clusterId = String.format("cluster-%02d", c);
                                store.storeAll(simulator.generateCluster(tenantId, clusterId,
                                                config.getNodesPerCluster(), config.getMetrics(),
                                                config.getPointsPerSeries(), start, config.getAnomalousNodeRatio()));
                        }
                }
                LOG.info("Simulated {} series", store.size());
                return store;
        }

        private static void shutdown(ExecutorService executor) {
                executor.shutdown();
                try {
                        if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                                executor.shutdownNow();
                        }
                } catch (InterruptedException e) {
                        executor.shutdownNow();
                        Thread.currentThread().interrupt();
                }
        }
}
