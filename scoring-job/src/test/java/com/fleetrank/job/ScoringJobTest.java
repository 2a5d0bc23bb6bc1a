package com.fleetrank.job;

import com.fleetrank.core.config.PipelineConfig;
import com.fleetrank.core.config.PipelineConfigLoader;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link ScoringJob#run}.
 */
class ScoringJobTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    @DisplayName("Should score a simulated fleet with the bundled pipeline config")
    void shouldScoreSimulatedFleet() {
        ScoringReport report = ScoringJob.run(smallFleet().build(),
                PipelineConfigLoader.fromClasspath(PipelineConfigLoader.DEFAULT_RESOURCE), NOW);

        assertThat(report.isComplete()).isTrue();
        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getEngine()).isEqualTo("zscore");
        assertThat(report.getPartitions()).isEqualTo(6);
        assertThat(report.getFrom()).isEqualTo(NOW.minus(Duration.ofHours(6)));
        assertThat(report.getTo()).isEqualTo(NOW);

        assertThat(report.getTopNodes()).hasSize(6);
        assertThat(report.getTopClusters()).hasSize(2);
        assertThat(report.getTopTenants()).singleElement()
                .satisfies(t -> assertThat(t.getEntityId()).isEqualTo("tenant-00"));
        assertThat(report.getTopNodes()).extracting(ScoringReport.RankedEntity::getRank)
                .containsExactly(1, 2, 3, 4, 5, 6);
        assertThat(report.getTopNodes()).extracting(ScoringReport.RankedEntity::getScore)
                .isSortedAccordingTo((a, b) -> Double.compare(b, a))
                .allSatisfy(s -> assertThat(s).isBetween(0.0, 1.0));
    }

    @Test
    @DisplayName("Should let the job topN override the pipeline ranking size")
    void shouldOverrideTopN() {
        ScoringReport report = ScoringJob.run(smallFleet().topN(2).parallelism(1).build(),
                new PipelineConfig(), NOW);

        assertThat(report.getTopNodes()).hasSize(2);
        assertThat(report.getTopClusters()).hasSize(2);
    }

    @Test
    @DisplayName("Should produce the same ranking for the same seed")
    void shouldBeReproducible() {
        JobConfig config = smallFleet().build();

        ScoringReport first = ScoringJob.run(config, new PipelineConfig(), NOW);
        ScoringReport second = ScoringJob.run(config, new PipelineConfig(), NOW);

        assertThat(first.getTopNodes()).extracting(ScoringReport.RankedEntity::getKey)
                .isEqualTo(second.getTopNodes().stream().map(ScoringReport.RankedEntity::getKey).toList());
        assertThat(first.getTopNodes()).extracting(ScoringReport.RankedEntity::getScore)
                .isEqualTo(second.getTopNodes().stream().map(ScoringReport.RankedEntity::getScore).toList());
    }

    @Test
    @DisplayName("Should report nodes whose series are shorter than one window without failing")
    void shouldHandleSeriesShorterThanWindow() {
        PipelineConfig pipelineConfig = new PipelineConfig();
        pipelineConfig.getWindowing().setWindowSizePoints(500);

        ScoringReport report = ScoringJob.run(smallFleet().build(), pipelineConfig, NOW);

        assertThat(report.isComplete()).isTrue();
        assertThat(report.getPartitions()).isEqualTo(6);
        assertThat(report.getTopNodes()).isEmpty();
        assertThat(report.getTopTenants()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static JobConfig.Builder smallFleet() {
        return new JobConfig.Builder()
                .tenants(1)
                .clustersPerTenant(2)
                .nodesPerCluster(3)
                .pointsPerSeries(120)
                .anomalousNodeRatio(0.34)
                .metrics(List.of("cpu_usage"))
                .parallelism(2);
    }
}
