package com.fleetrank.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig.Builder}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with defaults")
    void shouldBuildWithDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getParallelism()).isEqualTo(4);
        assertThat(config.getLookback()).isEqualTo(Duration.ofHours(6));
        assertThat(config.getTopN()).isZero();
        assertThat(config.getReportPath()).isEmpty();
        assertThat(config.getMetrics()).containsExactly("cpu_usage", "memory_usage");
        assertThat(config.getSeed()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Should trim metric names and drop blanks")
    void shouldTrimMetrics() {
        JobConfig config = new JobConfig.Builder()
                .metrics(List.of(" cpu_usage", "", "disk_io "))
                .build();

        assertThat(config.getMetrics()).containsExactly("cpu_usage", "disk_io");
    }

    @Test
    @DisplayName("Should reject parallelism below one")
    void shouldRejectZeroParallelism() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism");
    }

    @Test
    @DisplayName("Should reject a non-positive lookback")
    void shouldRejectZeroLookback() {
        assertThatThrownBy(() -> new JobConfig.Builder().lookback(Duration.ZERO).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookback");
    }

    @Test
    @DisplayName("Should reject a negative topN")
    void shouldRejectNegativeTopN() {
        assertThatThrownBy(() -> new JobConfig.Builder().topN(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("topN");
    }

    @Test
    @DisplayName("Should reject an anomalous ratio outside [0, 1]")
    void shouldRejectRatioOutOfRange() {
        assertThatThrownBy(() -> new JobConfig.Builder().anomalousNodeRatio(1.5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("anomalousNodeRatio");
    }

    @Test
    @DisplayName("Should reject an empty fleet")
    void shouldRejectEmptyFleet() {
        assertThatThrownBy(() -> new JobConfig.Builder().nodesPerCluster(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nodesPerCluster");
    }

    @Test
    @DisplayName("Should require at least one metric")
    void shouldRequireMetrics() {
        assertThatThrownBy(() -> new JobConfig.Builder().metrics(List.of(" ")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one metric");
    }
}
