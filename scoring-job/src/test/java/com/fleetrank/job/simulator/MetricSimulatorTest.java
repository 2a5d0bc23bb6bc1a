package com.fleetrank.job.simulator;

import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricSimulator}.
 */
class MetricSimulatorTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final SeriesKey CPU = new SeriesKey("t1", "c1", "n1", "cpu_usage");

    @Test
    @DisplayName("Should produce identical series for the same seed")
    void shouldBeReproducible() {
        SimulatorConfig config = SimulatorConfig.defaults().toBuilder()
                .injectSpikes(true).injectTrend(true).injectSeasonal(true)
                .build();

        MetricSeries first = new MetricSimulator(7).generate(CPU, 200, START, config);
        MetricSeries second = new MetricSimulator(7).generate(CPU, 200, START, config);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should space samples by the sampling interval")
    void shouldSpaceSamples() {
        SimulatorConfig config = SimulatorConfig.builder().samplingInterval(Duration.ofSeconds(30)).build();

        MetricSeries series = new MetricSimulator(1).generate(CPU, 5, START, config);

        assertThat(series.size()).isEqualTo(5);
        assertThat(series.getStartTime()).isEqualTo(START);
        assertThat(series.getEndTime()).isEqualTo(START.plusSeconds(120));
        assertThat(series.getMetadata()).containsEntry("source", "simulator");
    }

    @Test
    @DisplayName("Should clip usage metrics to [0, 100]")
    void shouldClipPercentages() {
        SimulatorConfig config = SimulatorConfig.builder().baselineMean(95).baselineStd(30).build();

        double[] values = new MetricSimulator(3).generate(CPU, 500, START, config).getValues();

        assertThat(Arrays.stream(values).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
        assertThat(Arrays.stream(values).max().orElseThrow()).isLessThanOrEqualTo(100.0);
    }

    @Test
    @DisplayName("Should clip other metrics at zero only")
    void shouldClipOtherMetricsAtZero() {
        SimulatorConfig config = SimulatorConfig.builder().baselineMean(120).baselineStd(40).build();

        double[] values = new MetricSimulator(3)
                .generate(new SeriesKey("t1", "c1", "n1", "latency_ms"), 500, START, config).getValues();

        assertThat(Arrays.stream(values).min().orElseThrow()).isGreaterThanOrEqualTo(0.0);
        assertThat(Arrays.stream(values).max().orElseThrow()).isGreaterThan(100.0);
    }

    @Test
    @DisplayName("Should multiply spiked samples by the spike magnitude")
    void shouldInjectSpikes() {
        SimulatorConfig config = SimulatorConfig.builder()
                .baselineMean(50).baselineStd(0).noiseLevel(0)
                .injectSpikes(true).spikeProbability(1.0).spikeMagnitude(3.0)
                .build();

        double[] values = new MetricSimulator(5)
                .generate(new SeriesKey("t1", "c1", "n1", "latency_ms"), 20, START, config).getValues();

        assertThat(Arrays.stream(values).min().orElseThrow()).isGreaterThanOrEqualTo(150.0);
    }

    @Test
    @DisplayName("Should generate every metric for every node of a cluster")
    void shouldGenerateCluster() {
        List<MetricSeries> series = new MetricSimulator(42)
                .generateCluster("t1", "c1", 4, List.of("cpu_usage", "memory_usage"), 50, START, 0.5);

        assertThat(series).hasSize(8);
        assertThat(series).extracting(MetricSeries::getNodeId).containsExactly(
                "node-000", "node-000", "node-001", "node-001",
                "node-002", "node-002", "node-003", "node-003");
        assertThat(series).allSatisfy(s -> assertThat(s.size()).isEqualTo(50));
    }

    @Test
    @DisplayName("Should reject a series with no points")
    void shouldRejectZeroPoints() {
        assertThatThrownBy(() -> new MetricSimulator(1).generate(CPU, 0, START, SimulatorConfig.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("numPoints");
    }
}
