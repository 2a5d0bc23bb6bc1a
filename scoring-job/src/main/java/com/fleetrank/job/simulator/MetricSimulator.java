package com.fleetrank.job.simulator;

import com.fleetrank.core.model.MetricSeries;
import com.fleetrank.core.model.SeriesKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Generates synthetic infrastructure metrics for local runs and tests.
 *
 * <p>
 * Output is reproducible: two simulators created with the same seed produce
 * the same series for the same sequence of calls.
 * </p>
 *
 * <h3>Value range</h3>
 * <p>
 * Metrics whose name contains {@code usage} or {@code percent} are clipped to
 * [0, 100]; all others are clipped at 0.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricSimulator {

    private static final Logger LOG = LoggerFactory.getLogger(MetricSimulator.class);

    /** Length of the seasonal cycle, in samples. */
    static final int SEASONAL_PERIOD = 100;

    /** Per-sample drift once a trend starts. */
    static final double TREND_SLOPE = 0.05;

    private final Random random;

    public MetricSimulator(long seed) {
        this.random = new Random(seed);
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Generate one series.
     *
     * @param key       hierarchy keys and metric name
     * @param numPoints number of samples, at least 1
     * @param start     timestamp of the first sample
     * @param config    distribution and anomaly settings
     * @return a series with {@code numPoints} samples spaced by the sampling
     *         interval
     */
    public MetricSeries generate(SeriesKey key, int numPoints, Instant start, SimulatorConfig config) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(config, "config must not be null");
        if (numPoints < 1) {
            throw new IllegalArgumentException("numPoints must be >= 1, got: " + numPoints);
        }

        double[] values = new double[numPoints];
        for (int i = 0; i < numPoints; i++) {
            values[i] = config.getBaselineMean() + random.nextGaussian() * config.getBaselineStd();
        }
        if (config.isInjectSpikes()) {
            injectSpikes(values, config);
        }
        if (config.isInjectTrend()) {
            injectTrend(values);
        }
        if (config.isInjectSeasonal()) {
            addSeasonality(values, config);
        }

        boolean percentage = key.getMetricName().contains("usage") || key.getMetricName().contains("percent");
        MetricSeries.Builder builder = MetricSeries.builder()
                .key(key)
                .metadata("source", "simulator");
        for (int i = 0; i < numPoints; i++) {
            double value = values[i] + random.nextGaussian() * config.getNoiseLevel();
            value = percentage ? Math.min(100.0, Math.max(0.0, value)) : Math.max(0.0, value);
            builder.sample(start.plus(config.getSamplingInterval().multipliedBy(i)), value);
        }
        return builder.build();
    }

    /**
     * Generate one series per metric for every node of a cluster. The first
     * {@code floor(nodes * anomalousRatio)} nodes get spikes, and some of them
     * a trend as well; the rest are baseline only.
     *
     * @param tenantId       tenant id
     * @param clusterId      cluster id
     * @param nodes          number of nodes, named {@code node-000} onwards
     * @param metrics        metric names generated for every node
     * @param numPoints      samples per series
     * @param start          timestamp of the first sample
     * @param anomalousRatio share of nodes with injected anomalies, in [0, 1]
     * @return the generated series, ordered by node then metric
     */
    public List<MetricSeries> generateCluster(String tenantId, String clusterId, int nodes, List<String> metrics,
            int numPoints, Instant start, double anomalousRatio) {
        int anomalous = (int) (nodes * anomalousRatio);
        List<MetricSeries> series = new ArrayList<>(nodes * metrics.size());
        for (int i = 0; i < nodes; i++) {
            String nodeId = String.format("node-%03d", i);
            SimulatorConfig config = SimulatorConfig.defaults();
            if (i < anomalous) {
                config = config.toBuilder()
                        .injectSpikes(true)
                        .injectTrend(random.nextBoolean())
                        .build();
            }
            for (String metric : metrics) {
                series.add(generate(new SeriesKey(tenantId, clusterId, nodeId, metric), numPoints, start, config));
            }
        }
        LOG.debug("Generated {} series for {}/{} ({} anomalous node(s))", series.size(), tenantId, clusterId,
                anomalous);
        return series;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void injectSpikes(double[] values, SimulatorConfig config) {
        for (int i = 0; i < values.length; i++) {
            if (random.nextDouble() < config.getSpikeProbability()) {
                int duration = 1 + random.nextInt(3);
                for (int j = i; j < Math.min(i + duration, values.length); j++) {
                    values[j] *= config.getSpikeMagnitude();
                }
            }
        }
    }

    private void injectTrend(double[] values) {
        int startIdx = values.length / 2;
        double slope = random.nextBoolean() ? TREND_SLOPE : -TREND_SLOPE;
        for (int i = startIdx; i < values.length; i++) {
            values[i] += slope * (i - startIdx);
        }
    }

    private static void addSeasonality(double[] values, SimulatorConfig config) {
        double amplitude = config.getBaselineStd() * 2;
        for (int i = 0; i < values.length; i++) {
            values[i] += amplitude * Math.sin(2 * Math.PI * i / SEASONAL_PERIOD);
        }
    }
}
