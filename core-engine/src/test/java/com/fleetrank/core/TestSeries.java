package com.fleetrank.core;

import com.fleetrank.core.model.AnomalyLabel;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.MetricSeries;

import java.time.Instant;
import java.util.Arrays;

/**
 * Fixtures shared by the core-engine tests.
 */
public final class TestSeries {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private TestSeries() {
        // utility class, not instantiable
    }

    /**
     * Series with one sample a minute starting at {@link #T0}.
     */
    public static MetricSeries series(String tenant, String cluster, String node, String metric, double... values) {
        MetricSeries.Builder builder = MetricSeries.builder()
                .tenantId(tenant)
                .clusterId(cluster)
                .nodeId(node)
                .metricName(metric);
        for (int i = 0; i < values.length; i++) {
            builder.sample(T0.plusSeconds(60L * i), values[i]);
        }
        return builder.build();
    }

    /**
     * Series of {@code n} constant samples.
     */
    public static MetricSeries flat(String node, String metric, int n) {
        double[] values = new double[n];
        Arrays.fill(values, 50.0);
        return series("t1", "c1", node, metric, values);
    }

    public static AnomalyResult result(String tenant, String cluster, String node, String metric, double score) {
        return AnomalyResult.builder()
                .tenantId(tenant)
                .clusterId(cluster)
                .nodeId(node)
                .metricName(metric)
                .windowStart(T0)
                .windowEnd(T0.plusSeconds(600))
                .anomalyScore(score)
                .anomalyLabel(score >= 0.5 ? AnomalyLabel.SPIKE : AnomalyLabel.NORMAL)
                .build();
    }

    public static AnomalyResult result(String node, String metric, double score) {
        return result("t1", "c1", node, metric, score);
    }
}
