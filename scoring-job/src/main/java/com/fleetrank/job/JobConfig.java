package com.fleetrank.job;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Fleet Rank scoring job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be configured from a container spec, Docker {@code -e} flags
 * or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    // ---------------------------------------------------------------
    // Pipeline
    // ---------------------------------------------------------------
    private final String pipelineConfigPath;
    private final int parallelism;
    private final Duration lookback;

    // ---------------------------------------------------------------
    // Output
    // ---------------------------------------------------------------
    private final int topN;
    private final String reportPath;

    // ---------------------------------------------------------------
    // Simulated fleet
    // ---------------------------------------------------------------
    private final int tenants;
    private final int clustersPerTenant;
    private final int nodesPerCluster;
    private final int pointsPerSeries;
    private final double anomalousNodeRatio;
    private final List<String> metrics;
    private final long seed;

    private JobConfig(Builder b) {
        this.pipelineConfigPath = b.pipelineConfigPath;
        this.parallelism = b.parallelism;
        this.lookback = b.lookback;
        this.topN = b.topN;
        this.reportPath = b.reportPath;
        this.tenants = b.tenants;
        this.clustersPerTenant = b.clustersPerTenant;
        this.nodesPerCluster = b.nodesPerCluster;
        this.pointsPerSeries = b.pointsPerSeries;
        this.anomalousNodeRatio = b.anomalousNodeRatio;
        this.metrics = List.copyOf(b.metrics);
        this.seed = b.seed;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .pipelineConfigPath(env("PIPELINE_CONFIG_PATH", ""))
                    .parallelism(parseIntEnv("SCORING_PARALLELISM", "4"))
                    .lookback(Duration.parse(env("LOOKBACK", "PT6H")))
                    .topN(parseIntEnv("TOP_N", "0"))
                    .reportPath(env("REPORT_PATH", ""))
                    .tenants(parseIntEnv("SIM_TENANTS", "2"))
                    .clustersPerTenant(parseIntEnv("SIM_CLUSTERS_PER_TENANT", "2"))
                    .nodesPerCluster(parseIntEnv("SIM_NODES_PER_CLUSTER", "5"))
                    .pointsPerSeries(parseIntEnv("SIM_POINTS_PER_SERIES", "360"))
                    .anomalousNodeRatio(Double.parseDouble(env("SIM_ANOMALOUS_NODE_RATIO", "0.2")))
                    .metrics(Arrays.asList(env("SIM_METRICS", "cpu_usage,memory_usage").split(",")))
                    .seed(Long.parseLong(env("SIM_SEED", "42")))
                    .build();
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new IllegalStateException(
                    "Failed to parse environment variable: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getPipelineConfigPath() {
        return pipelineConfigPath;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getLookback() {
        return lookback;
    }

    /**
     * @return ranking size, or {@code 0} to use the pipeline configuration's
     *         {@code ranking.topN}
     */
    public int getTopN() {
        return topN;
    }

    /**
     * @return report file path, or an empty string for standard output
     */
    public String getReportPath() {
        return reportPath;
    }

    public int getTenants() {
        return tenants;
    }

    public int getClustersPerTenant() {
        return clustersPerTenant;
    }

    public int getNodesPerCluster() {
        return nodesPerCluster;
    }

    public int getPointsPerSeries() {
        return pointsPerSeries;
    }

    public double getAnomalousNodeRatio() {
        return anomalousNodeRatio;
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public long getSeed() {
        return seed;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, positive lookback, fleet sizes &gt; 0,
     * anomalous ratio in [0, 1], at least one metric name).
     * </p>
     */
    public static class Builder {
        private String pipelineConfigPath = "";
        private int parallelism = 4;
        private Duration lookback = Duration.ofHours(6);
        private int topN = 0;
        private String reportPath = "";
        private int tenants = 2;
        private int clustersPerTenant = 2;
        private int nodesPerCluster = 5;
        private int pointsPerSeries = 360;
        private double anomalousNodeRatio = 0.2;
        private List<String> metrics = List.of("cpu_usage", "memory_usage");
        private long seed = 42L;

        public Builder pipelineConfigPath(String v) {
            this.pipelineConfigPath = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder lookback(Duration v) {
            this.lookback = v;
            return this;
        }

        public Builder topN(int v) {
            this.topN = v;
            return this;
        }

        public Builder reportPath(String v) {
            this.reportPath = v;
            return this;
        }

        public Builder tenants(int v) {
            this.tenants = v;
            return this;
        }

        public Builder clustersPerTenant(int v) {
            this.clustersPerTenant = v;
            return this;
        }

        public Builder nodesPerCluster(int v) {
            this.nodesPerCluster = v;
            return this;
        }

        public Builder pointsPerSeries(int v) {
            this.pointsPerSeries = v;
            return this;
        }

        public Builder anomalousNodeRatio(double v) {
            this.anomalousNodeRatio = v;
            return this;
        }

        public Builder metrics(List<String> v) {
            this.metrics = v;
            return this;
        }

        public Builder seed(long v) {
            this.seed = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(pipelineConfigPath, "pipelineConfigPath required");
            Objects.requireNonNull(reportPath, "reportPath required");
            Objects.requireNonNull(lookback, "lookback required");
            Objects.requireNonNull(metrics, "metrics required");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (lookback.isNegative() || lookback.isZero()) {
                throw new IllegalArgumentException("lookback must be positive, got: " + lookback);
            }
            if (topN < 0) {
                throw new IllegalArgumentException("topN must be >= 0, got: " + topN);
            }
            requirePositive(tenants, "tenants");
            requirePositive(clustersPerTenant, "clustersPerTenant");
            requirePositive(nodesPerCluster, "nodesPerCluster");
            requirePositive(pointsPerSeries, "pointsPerSeries");
            if (!(anomalousNodeRatio >= 0.0 && anomalousNodeRatio <= 1.0)) {
                throw new IllegalArgumentException(
                        "anomalousNodeRatio must be in [0, 1], got: " + anomalousNodeRatio);
            }
            metrics = metrics.stream().map(String::trim).filter(m -> !m.isEmpty()).toList();
            if (metrics.isEmpty()) {
                throw new IllegalArgumentException("metrics must name at least one metric");
            }

            return new JobConfig(this);
        }

        private static void requirePositive(int value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "pipelineConfigPath='" + pipelineConfigPath + '\'' +
                ", parallelism=" + parallelism +
                ", lookback=" + lookback +
                ", topN=" + topN +
                ", reportPath='" + reportPath + '\'' +
                ", tenants=" + tenants +
                ", clustersPerTenant=" + clustersPerTenant +
                ", nodesPerCluster=" + nodesPerCluster +
                ", pointsPerSeries=" + pointsPerSeries +
                ", anomalousNodeRatio=" + anomalousNodeRatio +
                ", metrics=" + metrics +
                ", seed=" + seed +
                '}';
    }
}
