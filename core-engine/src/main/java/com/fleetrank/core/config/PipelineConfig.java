package com.fleetrank.core.config;

import com.fleetrank.core.aggregation.AggregationStrategy;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.error.FleetRankException;
import com.fleetrank.core.model.RollupLevel;
import com.fleetrank.core.pipeline.RollupConfig;
import com.fleetrank.core.window.PointWindowExtractor;
import com.fleetrank.core.window.TimeWindowExtractor;
import com.fleetrank.core.window.WindowExtractor;

import java.io.Serializable;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Top-level POJO for the pipeline YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * windowing:
 *   mode: points            # or: time
 *   windowSizePoints: 100
 *   stridePoints: 50
 *   windowDuration: PT10M   # time mode only
 *   strideDuration: PT5M    # time mode only
 * aggregation:
 *   node:
 *     strategy: weighted
 *     weights: { cpu: 2, mem: 1 }
 *   cluster:
 *     strategy: p95
 *   tenant:
 *     strategy: max
 * ranking:
 *   topN: 10
 * detection:
 *   engine: zscore
 *   deviationFactor: 2.0
 * </pre>
 *
 * <p>
 * Every section is optional and falls back to its defaults. Call
 * {@link #validate()} after loading; {@link PipelineConfigLoader} does this
 * for you.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private WindowingSettings windowing = new WindowingSettings();
    private AggregationSettings aggregation = new AggregationSettings();
    private RankingSettings ranking = new RankingSettings();
    private DetectionSettings detection = new DetectionSettings();

    /**
     * Validate every section. Collects all errors and throws a single
     * exception listing them.
     *
     * @throws ConfigException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        collect(errors, windowing::toExtractor);
        collect(errors, aggregation::toRollupConfig);
        if (ranking.getTopN() <= 0) {
            errors.add("ranking.topN must be > 0, got: " + ranking.getTopN());
        }
        collect(errors, () -> {
            detection.validate();
            return null;
        });

        if (!errors.isEmpty()) {
            throw new ConfigException(
                    "Pipeline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static void collect(List<String> errors, Supplier<?> check) {
        try {
            check.get();
        } catch (FleetRankException e) {
            errors.add(e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public WindowingSettings getWindowing() {
        return windowing;
    }

    public void setWindowing(WindowingSettings windowing) {
        this.windowing = windowing != null ? windowing : new WindowingSettings();
    }

    public AggregationSettings getAggregation() {
        return aggregation;
    }

    public void setAggregation(AggregationSettings aggregation) {
        this.aggregation = aggregation != null ? aggregation : new AggregationSettings();
    }

    public RankingSettings getRanking() {
        return ranking;
    }

    public void setRanking(RankingSettings ranking) {
        this.ranking = ranking != null ? ranking : new RankingSettings();
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection != null ? detection : new DetectionSettings();
    }

    @Override
    public String toString() {
        return "PipelineConfig{windowing=" + windowing
                + ", aggregation=" + aggregation
                + ", ranking=" + ranking
                + ", detection=" + detection + '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /**
     * Window policy: point-count or duration based.
     */
    public static class WindowingSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private String mode = "points";
        private int windowSizePoints = 100;
        private int stridePoints = 50;
        private String windowDuration;
        private String strideDuration;

        /**
         * Build the extractor these settings describe.
         *
         * @return a point or time window extractor
         * @throws ConfigException if the mode is unknown or a size, stride or
         *                         duration is invalid
         */
        public WindowExtractor toExtractor() {
            String m = mode == null ? "" : mode.trim().toLowerCase(Locale.ROOT);
            switch (m) {
                case "points":
                    return new PointWindowExtractor(windowSizePoints, stridePoints);
                case "time":
                    Duration window = parseDuration("windowDuration", windowDuration);
                    Duration stride = strideDuration == null ? window : parseDuration("strideDuration", strideDuration);
                    return new TimeWindowExtractor(window, stride);
                default:
                    throw new ConfigException("windowing.mode must be 'points' or 'time', got: '" + mode + "'");
            }
        }

        private static Duration parseDuration(String field, String value) {
            if (value == null || value.isBlank()) {
                throw new ConfigException("windowing." + field + " is required in time mode");
            }
            try {
                return Duration.parse(value.trim());
            } catch (DateTimeParseException e) {
                throw new ConfigException("windowing." + field + " is not an ISO-8601 duration: '" + value + "'", e);
            }
        }

        public String getMode() {
            return mode;
        }

        public void setMode(String mode) {
            this.mode = mode;
        }

        public int getWindowSizePoints() {
            return windowSizePoints;
        }

        public void setWindowSizePoints(int windowSizePoints) {
            this.windowSizePoints = windowSizePoints;
        }

        public int getStridePoints() {
            return stridePoints;
        }

        public void setStridePoints(int stridePoints) {
            this.stridePoints = stridePoints;
        }

        public String getWindowDuration() {
            return windowDuration;
        }

        public void setWindowDuration(String windowDuration) {
            this.windowDuration = windowDuration;
        }

        public String getStrideDuration() {
            return strideDuration;
        }

        public void setStrideDuration(String strideDuration) {
            this.strideDuration = strideDuration;
        }

        @Override
        public String toString() {
            return "WindowingSettings{mode='" + mode + '\''
                    + ", windowSizePoints=" + windowSizePoints
                    + ", stridePoints=" + stridePoints
                    + ", windowDuration='" + windowDuration + '\''
                    + ", strideDuration='" + strideDuration + "'}";
        }
    }

    /**
     * Strategy and weights for each roll-up level.
     */
    public static class AggregationSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private LevelSettings node = new LevelSettings();
        private LevelSettings cluster = new LevelSettings();
        private LevelSettings tenant = new LevelSettings();

        /**
         * Build the roll-up configuration these settings describe.
         *
         * @return per-level aggregators
         * @throws com.fleetrank.core.error.AggregationException if a strategy name is unknown
         * @throws ConfigException if a weight is invalid
         */
        public RollupConfig toRollupConfig() {
            RollupConfig.Builder builder = RollupConfig.builder();
            apply(builder, RollupLevel.NODE, node);
            apply(builder, RollupLevel.CLUSTER, cluster);
            apply(builder, RollupLevel.TENANT, tenant);
            return builder.build();
        }

        private static void apply(RollupConfig.Builder builder, RollupLevel level, LevelSettings settings) {
            String prefix = "aggregation." + level.name().toLowerCase(Locale.ROOT);
            builder.strategy(level, AggregationStrategy.fromName(settings.getStrategy()));
            Map<String, Double> weights = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : settings.getWeights().entrySet()) {
                if (!(entry.getValue() instanceof Number number)) {
                    throw new ConfigException(prefix + ".weights['" + entry.getKey()
                            + "'] must be a number, got: " + entry.getValue());
                }
                weights.put(entry.getKey(), number.doubleValue());
            }
            builder.weights(level, weights);
        }

        public LevelSettings getNode() {
            return node;
        }

        public void setNode(LevelSettings node) {
            this.node = node != null ? node : new LevelSettings();
        }

        public LevelSettings getCluster() {
            return cluster;
        }

        public void setCluster(LevelSettings cluster) {
            this.cluster = cluster != null ? cluster : new LevelSettings();
        }

        public LevelSettings getTenant() {
            return tenant;
        }

        public void setTenant(LevelSettings tenant) {
            this.tenant = tenant != null ? tenant : new LevelSettings();
        }

        @Override
        public String toString() {
            return "AggregationSettings{node=" + node + ", cluster=" + cluster + ", tenant=" + tenant + '}';
        }
    }

    /**
     * One level's strategy name and, for {@code weighted}, the weight per
     * child id.
     */
    public static class LevelSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private String strategy = "max";
        private Map<String, Object> weights = new LinkedHashMap<>();

        public String getStrategy() {
            return strategy;
        }

        public void setStrategy(String strategy) {
            this.strategy = strategy;
        }

        public Map<String, Object> getWeights() {
            return weights;
        }

        public void setWeights(Map<String, Object> weights) {
            this.weights = weights != null ? new LinkedHashMap<>(weights) : new LinkedHashMap<>();
        }

        @Override
        public String toString() {
            return "LevelSettings{strategy='" + strategy + "', weights=" + weights + '}';
        }
    }

    /**
     * Ranking output size.
     */
    public static class RankingSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private int topN = 10;

        public int getTopN() {
            return topN;
        }

        public void setTopN(int topN) {
            this.topN = topN;
        }

        @Override
        public String toString() {
            return "RankingSettings{topN=" + topN + '}';
        }
    }
}
