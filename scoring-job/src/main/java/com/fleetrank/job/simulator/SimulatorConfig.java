package com.fleetrank.job.simulator;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable parameters for {@link MetricSimulator}.
 *
 * <p>
 * A baseline is drawn from a normal distribution with {@code baselineMean}
 * and {@code baselineStd}; spikes, a trend and a seasonal cycle are layered on
 * top when enabled, followed by low-amplitude noise.
 * </p>
 *
 * @since 1.0.0
 */
public final class SimulatorConfig {

    private final double baselineMean;
    private final double baselineStd;
    private final Duration samplingInterval;
    private final double noiseLevel;
    private final boolean injectSpikes;
    private final boolean injectTrend;
    private final boolean injectSeasonal;
    private final double spikeProbability;
    private final double spikeMagnitude;

    private SimulatorConfig(Builder b) {
        this.baselineMean = b.baselineMean;
        this.baselineStd = b.baselineStd;
        this.samplingInterval = b.samplingInterval;
        this.noiseLevel = b.noiseLevel;
        this.injectSpikes = b.injectSpikes;
        this.injectTrend = b.injectTrend;
        this.injectSeasonal = b.injectSeasonal;
        this.spikeProbability = b.spikeProbability;
        this.spikeMagnitude = b.spikeMagnitude;
    }

    /**
     * @return baseline-only configuration: mean 50, std 5, one sample a minute
     */
    public static SimulatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-filled with this configuration
     */
    public Builder toBuilder() {
        return new Builder()
                .baselineMean(baselineMean)
                .baselineStd(baselineStd)
                .samplingInterval(samplingInterval)
                .noiseLevel(noiseLevel)
                .injectSpikes(injectSpikes)
                .injectTrend(injectTrend)
                .injectSeasonal(injectSeasonal)
                .spikeProbability(spikeProbability)
                .spikeMagnitude(spikeMagnitude);
    }

    public double getBaselineMean() {
        return baselineMean;
    }

    public double getBaselineStd() {
        return baselineStd;
    }

    public Duration getSamplingInterval() {
        return samplingInterval;
    }

    public double getNoiseLevel() {
        return noiseLevel;
    }

    public boolean isInjectSpikes() {
        return injectSpikes;
    }

    public boolean isInjectTrend() {
        return injectTrend;
    }

    public boolean isInjectSeasonal() {
        return injectSeasonal;
    }

    public double getSpikeProbability() {
        return spikeProbability;
    }

    public double getSpikeMagnitude() {
        return spikeMagnitude;
    }

    @Override
    public String toString() {
        return "SimulatorConfig{" +
                "baselineMean=" + baselineMean +
                ", baselineStd=" + baselineStd +
                ", samplingInterval=" + samplingInterval +
                ", noiseLevel=" + noiseLevel +
                ", injectSpikes=" + injectSpikes +
                ", injectTrend=" + injectTrend +
                ", injectSeasonal=" + injectSeasonal +
                ", spikeProbability=" + spikeProbability +
                ", spikeMagnitude=" + spikeMagnitude +
                '}';
    }

    /**
     * Fluent builder for {@link SimulatorConfig}.
     */
    public static class Builder {
        private double baselineMean = 50.0;
        private double baselineStd = 5.0;
        private Duration samplingInterval = Duration.ofSeconds(60);
        private double noiseLevel = 0.1;
        private boolean injectSpikes;
        private boolean injectTrend;
        private boolean injectSeasonal;
        private double spikeProbability = 0.01;
        private double spikeMagnitude = 3.0;

        public Builder baselineMean(double v) {
            this.baselineMean = v;
            return this;
        }

        public Builder baselineStd(double v) {
            this.baselineStd = v;
            return this;
        }

        public Builder samplingInterval(Duration v) {
            this.samplingInterval = v;
            return this;
        }

        public Builder noiseLevel(double v) {
            this.noiseLevel = v;
            return this;
        }

        public Builder injectSpikes(boolean v) {
            this.injectSpikes = v;
            return this;
        }

        public Builder injectTrend(boolean v) {
            this.injectTrend = v;
            return this;
        }

        public Builder injectSeasonal(boolean v) {
            this.injectSeasonal = v;
            return this;
        }

        public Builder spikeProbability(double v) {
            this.spikeProbability = v;
            return this;
        }

        public Builder spikeMagnitude(double v) {
            this.spikeMagnitude = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link SimulatorConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public SimulatorConfig build() {
            Objects.requireNonNull(samplingInterval, "samplingInterval required");
            if (samplingInterval.isNegative() || samplingInterval.isZero()) {
                throw new IllegalArgumentException("samplingInterval must be positive, got: " + samplingInterval);
            }
            if (!(baselineStd >= 0) || !(noiseLevel >= 0)) {
                throw new IllegalArgumentException("baselineStd and noiseLevel must be >= 0");
            }
            if (!(spikeProbability >= 0 && spikeProbability <= 1)) {
                throw new IllegalArgumentException("spikeProbability must be in [0, 1], got: " + spikeProbability);
            }
            return new SimulatorConfig(this);
        }
    }
}
