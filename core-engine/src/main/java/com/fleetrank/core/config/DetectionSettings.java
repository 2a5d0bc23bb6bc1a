package com.fleetrank.core.config;

import com.fleetrank.core.error.ConfigException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Settings for the detection engine the scoring run uses.
 *
 * <p>
 * Built-in engines:
 * </p>
 * <ul>
 * <li>{@code zscore}: largest z-score within the window</li>
 * <li>{@code threshold}: share of samples above a static threshold</li>
 * </ul>
 *
 * <p>
 * Other names are accepted here and resolved against the
 * {@link com.fleetrank.core.detection.DetectionEngineRegistry} the caller
 * supplies.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Registry name of the engine. */
    private String engine = "zscore";

    // --- Threshold fields ---
    /** Value above which a sample counts as exceeding. */
    private Double threshold;

    // --- Z-score fields ---
    /** Number of standard deviations that maps to a score of 0.5. */
    private double deviationFactor = 2.0;

    /** Windows with fewer samples score 0. */
    private int minSamples = 3;

    /**
     * Validate the fields the named engine needs.
     *
     * @throws ConfigException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (engine == null || engine.isBlank()) {
            errors.add("Detection 'engine' is required");
        } else {
            switch (engine) {
                case "zscore" -> {
                    if (!(deviationFactor > 0)) {
                        errors.add("zscore engine requires 'deviationFactor' > 0");
                    }
                    if (minSamples < 2) {
                        errors.add("zscore engine requires 'minSamples' >= 2");
                    }
                }
                case "threshold" -> {
                    if (threshold == null || !Double.isFinite(threshold)) {
                        errors.add("threshold engine requires a finite 'threshold'");
                    }
                }
                default -> {
                    // resolved against the caller's registry
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new ConfigException("Invalid DetectionSettings: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getEngine() {
        return engine;
    }

    /**
     * Set the engine name, normalised to lowercase.
     *
     * @param engine engine name
     */
    public void setEngine(String engine) {
        this.engine = engine != null ? engine.trim().toLowerCase(Locale.ROOT) : null;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public double getDeviationFactor() {
        return deviationFactor;
    }

    public void setDeviationFactor(double deviationFactor) {
        this.deviationFactor = deviationFactor;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectionSettings that))
            return false;
        return Double.compare(deviationFactor, that.deviationFactor) == 0
                && minSamples == that.minSamples
                && Objects.equals(engine, that.engine)
                && Objects.equals(threshold, that.threshold);
    }

    @Override
    public int hashCode() {
        return Objects.hash(engine, threshold, deviationFactor, minSamples);
    }

    @Override
    public String toString() {
        return "DetectionSettings{" +
                "engine='" + engine + '\'' +
                ", threshold=" + threshold +
                ", deviationFactor=" + deviationFactor +
                ", minSamples=" + minSamples +
                '}';
    }
}
