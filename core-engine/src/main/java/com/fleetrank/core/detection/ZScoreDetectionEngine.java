package com.fleetrank.core.detection;

import com.fleetrank.core.config.DetectionSettings;
import com.fleetrank.core.error.ConfigException;
import com.fleetrank.core.model.AnomalyLabel;
import com.fleetrank.core.model.AnomalyResult;
import com.fleetrank.core.model.MetricSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Statistical outlier engine based on the window's own mean and standard
 * deviation.
 *
 * <p>
 * The window's most extreme value is measured in standard deviations from
 * the window mean. A deviation of {@code deviationFactor × σ} scores 0.5 and
 * twice that scores 1.0; the score grows linearly in between and is capped
 * at 1.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * Windows with fewer than {@code minSamples} values score 0 and are labelled
 * normal, because a standard deviation over so few points is meaningless.
 * A window whose values are all identical also scores 0.
 * </p>
 *
 * @since 1.0.0
 */
public class ZScoreDetectionEngine implements DetectionEngine {

    public static final String NAME = "zscore";

    private static final Logger LOG = LoggerFactory.getLogger(ZScoreDetectionEngine.class);

    private final double deviationFactor;
    private final int minSamples;
    private final AnomalyClassifier classifier;

    /**
     * @param settings detection settings
     * @throws NullPointerException if {@code settings} is {@code null}
     * @throws ConfigException      if {@code deviationFactor} or
     *                              {@code minSamples} are invalid
     */
    public ZScoreDetectionEngine(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.deviationFactor = settings.getDeviationFactor();
        this.minSamples = settings.getMinSamples();
        this.classifier = new AnomalyClassifier();

        if (!(deviationFactor > 0)) {
            throw new ConfigException("deviationFactor must be > 0 for engine '" + NAME + "', got: "
                    + deviationFactor);
        }
        if (minSamples < 2) {
            throw new ConfigException("minSamples must be >= 2 for engine '" + NAME + "', got: " + minSamples);
        }
    }

    @Override
    public List<AnomalyResult> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.getValues();

        if (values.length < minSamples) {
            LOG.trace("Window of {} has {} sample(s) < minSamples={} – scoring 0",
                    series.getSeriesKey(), values.length, minSamples);
            return List.of(AnomalyResult.forSeries(series)
                    .anomalyScore(0.0)
                    .anomalyLabel(AnomalyLabel.NORMAL)
                    .engineName(NAME)
                    .build());
        }

        double mean = AnomalyClassifier.mean(values);
        double stddev = populationStdDev(values, mean);
        double maxDeviation = 0;
        for (double v : values) {
            maxDeviation = Math.max(maxDeviation, Math.abs(v - mean));
        }
        double z = stddev == 0 ? 0 : maxDeviation / stddev;
        double score = Math.min(1.0, z / (2 * deviationFactor));

        AnomalyClassifier.Classification classification = classifier.classify(values, score);
        Double magnitude = mean != 0 ? Math.min(1.0, maxDeviation / Math.abs(mean)) : null;

        if (classification.getLabel() != AnomalyLabel.NORMAL) {
            LOG.debug("{} window [{} – {}] flagged: z={} score={} label={}", series.getSeriesKey(),
                    series.getStartTime(), series.getEndTime(), z, score, classification.getLabel().value());
        }

        return List.of(AnomalyResult.forSeries(series)
                .anomalyScore(score)
                .anomalyLabel(classification.getLabel())
                .magnitude(magnitude)
                .explanation(classification.getExplanation())
                .engineName(NAME)
                .build());
    }

    @Override
    public String getEngineName() {
        return NAME;
    }

    private static double populationStdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }
}
