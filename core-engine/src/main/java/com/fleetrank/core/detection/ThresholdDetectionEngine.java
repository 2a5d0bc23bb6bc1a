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
 * Threshold engine.
 *
 * <p>
 * Scores a window by the share of its samples strictly above the configured
 * threshold. A value equal to the threshold does not count. The magnitude is
 * the largest relative exceedance, capped at 1.
 * </p>
 *
 * @since 1.0.0
 */
public class ThresholdDetectionEngine implements DetectionEngine {

    public static final String NAME = "threshold";

    private static final Logger LOG = LoggerFactory.getLogger(ThresholdDetectionEngine.class);

    private final double threshold;
    private final AnomalyClassifier classifier;

    /**
     * @param settings detection settings
     * @throws NullPointerException if {@code settings} is {@code null}
     * @throws ConfigException      if no finite threshold is configured
     */
    public ThresholdDetectionEngine(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        Double configured = settings.getThreshold();
        if (configured == null || !Double.isFinite(configured)) {
            throw new ConfigException("threshold must be a finite number for engine '" + NAME + "', got: "
                    + configured);
        }
        this.threshold = configured;
        this.classifier = new AnomalyClassifier();
    }

    @Override
    public List<AnomalyResult> detect(MetricSeries series) {
        Objects.requireNonNull(series, "series must not be null");
        double[] values = series.getValues();

        int above = 0;
        double peak = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > threshold) {
                above++;
            }
            peak = Math.max(peak, v);
        }
        double score = (double) above / values.length;

        Double magnitude = null;
        if (above > 0) {
            magnitude = threshold != 0 ? Math.min(1.0, (peak - threshold) / Math.abs(threshold)) : 1.0;
            LOG.debug("{} window [{} – {}]: {}/{} sample(s) above threshold={} (peak={})",
                    series.getSeriesKey(), series.getStartTime(), series.getEndTime(),
                    above, values.length, threshold, peak);
        }

        AnomalyClassifier.Classification classification = classifier.classify(values, score);
        String explanation = classification.getLabel() == AnomalyLabel.NORMAL
                ? classification.getExplanation()
                : String.format("%s; %d of %d sample(s) above %.2f",
                        classification.getExplanation(), above, values.length, threshold);

        return List.of(AnomalyResult.forSeries(series)
                .anomalyScore(score)
                .anomalyLabel(classification.getLabel())
                .magnitude(magnitude)
                .explanation(explanation)
                .engineName(NAME)
                .build());
    }

    @Override
    public String getEngineName() {
        return NAME;
    }

    public double getThreshold() {
        return threshold;
    }
}
