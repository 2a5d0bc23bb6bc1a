package com.fleetrank.core.detection;

import com.fleetrank.core.model.AnomalyLabel;

import java.util.Locale;

/**
 * Labels a scored window as a spike, trend or seasonal break, and renders a
 * one-line explanation.
 *
 * <h3>Rules</h3>
 * <p>
 * Windows scoring below {@value #ANOMALY_SCORE_CUTOFF} are
 * {@link AnomalyLabel#NORMAL}. Above it, the first matching rule wins:
 * </p>
 * <ol>
 * <li>spike: the most extreme value lies more than {@value #SPIKE_Z}
 * sample standard deviations from the mean (at least 3 points)</li>
 * <li>trend: the means of the two halves differ by more than 5% of the
 * first half's mean (at least 4 points)</li>
 * <li>seasonal: the values cross their mean at least 3 times (at least 6
 * points)</li>
 * <li>otherwise spike</li>
 * </ol>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyClassifier {

    static final double ANOMALY_SCORE_CUTOFF = 0.5;
    static final double SPIKE_Z = 2.0;
    static final double TREND_RATIO = 0.05;
    static final int MIN_MEAN_CROSSINGS = 3;

    /**
     * Classify a window.
     *
     * @param values the window's values; must not be empty
     * @param score  the anomaly score the engine assigned
     * @return classification with label, statistics and explanation
     */
    public Classification classify(double[] values, double score) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot classify an empty window");
        }
        double baseline = mean(values);
        double observed = values[0];
        for (double v : values) {
            if (Math.abs(v - baseline) > Math.abs(observed - baseline)) {
                observed = v;
            }
        }
        double deviationPercent = baseline != 0 ? (observed - baseline) / baseline * 100.0 : 0.0;

        AnomalyLabel label = AnomalyLabel.NORMAL;
        if (score >= ANOMALY_SCORE_CUTOFF) {
            if (isSpike(values, baseline, observed)) {
                label = AnomalyLabel.SPIKE;
            } else if (isTrend(values)) {
                label = AnomalyLabel.TREND;
            } else if (isSeasonal(values)) {
                label = AnomalyLabel.SEASONAL;
            } else {
                // score says anomalous even though no shape rule matched
                label = AnomalyLabel.SPIKE;
            }
        }
        return new Classification(label, baseline, observed, deviationPercent,
                explain(label, baseline, observed, deviationPercent));
    }

    // ---------------------------------------------------------------
    // Shape rules
    // ---------------------------------------------------------------

    static boolean isSpike(double[] values, double baseline, double observed) {
        if (values.length < 3) {
            return false;
        }
        double stdev = sampleStdDev(values, baseline);
        if (stdev == 0) {
            return false;
        }
        return Math.abs(observed - baseline) / stdev > SPIKE_Z;
    }

    static boolean isTrend(double[] values) {
        if (values.length < 4) {
            return false;
        }
        int mid = values.length / 2;
        double firstSum = 0;
        double secondSum = 0;
        for (int i = 0; i < values.length; i++) {
            if (i < mid) {
                firstSum += values[i];
            } else {
                secondSum += values[i];
            }
        }
        double firstAvg = firstSum / mid;
        double secondAvg = secondSum / (values.length - mid);
        double threshold = firstAvg != 0 ? TREND_RATIO * Math.abs(firstAvg) : TREND_RATIO;
        return Math.abs(secondAvg - firstAvg) > threshold;
    }

    static boolean isSeasonal(double[] values) {
        if (values.length < 6) {
            return false;
        }
        double mean = mean(values);
        int crossings = 0;
        for (int i = 1; i < values.length; i++) {
            if ((values[i - 1] - mean) * (values[i] - mean) < 0) {
                crossings++;
            }
        }
        return crossings >= MIN_MEAN_CROSSINGS;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static String explain(AnomalyLabel label, double baseline, double observed, double deviationPercent) {
        return switch (label) {
            case SPIKE -> String.format(Locale.ROOT,
                    "Spike detected: value jumped to %.2f (%.1f%% deviation from baseline %.2f)",
                    observed, deviationPercent, baseline);
            case TREND -> String.format(Locale.ROOT,
                    "Trend detected: peak %.2f deviates %.1f%% from expected %.2f",
                    observed, deviationPercent, baseline);
            case SEASONAL -> String.format(Locale.ROOT,
                    "Seasonal anomaly: value %.2f breaks the expected cycle (baseline %.2f, %.1f%% off)",
                    observed, baseline, deviationPercent);
            case NORMAL -> String.format(Locale.ROOT,
                    "No anomaly detected: value %.2f is within normal range", observed);
        };
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double sampleStdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / (values.length - 1));
    }

    /**
     * Outcome of {@link #classify(double[], double)}.
     */
    public static final class Classification {
        private final AnomalyLabel label;
        private final double baseline;
        private final double observed;
        private final double deviationPercent;
        private final String explanation;

        Classification(AnomalyLabel label, double baseline, double observed, double deviationPercent,
                String explanation) {
            this.label = label;
            this.baseline = baseline;
            this.observed = observed;
            this.deviationPercent = deviationPercent;
            this.explanation = explanation;
        }

        public AnomalyLabel getLabel() {
            return label;
        }

        /** Mean of the window. */
        public double getBaseline() {
            return baseline;
        }

        /** Value furthest from the baseline. */
        public double getObserved() {
            return observed;
        }

        public double getDeviationPercent() {
            return deviationPercent;
        }

        public String getExplanation() {
            return explanation;
        }
    }
}
