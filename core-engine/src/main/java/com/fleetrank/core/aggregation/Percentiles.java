package com.fleetrank.core.aggregation;

import java.util.Arrays;

/**
 * Percentile helper using linear interpolation between order statistics.
 *
 * <p>
 * For {@code n} ascending values the fractional rank is
 * {@code p / 100 * (n - 1)}. The result interpolates between the values at
 * {@code floor(rank)} and {@code floor(rank) + 1}. When those two order
 * statistics are equal the higher-indexed one is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class Percentiles {

    private Percentiles() {
        // utility class, not instantiable
    }

    /**
     * Compute the {@code p}-th percentile of {@code values}.
     *
     * @param values input values; not modified
     * @param p      percentile in {@code [0, 100]}
     * @return the interpolated percentile
     * @throws IllegalArgumentException if {@code values} is empty or {@code p}
     *                                  is out of range
     */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Cannot compute a percentile of no values");
        }
        if (!(p >= 0.0 && p <= 100.0)) {
            throw new IllegalArgumentException("Percentile must be in [0, 100], got " + p);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = (p / 100.0) * (sorted.length - 1);
        int lowerIndex = (int) Math.floor(rank);
        int upperIndex = lowerIndex + 1;
        if (upperIndex >= sorted.length) {
            return sorted[lowerIndex];
        }

        double lower = sorted[lowerIndex];
        double upper = sorted[upperIndex];
        if (lower == upper) {
            return upper;
        }
        double fraction = rank - lowerIndex;
        return lower + (upper - lower) * fraction;
    }
}
