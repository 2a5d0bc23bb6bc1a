package com.fleetrank.core.model;

import com.fleetrank.core.error.ValidationException;

import java.util.Locale;

/**
 * Classification attached to every {@link AnomalyResult}. Anything other
 * than {@link #NORMAL} counts as anomalous.
 *
 * @since 1.0.0
 */
public enum AnomalyLabel {

    /** Sudden, short-lived departure from the baseline. */
    SPIKE,

    /** Sustained directional change. */
    TREND,

    /** Break in an otherwise cyclic pattern. */
    SEASONAL,

    NORMAL;

    /**
     * @return lowercase name used in configuration and reports
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a label, ignoring case.
     *
     * @param value label text such as {@code "spike"}
     * @return the label
     * @throws ValidationException if {@code value} is null or not a known label
     */
    public static AnomalyLabel fromValue(String value) {
        if (value != null) {
            for (AnomalyLabel label : values()) {
                if (label.name().equalsIgnoreCase(value.trim())) {
                    return label;
                }
            }
        }
        throw new ValidationException("Unknown anomaly label: '" + value
                + "'. Supported: spike, trend, seasonal, normal");
    }
}
