package com.fleetrank.core.aggregation;

import com.fleetrank.core.error.AggregationException;

import java.util.Locale;

/**
 * Statistical functions available for combining child scores into a parent
 * score.
 *
 * <ul>
 * <li>{@code max}: any anomalous child flags the parent</li>
 * <li>{@code mean}: overall health view</li>
 * <li>{@code weighted}: mean weighted by child importance (e.g. CPU over
 * disk I/O)</li>
 * <li>{@code p95}: tail-focused, suppresses single-child noise</li>
 * </ul>
 *
 * @since 1.0.0
 */
public enum AggregationStrategy {
    MAX,
    MEAN,
    WEIGHTED,
    P95;

    /**
     * @return lowercase name used in configuration files and reports
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a strategy from its configured name, ignoring case.
     *
     * @param name strategy name such as {@code "max"} or {@code "P95"}
     * @return the strategy
     * @throws AggregationException if the name is null or unknown
     */
    public static AggregationStrategy fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toUpperCase(Locale.ROOT);
            for (AggregationStrategy strategy : values()) {
                if (strategy.name().equals(normalized)) {
                    return strategy;
                }
            }
        }
        throw new AggregationException("unknown strategy: '" + name
                + "'. Supported: max, mean, weighted, p95");
    }
}
