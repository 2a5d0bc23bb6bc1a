package com.fleetrank.core.error;

/**
 * Raised for invalid settings: non-positive window size, stride, duration or
 * Top-N count, non-positive weights, and malformed pipeline configuration
 * files.
 *
 * @since 1.0.0
 */
public class ConfigException extends FleetRankException {

    private static final long serialVersionUID = 1L;

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
