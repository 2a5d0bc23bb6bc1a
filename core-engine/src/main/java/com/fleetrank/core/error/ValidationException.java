package com.fleetrank.core.error;

/**
 * Raised when a value object cannot be constructed because its invariants
 * do not hold (unsorted timestamps, length mismatch, non-finite values,
 * out-of-range scores) or when hierarchy keys are missing or inconsistent.
 *
 * @since 1.0.0
 */
public class ValidationException extends FleetRankException {

    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
