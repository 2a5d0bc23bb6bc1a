package com.fleetrank.core.error;

/**
 * Root of every failure raised by the Fleet Rank core.
 *
 * <p>
 * All subclasses are unchecked. Callers that need to tell failure kinds
 * apart catch the specific subclass; callers that only need to isolate a
 * unit of work (for example one node partition) catch this type.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class FleetRankException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected FleetRankException(String message) {
        super(message);
    }

    protected FleetRankException(String message, Throwable cause) {
        super(message, cause);
    }
}
