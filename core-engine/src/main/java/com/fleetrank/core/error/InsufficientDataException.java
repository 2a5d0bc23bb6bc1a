package com.fleetrank.core.error;

/**
 * Signals that a series holds fewer samples than one point window needs.
 *
 * <p>
 * This is not a defect in the input. It tells the caller that the series
 * produces zero windows under the current configuration, which is distinct
 * from the configuration itself being invalid.
 * </p>
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends FleetRankException {

    private static final long serialVersionUID = 1L;

    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Series has " + available + " sample(s) but a window needs " + required);
        this.available = available;
        this.required = required;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
