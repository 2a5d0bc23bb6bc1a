package com.fleetrank.core.model;

import com.fleetrank.core.error.ValidationException;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single observation: a timestamp and a finite numeric value.
 *
 * @since 1.0.0
 */
public final class MetricSample implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Instant timestamp;
    private final double value;

    private MetricSample(Instant timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    /**
     * Create a sample.
     *
     * @param timestamp observation time; must not be {@code null}
     * @param value     observed value; must be finite
     * @return the sample
     * @throws ValidationException if the timestamp is missing or the value is
     *                             NaN or infinite
     */
    public static MetricSample of(Instant timestamp, double value) {
        if (timestamp == null) {
            throw new ValidationException("Sample timestamp must not be null");
        }
        if (!Double.isFinite(value)) {
            throw new ValidationException("Sample value must be finite, got " + value + " at " + timestamp);
        }
        return new MetricSample(timestamp, value);
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricSample that))
            return false;
        return Double.compare(value, that.value) == 0 && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, value);
    }

    @Override
    public String toString() {
        return "(" + timestamp + ", " + value + ")";
    }
}
