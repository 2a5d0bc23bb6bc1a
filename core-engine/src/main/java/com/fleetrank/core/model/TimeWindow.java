package com.fleetrank.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Describes a slice {@code [startIndex, endIndex)} of a {@link MetricSeries}.
 *
 * <p>
 * A window never holds sample data; use {@link MetricSeries#slice(TimeWindow)}
 * to read the samples it covers. Point windows carry the timestamps of their
 * first and last sample. Time windows carry their anchor and
 * {@code anchor + duration}, and may be empty when the series is sparse.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int startIndex;
    private final int endIndex;
    private final Instant startTime;
    private final Instant endTime;
    private final int windowNumber;

    /**
     * @param startIndex   first covered index (inclusive)
     * @param endIndex     end index (exclusive); {@code >= startIndex}
     * @param startTime    start of the window
     * @param endTime      end of the window
     * @param windowNumber 1-based position in the extraction sequence
     * @throws IllegalArgumentException if the indexes are inconsistent
     */
    public TimeWindow(int startIndex, int endIndex, Instant startTime, Instant endTime, int windowNumber) {
        if (startIndex < 0 || endIndex < startIndex) {
            throw new IllegalArgumentException(
                    "Invalid window bounds [" + startIndex + ", " + endIndex + ")");
        }
        this.startIndex = startIndex;
        this.endIndex = endIndex;
        this.startTime = Objects.requireNonNull(startTime, "startTime must not be null");
        this.endTime = Objects.requireNonNull(endTime, "endTime must not be null");
        this.windowNumber = windowNumber;
    }

    public int getStartIndex() {
        return startIndex;
    }

    public int getEndIndex() {
        return endIndex;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public int getWindowNumber() {
        return windowNumber;
    }

    /**
     * @return number of samples covered
     */
    public int size() {
        return endIndex - startIndex;
    }

    public boolean isEmpty() {
        return endIndex == startIndex;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeWindow that))
            return false;
        return startIndex == that.startIndex
                && endIndex == that.endIndex
                && windowNumber == that.windowNumber
                && startTime.equals(that.startTime)
                && endTime.equals(that.endTime);
    }

    @Override
    public int hashCode() {
        return Objects.hash(startIndex, endIndex, startTime, endTime, windowNumber);
    }

    @Override
    public String toString() {
        return "TimeWindow{#" + windowNumber +
                ", [" + startIndex + ", " + endIndex + ")" +
                ", " + startTime + " -> " + endTime +
                '}';
    }
}
